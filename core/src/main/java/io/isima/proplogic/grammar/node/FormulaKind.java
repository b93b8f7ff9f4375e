/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.proplogic.grammar.node;

import io.isima.proplogic.grammar.automaton.PatternTable;

/** The variants a {@link Formula} node can take. */
public enum FormulaKind {
  CONSTANT(0, null),
  PROPOSITION(0, null),
  NEGATION(1, PatternTable.NEGATION),
  AND(2, PatternTable.WEDGE),
  OR(2, PatternTable.VEE),
  IMPLIES(2, PatternTable.RIGHTARROW),
  BICONDITIONAL(2, PatternTable.LEFTRIGHTARROW);

  private final int arity;
  private final String operator;

  FormulaKind(int arity, String operator) {
    this.arity = arity;
    this.operator = operator;
  }

  public int getArity() {
    return arity;
  }

  /** Operator text of a connective; null for atoms. */
  public String getOperator() {
    return operator;
  }

  /**
   * Finds the binary connective spelled by the operator text.
   *
   * @param text matched operator text, for example \wedge
   * @return the connective, or null if the text is not a binary operator
   */
  public static FormulaKind fromBinaryOperator(String text) {
    for (FormulaKind kind : values()) {
      if (kind.arity == 2 && kind.operator.equals(text)) {
        return kind;
      }
    }
    return null;
  }
}
