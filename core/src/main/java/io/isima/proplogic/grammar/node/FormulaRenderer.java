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

/** Writes a formula back in the prefix notation the parser reads. */
public class FormulaRenderer {

  private FormulaRenderer() {}

  public static String render(Formula formula) {
    return render(formula, false);
  }

  /**
   * Renders the formula with single spaces between operator and operands.
   *
   * @param formula the formula
   * @param parenthesizeAtoms whether constants and propositions are written as (true), (1)
   * @return the text
   */
  public static String render(Formula formula, boolean parenthesizeAtoms) {
    final StringBuilder sb = new StringBuilder();
    append(sb, formula, parenthesizeAtoms);
    return sb.toString();
  }

  private static void append(StringBuilder sb, Formula formula, boolean parenthesizeAtoms) {
    switch (formula.getKind()) {
      case CONSTANT:
      case PROPOSITION:
        if (parenthesizeAtoms) {
          sb.append('(').append(formula.getText()).append(')');
        } else {
          sb.append(formula.getText());
        }
        break;
      case NEGATION:
        sb.append('(').append(formula.getKind().getOperator()).append(' ');
        append(sb, formula.getChild(), parenthesizeAtoms);
        sb.append(')');
        break;
      case AND:
      case OR:
      case IMPLIES:
      case BICONDITIONAL:
        sb.append('(').append(formula.getKind().getOperator()).append(' ');
        append(sb, formula.getLeft(), parenthesizeAtoms);
        sb.append(' ');
        append(sb, formula.getRight(), parenthesizeAtoms);
        sb.append(')');
        break;
      default:
        throw new IllegalArgumentException("Unknown formula kind " + formula.getKind());
    }
  }
}
