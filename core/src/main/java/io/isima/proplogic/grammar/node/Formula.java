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

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable node of a formula tree.
 *
 * <p>The {@link FormulaKind} tells which fields are set: atoms carry their text, a negation carries
 * its operand in {@code left}, and binary connectives carry both operands. Equality is structural.
 */
@Getter
@EqualsAndHashCode
public final class Formula {

  private final FormulaKind kind;
  private final String text;
  private final Formula left;
  private final Formula right;

  private Formula(FormulaKind kind, String text, Formula left, Formula right) {
    this.kind = kind;
    this.text = text;
    this.left = left;
    this.right = right;
  }

  public static Formula constant(String text) {
    return new Formula(FormulaKind.CONSTANT, Objects.requireNonNull(text), null, null);
  }

  public static Formula proposition(String text) {
    return new Formula(FormulaKind.PROPOSITION, Objects.requireNonNull(text), null, null);
  }

  public static Formula negation(Formula child) {
    return new Formula(FormulaKind.NEGATION, null, Objects.requireNonNull(child), null);
  }

  public static Formula and(Formula left, Formula right) {
    return binary(FormulaKind.AND, left, right);
  }

  public static Formula or(Formula left, Formula right) {
    return binary(FormulaKind.OR, left, right);
  }

  public static Formula implies(Formula left, Formula right) {
    return binary(FormulaKind.IMPLIES, left, right);
  }

  public static Formula biconditional(Formula left, Formula right) {
    return binary(FormulaKind.BICONDITIONAL, left, right);
  }

  /**
   * Builds a binary connective node.
   *
   * @param kind one of AND, OR, IMPLIES, BICONDITIONAL
   * @param left left operand
   * @param right right operand
   * @return the node
   */
  public static Formula binary(FormulaKind kind, Formula left, Formula right) {
    if (kind.getArity() != 2) {
      throw new IllegalArgumentException(kind + " is not a binary connective");
    }
    return new Formula(kind, null, Objects.requireNonNull(left), Objects.requireNonNull(right));
  }

  /** Operand of a negation. */
  public Formula getChild() {
    if (kind != FormulaKind.NEGATION) {
      throw new IllegalStateException(kind + " has no single child");
    }
    return left;
  }

  public boolean isLeaf() {
    return kind.getArity() == 0;
  }

  public int getHeight() {
    int leftSubtreeHeight = left == null ? 0 : left.getHeight();
    int rightSubtreeHeight = right == null ? 0 : right.getHeight();
    return Math.max(leftSubtreeHeight, rightSubtreeHeight) + 1;
  }

  @Override
  public String toString() {
    return FormulaRenderer.render(this);
  }
}
