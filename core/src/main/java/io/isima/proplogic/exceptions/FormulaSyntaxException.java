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
package io.isima.proplogic.exceptions;

import io.isima.proplogic.grammar.automaton.LexemeKind;

/**
 * Thrown when a token of an unexpected kind is met, when input ends before a production completes,
 * or when no lexeme can be recognized at the cursor.
 */
public class FormulaSyntaxException extends InvalidFormulaException {

  private static final long serialVersionUID = 7461240378015533792L;

  private final LexemeKind expected;
  private final LexemeKind actual;

  public FormulaSyntaxException(String message, int position) {
    this(message, position, null, null);
  }

  public FormulaSyntaxException(
      String message, int position, LexemeKind expected, LexemeKind actual) {
    super(message, position);
    this.expected = expected;
    this.actual = actual;
  }

  /** The lexeme kind the parser required; null if the error is not a kind mismatch. */
  public LexemeKind getExpected() {
    return expected;
  }

  /** The lexeme kind actually found; null at end of input or when not applicable. */
  public LexemeKind getActual() {
    return actual;
  }
}
