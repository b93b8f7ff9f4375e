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

/** Thrown when an input character is outside the fixed scanner alphabet. */
public class AlphabetException extends InvalidFormulaException {

  private static final long serialVersionUID = -4475101283990561327L;

  private final char symbol;

  public AlphabetException(char symbol) {
    this(symbol, -1);
  }

  public AlphabetException(char symbol, int position) {
    super(buildMessage(symbol, position), position);
    this.symbol = symbol;
  }

  public char getSymbol() {
    return symbol;
  }

  private static String buildMessage(char symbol, int position) {
    if (position < 0) {
      return "Invalid symbol <" + symbol + ">";
    }
    return String.format("Invalid symbol <%c> at position %d", symbol, position);
  }
}
