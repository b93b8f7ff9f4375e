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
package io.isima.proplogic.grammar.scanner;

import io.isima.proplogic.grammar.automaton.LexemeKind;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A lexeme recognized by the scanner. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Token {
  private final LexemeKind kind;
  private final String text;

  // Column of the first character of the token in the scanned line
  private final int start;

  public int getLength() {
    return text.length();
  }
}
