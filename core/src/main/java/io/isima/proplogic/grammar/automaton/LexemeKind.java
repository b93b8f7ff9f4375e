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
package io.isima.proplogic.grammar.automaton;

/** Lexical categories; declaration order is the scanner's tie-break priority. */
public enum LexemeKind {
  // true, false
  CONSTANT,

  // A digit followed by digits and letters - for example 1, 23abc
  PROPOSITION,

  // (
  OPEN_PARENTHESIS,

  // )
  CLOSE_PARENTHESIS,

  // \neg
  UNARY_OPERATOR,

  // \wedge, \vee, \rightarrow, \leftrightarrow
  BINARY_OPERATOR
}
