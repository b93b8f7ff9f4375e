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

import lombok.Getter;
import lombok.ToString;

/** A lexeme kind together with the automaton recognizing it. */
@Getter
@ToString
public class Pattern {
  private final LexemeKind kind;
  @ToString.Exclude private final Automaton automaton;

  public Pattern(LexemeKind kind, Automaton automaton) {
    this.kind = kind;
    this.automaton = automaton;
  }

  /** Returns a pattern holding an independent copy of the automaton. */
  public Pattern copy() {
    return new Pattern(kind, automaton.copy());
  }
}
