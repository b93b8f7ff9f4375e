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

import io.isima.proplogic.common.ParserConstants;
import java.util.BitSet;

/** Fixed, finite set of characters accepted by the automata. */
public class Alphabet {

  public static final Alphabet DEFAULT = of(ParserConstants.DEFAULT_ALPHABET);

  private final BitSet symbols;
  private final String definition;

  private Alphabet(BitSet symbols, String definition) {
    this.symbols = symbols;
    this.definition = definition;
  }

  /**
   * Builds an alphabet out of every character of the given string.
   *
   * @param characters the members of the alphabet
   * @return the alphabet
   */
  public static Alphabet of(String characters) {
    if (characters == null || characters.isEmpty()) {
      throw new IllegalArgumentException("Alphabet must have at least one symbol");
    }
    final var symbols = new BitSet();
    for (char symbol : characters.toCharArray()) {
      symbols.set(symbol);
    }
    return new Alphabet(symbols, characters);
  }

  public boolean contains(char symbol) {
    return symbols.get(symbol);
  }

  @Override
  public String toString() {
    return "Alphabet{" + definition + "}";
  }
}
