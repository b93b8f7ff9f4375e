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

import io.isima.proplogic.common.ParserConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered collection of the patterns recognizing each lexeme kind.
 *
 * <p>The table order is the order of {@link LexemeKind} and decides which kind wins when more than
 * one automaton reaches a final state on the same text. A table is immutable; scanners work on
 * copies obtained from {@link #instantiate()}.
 */
@Slf4j
public class PatternTable {

  public static final String[] CONSTANTS = {"true", "false"};
  public static final String NEGATION = "\\neg";
  public static final String WEDGE = "\\wedge";
  public static final String VEE = "\\vee";
  public static final String RIGHTARROW = "\\rightarrow";
  public static final String LEFTRIGHTARROW = "\\leftrightarrow";

  private static PatternTable defaultTable;
  private static String defaultAlphabet;

  private final List<Pattern> patterns;

  private PatternTable(List<Pattern> patterns) {
    this.patterns = Collections.unmodifiableList(patterns);
  }

  /**
   * Returns the table built over the configured alphabet. The table is built on first use and
   * rebuilt whenever the configured alphabet changes.
   *
   * @return the shared default table
   */
  public static synchronized PatternTable getDefault() {
    final String alphabet = ParserConfig.getInstance().getAlphabet();
    if (defaultTable == null || !alphabet.equals(defaultAlphabet)) {
      defaultTable = create(Alphabet.of(alphabet));
      defaultAlphabet = alphabet;
    }
    return defaultTable;
  }

  /**
   * Builds the six patterns of the formula language over the alphabet.
   *
   * @param alphabet symbols the automata accept
   * @return the table
   */
  public static PatternTable create(Alphabet alphabet) {
    final List<Pattern> patterns = new ArrayList<>();
    patterns.add(new Pattern(LexemeKind.CONSTANT, buildConstant(alphabet)));
    patterns.add(new Pattern(LexemeKind.PROPOSITION, buildProposition(alphabet)));
    patterns.add(new Pattern(LexemeKind.OPEN_PARENTHESIS, buildSingleCharacter(alphabet, '(')));
    patterns.add(new Pattern(LexemeKind.CLOSE_PARENTHESIS, buildSingleCharacter(alphabet, ')')));
    patterns.add(new Pattern(LexemeKind.UNARY_OPERATOR, buildUnaryOperator(alphabet)));
    patterns.add(new Pattern(LexemeKind.BINARY_OPERATOR, buildBinaryOperator(alphabet)));
    logger.debug("Built pattern table over {}", alphabet);
    return new PatternTable(patterns);
  }

  /**
   * Wraps a custom list of patterns; the list order becomes the tie-break order.
   *
   * @param patterns patterns to scan with
   * @return the table
   */
  public static PatternTable of(List<Pattern> patterns) {
    if (patterns.isEmpty()) {
      throw new IllegalArgumentException("Pattern table must not be empty");
    }
    return new PatternTable(new ArrayList<>(patterns));
  }

  /**
   * Makes fresh, reset copies of every pattern in table order.
   *
   * @return patterns owned by the caller
   */
  public List<Pattern> instantiate() {
    final List<Pattern> copies = new ArrayList<>(patterns.size());
    for (Pattern pattern : patterns) {
      final Pattern copy = pattern.copy();
      copy.getAutomaton().reset();
      copies.add(copy);
    }
    return copies;
  }

  public List<Pattern> getPatterns() {
    return patterns;
  }

  static Automaton buildConstant(Alphabet alphabet) {
    final var builder = AutomatonBuilder.create(alphabet);
    for (String constant : CONSTANTS) {
      builder.finalState(builder.literal(0, constant));
    }
    return builder.rejectUnmatched().build();
  }

  static Automaton buildProposition(Alphabet alphabet) {
    final var builder = AutomatonBuilder.create(alphabet);
    final int identifier = builder.newState();
    return builder
        .transition(0, SymbolGuard.digit(), identifier)
        .transition(identifier, SymbolGuard.alphanumeric(), identifier)
        .finalState(identifier)
        .rejectUnmatched()
        .build();
  }

  static Automaton buildSingleCharacter(Alphabet alphabet, char character) {
    final var builder = AutomatonBuilder.create(alphabet);
    final int accepted = builder.literal(0, String.valueOf(character));
    return builder.finalState(accepted).rejectUnmatched().build();
  }

  static Automaton buildUnaryOperator(Alphabet alphabet) {
    final var builder = AutomatonBuilder.create(alphabet);
    return builder.finalState(builder.literal(0, NEGATION)).rejectUnmatched().build();
  }

  static Automaton buildBinaryOperator(Alphabet alphabet) {
    final var builder = AutomatonBuilder.create(alphabet);
    final int backslash = builder.literal(0, "\\");
    for (String operator : new String[] {WEDGE, VEE, RIGHTARROW, LEFTRIGHTARROW}) {
      builder.finalState(builder.literal(backslash, operator.substring(1)));
    }
    return builder.rejectUnmatched().build();
  }
}
