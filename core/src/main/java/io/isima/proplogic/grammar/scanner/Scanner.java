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

import io.isima.proplogic.common.ParserConfig;
import io.isima.proplogic.exceptions.AlphabetException;
import io.isima.proplogic.exceptions.FormulaSyntaxException;
import io.isima.proplogic.exceptions.InvalidFormulaException;
import io.isima.proplogic.grammar.automaton.Automaton;
import io.isima.proplogic.grammar.automaton.Pattern;
import io.isima.proplogic.grammar.automaton.PatternTable;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits one line of text into tokens by running every automaton of a {@link PatternTable} in
 * lockstep over the same cursor.
 *
 * <p>Tokenization is longest match: once an automaton reaches a final state, the scanner keeps
 * feeding that automaton while the next character keeps it final. When several automata become
 * final on the same character, the first one in table order wins.
 *
 * <p>A scanner is not thread safe; use one instance per line.
 */
@Slf4j
public class Scanner {

  private final String line;
  private final char separator;
  private final List<Pattern> patterns;
  private int cursor;

  public Scanner(String line) {
    this(
        line,
        PatternTable.getDefault(),
        ParserConfig.getInstance().getSeparator(),
        ParserConfig.getInstance().isCaseInsensitive());
  }

  public Scanner(String line, PatternTable patternTable) {
    this(
        line,
        patternTable,
        ParserConfig.getInstance().getSeparator(),
        ParserConfig.getInstance().isCaseInsensitive());
  }

  public Scanner(String line, PatternTable patternTable, char separator, boolean caseInsensitive) {
    final String content = stripLineTerminator(line);
    this.line = caseInsensitive ? foldAsciiUpperCase(content) : content;
    this.separator = separator;
    this.patterns = patternTable.instantiate();
    this.cursor = 0;
  }

  private Scanner(Scanner other) {
    this.line = other.line;
    this.separator = other.separator;
    this.patterns = new ArrayList<>(other.patterns.size());
    for (Pattern pattern : other.patterns) {
      this.patterns.add(pattern.copy());
    }
    this.cursor = other.cursor;
  }

  /**
   * Makes a snapshot of this scanner. The snapshot owns its own automata; advancing one of the two
   * never affects the other.
   *
   * @return the snapshot
   */
  public Scanner copy() {
    return new Scanner(this);
  }

  /**
   * Consumes the next token.
   *
   * @return the token, or null at the end of the line
   * @throws AlphabetException if a character outside the alphabet is met
   * @throws FormulaSyntaxException if no pattern recognizes the characters at the cursor
   */
  public Token getNextToken() throws InvalidFormulaException {
    if (cursor < line.length() && line.charAt(cursor) == separator) {
      ++cursor;
    }
    if (cursor >= line.length()) {
      return null;
    }

    final int start = cursor;
    Pattern matched = null;
    try {
      while (cursor < line.length()) {
        final char symbol = line.charAt(cursor);
        if (matched == null) {
          executeAll(symbol);
          ++cursor;
          matched = findFirstFinal();
          if (matched == null && allDead()) {
            break;
          }
        } else {
          // Longest match: stop before the character that would leave the final state.
          final Automaton automaton = matched.getAutomaton();
          if (!automaton.isFinal(nextState(automaton, symbol))) {
            break;
          }
          automaton.execute(symbol);
          ++cursor;
        }
      }
    } finally {
      resetAll();
    }

    if (matched == null) {
      throw new FormulaSyntaxException(
          String.format(
              "Unrecognized lexeme <%s> at position %d", line.substring(start, cursor), start),
          start);
    }
    final Token token = new Token(matched.getKind(), line.substring(start, cursor), start);
    logger.trace("Scanned {}", token);
    return token;
  }

  /**
   * Returns the next token without consuming it.
   *
   * @return the token, or null at the end of the line
   */
  public Token peekNextToken() throws InvalidFormulaException {
    return copy().getNextToken();
  }

  /**
   * Returns the token after the next one without consuming either.
   *
   * @return the token, or null if the line ends before it
   */
  public Token peekSecondToken() throws InvalidFormulaException {
    final Scanner lookahead = copy();
    if (lookahead.getNextToken() == null) {
      return null;
    }
    return lookahead.getNextToken();
  }

  /**
   * Consumes every remaining token.
   *
   * @return the tokens in line order
   */
  public List<Token> tokenize() throws InvalidFormulaException {
    final List<Token> tokens = new ArrayList<>();
    Token token;
    while ((token = getNextToken()) != null) {
      tokens.add(token);
    }
    return tokens;
  }

  /** Whether only an optional separator is left before the end of the line. */
  public boolean isAtEnd() {
    int position = cursor;
    if (position < line.length() && line.charAt(position) == separator) {
      ++position;
    }
    return position >= line.length();
  }

  /**
   * Checks every character left after the cursor against the alphabet of each pattern, without
   * consuming anything. Separator characters are not checked.
   *
   * @throws AlphabetException at the first character outside the alphabet
   */
  public void checkRemainingSymbols() throws AlphabetException {
    for (int position = cursor; position < line.length(); ++position) {
      final char symbol = line.charAt(position);
      if (symbol == separator) {
        continue;
      }
      for (Pattern pattern : patterns) {
        if (!pattern.getAutomaton().getAlphabet().contains(symbol)) {
          throw new AlphabetException(symbol, position);
        }
      }
    }
  }

  public int getCursor() {
    return cursor;
  }

  public String getLine() {
    return line;
  }

  List<Pattern> getPatterns() {
    return patterns;
  }

  private void executeAll(char symbol) throws AlphabetException {
    for (Pattern pattern : patterns) {
      try {
        pattern.getAutomaton().execute(symbol);
      } catch (AlphabetException e) {
        throw new AlphabetException(e.getSymbol(), cursor);
      }
    }
  }

  private int nextState(Automaton automaton, char symbol) throws AlphabetException {
    try {
      return automaton.nextState(symbol);
    } catch (AlphabetException e) {
      throw new AlphabetException(e.getSymbol(), cursor);
    }
  }

  private Pattern findFirstFinal() {
    for (Pattern pattern : patterns) {
      if (pattern.getAutomaton().isInFinalState()) {
        return pattern;
      }
    }
    return null;
  }

  private boolean allDead() {
    for (Pattern pattern : patterns) {
      if (!pattern.getAutomaton().isDead()) {
        return false;
      }
    }
    return true;
  }

  private void resetAll() {
    for (Pattern pattern : patterns) {
      pattern.getAutomaton().reset();
    }
    logger.trace("Reset automata at position {}", cursor);
  }

  // Only A-Z is folded; any other character keeps its column and is left to the alphabet check.
  private static String foldAsciiUpperCase(String content) {
    final char[] symbols = content.toCharArray();
    for (int i = 0; i < symbols.length; ++i) {
      if (symbols[i] >= 'A' && symbols[i] <= 'Z') {
        symbols[i] = (char) (symbols[i] - 'A' + 'a');
      }
    }
    return new String(symbols);
  }

  private static String stripLineTerminator(String line) {
    if (line == null) {
      throw new IllegalArgumentException("line must not be null");
    }
    int end = line.length();
    for (int i = 0; i < line.length(); ++i) {
      final char ch = line.charAt(i);
      if (ch == '\n' || ch == '\r') {
        end = i;
        break;
      }
    }
    return line.substring(0, end);
  }
}
