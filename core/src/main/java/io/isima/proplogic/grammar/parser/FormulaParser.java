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
package io.isima.proplogic.grammar.parser;

import io.isima.proplogic.common.ParserConfig;
import io.isima.proplogic.exceptions.FormulaSyntaxException;
import io.isima.proplogic.exceptions.InvalidFormulaException;
import io.isima.proplogic.grammar.automaton.LexemeKind;
import io.isima.proplogic.grammar.node.Formula;
import io.isima.proplogic.grammar.node.FormulaKind;
import io.isima.proplogic.grammar.scanner.Scanner;
import io.isima.proplogic.grammar.scanner.Token;
import lombok.extern.slf4j.Slf4j;

/**
 * Recursive-descent parser of prefix propositional formulas.
 *
 * <pre>
 * Formula      := Constant | Proposition | "(" UnaryOp Formula ")"
 *               | "(" BinaryOp Formula Formula ")" | "(" Constant ")" | "(" Proposition ")"
 * </pre>
 *
 * <p>A parenthesized formula is told apart by the token following the opening parenthesis, so at
 * most two tokens of lookahead are needed and the parser never backtracks. Content left on the line
 * after a complete formula is not consumed.
 */
@Slf4j
public class FormulaParser {

  private final Scanner scanner;

  public FormulaParser(Scanner scanner) {
    this.scanner = scanner;
  }

  /**
   * Parses the formula on one line of text, using the configured end of input policy.
   *
   * @param line text of the formula
   * @return the formula tree
   * @throws InvalidFormulaException if the line is not a valid formula
   */
  public static Formula parseOneLine(String line) throws InvalidFormulaException {
    return parseOneLine(line, ParserConfig.getInstance().isEndOfInputRequired());
  }

  /**
   * Parses the formula on one line of text. Every character of the line must belong to the
   * alphabet, including those after the formula.
   *
   * @param line text of the formula
   * @param requireEndOfInput whether tokens left after the formula are an error
   * @return the formula tree
   * @throws InvalidFormulaException if the line is not a valid formula
   */
  public static Formula parseOneLine(String line, boolean requireEndOfInput)
      throws InvalidFormulaException {
    final var scanner = new Scanner(line);
    final Formula formula = new FormulaParser(scanner).parse();
    // Trailing tokens may be ignored, characters outside the alphabet may not.
    scanner.checkRemainingSymbols();
    if (requireEndOfInput) {
      final Token trailing = scanner.peekNextToken();
      if (trailing != null) {
        throw new FormulaSyntaxException(
            String.format(
                "Unexpected trailing token <%s> at position %d",
                trailing.getText(), trailing.getStart()),
            trailing.getStart(),
            null,
            trailing.getKind());
      }
    }
    return formula;
  }

  public Formula parse() throws InvalidFormulaException {
    final Token next = scanner.peekNextToken();
    if (next == null) {
      throw endOfInput(null);
    }
    switch (next.getKind()) {
      case CONSTANT:
        return parseConstant();
      case PROPOSITION:
        return parseProposition();
      case OPEN_PARENTHESIS:
        final Token second = scanner.peekSecondToken();
        final LexemeKind secondKind = second != null ? second.getKind() : null;
        if (secondKind == LexemeKind.UNARY_OPERATOR) {
          logger.debug("Unary formula at position {}", next.getStart());
          return parseUnaryFormula();
        } else if (secondKind == LexemeKind.CONSTANT || secondKind == LexemeKind.PROPOSITION) {
          logger.debug("Parenthesized atom at position {}", next.getStart());
          return parseParenthesizedAtom();
        }
        logger.debug("Binary formula at position {}", next.getStart());
        return parseBinaryFormula();
      default:
        throw new FormulaSyntaxException(
            String.format(
                "Unexpected token <%s> at position %d", next.getText(), next.getStart()),
            next.getStart(),
            null,
            next.getKind());
    }
  }

  public Formula parseUnaryFormula() throws InvalidFormulaException {
    parseOpenParenthesis();
    parseUnaryOperator();
    final Formula child = parse();
    parseCloseParenthesis();
    return Formula.negation(child);
  }

  public Formula parseBinaryFormula() throws InvalidFormulaException {
    parseOpenParenthesis();
    final FormulaKind connective = parseBinaryOperator();
    final Formula left = parse();
    final Formula right = parse();
    parseCloseParenthesis();
    return Formula.binary(connective, left, right);
  }

  public Formula parseParenthesizedAtom() throws InvalidFormulaException {
    parseOpenParenthesis();
    final Token next = scanner.peekNextToken();
    final Formula atom =
        next != null && next.getKind() == LexemeKind.CONSTANT
            ? parseConstant()
            : parseProposition();
    parseCloseParenthesis();
    return atom;
  }

  public Formula parseConstant() throws InvalidFormulaException {
    return Formula.constant(expect(LexemeKind.CONSTANT).getText());
  }

  public Formula parseProposition() throws InvalidFormulaException {
    return Formula.proposition(expect(LexemeKind.PROPOSITION).getText());
  }

  public void parseOpenParenthesis() throws InvalidFormulaException {
    expect(LexemeKind.OPEN_PARENTHESIS);
  }

  public void parseCloseParenthesis() throws InvalidFormulaException {
    expect(LexemeKind.CLOSE_PARENTHESIS);
  }

  public void parseUnaryOperator() throws InvalidFormulaException {
    expect(LexemeKind.UNARY_OPERATOR);
  }

  /**
   * Consumes a binary operator.
   *
   * @return the connective the operator spells
   */
  public FormulaKind parseBinaryOperator() throws InvalidFormulaException {
    final Token token = expect(LexemeKind.BINARY_OPERATOR);
    final FormulaKind connective = FormulaKind.fromBinaryOperator(token.getText());
    if (connective == null) {
      throw new FormulaSyntaxException(
          String.format(
              "Unknown binary operator <%s> at position %d", token.getText(), token.getStart()),
          token.getStart());
    }
    return connective;
  }

  private Token expect(LexemeKind expected) throws InvalidFormulaException {
    final Token token = scanner.getNextToken();
    if (token == null) {
      throw endOfInput(expected);
    }
    if (token.getKind() != expected) {
      throw new FormulaSyntaxException(
          String.format(
              "Unexpected token <%s> at position %d; expected %s",
              token.getText(), token.getStart(), expected),
          token.getStart(),
          expected,
          token.getKind());
    }
    return token;
  }

  private FormulaSyntaxException endOfInput(LexemeKind expected) {
    final String message =
        expected == null
            ? "Unexpected end of input; expected a formula"
            : "Unexpected end of input; expected " + expected;
    return new FormulaSyntaxException(message, scanner.getLine().length(), expected, null);
  }
}
