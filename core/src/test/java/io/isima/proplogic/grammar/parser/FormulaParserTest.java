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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import io.isima.proplogic.common.ParserConfig;
import io.isima.proplogic.common.ParserConstants;
import io.isima.proplogic.exceptions.AlphabetException;
import io.isima.proplogic.exceptions.FormulaSyntaxException;
import io.isima.proplogic.grammar.automaton.LexemeKind;
import io.isima.proplogic.grammar.node.Formula;
import io.isima.proplogic.grammar.node.FormulaKind;
import io.isima.proplogic.grammar.node.FormulaRenderer;
import io.isima.proplogic.grammar.scanner.Scanner;
import java.util.Properties;
import java.util.Random;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class FormulaParserTest {

  @After
  public void tearDown() {
    ParserConfig.reset();
  }

  @Test
  public void testAtoms() throws Exception {
    assertThat(FormulaParser.parseOneLine("true"), is(Formula.constant("true")));
    assertThat(FormulaParser.parseOneLine("false"), is(Formula.constant("false")));
    assertThat(FormulaParser.parseOneLine("23abc"), is(Formula.proposition("23abc")));
    assertThat(FormulaParser.parseOneLine("(1)"), is(Formula.proposition("1")));
    assertThat(FormulaParser.parseOneLine("(false)"), is(Formula.constant("false")));
  }

  @Test
  public void testUnaryFormulaWithParenthesizedOperand() throws Exception {
    final Formula formula = FormulaParser.parseOneLine("(\\neg (1))");
    assertThat(formula.getKind(), is(FormulaKind.NEGATION));
    assertThat(formula.getChild(), is(Formula.proposition("1")));
  }

  @Test
  public void testBinaryFormulaWithParenthesizedOperands() throws Exception {
    assertThat(
        FormulaParser.parseOneLine("(\\wedge (true) (2))"),
        is(Formula.and(Formula.constant("true"), Formula.proposition("2"))));
  }

  @Test
  public void testEveryConnective() throws Exception {
    final Formula one = Formula.proposition("1");
    final Formula two = Formula.proposition("2");
    assertThat(FormulaParser.parseOneLine("(\\wedge 1 2)"), is(Formula.and(one, two)));
    assertThat(FormulaParser.parseOneLine("(\\vee 1 2)"), is(Formula.or(one, two)));
    assertThat(FormulaParser.parseOneLine("(\\rightarrow 1 2)"), is(Formula.implies(one, two)));
    assertThat(
        FormulaParser.parseOneLine("(\\leftrightarrow 1 2)"), is(Formula.biconditional(one, two)));
    assertThat(FormulaParser.parseOneLine("(\\neg 1)"), is(Formula.negation(one)));
  }

  @Test
  public void testNestedFormula() throws Exception {
    final Formula formula =
        FormulaParser.parseOneLine(
            "(\\leftrightarrow (\\neg (\\vee 1a false)) (\\rightarrow (\\wedge 2 3) (\\neg 4)))");
    final Formula expected =
        Formula.biconditional(
            Formula.negation(Formula.or(Formula.proposition("1a"), Formula.constant("false"))),
            Formula.implies(
                Formula.and(Formula.proposition("2"), Formula.proposition("3")),
                Formula.negation(Formula.proposition("4"))));
    assertThat(formula, is(expected));
    assertThat(formula.getHeight(), is(4));
  }

  @Test
  public void testInputIsCaseInsensitive() throws Exception {
    assertThat(
        FormulaParser.parseOneLine("(\\Wedge TRUE 1A)"),
        is(Formula.and(Formula.constant("true"), Formula.proposition("1a"))));
  }

  @Test
  public void testRoundTrip() throws Exception {
    final Random random = new Random(20261018L);
    for (int i = 0; i < 200; ++i) {
      final Formula formula = randomFormula(random, 5);
      assertThat(FormulaParser.parseOneLine(FormulaRenderer.render(formula)), is(formula));
      assertThat(FormulaParser.parseOneLine(FormulaRenderer.render(formula, true)), is(formula));
    }
  }

  @Test
  public void testMissingOperand() throws Exception {
    try {
      FormulaParser.parseOneLine("(\\wedge (true))");
      Assert.fail("exception is expected");
    } catch (FormulaSyntaxException e) {
      assertThat(e.getActual(), is(LexemeKind.CLOSE_PARENTHESIS));
      assertThat(e.getPosition(), is(14));
    }
  }

  @Test
  public void testMissingCloseParenthesis() throws Exception {
    try {
      FormulaParser.parseOneLine("(\\neg 1 2)");
      Assert.fail("exception is expected");
    } catch (FormulaSyntaxException e) {
      assertThat(e.getExpected(), is(LexemeKind.CLOSE_PARENTHESIS));
      assertThat(e.getActual(), is(LexemeKind.PROPOSITION));
      assertThat(e.getPosition(), is(8));
    }
  }

  @Test
  public void testUnexpectedEndOfInput() throws Exception {
    String[] truncatedLines = new String[] {"", "(", "(\\wedge true", "(\\neg 1", "(\\vee"};
    for (String truncatedLine : truncatedLines) {
      try {
        FormulaParser.parseOneLine(truncatedLine);
        Assert.fail("exception is expected for " + truncatedLine);
      } catch (FormulaSyntaxException e) {
        assertThat(e.getActual(), nullValue());
        assertThat(e.getPosition(), is(truncatedLine.length()));
      }
    }
  }

  @Test
  public void testMissingOperator() throws Exception {
    try {
      FormulaParser.parseOneLine("((1) 2)");
      Assert.fail("exception is expected");
    } catch (FormulaSyntaxException e) {
      assertThat(e.getExpected(), is(LexemeKind.BINARY_OPERATOR));
      assertThat(e.getActual(), is(LexemeKind.OPEN_PARENTHESIS));
    }
  }

  @Test(expected = FormulaSyntaxException.class)
  public void testOperatorOutsideParentheses() throws Exception {
    FormulaParser.parseOneLine("\\wedge 1 2");
  }

  @Test(expected = FormulaSyntaxException.class)
  public void testUnaryOperatorWithBinaryArity() throws Exception {
    FormulaParser.parseOneLine("(\\wedge 1)");
  }

  @Test
  public void testSymbolOutsideAlphabet() throws Exception {
    try {
      FormulaParser.parseOneLine("(\\vee 1 #)");
      Assert.fail("exception is expected");
    } catch (AlphabetException e) {
      assertThat(e.getSymbol(), is('#'));
      assertThat(e.getPosition(), is(8));
    }
  }

  @Test
  public void testNonAsciiLettersAreAlphabetErrors() throws Exception {
    try {
      FormulaParser.parseOneLine("1\u212A");
      Assert.fail("exception is expected");
    } catch (AlphabetException e) {
      assertThat(e.getSymbol(), is('\u212A'));
      assertThat(e.getPosition(), is(1));
    }
    try {
      FormulaParser.parseOneLine("(\\neg 1) \u0130#");
      Assert.fail("exception is expected");
    } catch (AlphabetException e) {
      assertThat(e.getSymbol(), is('\u0130'));
      assertThat(e.getPosition(), is(9));
    }
  }

  @Test
  public void testSymbolOutsideAlphabetAfterFormula() throws Exception {
    String[] lines = new String[] {"true #", "(\\neg 1) #"};
    int[] positions = new int[] {5, 9};
    for (int i = 0; i < lines.length; ++i) {
      try {
        FormulaParser.parseOneLine(lines[i], false);
        Assert.fail("exception is expected for " + lines[i]);
      } catch (AlphabetException e) {
        assertThat(e.getSymbol(), is('#'));
        assertThat(e.getPosition(), is(positions[i]));
      }
    }
  }

  @Test
  public void testTrailingContentIsIgnoredByDefault() throws Exception {
    final Scanner scanner = new Scanner("1 2");
    assertThat(new FormulaParser(scanner).parse(), is(Formula.proposition("1")));
    Assert.assertFalse(scanner.isAtEnd());
    assertThat(
        FormulaParser.parseOneLine("(\\neg 1) )"),
        is(Formula.negation(Formula.proposition("1"))));
  }

  @Test
  public void testStrictModeRejectsTrailingContent() throws Exception {
    try {
      FormulaParser.parseOneLine("1 2", true);
      Assert.fail("exception is expected");
    } catch (FormulaSyntaxException e) {
      assertThat(e.getActual(), is(LexemeKind.PROPOSITION));
      assertThat(e.getPosition(), is(2));
    }
    assertThat(
        FormulaParser.parseOneLine("(\\neg 1) ", true),
        is(Formula.negation(Formula.proposition("1"))));
  }

  @Test(expected = FormulaSyntaxException.class)
  public void testStrictModeFromConfiguration() throws Exception {
    final Properties properties = new Properties();
    properties.setProperty(ParserConstants.PARSER_REQUIRE_END_OF_INPUT, "true");
    ParserConfig.setProperties(properties);
    FormulaParser.parseOneLine("true false");
  }

  @Test
  public void testProductionsConsumeExpectedKinds() throws Exception {
    final FormulaParser parser = new FormulaParser(new Scanner("( \\neg \\vee true 1 )"));
    parser.parseOpenParenthesis();
    parser.parseUnaryOperator();
    assertThat(parser.parseBinaryOperator(), is(FormulaKind.OR));
    assertThat(parser.parseConstant(), is(Formula.constant("true")));
    assertThat(parser.parseProposition(), is(Formula.proposition("1")));
    parser.parseCloseParenthesis();
  }

  @Test(expected = FormulaSyntaxException.class)
  public void testConstantProductionRejectsProposition() throws Exception {
    new FormulaParser(new Scanner("1")).parseConstant();
  }

  private static Formula randomFormula(Random random, int depth) {
    final int choice = depth <= 0 ? random.nextInt(2) : random.nextInt(7);
    switch (choice) {
      case 0:
        return Formula.constant(random.nextBoolean() ? "true" : "false");
      case 1:
        return Formula.proposition(randomProposition(random));
      case 2:
        return Formula.negation(randomFormula(random, depth - 1));
      case 3:
        return Formula.and(randomFormula(random, depth - 1), randomFormula(random, depth - 1));
      case 4:
        return Formula.or(randomFormula(random, depth - 1), randomFormula(random, depth - 1));
      case 5:
        return Formula.implies(randomFormula(random, depth - 1), randomFormula(random, depth - 1));
      default:
        return Formula.biconditional(
            randomFormula(random, depth - 1), randomFormula(random, depth - 1));
    }
  }

  private static String randomProposition(Random random) {
    final String alphanumerics = "abcdefghijklmnopqrstuvwxyz0123456789";
    final StringBuilder sb = new StringBuilder();
    sb.append((char) ('0' + random.nextInt(10)));
    final int length = random.nextInt(4);
    for (int i = 0; i < length; ++i) {
      sb.append(alphanumerics.charAt(random.nextInt(alphanumerics.length())));
    }
    return sb.toString();
  }
}
