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
package io.isima.proplogic.cli;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

import io.isima.proplogic.exceptions.AlphabetException;
import io.isima.proplogic.exceptions.FormulaSyntaxException;
import io.isima.proplogic.grammar.node.Formula;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ExampleFileRunnerTest {
  private ByteArrayOutputStream output;
  private PrintStream out;
  private Path examples;

  @Before
  public void setUp() throws Exception {
    output = new ByteArrayOutputStream();
    out = new PrintStream(output, true, StandardCharsets.UTF_8);
    examples = Paths.get(getClass().getResource("/examples.txt").toURI());
  }

  @Test
  public void testRunContinuesAfterFailure() throws Exception {
    final List<ExampleResult> results = new ExampleFileRunner(out, false).run(examples);
    assertThat(results.size(), is(5));

    Assert.assertTrue(results.get(0).isSuccess());
    assertThat(results.get(0).getLineNumber(), is(2));
    assertThat(
        results.get(0).getFormula(),
        is(Formula.and(Formula.constant("true"), Formula.proposition("1"))));
    assertThat(results.get(1).getFormula(), is(Formula.negation(Formula.proposition("1"))));
    Assert.assertTrue(results.get(2).isSuccess());

    Assert.assertFalse(results.get(3).isSuccess());
    assertThat(results.get(3).getError(), instanceOf(AlphabetException.class));
    assertThat(results.get(3).getError().getPosition(), is(10));
    assertThat(results.get(4).getError(), instanceOf(FormulaSyntaxException.class));

    final String[] report = output.toString(StandardCharsets.UTF_8).split("\\R");
    assertThat(report.length, is(5));
    assertThat(report[0], is("2: (\\wedge true 1)"));
    assertThat(report[1], is("3: (\\neg 1)"));
    assertThat(report[2], is("4: (\\vee (\\rightarrow 1a 2b) (\\leftrightarrow false 3))"));
    assertThat(report[3], is("5: error: Invalid symbol <#> at position 10"));
    Assert.assertTrue(report[4].startsWith("6: error: "));
  }

  @Test(expected = AlphabetException.class)
  public void testRunStopsOnFirstFailure() throws Exception {
    new ExampleFileRunner(out, true).run(examples);
  }

  @Test
  public void testCountLineIsInformational() throws Exception {
    final List<ExampleResult> results =
        new ExampleFileRunner(out, true).run(List.of("not a number", "true", "", "(\\neg 2)"));
    assertThat(results.size(), is(2));
    assertThat(results.get(1).getLineNumber(), is(4));

    final List<ExampleResult> mismatched =
        new ExampleFileRunner(out, true).run(List.of("10", "false"));
    assertThat(mismatched.size(), is(1));
  }

  @Test
  public void testEmptyInput() throws Exception {
    Assert.assertTrue(new ExampleFileRunner(out, false).run(List.of()).isEmpty());
    Assert.assertTrue(new ExampleFileRunner(out, false).run(List.of("0")).isEmpty());
  }
}
