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

import io.isima.proplogic.common.ParserConfig;
import io.isima.proplogic.exceptions.InvalidFormulaException;
import io.isima.proplogic.grammar.node.Formula;
import io.isima.proplogic.grammar.parser.FormulaParser;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses every formula of an example file.
 *
 * <p>The first line of the file holds the number of examples. It is informational only; every
 * following non-empty line is parsed as one formula.
 */
@Slf4j
public class ExampleFileRunner {

  private final PrintStream out;
  private final boolean stopOnError;

  public ExampleFileRunner(PrintStream out) {
    this(out, ParserConfig.getInstance().isStopOnError());
  }

  public ExampleFileRunner(PrintStream out, boolean stopOnError) {
    this.out = out;
    this.stopOnError = stopOnError;
  }

  /**
   * Parses the file and writes one report line per formula.
   *
   * @param file the example file
   * @return results in file order
   * @throws IOException if the file cannot be read
   * @throws InvalidFormulaException on the first invalid formula when stopping on error
   */
  public List<ExampleResult> run(Path file) throws IOException, InvalidFormulaException {
    logger.info("Reading examples from {}", file);
    return run(Files.readAllLines(file, StandardCharsets.UTF_8));
  }

  public List<ExampleResult> run(List<String> lines) throws InvalidFormulaException {
    final List<ExampleResult> results = new ArrayList<>();
    if (lines.isEmpty()) {
      logger.warn("Example file is empty");
      return results;
    }

    final Integer declaredCount = parseCount(lines.get(0));
    for (int i = 1; i < lines.size(); ++i) {
      final String line = lines.get(i);
      if (line.isBlank()) {
        continue;
      }
      final int lineNumber = i + 1;
      ExampleResult result;
      try {
        final Formula formula = FormulaParser.parseOneLine(line);
        logger.info("Line {}: {}", lineNumber, formula);
        result = new ExampleResult(lineNumber, line, formula, null);
      } catch (InvalidFormulaException e) {
        if (stopOnError) {
          logger.error("Line {}: {}; aborting", lineNumber, e.getMessage());
          throw e;
        }
        logger.warn("Line {}: {}", lineNumber, e.getMessage());
        result = new ExampleResult(lineNumber, line, null, e);
      }
      results.add(result);
      out.println(result.toReportLine());
    }

    if (declaredCount != null && declaredCount != results.size()) {
      logger.warn("Example count is {} but {} formulas were read", declaredCount, results.size());
    }
    return results;
  }

  private static Integer parseCount(String line) {
    try {
      return Integer.parseInt(line.trim());
    } catch (NumberFormatException e) {
      logger.warn("First line is not an example count: {}", line);
      return null;
    }
  }
}
