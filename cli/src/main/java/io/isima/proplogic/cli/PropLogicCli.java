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
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Command line entry point: parses the formulas of an example file and prints the results. */
@Slf4j
public class PropLogicCli {

  public static final int EXIT_OK = 0;
  public static final int EXIT_INVALID_FORMULA = 1;
  public static final int EXIT_IO_ERROR = 2;
  public static final int EXIT_USAGE = 3;

  public static void main(String[] args) {
    System.exit(execute(args));
  }

  /**
   * Runs the driver.
   *
   * @param args an optional example file name
   * @return the process exit status
   */
  public static int execute(String[] args) {
    if (args.length > 1) {
      System.err.println("Usage: proplogic [examples-file]");
      return EXIT_USAGE;
    }
    final Path file =
        Paths.get(args.length == 1 ? args[0] : ParserConfig.getInstance().getExamplesFile());
    final var runner = new ExampleFileRunner(System.out);
    try {
      final List<ExampleResult> results = runner.run(file);
      for (ExampleResult result : results) {
        if (!result.isSuccess()) {
          return EXIT_INVALID_FORMULA;
        }
      }
      return EXIT_OK;
    } catch (InvalidFormulaException e) {
      return EXIT_INVALID_FORMULA;
    } catch (IOException e) {
      logger.error("Failed to read {}: {}", file, e.toString());
      System.err.println("Failed to read " + file + ": " + e.getMessage());
      return EXIT_IO_ERROR;
    }
  }
}
