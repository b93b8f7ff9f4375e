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

import io.isima.proplogic.exceptions.InvalidFormulaException;
import io.isima.proplogic.grammar.node.Formula;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** Outcome of parsing one line of an example file; exactly one of formula and error is set. */
@Getter
@AllArgsConstructor
@ToString
public class ExampleResult {
  private final int lineNumber;
  private final String source;
  private final Formula formula;
  private final InvalidFormulaException error;

  public boolean isSuccess() {
    return error == null;
  }

  /** One report line, e.g. "3: (\wedge true 1)" or "4: error: Invalid symbol". */
  public String toReportLine() {
    if (isSuccess()) {
      return lineNumber + ": " + formula;
    }
    return lineNumber + ": error: " + error.getMessage();
  }
}
