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
package io.isima.proplogic.exceptions;

/** Base class of the errors raised while scanning or parsing a formula line. */
public class InvalidFormulaException extends Exception {

  private static final long serialVersionUID = 3208712671920845116L;

  private final int position;

  public InvalidFormulaException(String message, int position) {
    super(message);
    this.position = position;
  }

  /**
   * Zero-based column in the scanned line where the problem was detected.
   *
   * @return the position, or -1 if unknown
   */
  public int getPosition() {
    return position;
  }
}
