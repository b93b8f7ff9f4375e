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
package io.isima.proplogic.common;

/** Property keys and default values used by the scanner, the parser and the example driver. */
public class ParserConstants {
  public static final String SCANNER_ALPHABET = "proplogic.scanner.alphabet";
  public static final String SCANNER_SEPARATOR = "proplogic.scanner.separator";
  public static final String SCANNER_CASE_INSENSITIVE = "proplogic.scanner.caseInsensitive";
  public static final String PARSER_REQUIRE_END_OF_INPUT = "proplogic.parser.requireEndOfInput";
  public static final String EXAMPLES_FILE = "proplogic.examples.file";
  public static final String EXAMPLES_STOP_ON_ERROR = "proplogic.examples.stopOnError";

  public static final String DEFAULT_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789\\()- ";
  public static final char DEFAULT_SEPARATOR = ' ';
  public static final boolean DEFAULT_CASE_INSENSITIVE = true;
  public static final boolean DEFAULT_REQUIRE_END_OF_INPUT = false;
  public static final String DEFAULT_EXAMPLES_FILE = "examples.txt";
  public static final boolean DEFAULT_STOP_ON_ERROR = false;

  // Automaton state that has no outgoing transition
  public static final int DEAD_STATE = 999;

  private ParserConstants() {}
}
