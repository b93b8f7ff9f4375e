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

import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * Properties-backed configuration of the formula front end.
 *
 * <p>Values come from the system properties unless another set is installed by {@link
 * #setProperties(Properties)}.
 */
@Slf4j
public class ParserConfig {

  private static ParserConfig instance;

  private Properties properties = System.getProperties();

  /**
   * ParserConfig is instantiated as a singleton.
   *
   * @return The instance.
   */
  public static synchronized ParserConfig getInstance() {
    if (instance == null) {
      instance = new ParserConfig();
    }
    return instance;
  }

  public static void setProperties(Properties properties) {
    getInstance().properties = properties;
  }

  /** Reverts to the system properties. */
  public static void reset() {
    getInstance().properties = System.getProperties();
  }

  /**
   * Generic method to get property as string.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a string.
   */
  public String getString(String key, String defaultValue) {
    String value = properties.getProperty(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Generic method to get property as boolean.
   *
   * @param key the property key
   * @param defaultValue default value used in case the property with the specified key is missing.
   * @return property as a boolean.
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    final String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    } else if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(
        String.format("Value of parameter %s is not a boolean: %s", key, value));
  }

  // Alphabet is not trimmed since space is a member of the default one
  public String getAlphabet() {
    return getString(ParserConstants.SCANNER_ALPHABET, ParserConstants.DEFAULT_ALPHABET);
  }

  public char getSeparator() {
    final String value = properties.getProperty(ParserConstants.SCANNER_SEPARATOR);
    if (value == null || value.isEmpty()) {
      return ParserConstants.DEFAULT_SEPARATOR;
    }
    if (value.length() > 1) {
      logger.warn(
          "Separator {} has more than one character, using the first one only",
          ParserConstants.SCANNER_SEPARATOR);
    }
    return value.charAt(0);
  }

  public boolean isCaseInsensitive() {
    return getBoolean(
        ParserConstants.SCANNER_CASE_INSENSITIVE, ParserConstants.DEFAULT_CASE_INSENSITIVE);
  }

  public boolean isEndOfInputRequired() {
    return getBoolean(
        ParserConstants.PARSER_REQUIRE_END_OF_INPUT,
        ParserConstants.DEFAULT_REQUIRE_END_OF_INPUT);
  }

  public String getExamplesFile() {
    return getString(ParserConstants.EXAMPLES_FILE, ParserConstants.DEFAULT_EXAMPLES_FILE).trim();
  }

  public boolean isStopOnError() {
    return getBoolean(
        ParserConstants.EXAMPLES_STOP_ON_ERROR, ParserConstants.DEFAULT_STOP_ON_ERROR);
  }
}
