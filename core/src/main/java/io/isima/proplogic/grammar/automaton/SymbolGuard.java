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
package io.isima.proplogic.grammar.automaton;

/** Predicate over one input symbol deciding whether a transition fires. */
@FunctionalInterface
public interface SymbolGuard {

  boolean accepts(char symbol);

  static SymbolGuard is(char expected) {
    return symbol -> symbol == expected;
  }

  static SymbolGuard digit() {
    return symbol -> symbol >= '0' && symbol <= '9';
  }

  static SymbolGuard alphanumeric() {
    return symbol -> (symbol >= '0' && symbol <= '9') || (symbol >= 'a' && symbol <= 'z');
  }

  static SymbolGuard any() {
    return symbol -> true;
  }
}
