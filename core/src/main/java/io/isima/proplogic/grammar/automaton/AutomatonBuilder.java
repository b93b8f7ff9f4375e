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

import io.isima.proplogic.common.ParserConstants;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds an {@link Automaton} one rule at a time.
 *
 * <p>States are allocated by the builder; state 0 is the initial state. Literal chains added from
 * the same state share that state, which lets one automaton branch into several keywords.
 */
public class AutomatonBuilder {

  private final Alphabet alphabet;
  private final List<TransitionRule> rules = new ArrayList<>();
  private final Set<Integer> finalStates = new HashSet<>();
  private int lastState = 0;
  private boolean rejectUnmatched = false;

  public AutomatonBuilder(Alphabet alphabet) {
    this.alphabet = alphabet;
  }

  public static AutomatonBuilder create(Alphabet alphabet) {
    return new AutomatonBuilder(alphabet);
  }

  /**
   * Allocates a fresh state.
   *
   * @return the new state
   */
  public int newState() {
    ++lastState;
    if (lastState == ParserConstants.DEAD_STATE) {
      throw new IllegalStateException("Too many states");
    }
    return lastState;
  }

  public AutomatonBuilder transition(int source, SymbolGuard guard, int destination) {
    rules.add(new TransitionRule(source, guard, destination));
    return this;
  }

  public AutomatonBuilder finalState(int state) {
    finalStates.add(state);
    return this;
  }

  /**
   * Adds a chain of exact-character transitions spelling the literal, starting at the given state.
   * A transition on the same character already leaving a state of the chain is reused.
   *
   * @param from state the chain starts from
   * @param literal characters to match in order
   * @return the state reached after the last character
   */
  public int literal(int from, String literal) {
    int state = from;
    for (char symbol : literal.toCharArray()) {
      Integer existing = findExactTransition(state, symbol);
      if (existing != null) {
        state = existing;
      } else {
        int next = newState();
        rules.add(new ExactRule(state, symbol, next));
        state = next;
      }
    }
    return state;
  }

  /**
   * Sends every symbol that no declared rule accepts to the dead state, so that the automaton never
   * stalls.
   */
  public AutomatonBuilder rejectUnmatched() {
    rejectUnmatched = true;
    return this;
  }

  public Automaton build() {
    final List<TransitionRule> allRules = new ArrayList<>(rules);
    if (rejectUnmatched) {
      final Set<Integer> states = new LinkedHashSet<>();
      states.add(0);
      for (TransitionRule rule : rules) {
        states.add(rule.getSource());
        states.add(rule.getDestination());
      }
      // Catch-all rules go last so that they lose to every declared guard.
      states.remove(ParserConstants.DEAD_STATE);
      for (int state : states) {
        allRules.add(new TransitionRule(state, SymbolGuard.any(), ParserConstants.DEAD_STATE));
      }
    }
    return new Automaton(alphabet, 0, allRules, finalStates);
  }

  private Integer findExactTransition(int source, char symbol) {
    for (TransitionRule rule : rules) {
      if (rule instanceof ExactRule
          && rule.getSource() == source
          && ((ExactRule) rule).symbol == symbol) {
        return rule.getDestination();
      }
    }
    return null;
  }

  private static class ExactRule extends TransitionRule {
    private final char symbol;

    ExactRule(int source, char symbol, int destination) {
      super(source, SymbolGuard.is(symbol), destination);
      this.symbol = symbol;
    }
  }
}
