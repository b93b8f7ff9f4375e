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
import io.isima.proplogic.exceptions.AlphabetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic finite automaton with guarded transitions.
 *
 * <p>The definition (alphabet, initial state, transition rules and final states) is immutable and
 * shared between copies. The current state is the only mutable part and belongs to one instance.
 *
 * <p>Rules leaving the same state are tried in the order they were declared and the first one whose
 * guard accepts the symbol fires. When no rule fires the automaton stays where it is. The state
 * {@link ParserConstants#DEAD_STATE} has no outgoing transition, so an automaton that reaches it
 * stays there until {@link #reset()}.
 */
public class Automaton {

  private final Alphabet alphabet;
  private final int initialState;
  private final List<TransitionRule> rules;
  private final Map<Integer, List<TransitionRule>> rulesBySource;
  private final Set<Integer> finalStates;

  private int currentState;

  public Automaton(
      Alphabet alphabet, int initialState, List<TransitionRule> rules, Set<Integer> finalStates) {
    if (finalStates.contains(ParserConstants.DEAD_STATE)) {
      throw new IllegalArgumentException("Dead state must not be final");
    }
    this.alphabet = alphabet;
    this.initialState = initialState;
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    this.finalStates = Collections.unmodifiableSet(new HashSet<>(finalStates));
    final Map<Integer, List<TransitionRule>> bySource = new HashMap<>();
    for (TransitionRule rule : this.rules) {
      if (rule.getSource() == ParserConstants.DEAD_STATE) {
        throw new IllegalArgumentException("Dead state must not have outgoing transitions");
      }
      bySource.computeIfAbsent(rule.getSource(), k -> new ArrayList<>()).add(rule);
    }
    this.rulesBySource = bySource;
    this.currentState = initialState;
  }

  private Automaton(Automaton other) {
    this.alphabet = other.alphabet;
    this.initialState = other.initialState;
    this.rules = other.rules;
    this.rulesBySource = other.rulesBySource;
    this.finalStates = other.finalStates;
    this.currentState = other.currentState;
  }

  /**
   * Makes an independent instance with the same definition and the same current state.
   *
   * @return the copy
   */
  public Automaton copy() {
    return new Automaton(this);
  }

  /**
   * Computes the state the automaton would move to on the symbol, without moving.
   *
   * @param symbol input symbol
   * @return the destination state, or the current state if no rule fires
   * @throws AlphabetException if the symbol is not in the alphabet
   */
  public int nextState(char symbol) throws AlphabetException {
    if (!alphabet.contains(symbol)) {
      throw new AlphabetException(symbol);
    }
    final List<TransitionRule> candidates = rulesBySource.get(currentState);
    if (candidates != null) {
      for (TransitionRule rule : candidates) {
        if (rule.getGuard().accepts(symbol)) {
          return rule.getDestination();
        }
      }
    }
    return currentState;
  }

  /**
   * Applies the first matching transition of the current state.
   *
   * @param symbol input symbol
   * @throws AlphabetException if the symbol is not in the alphabet
   */
  public void execute(char symbol) throws AlphabetException {
    currentState = nextState(symbol);
  }

  public boolean isInFinalState() {
    return finalStates.contains(currentState);
  }

  public boolean isFinal(int state) {
    return finalStates.contains(state);
  }

  public boolean isDead() {
    return currentState == ParserConstants.DEAD_STATE;
  }

  public void reset() {
    currentState = initialState;
  }

  public int getCurrentState() {
    return currentState;
  }

  public int getInitialState() {
    return initialState;
  }

  public List<TransitionRule> getRules() {
    return rules;
  }

  public Alphabet getAlphabet() {
    return alphabet;
  }
}
