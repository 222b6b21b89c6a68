package com.github.fsm;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Symbolic lookup of state names, computed once when a definition is built, eg. state
 * "awaiting_review" is reachable via constant "AWAITING_REVIEW". Lets calling code refer to states
 * symbolically without string literals scattered around.
 */
public final class StateConstants {
  // K=constant, V=state name
  private final Map<String, String> constants;

  private StateConstants(final Map<String, String> constants) {
    this.constants = Collections.unmodifiableMap(constants);
  }

  /**
   * States whose constant names collide, eg. "in-progress" and "in_progress", get no constant at
   * all; they remain reachable by their state names.
   */
  static StateConstants of(final TransitionTable transitionTable) {
    final Map<String, String> constants = new TreeMap<>();
    final Set<String> ambiguous = new HashSet<>();
    for (final String state : transitionTable.allStates()) {
      final String constant = constantName(state);
      if (constants.putIfAbsent(constant, state) != null) {
        ambiguous.add(constant);
      }
    }
    constants.keySet().removeAll(ambiguous);
    return new StateConstants(constants);
  }

  /**
   * Upper-cases the state name and replaces every character that's not a letter or digit with an
   * underscore.
   */
  public static String constantName(final String state) {
    final StringBuilder constant = new StringBuilder(state.length());
    for (final char character : state.trim().toUpperCase(Locale.ROOT).toCharArray()) {
      constant.append(Character.isLetterOrDigit(character) ? character : '_');
    }
    return constant.toString();
  }

  public Optional<String> stateFor(final String constant) {
    return Optional.ofNullable(constants.get(constant));
  }

  public Map<String, String> asMap() {
    return constants;
  }

  @Override
  public String toString() {
    return "StateConstants " + constants;
  }
}
