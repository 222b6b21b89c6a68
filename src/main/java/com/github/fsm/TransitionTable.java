package com.github.fsm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.github.fsm.StateMachineException.Code;

/**
 * Immutable table of permitted transitions. Every state of a machine is a key of this table and
 * maps either to the ordered list of states it may move to or to the terminal marker (an empty
 * Optional) meaning the state has no outgoing transitions.
 *
 * Every destination must itself be declared as a key. A reachable state with nowhere else to go is
 * declared via {@link TransitionTableBuilder#terminal(String)}.
 *
 * The table is never modified after {@link TransitionTableBuilder#build()} and is safe to share
 * across any number of machines.
 *
 * @author gaurav
 */
public final class TransitionTable {
  // K=fromState, V=allowed toStates or empty for a terminal state
  private final Map<String, Optional<List<String>>> stateTransitionTable;
  private final List<String> allStates;

  private TransitionTable(final Map<String, Optional<List<String>>> stateTransitionTable) {
    this.stateTransitionTable = Collections.unmodifiableMap(stateTransitionTable);
    this.allStates =
        Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(stateTransitionTable.keySet())));
  }

  /**
   * All state names, sorted lexicographically regardless of declaration order.
   */
  public List<String> allStates() {
    return allStates;
  }

  public boolean isValidState(final String state) {
    return state != null && stateTransitionTable.containsKey(state);
  }

  /**
   * True iff fromState is known, is not terminal and explicitly lists toState. A state never
   * implicitly allows a transition to itself.
   */
  public boolean isAllowed(final String fromState, final String toState) {
    if (fromState == null || toState == null) {
      return false;
    }
    final Optional<List<String>> destinations = stateTransitionTable.get(fromState);
    return destinations != null && destinations.isPresent()
        && destinations.get().contains(toState);
  }

  /**
   * Raw outgoing edges of a state, empty for a terminal state.
   */
  public Optional<List<String>> outgoing(final String fromState) throws StateMachineException {
    if (!isValidState(fromState)) {
      throw new StateMachineException(Code.INVALID_STATE,
          String.format("'%s' is not a recognized state.", fromState));
    }
    return stateTransitionTable.get(fromState);
  }

  public boolean isTerminal(final String state) {
    final Optional<List<String>> destinations = stateTransitionTable.get(state);
    return destinations != null && !destinations.isPresent();
  }

  public int size() {
    return stateTransitionTable.size();
  }

  @Override
  public int hashCode() {
    return stateTransitionTable.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TransitionTable)) {
      return false;
    }
    return stateTransitionTable.equals(((TransitionTable) obj).stateTransitionTable);
  }

  @Override
  public String toString() {
    return "TransitionTable " + stateTransitionTable;
  }

  /**
   * A simple builder to let users use fluent APIs to build transition tables. All validation is
   * deferred to {@link #build()}.
   */
  public final static class TransitionTableBuilder {
    private final List<Declaration> declarations = new ArrayList<>();

    public static TransitionTableBuilder newBuilder() {
      return new TransitionTableBuilder();
    }

    /**
     * Declare fromState along with the states it may transition to. Passing no toStates declares a
     * terminal state.
     */
    public TransitionTableBuilder transitions(final String fromState, final String... toStates) {
      return transitions(fromState, toStates == null ? null : Arrays.asList(toStates));
    }

    /**
     * Declare fromState along with the states it may transition to. A null or empty list declares
     * a terminal state.
     */
    public TransitionTableBuilder transitions(final String fromState,
        final List<String> toStates) {
      declarations.add(new Declaration(fromState,
          toStates == null || toStates.isEmpty() ? null : new ArrayList<>(toStates)));
      return this;
    }

    public TransitionTableBuilder terminal(final String state) {
      declarations.add(new Declaration(state, null));
      return this;
    }

    public TransitionTable build() throws StateMachineException {
      if (declarations.isEmpty()) {
        throw new StateMachineException(Code.NO_STATES_DEFINED);
      }
      final Map<String, Optional<List<String>>> table = new LinkedHashMap<>();
      for (final Declaration declaration : declarations) {
        validateName(declaration.fromState);
        if (table.containsKey(declaration.fromState)) {
          throw new StateMachineException(Code.INVALID_TRANSITIONS,
              String.format("State '%s' is declared more than once", declaration.fromState));
        }
        if (declaration.toStates == null) {
          table.put(declaration.fromState, Optional.empty());
          continue;
        }
        final Set<String> destinations = new LinkedHashSet<>();
        for (final String toState : declaration.toStates) {
          validateName(toState);
          destinations.add(toState);
        }
        table.put(declaration.fromState,
            Optional.of(Collections.unmodifiableList(new ArrayList<>(destinations))));
      }

      final StringBuilder messages = new StringBuilder();
      for (final Map.Entry<String, Optional<List<String>>> entry : table.entrySet()) {
        if (!entry.getValue().isPresent()) {
          continue;
        }
        for (final String toState : entry.getValue().get()) {
          if (!table.containsKey(toState)) {
            messages.append(String.format("'%s' transitions to undeclared state '%s'. ",
                entry.getKey(), toState));
          }
        }
      }
      if (messages.length() > 0) {
        throw new StateMachineException(Code.INVALID_TRANSITIONS, messages.toString().trim());
      }
      return new TransitionTable(table);
    }

    private static void validateName(final String state) throws StateMachineException {
      if (state == null || state.trim().isEmpty()) {
        throw new StateMachineException(Code.INVALID_STATE_NAME);
      }
    }

    private TransitionTableBuilder() {}
  }

  private final static class Declaration {
    private final String fromState;
    private final List<String> toStates;

    private Declaration(final String fromState, final List<String> toStates) {
      this.fromState = fromState;
      this.toStates = toStates;
    }
  }

}
