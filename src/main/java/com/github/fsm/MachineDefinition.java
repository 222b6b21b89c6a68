package com.github.fsm;

import com.github.fsm.StateMachineException.Code;
import com.github.fsm.TransitionHandlers.TransitionHandlersBuilder;

/**
 * The shape of a state machine: its transition table, the default state new machines start in and
 * the handlers to run around transitions. A definition is validated as a whole when built and is
 * immutable afterwards, so one definition can back any number of {@link StateMachine} instances.
 *
 * Definitions are either declared in code via {@link MachineDefinitionBuilder} or loaded from an
 * external description via {@link MachineDefinitionLoader}. Both converge on this same type and
 * behave identically.
 *
 * @param <T> type of the subject machines of this definition are bound to
 * @author gaurav
 */
public final class MachineDefinition<T> {
  static final String ANONYMOUS = "anonymous";

  private final String name;
  private final TransitionTable transitionTable;
  private final String defaultState;
  private final TransitionHandlers<T> handlers;
  private final StateConstants stateConstants;

  private MachineDefinition(final String name, final TransitionTable transitionTable,
      final String defaultState, final TransitionHandlers<T> handlers,
      final StateConstants stateConstants) {
    this.name = name;
    this.transitionTable = transitionTable;
    this.defaultState = defaultState;
    this.handlers = handlers;
    this.stateConstants = stateConstants;
  }

  public String getName() {
    return name;
  }

  public TransitionTable getTransitionTable() {
    return transitionTable;
  }

  public String getDefaultState() {
    return defaultState;
  }

  public TransitionHandlers<T> getHandlers() {
    return handlers;
  }

  public StateConstants getStateConstants() {
    return stateConstants;
  }

  @Override
  public String toString() {
    return "MachineDefinition [name=" + name + ", defaultState=" + defaultState
        + ", transitionTable=" + transitionTable + ", handlers=" + handlers + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build machine definitions. The transition
   * table and the default state are validated together in {@link #build()}.
   */
  public final static class MachineDefinitionBuilder<T> {
    private String name = ANONYMOUS;
    private TransitionTable transitionTable;
    private String defaultState;
    private final TransitionHandlersBuilder<T> handlers = TransitionHandlersBuilder.newBuilder();

    public static <T> MachineDefinitionBuilder<T> newBuilder() {
      return new MachineDefinitionBuilder<>();
    }

    public MachineDefinitionBuilder<T> name(final String name) {
      this.name = name;
      return this;
    }

    public MachineDefinitionBuilder<T> transitions(final TransitionTable transitionTable) {
      this.transitionTable = transitionTable;
      return this;
    }

    public MachineDefinitionBuilder<T> defaultState(final String defaultState) {
      this.defaultState = defaultState;
      return this;
    }

    public MachineDefinitionBuilder<T> onAnyTransition(final TransitionHandler<T> handler) {
      handlers.onAnyTransition(handler);
      return this;
    }

    public MachineDefinitionBuilder<T> onTransitionTo(final String toState,
        final TransitionHandler<T> handler) {
      handlers.onTransitionTo(toState, handler);
      return this;
    }

    public MachineDefinitionBuilder<T> handlers(final TransitionHandlers<T> transitionHandlers) {
      handlers.addAll(transitionHandlers);
      return this;
    }

    public MachineDefinition<T> build() throws StateMachineException {
      final String definitionName =
          name == null || name.trim().isEmpty() ? ANONYMOUS : name.trim();
      if (transitionTable == null) {
        throw new StateMachineException(Code.NO_STATES_DEFINED,
            String.format("Transitions not defined on %s", definitionName));
      }
      if (defaultState == null) {
        throw new StateMachineException(Code.INVALID_DEFAULT_STATE,
            String.format("Default state not defined on %s", definitionName));
      }
      if (!transitionTable.isValidState(defaultState)) {
        throw new StateMachineException(Code.INVALID_DEFAULT_STATE,
            String.format("Default state '%s' is not a recognized state of %s", defaultState,
                definitionName));
      }
      final TransitionHandlers<T> transitionHandlers = handlers.build();
      transitionHandlers.validateAgainst(transitionTable);
      return new MachineDefinition<>(definitionName, transitionTable, defaultState,
          transitionHandlers, StateConstants.of(transitionTable));
    }

    private MachineDefinitionBuilder() {}
  }

}
