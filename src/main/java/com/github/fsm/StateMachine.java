package com.github.fsm;

import java.util.List;
import java.util.Optional;

/**
 * A simple Finite State Machine instance, bound to a {@link MachineDefinition} and optionally to
 * a subject object its handlers act upon.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. this FSM instance is NOT thread-safe. It holds no locks and spawns no threads; callers sharing
 * an instance across threads must synchronize externally<br>
 *
 * 2. definitions are immutable and meant to be reused. Create as many machines from the same
 * definition as needed, eg. one per workflow item<br>
 *
 * 3. a transition is validated first, then the wildcard handler runs, then the handler for the
 * destination state runs, and only then is the new state committed. Handlers therefore always see
 * the state being left via {@link #readCurrentState()}<br>
 *
 * 4. a failed transition never changes the current state and never leaves the machine unusable<br>
 *
 * @param <T> type of the subject this machine is bound to
 * @author gaurav
 */
public interface StateMachine<T> {

  /**
   * Transition the state machine to the given nextState. Fails with
   * {@link StateMachineException.Code#INVALID_STATE} if nextState is not a state of the
   * definition and with {@link StateMachineException.Code#TRANSITION_NOT_ALLOWED} if the current
   * state has no edge to it. Exceptions thrown by handlers are propagated as is. Handlers may not
   * start another transition on the same machine, such calls fail with
   * {@link StateMachineException.Code#TRANSITION_IN_FLIGHT}.
   */
  void transitionTo(final String nextState) throws StateMachineException;

  /**
   * Read/report the current state of the state machine.
   */
  String readCurrentState();

  /**
   * Identifies if the provided state name is a recognized state of this machine.
   */
  boolean isValid(final String state);

  /**
   * From the current state, identifies if transitioning to the provided state is allowed.
   */
  boolean isAllowed(final String nextState);

  /**
   * All the valid state names, sorted.
   */
  List<String> allStates();

  /**
   * States reachable in one step from the current state, empty if the current state is terminal.
   */
  List<String> allowedTransitions();

  /**
   * True iff the current state has no outgoing transitions.
   */
  boolean isTerminal();

  /**
   * The object this machine was bound to at construction, if any.
   */
  Optional<T> getSubject();

  MachineDefinition<T> getDefinition();

  /**
   * Reports the id of this StateMachine instance.
   */
  String getId();

  /**
   * Report statistics for this FSM.
   */
  TransitionStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder<T> {
    private final MachineDefinition<T> definition;
    private StateMachineConfiguration config;
    private T subject;
    private String initialState;

    public static <T> StateMachineBuilder<T> newBuilder(final MachineDefinition<T> definition) {
      return new StateMachineBuilder<>(definition);
    }

    public StateMachineBuilder<T> config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineBuilder<T> subject(final T subject) {
      this.subject = subject;
      return this;
    }

    /**
     * Start the machine in initialState instead of the definition's default state.
     */
    public StateMachineBuilder<T> initialState(final String initialState) {
      this.initialState = initialState;
      return this;
    }

    public StateMachine<T> build() throws StateMachineException {
      return new StateMachineImpl<>(definition,
          config == null ? StateMachineConfiguration.defaults() : config, subject,
          Optional.ofNullable(initialState));
    }

    private StateMachineBuilder(final MachineDefinition<T> definition) {
      this.definition = definition;
    }
  }

}
