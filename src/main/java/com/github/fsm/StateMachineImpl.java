package com.github.fsm;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsm.StateMachineException.Code;

/**
 * A simple Finite State Machine.
 *
 * Notes for users:<br>
 * 1. this FSM instance is NOT thread-safe, see {@link StateMachine}<br>
 *
 * 2. the only mutable state is the currentState field, and it is written only once a transition
 * has been validated and all its handlers have returned normally<br>
 *
 * 3. the bound definition is shared and never modified; the subject is neither owned nor copied<br>
 *
 * @author gaurav
 */
public final class StateMachineImpl<T> implements StateMachine<T> {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();

  private final MachineDefinition<T> definition;
  private final TransitionTable transitionTable;
  private final Optional<T> subject;
  private final StateMachineConfiguration config;
  private final TransitionStatistics machineStats;

  private String currentState;
  // set while handlers of a transition run, handlers may not start another one
  private boolean transitionInFlight;

  StateMachineImpl(final MachineDefinition<T> definition, final StateMachineConfiguration config,
      final T subject, final Optional<String> initialState) throws StateMachineException {
    if (definition == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "State machine definition cannot be null");
    }
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "State machine configuration cannot be null");
    }
    this.definition = definition;
    this.transitionTable = definition.getTransitionTable();
    this.config = config;
    this.subject = Optional.ofNullable(subject);

    String startState = definition.getDefaultState();
    if (initialState.isPresent()) {
      final String requested = initialState.get();
      if (requested.trim().isEmpty()) {
        throw new StateMachineException(Code.INVALID_STATE_NAME);
      }
      if (!transitionTable.isValidState(requested)) {
        throw new StateMachineException(Code.INVALID_STATE,
            String.format("'%s' is not a recognized state.", requested));
      }
      startState = requested;
    }
    this.currentState = startState;

    machineStats = new TransitionStatistics(machineId, config.getRouteHistoryLimit());
    if (config.isStatisticsEnabled()) {
      machineStats.enter(startState);
    }
    logInfo(definition.getName(), machineId,
        String.format("Fired up state machine in state %s with %s", startState, config));
  }

  @Override
  public void transitionTo(final String nextState) throws StateMachineException {
    if (transitionInFlight) {
      recordFailure();
      logWarning(definition.getName(), machineId, String.format(
          "Rejected transition to %s requested while in flight from %s", nextState, currentState));
      throw new StateMachineException(Code.TRANSITION_IN_FLIGHT, String.format(
          "Cannot transition to '%s' while a transition from '%s' is in flight", nextState,
          currentState));
    }
    // 1. validate
    if (!transitionTable.isValidState(nextState)) {
      recordFailure();
      logWarning(definition.getName(), machineId,
          String.format("Rejected transition to unrecognized state %s", nextState));
      throw new StateMachineException(Code.INVALID_STATE,
          String.format("'%s' is not a recognized state.", nextState));
    }
    final String fromState = currentState;
    if (!transitionTable.isAllowed(fromState, nextState)) {
      recordFailure();
      logWarning(definition.getName(), machineId,
          String.format("Rejected transition %s->%s", fromState, nextState));
      throw StateMachineException.transitionNotAllowed(fromState, nextState);
    }

    // 2. resolve and run handlers, the machine still reports fromState while they run
    final HandlerSet<T> handlerSet = definition.getHandlers().resolve(nextState);
    transitionInFlight = true;
    try {
      if (handlerSet.getWildcardHandler().isPresent()) {
        logDebug(definition.getName(), machineId,
            String.format("Invoking wildcard handler for %s->%s", fromState, nextState));
        handlerSet.getWildcardHandler().get().onTransition(this, nextState);
      }
      if (handlerSet.getSpecificHandler().isPresent()) {
        logDebug(definition.getName(), machineId,
            String.format("Invoking %s handler for %s->%s", nextState, fromState, nextState));
        handlerSet.getSpecificHandler().get().onTransition(this, nextState);
      }
    } catch (StateMachineException | RuntimeException problem) {
      recordFailure();
      logError(definition.getName(), machineId, String.format(
          "Handler failed during transition %s->%s, staying in %s", fromState, nextState,
          fromState), problem);
      throw problem;
    } finally {
      transitionInFlight = false;
    }

    // 3. commit
    currentState = nextState;
    if (config.isStatisticsEnabled()) {
      machineStats.transitionSuccesses++;
      machineStats.lastTransitionMillis = System.currentTimeMillis();
      machineStats.enter(nextState);
    }
    logDebug(definition.getName(), machineId,
        String.format("Successfully transitioned from %s->%s", fromState, nextState));
  }

  @Override
  public String readCurrentState() {
    return currentState;
  }

  @Override
  public boolean isValid(final String state) {
    return transitionTable.isValidState(state);
  }

  @Override
  public boolean isAllowed(final String nextState) {
    return transitionTable.isAllowed(currentState, nextState);
  }

  @Override
  public List<String> allStates() {
    return transitionTable.allStates();
  }

  @Override
  public List<String> allowedTransitions() {
    try {
      return transitionTable.outgoing(currentState).orElse(Collections.emptyList());
    } catch (StateMachineException impossible) {
      // currentState is always a state of the table
      throw new IllegalStateException(impossible);
    }
  }

  @Override
  public boolean isTerminal() {
    return transitionTable.isTerminal(currentState);
  }

  @Override
  public Optional<T> getSubject() {
    return subject;
  }

  @Override
  public MachineDefinition<T> getDefinition() {
    return definition;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public TransitionStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public String toString() {
    return "StateMachine [id=" + machineId + ", definition=" + definition.getName()
        + ", currentState=" + currentState + "]";
  }

  private void recordFailure() {
    if (config.isStatisticsEnabled()) {
      machineStats.transitionFailures++;
    }
  }

  private static void logError(final String machineName, final String machineId,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineName).append("][i:")
        .append(machineId).append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String machineName, final String machineId,
      final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineName).append("][i:")
        .append(machineId).append("] ").append(message).toString());
  }

  private static void logInfo(final String machineName, final String machineId,
      final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineName).append("][i:")
        .append(machineId).append("] ").append(message).toString());
  }

  private static void logDebug(final String machineName, final String machineId,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineName).append("][i:")
          .append(machineId).append("] ").append(message).toString());
    }
  }

}
