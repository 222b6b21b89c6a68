package com.github.fsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.fsm.StateMachineException.Code;

/**
 * Explicit registry of transition handlers: at most one wildcard handler that runs on every
 * transition plus at most one handler per destination state. The registry is immutable once built.
 *
 * @param <T> type of the subject the machine is bound to
 */
public final class TransitionHandlers<T> {
  private final Optional<TransitionHandler<T>> wildcardHandler;
  // K=toState, V=handler
  private final Map<String, TransitionHandler<T>> stateHandlers;

  private TransitionHandlers(final Optional<TransitionHandler<T>> wildcardHandler,
      final Map<String, TransitionHandler<T>> stateHandlers) {
    this.wildcardHandler = wildcardHandler;
    this.stateHandlers = Collections.unmodifiableMap(stateHandlers);
  }

  public static <T> TransitionHandlers<T> none() {
    return new TransitionHandlers<>(Optional.empty(), new LinkedHashMap<>());
  }

  /**
   * Find the handlers applicable to a transition into toState. Absence of either handler is
   * normal, this never fails.
   */
  public HandlerSet<T> resolve(final String toState) {
    return new HandlerSet<>(wildcardHandler, Optional.ofNullable(stateHandlers.get(toState)));
  }

  public Optional<TransitionHandler<T>> getWildcardHandler() {
    return wildcardHandler;
  }

  public Map<String, TransitionHandler<T>> getStateHandlers() {
    return stateHandlers;
  }

  public boolean isEmpty() {
    return !wildcardHandler.isPresent() && stateHandlers.isEmpty();
  }

  /**
   * Fails unless every state with a handler is a state of the transition table.
   */
  void validateAgainst(final TransitionTable transitionTable) throws StateMachineException {
    final List<String> unknown = new ArrayList<>();
    for (final String state : stateHandlers.keySet()) {
      if (!transitionTable.isValidState(state)) {
        unknown.add(state);
      }
    }
    if (!unknown.isEmpty()) {
      throw new StateMachineException(Code.INVALID_HANDLER,
          "Handlers registered for unrecognized states: " + unknown);
    }
  }

  @Override
  public String toString() {
    return "TransitionHandlers [wildcard=" + wildcardHandler.isPresent() + ", states="
        + stateHandlers.keySet() + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to register handlers. Registration problems are
   * reported by {@link #build()}.
   */
  public final static class TransitionHandlersBuilder<T> {
    private TransitionHandler<T> wildcardHandler;
    private final Map<String, TransitionHandler<T>> stateHandlers = new LinkedHashMap<>();
    private final StringBuilder problems = new StringBuilder();

    public static <T> TransitionHandlersBuilder<T> newBuilder() {
      return new TransitionHandlersBuilder<>();
    }

    public TransitionHandlersBuilder<T> onAnyTransition(final TransitionHandler<T> handler) {
      if (handler == null) {
        problems.append("Wildcard handler cannot be null. ");
      } else if (wildcardHandler != null) {
        problems.append("Wildcard handler is already registered. ");
      } else {
        wildcardHandler = handler;
      }
      return this;
    }

    public TransitionHandlersBuilder<T> onTransitionTo(final String toState,
        final TransitionHandler<T> handler) {
      if (toState == null || toState.trim().isEmpty()) {
        problems.append("Handler state name cannot be null or blank. ");
      } else if (handler == null) {
        problems.append(String.format("Handler for '%s' cannot be null. ", toState));
      } else if (stateHandlers.putIfAbsent(toState, handler) != null) {
        problems.append(String.format("Handler for '%s' is already registered. ", toState));
      }
      return this;
    }

    /**
     * Copy every registration of an existing registry into this builder.
     */
    public TransitionHandlersBuilder<T> addAll(final TransitionHandlers<T> handlers) {
      if (handlers == null) {
        return this;
      }
      if (handlers.wildcardHandler.isPresent()) {
        onAnyTransition(handlers.wildcardHandler.get());
      }
      for (final Map.Entry<String, TransitionHandler<T>> entry : handlers.stateHandlers
          .entrySet()) {
        onTransitionTo(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public TransitionHandlers<T> build() throws StateMachineException {
      if (problems.length() > 0) {
        throw new StateMachineException(Code.INVALID_HANDLER, problems.toString().trim());
      }
      return new TransitionHandlers<>(Optional.ofNullable(wildcardHandler),
          new LinkedHashMap<>(stateHandlers));
    }

    private TransitionHandlersBuilder() {}
  }

}
