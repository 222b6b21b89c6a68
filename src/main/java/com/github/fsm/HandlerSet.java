package com.github.fsm;

import java.util.Optional;

/**
 * The handlers that apply to one transition: the wildcard handler, if registered, followed by the
 * handler for the destination state, if registered. Resolved per transition and never stored.
 *
 * @param <T> type of the subject the machine is bound to
 */
public final class HandlerSet<T> {
  private final Optional<TransitionHandler<T>> wildcardHandler;
  private final Optional<TransitionHandler<T>> specificHandler;

  HandlerSet(final Optional<TransitionHandler<T>> wildcardHandler,
      final Optional<TransitionHandler<T>> specificHandler) {
    this.wildcardHandler = wildcardHandler;
    this.specificHandler = specificHandler;
  }

  public Optional<TransitionHandler<T>> getWildcardHandler() {
    return wildcardHandler;
  }

  public Optional<TransitionHandler<T>> getSpecificHandler() {
    return specificHandler;
  }

  public boolean isEmpty() {
    return !wildcardHandler.isPresent() && !specificHandler.isPresent();
  }

  @Override
  public String toString() {
    return "HandlerSet [wildcard=" + wildcardHandler.isPresent() + ", specific="
        + specificHandler.isPresent() + "]";
  }
}
