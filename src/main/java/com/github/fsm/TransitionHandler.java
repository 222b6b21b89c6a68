package com.github.fsm;

/**
 * Behavior invoked around a transition. Handlers run after the transition has been validated but
 * before the machine commits the new state, so {@link StateMachine#readCurrentState()} still
 * reports the state being left while nextState is the state being entered. The bound subject, if
 * any, is available via {@link StateMachine#getSubject()} and may be mutated freely.
 *
 * Throwing from a handler aborts the transition: the current state is left as it was and the
 * exception reaches the caller of {@link StateMachine#transitionTo(String)}.
 *
 * @param <T> type of the subject the machine is bound to
 */
@FunctionalInterface
public interface TransitionHandler<T> {

  void onTransition(final StateMachine<T> machine, final String nextState)
      throws StateMachineException;

}
