package com.github.fsm;

/**
 * Unified single exception that's thrown and handled by this FSM. The idea is to use the code enum
 * to encapsulate various error/exception conditions. That said, stack traces, where available and
 * desired, are not meant to be kept from users.
 *
 * Construction-time failures (INVALID_DEFAULT_STATE, NO_STATES_DEFINED, INVALID_TRANSITIONS,
 * INVALID_HANDLER, MALFORMED_DEFINITION) abort building the object. Operation-time failures
 * (INVALID_STATE, TRANSITION_NOT_ALLOWED, TRANSITION_IN_FLIGHT) leave the machine untouched and
 * fully usable.
 *
 * @author gaurav
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  // only populated for TRANSITION_NOT_ALLOWED
  private final String fromState;
  private final String toState;

  public StateMachineException(final Code code) {
    this(code, code.getDescription());
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.fromState = null;
    this.toState = null;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
    this.fromState = null;
    this.toState = null;
  }

  public StateMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
    this.fromState = null;
    this.toState = null;
  }

  private StateMachineException(final String fromState, final String toState) {
    super(String.format("'%s' cannot transition to '%s'", fromState, toState));
    this.code = Code.TRANSITION_NOT_ALLOWED;
    this.fromState = fromState;
    this.toState = toState;
  }

  static StateMachineException transitionNotAllowed(final String fromState,
      final String toState) {
    return new StateMachineException(fromState, toState);
  }

  public Code getCode() {
    return code;
  }

  /**
   * Source state of a rejected transition, null for every other code.
   */
  public String getFromState() {
    return fromState;
  }

  /**
   * Target state of a rejected transition, null for every other code.
   */
  public String getToState() {
    return toState;
  }

  public static enum Code {
    // 1.
    INVALID_DEFAULT_STATE("Default state is not defined or is not a state of the transition table"),
    // 2.
    INVALID_STATE("State is not a recognized state of the state machine"),
    // 3.
    TRANSITION_NOT_ALLOWED("Attempted transition between from->to states is not allowed"),
    // 4.
    MALFORMED_DEFINITION("State machine definition cannot be interpreted"),
    // 5.
    NO_STATES_DEFINED("Transition table does not define any states"),
    // 6.
    INVALID_HANDLER("Transition handler registration is invalid"),
    // 7.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 8.
    INVALID_TRANSITIONS("Transitions are duplicated or reference undeclared states"),
    // 9.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 10.
    HANDLER_FAILURE(
        "Transition handler failed. Check exception stacktrace for more details of the failure."),
    // 11.
    TRANSITION_IN_FLIGHT("Cannot start a transition while another one is running its handlers");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
