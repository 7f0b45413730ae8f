package com.github.automata;

/**
 * Unified single exception that's thrown by this FSM library. The idea is to use the code enum to
 * encapsulate the various failure conditions so callers can tell a malformed argument apart from a
 * missing precondition or an automaton that is not fit for deterministic traversal.
 *
 * Note that exceptions raised by user-supplied {@link TransitionListener}s are never wrapped in
 * this exception, they reach the caller untouched.
 */
public final class FiniteStateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FiniteStateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FiniteStateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 2.
    RESERVED_STATE("The implicit error state is reserved and cannot be part of the state graph"),
    // 3.
    UNKNOWN_STATE("State does not exist in the state graph"),
    // 4.
    INVALID_TRANSITION("Transition is missing its guard or targets the implicit error state"),
    // 5.
    MISSING_START_STATE("State machine has no start state configured"),
    // 6.
    AMBIGUOUS_TRANSITION(
        "More than one transition accepts the input symbol, machine is not deterministic"),
    // 7.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
