package com.github.automata;

import com.github.automata.FiniteStateMachineException.Code;

/**
 * This object represents an immutable state of a finite state machine. A state is identified purely
 * by its name, two instances with the same name are the same state.
 *
 * There's exactly one state that callers cannot create: {@link #ERROR}, the implicit absorbing sink
 * that enumerators move to when no transition accepts a symbol. It is never a vertex of any state
 * graph.
 */
public final class State {
  public static final State ERROR = new State("<error>", true);

  private final String name;
  private final boolean error;

  private State(final String name, final boolean error) {
    this.name = name;
    this.error = error;
  }

  /**
   * Creates a user state. The name is trimmed and must not be blank.
   */
  public static State named(final String name) throws FiniteStateMachineException {
    if (name == null || name.trim().isEmpty()) {
      throw new FiniteStateMachineException(Code.INVALID_STATE_NAME);
    }
    return new State(name.trim(), false);
  }

  public String getName() {
    return name;
  }

  public boolean isError() {
    return error;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + (error ? 1231 : 1237);
    result = prime * result + name.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    return error == other.error && name.equals(other.name);
  }

  @Override
  public String toString() {
    return error ? "State [ERROR]" : "State [name=" + name + "]";
  }
}
