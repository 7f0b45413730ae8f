package com.github.automata;

/**
 * This object carries the details of a fired {@link Transition} to its listeners: the state the
 * machine was in before the move and the symbol that triggered it.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class StateTransitionEvent<T> {
  private final State sourceState;
  private final T inputSymbol;

  public StateTransitionEvent(final State sourceState, final T inputSymbol) {
    this.sourceState = sourceState;
    this.inputSymbol = inputSymbol;
  }

  public State getSourceState() {
    return sourceState;
  }

  public T getInputSymbol() {
    return inputSymbol;
  }

  @Override
  public String toString() {
    return "StateTransitionEvent [sourceState=" + sourceState + ", inputSymbol=" + inputSymbol
        + "]";
  }
}
