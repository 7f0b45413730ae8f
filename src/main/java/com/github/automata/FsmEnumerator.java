package com.github.automata;

import java.util.Set;

/**
 * A cursor over the state graph of a {@link FiniteStateMachine}. Enumerators are short-lived, one
 * per traversal, and only hold a read reference to the machine's graph: structural changes made to
 * the machine between two steps are visible to the next step.
 *
 * Once a step fails to find any accepting transition the enumerator parks in {@link State#ERROR}
 * and every later step returns false.
 */
public interface FsmEnumerator<T> {

  /**
   * Performs a state transition from the current state(s) using the given input symbol.
   *
   * Returns true iff a transition happened.
   */
  boolean step(final T inputSymbol) throws FiniteStateMachineException;

  /**
   * The representative current state: the first member of {@link #getCurrentStates()}.
   */
  State getCurrentState();

  /**
   * Read-only view of all current states, in the order they were reached.
   */
  Set<State> getCurrentStates();

  boolean isInErrorState();

  EnumerationMode getMode();

}
