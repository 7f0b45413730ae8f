package com.github.automata;

import java.util.Collections;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared cursor bookkeeping for both enumerator flavors. Subclasses only decide how the next set of
 * current states is computed from the current one.
 */
abstract class AbstractFsmEnumerator<T> implements FsmEnumerator<T> {
  private static final Logger logger = LogManager.getLogger(FsmEnumerator.class.getSimpleName());

  private final StateGraph<T> graph;
  private final String machineId;
  private final boolean traceSteps;

  // replaced, never mutated, on every move so that handed out views stay stable
  private Set<State> currentStates;
  private boolean inErrorState;

  AbstractFsmEnumerator(final State startState, final StateGraph<T> graph,
      final String machineId, final boolean traceSteps) {
    this.graph = graph;
    this.machineId = machineId;
    this.traceSteps = traceSteps;
    this.currentStates = Collections.singleton(startState);
  }

  @Override
  public final boolean step(final T inputSymbol) throws FiniteStateMachineException {
    if (inErrorState) {
      return false;
    }
    final Set<State> nextStates = nextStates(inputSymbol);
    if (nextStates.isEmpty()) {
      trace(inputSymbol, Collections.singleton(State.ERROR));
      currentStates = Collections.singleton(State.ERROR);
      inErrorState = true;
      return false;
    }
    trace(inputSymbol, nextStates);
    currentStates = Collections.unmodifiableSet(nextStates);
    return true;
  }

  /**
   * Computes the states reached from the current ones on the given symbol, firing the listeners of
   * every chosen transition. An empty set means no transition accepted the symbol.
   */
  abstract Set<State> nextStates(final T inputSymbol) throws FiniteStateMachineException;

  @Override
  public State getCurrentState() {
    return currentStates.iterator().next();
  }

  @Override
  public Set<State> getCurrentStates() {
    return currentStates;
  }

  @Override
  public boolean isInErrorState() {
    return inErrorState;
  }

  StateGraph<T> graph() {
    return graph;
  }

  private void trace(final T inputSymbol, final Set<State> nextStates) {
    if (traceSteps && logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(getMode()).append(" step on '").append(inputSymbol).append("': ")
          .append(currentStates).append("->").append(nextStates).toString());
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [currentStates=" + currentStates + ", inErrorState="
        + inErrorState + "]";
  }
}
