package com.github.automata;

import java.util.Collections;
import java.util.Set;

import com.github.automata.FiniteStateMachineException.Code;

/**
 * Walks a deterministic finite state machine the standard way: one current state, at most one
 * transition may accept a given symbol.
 *
 * More than one accepting transition is treated as a modeling error rather than rejected input and
 * is reported as {@link Code#AMBIGUOUS_TRANSITION}; the cursor is left where it was.
 */
final class DeterministicFsmEnumerator<T> extends AbstractFsmEnumerator<T> {

  DeterministicFsmEnumerator(final State startState, final StateGraph<T> graph,
      final String machineId, final boolean traceSteps) {
    super(startState, graph, machineId, traceSteps);
  }

  @Override
  Set<State> nextStates(final T inputSymbol) throws FiniteStateMachineException {
    final State currentState = getCurrentState();
    Transition<T> match = null;
    for (final Transition<T> transition : graph().getOutEdges(currentState)) {
      if (transition.accepts(inputSymbol)) {
        if (match != null) {
          throw new FiniteStateMachineException(Code.AMBIGUOUS_TRANSITION,
              String.format("More than one transition from %s accepts symbol '%s'",
                  currentState.getName(), inputSymbol));
        }
        match = transition;
      }
    }
    if (match == null) {
      return Collections.emptySet();
    }
    match.fire(inputSymbol);
    return Collections.singleton(match.getToState());
  }

  @Override
  public EnumerationMode getMode() {
    return EnumerationMode.DETERMINISTIC;
  }
}
