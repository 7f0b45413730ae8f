package com.github.automata;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a nondeterministic finite state machine by tracking every simultaneously reachable state.
 * This is an online subset construction: the next set of states is computed per symbol and never
 * cached, so no DFA is ever built.
 *
 * Every accepting transition fires its listeners exactly once per step, even when its target was
 * already reached through another transition.
 */
final class NondeterministicFsmEnumerator<T> extends AbstractFsmEnumerator<T> {

  NondeterministicFsmEnumerator(final State startState, final StateGraph<T> graph,
      final String machineId, final boolean traceSteps) {
    super(startState, graph, machineId, traceSteps);
  }

  @Override
  Set<State> nextStates(final T inputSymbol) {
    // select first, fire after: guards are all evaluated against the pre-step graph
    final List<Transition<T>> matches = new ArrayList<>();
    for (final State currentState : getCurrentStates()) {
      for (final Transition<T> transition : graph().getOutEdges(currentState)) {
        if (transition.accepts(inputSymbol)) {
          matches.add(transition);
        }
      }
    }
    final Set<State> nextStates = new LinkedHashSet<>();
    for (final Transition<T> transition : matches) {
      transition.fire(inputSymbol);
      nextStates.add(transition.getToState());
    }
    return nextStates;
  }

  @Override
  public EnumerationMode getMode() {
    return EnumerationMode.NONDETERMINISTIC;
  }
}
