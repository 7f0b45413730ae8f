package com.github.automata;

/**
 * This represents the algorithm an {@link FsmEnumerator} uses to walk the state graph.
 */
public enum EnumerationMode {
  // track exactly one current state, more than one matching transition is a modeling error
  DETERMINISTIC,
  // track the set of all simultaneously reachable states, computed lazily per symbol
  NONDETERMINISTIC;
}
