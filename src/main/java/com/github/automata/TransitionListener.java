package com.github.automata;

/**
 * Hook invoked synchronously when the {@link Transition} it is attached to is chosen by an
 * enumerator, before the enumerator moves to the transition's target.
 *
 * Any RuntimeException thrown here propagates to the caller of
 * {@link FsmEnumerator#step(Object)} and the move does not happen.
 */
@FunctionalInterface
public interface TransitionListener<T> {

  void onTransition(final StateTransitionEvent<T> event);

}
