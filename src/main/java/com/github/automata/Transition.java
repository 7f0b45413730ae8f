package com.github.automata;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import com.github.automata.FiniteStateMachineException.Code;

/**
 * A guarded edge between two states of a {@link FiniteStateMachine}. The guard decides whether an
 * input symbol may move the machine from {@link #getFromState()} to {@link #getToState()}.
 *
 * Notes for users:<br>
 * 1. the guard must be a pure predicate, enumerators evaluate it speculatively against every
 * outgoing transition of a state before picking any of them<br>
 *
 * 2. from/to states and the guard are fixed at construction time; the description and the listeners
 * may change at any time<br>
 *
 * 3. equality is structural over from/to states, guard identity and description. Listeners are
 * not part of it: attaching one does not change which edge of the graph a transition refers to<br>
 */
public final class Transition<T> {
  private final State fromState;
  private final State toState;
  private final Predicate<T> guard;
  private String description = "";

  private final List<TransitionListener<T>> listeners = new CopyOnWriteArrayList<>();

  public Transition(final State fromState, final State toState, final Predicate<T> guard)
      throws FiniteStateMachineException {
    if (fromState == null || toState == null) {
      throw new FiniteStateMachineException(Code.INVALID_STATE_NAME,
          "Transition states cannot be null");
    }
    if (fromState.isError() || toState.isError()) {
      throw new FiniteStateMachineException(Code.INVALID_TRANSITION,
          "Transition cannot start or end in the implicit error state");
    }
    if (guard == null) {
      throw new FiniteStateMachineException(Code.INVALID_TRANSITION,
          "Transition guard cannot be null");
    }
    this.fromState = fromState;
    this.toState = toState;
    this.guard = guard;
  }

  public Transition(final State fromState, final State toState, final Predicate<T> guard,
      final String description) throws FiniteStateMachineException {
    this(fromState, toState, guard);
    setDescription(description);
  }

  public State getFromState() {
    return fromState;
  }

  public State getToState() {
    return toState;
  }

  public Predicate<T> getGuard() {
    return guard;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(final String description) {
    this.description = description == null ? "" : description;
  }

  /**
   * Evaluates the guard against the given symbol.
   */
  public boolean accepts(final T inputSymbol) {
    return guard.test(inputSymbol);
  }

  public void addListener(final TransitionListener<T> listener) {
    if (listener != null) {
      listeners.add(listener);
    }
  }

  /**
   * Detaches the first occurrence of the given listener. Returns false if it was never attached.
   */
  public boolean removeListener(final TransitionListener<T> listener) {
    return listeners.remove(listener);
  }

  public List<TransitionListener<T>> getListeners() {
    return Collections.unmodifiableList(listeners);
  }

  /**
   * Invokes every listener in attachment order. The first listener to throw stops the iteration
   * and its exception propagates as is.
   */
  void fire(final T inputSymbol) {
    if (listeners.isEmpty()) {
      return;
    }
    final StateTransitionEvent<T> event = new StateTransitionEvent<>(fromState, inputSymbol);
    for (final TransitionListener<T> listener : listeners) {
      listener.onTransition(event);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, toState, System.identityHashCode(guard), description);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition<?> other = (Transition<?>) obj;
    return fromState.equals(other.fromState) && toState.equals(other.toState)
        && guard == other.guard && description.equals(other.description);
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", toState=" + toState + ", description="
        + description + ", listeners=" + listeners.size() + "]";
  }
}
