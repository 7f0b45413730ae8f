package com.github.automata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * This object encapsulates the result of a {@link FiniteStateMachine} consuming a sequence of input
 * symbols.
 *
 * Acceptance is reported by {@link #isAccepted()}. When consumption stopped early because no
 * transition accepted a symbol, {@link #getLastSymbol()} is that symbol,
 * {@link #getConsumedSymbols()} counts it, and {@link #getLastState()} is {@link State#ERROR}. For
 * an empty input the last symbol is null and the last state is the start state.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class ConsumptionResult<T> {
  private final boolean accepted;
  private final T lastSymbol;
  private final long consumedSymbols;
  private final Set<State> lastStates;

  ConsumptionResult(final boolean accepted, final T lastSymbol, final long consumedSymbols,
      final Set<State> lastStates) {
    this.accepted = accepted;
    this.lastSymbol = lastSymbol;
    this.consumedSymbols = consumedSymbols;
    this.lastStates = Collections.unmodifiableSet(new LinkedHashSet<>(lastStates));
  }

  public boolean isAccepted() {
    return accepted;
  }

  public T getLastSymbol() {
    return lastSymbol;
  }

  public long getConsumedSymbols() {
    return consumedSymbols;
  }

  /**
   * The first of {@link #getLastStates()}.
   */
  public State getLastState() {
    return lastStates.iterator().next();
  }

  public Set<State> getLastStates() {
    return lastStates;
  }

  @Override
  public String toString() {
    return "ConsumptionResult [accepted=" + accepted + ", lastSymbol=" + lastSymbol
        + ", consumedSymbols=" + consumedSymbols + ", lastStates=" + lastStates + "]";
  }
}
