package com.github.automata;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Commonly used transition guards.
 */
public final class Guards {

  /**
   * Guard that accepts every symbol.
   */
  public static <T> Predicate<T> always() {
    return symbol -> true;
  }

  /**
   * Guard that rejects every symbol. Useful as a placeholder for a guard that cannot be resolved.
   */
  public static <T> Predicate<T> never() {
    return symbol -> false;
  }

  public static <T> Predicate<T> equalTo(final T expected) {
    return symbol -> Objects.equals(expected, symbol);
  }

  @SafeVarargs
  public static <T> Predicate<T> anyOf(final T... accepted) {
    final Set<T> acceptedSymbols =
        Collections.unmodifiableSet(new HashSet<>(Arrays.asList(accepted)));
    return acceptedSymbols::contains;
  }

  private Guards() {}
}
