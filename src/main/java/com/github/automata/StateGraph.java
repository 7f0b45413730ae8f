package com.github.automata;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * The storage behind a {@link FiniteStateMachine}: a directed multigraph whose vertices are
 * {@link State}s and whose edges are {@link Transition}s. Parallel edges between the same ordered
 * pair of states are allowed.
 *
 * Implementations must never accept {@link State#ERROR} as a vertex and must notify every
 * {@link VertexRemovedListener} synchronously, after a vertex and its incident edges are gone.
 *
 * Implementations are not required to be thread-safe.
 */
public interface StateGraph<T> {

  /**
   * Returns true iff the vertex was newly added.
   */
  boolean addVertex(final State state) throws FiniteStateMachineException;

  /**
   * Adds all given vertices, all or nothing. Returns the number of newly added vertices.
   */
  int addVertices(final Collection<State> states) throws FiniteStateMachineException;

  /**
   * Removes a vertex along with every edge entering or leaving it. Returns true iff the vertex was
   * present.
   */
  boolean removeVertex(final State state);

  boolean containsVertex(final State state);

  /**
   * Adds an edge. Both endpoints must already be vertices.
   */
  boolean addEdge(final Transition<T> transition) throws FiniteStateMachineException;

  boolean removeEdge(final Transition<T> transition);

  boolean containsEdge(final Transition<T> transition);

  /**
   * Outgoing edges of a vertex in insertion order, empty if the vertex is unknown.
   */
  List<Transition<T>> getOutEdges(final State state);

  /**
   * Vertices in insertion order.
   */
  Set<State> getVertices();

  List<Transition<T>> getEdges();

  void addVertexRemovedListener(final VertexRemovedListener listener);

  @FunctionalInterface
  public static interface VertexRemovedListener {
    void vertexRemoved(final State state);
  }

}
