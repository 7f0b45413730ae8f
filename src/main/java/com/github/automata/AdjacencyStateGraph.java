package com.github.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.FiniteStateMachineException.Code;

/**
 * Adjacency-list backed {@link StateGraph}. Vertices and the outgoing edges of every vertex are
 * kept in insertion order so that enumerators walk the graph in a stable order.
 */
public final class AdjacencyStateGraph<T> implements StateGraph<T> {
  private static final Logger logger =
      LogManager.getLogger(AdjacencyStateGraph.class.getSimpleName());

  // K=vertex, V=outgoing edges of the vertex
  private final Map<State, List<Transition<T>>> adjacency = new LinkedHashMap<>();

  private final List<VertexRemovedListener> vertexRemovedListeners = new CopyOnWriteArrayList<>();

  @Override
  public boolean addVertex(final State state) throws FiniteStateMachineException {
    checkVertex(state);
    if (adjacency.containsKey(state)) {
      return false;
    }
    adjacency.put(state, new ArrayList<>());
    return true;
  }

  @Override
  public int addVertices(final Collection<State> states) throws FiniteStateMachineException {
    if (states == null) {
      throw new FiniteStateMachineException(Code.INVALID_STATE_NAME, "States cannot be null");
    }
    // validate the whole batch first, no partial additions
    for (final State state : states) {
      checkVertex(state);
    }
    int added = 0;
    for (final State state : states) {
      if (addVertex(state)) {
        added++;
      }
    }
    return added;
  }

  @Override
  public boolean removeVertex(final State state) {
    if (state == null || adjacency.remove(state) == null) {
      return false;
    }
    for (final List<Transition<T>> outEdges : adjacency.values()) {
      final Iterator<Transition<T>> edgeIterator = outEdges.iterator();
      while (edgeIterator.hasNext()) {
        if (edgeIterator.next().getToState().equals(state)) {
          edgeIterator.remove();
        }
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Removed vertex " + state + ", notifying " + vertexRemovedListeners.size()
          + " listeners");
    }
    for (final VertexRemovedListener listener : vertexRemovedListeners) {
      listener.vertexRemoved(state);
    }
    return true;
  }

  @Override
  public boolean containsVertex(final State state) {
    return state != null && adjacency.containsKey(state);
  }

  @Override
  public boolean addEdge(final Transition<T> transition) throws FiniteStateMachineException {
    if (transition == null) {
      throw new FiniteStateMachineException(Code.INVALID_TRANSITION, "Transition cannot be null");
    }
    if (!containsVertex(transition.getFromState())) {
      throw new FiniteStateMachineException(Code.UNKNOWN_STATE,
          "Transition source is not a vertex: " + transition.getFromState());
    }
    if (!containsVertex(transition.getToState())) {
      throw new FiniteStateMachineException(Code.UNKNOWN_STATE,
          "Transition target is not a vertex: " + transition.getToState());
    }
    return adjacency.get(transition.getFromState()).add(transition);
  }

  @Override
  public boolean removeEdge(final Transition<T> transition) {
    if (transition == null) {
      return false;
    }
    final List<Transition<T>> outEdges = adjacency.get(transition.getFromState());
    return outEdges != null && outEdges.remove(transition);
  }

  @Override
  public boolean containsEdge(final Transition<T> transition) {
    if (transition == null) {
      return false;
    }
    final List<Transition<T>> outEdges = adjacency.get(transition.getFromState());
    return outEdges != null && outEdges.contains(transition);
  }

  @Override
  public List<Transition<T>> getOutEdges(final State state) {
    final List<Transition<T>> outEdges = state == null ? null : adjacency.get(state);
    if (outEdges == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(outEdges);
  }

  @Override
  public Set<State> getVertices() {
    return Collections.unmodifiableSet(adjacency.keySet());
  }

  @Override
  public List<Transition<T>> getEdges() {
    final List<Transition<T>> edges = new ArrayList<>();
    for (final List<Transition<T>> outEdges : adjacency.values()) {
      edges.addAll(outEdges);
    }
    return Collections.unmodifiableList(edges);
  }

  @Override
  public void addVertexRemovedListener(final VertexRemovedListener listener) {
    if (listener != null) {
      vertexRemovedListeners.add(listener);
    }
  }

  private static void checkVertex(final State state) throws FiniteStateMachineException {
    if (state == null) {
      throw new FiniteStateMachineException(Code.INVALID_STATE_NAME, "State cannot be null");
    }
    if (state.isError()) {
      throw new FiniteStateMachineException(Code.RESERVED_STATE);
    }
  }

  @Override
  public String toString() {
    return "AdjacencyStateGraph [vertices=" + adjacency.keySet() + ", edges=" + getEdges().size()
        + "]";
  }
}
