package com.github.automata;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.FiniteStateMachineException.Code;

/**
 * Graph-backed {@link FiniteStateMachine}.
 *
 * The final state set and the start state are kept consistent with the graph through a
 * {@link StateGraph.VertexRemovedListener}, so they stay valid even when callers mutate the graph
 * returned by {@link #asGraph()} directly.
 */
public final class FiniteStateMachineImpl<T> implements FiniteStateMachine<T> {
  private static final Logger logger =
      LogManager.getLogger(FiniteStateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();

  private final FiniteStateMachineConfiguration config;
  private final StateGraph<T> graph;
  private final FiniteStateMachineStatistics machineStats;

  // always a subset of graph.getVertices()
  private final Set<State> finalStates = new LinkedHashSet<>();
  private State startState;

  public FiniteStateMachineImpl() {
    this(FiniteStateMachineConfiguration.defaults(), new AdjacencyStateGraph<>());
  }

  public FiniteStateMachineImpl(final FiniteStateMachineConfiguration config) {
    this(config, new AdjacencyStateGraph<>());
  }

  public FiniteStateMachineImpl(final FiniteStateMachineConfiguration config,
      final StateGraph<T> graph) {
    this.config = config == null ? FiniteStateMachineConfiguration.defaults() : config;
    this.graph = graph;
    this.machineStats = new FiniteStateMachineStatistics(machineId);
    this.graph.addVertexRemovedListener(this::onStateRemoved);
    logInfo(machineId, "Created state machine with " + this.config);
  }

  @Override
  public boolean addState(final State state) throws FiniteStateMachineException {
    return graph.addVertex(state);
  }

  @Override
  public int addStates(final Collection<State> states) throws FiniteStateMachineException {
    return graph.addVertices(states);
  }

  @Override
  public boolean removeState(final State state) {
    return graph.removeVertex(state);
  }

  @Override
  public boolean addTransition(final Transition<T> transition) throws FiniteStateMachineException {
    return graph.addEdge(transition);
  }

  @Override
  public boolean removeTransition(final Transition<T> transition) {
    return graph.removeEdge(transition);
  }

  @Override
  public Set<State> getStates() {
    return graph.getVertices();
  }

  @Override
  public List<Transition<T>> getTransitions() {
    return graph.getEdges();
  }

  @Override
  public List<Transition<T>> getOutgoingTransitions(final State state) {
    return graph.getOutEdges(state);
  }

  @Override
  public StateGraph<T> asGraph() {
    return graph;
  }

  @Override
  public void setFinalState(final State state) throws FiniteStateMachineException {
    checkKnownState(state, "final");
    finalStates.add(state);
  }

  @Override
  public void setFinalStates(final Collection<State> states) throws FiniteStateMachineException {
    if (states == null) {
      throw new FiniteStateMachineException(Code.INVALID_STATE_NAME, "States cannot be null");
    }
    for (final State state : states) {
      checkKnownState(state, "final");
    }
    finalStates.addAll(states);
  }

  @Override
  public boolean clearFinalState(final State state) {
    return finalStates.remove(state);
  }

  @Override
  public void clearFinalStates(final Collection<State> states) {
    if (states != null) {
      finalStates.removeAll(states);
    }
  }

  @Override
  public boolean isFinalState(final State state) {
    return finalStates.contains(state);
  }

  @Override
  public Set<State> getFinalStates() {
    return Collections.unmodifiableSet(finalStates);
  }

  @Override
  public State getStartState() {
    return startState;
  }

  @Override
  public void setStartState(final State state) throws FiniteStateMachineException {
    checkKnownState(state, "start");
    startState = state;
  }

  @Override
  public FsmEnumerator<T> createEnumerator(final EnumerationMode mode, final State startState)
      throws FiniteStateMachineException {
    checkKnownState(startState, "enumerator start");
    if (mode == EnumerationMode.NONDETERMINISTIC) {
      return new NondeterministicFsmEnumerator<>(startState, graph, machineId,
          config.getTraceSteps());
    }
    return new DeterministicFsmEnumerator<>(startState, graph, machineId, config.getTraceSteps());
  }

  @Override
  public ConsumptionResult<T> consume(final Iterable<T> inputSymbols)
      throws FiniteStateMachineException {
    return consume(config.getConsumptionMode(), inputSymbols);
  }

  @Override
  public ConsumptionResult<T> consume(final EnumerationMode mode, final Iterable<T> inputSymbols)
      throws FiniteStateMachineException {
    if (startState == null) {
      logError(machineId, "Cannot consume input without a start state");
      throw new FiniteStateMachineException(Code.MISSING_START_STATE);
    }
    final FsmEnumerator<T> enumerator = createEnumerator(mode, startState);
    long consumedSymbols = 0L;
    T lastSymbol = null;
    try {
      for (final T symbol : inputSymbols) {
        consumedSymbols++;
        lastSymbol = symbol;
        if (!enumerator.step(symbol)) {
          break;
        }
      }
    } catch (FiniteStateMachineException problem) {
      logError(machineId, String.format("Consumption failed at symbol %d '%s'", consumedSymbols,
          lastSymbol), problem);
      throw problem;
    }

    final ConsumptionResult<T> result = new ConsumptionResult<>(
        !Collections.disjoint(finalStates, enumerator.getCurrentStates()), lastSymbol,
        consumedSymbols, enumerator.getCurrentStates());
    machineStats.record(result);
    logDebug(machineId, "Consumed input: " + result);
    return result;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public FiniteStateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public FiniteStateMachineStatistics getStatistics() {
    return machineStats;
  }

  private void onStateRemoved(final State state) {
    finalStates.remove(state);
    if (state.equals(startState)) {
      logInfo(machineId, "Start state " + state.getName() + " was removed, machine has no start");
      startState = null;
    }
  }

  private void checkKnownState(final State state, final String role)
      throws FiniteStateMachineException {
    if (!graph.containsVertex(state)) {
      throw new FiniteStateMachineException(Code.UNKNOWN_STATE,
          String.format("Cannot use %s as %s state, it is not part of the machine", state, role));
    }
  }

  @Override
  public String toString() {
    return "FiniteStateMachineImpl [machineId=" + machineId + ", states=" + graph.getVertices()
        + ", startState=" + startState + ", finalStates=" + finalStates + "]";
  }

  private static void logError(final String machineId, final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logError(final String machineId, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), error);
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

}
