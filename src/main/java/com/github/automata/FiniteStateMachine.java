package com.github.automata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * A generic finite state machine over an alphabet of type T. States and guarded transitions live in
 * a {@link StateGraph}; the machine adds a start state and a set of final states on top of it and
 * can traverse the graph either deterministically or nondeterministically.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. this FSM instance is NOT thread-safe. Mutations, enumerator steps and consumption all run to
 * completion on the calling thread; callers that share a machine across threads must serialize
 * access themselves<br>
 *
 * 2. enumerators hold a read reference to the live graph, they do not copy it. Changing the machine
 * while an enumerator is in use is visible to that enumerator's next step<br>
 *
 * 3. the final state set always stays a subset of the graph's vertices: removing a state, through
 * the machine or directly through {@link #asGraph()}, also clears its final mark, and unsets it as
 * the start state<br>
 *
 * 4. a failed step is not an error: the enumerator moves to {@link State#ERROR} and stays there.
 * Only an ambiguous deterministic step raises an exception<br>
 */
public interface FiniteStateMachine<T> {

  ///// State & transition management /////
  /**
   * Returns true iff the state was newly added. Fails for {@link State#ERROR}.
   */
  boolean addState(final State state) throws FiniteStateMachineException;

  /**
   * All or nothing: if any state is reserved, none are added. Returns the number of newly added
   * states.
   */
  int addStates(final Collection<State> states) throws FiniteStateMachineException;

  /**
   * Removes the state, its transitions and its final/start designations.
   */
  boolean removeState(final State state);

  boolean addTransition(final Transition<T> transition) throws FiniteStateMachineException;

  boolean removeTransition(final Transition<T> transition);

  Set<State> getStates();

  List<Transition<T>> getTransitions();

  List<Transition<T>> getOutgoingTransitions(final State state);

  /**
   * The graph backing this machine. Mutating it directly is allowed, vertex removal keeps the final
   * states consistent.
   */
  StateGraph<T> asGraph();


  ///// Start & final states /////
  /**
   * Idempotent; fails if the state is not part of the machine.
   */
  void setFinalState(final State state) throws FiniteStateMachineException;

  /**
   * Idempotent; fails without marking anything if any state is not part of the machine.
   */
  void setFinalStates(final Collection<State> states) throws FiniteStateMachineException;

  /**
   * Returns true iff the state was marked final.
   */
  boolean clearFinalState(final State state);

  void clearFinalStates(final Collection<State> states);

  boolean isFinalState(final State state);

  Set<State> getFinalStates();

  /**
   * Null until set.
   */
  State getStartState();

  void setStartState(final State state) throws FiniteStateMachineException;


  ///// Traversal /////
  /**
   * Create a fresh enumerator positioned at the given start state.
   */
  FsmEnumerator<T> createEnumerator(final EnumerationMode mode, final State startState)
      throws FiniteStateMachineException;

  /**
   * Consume the input from the start state, using the configured consumption mode, until a symbol
   * fails to cause a transition or the input is exhausted.
   */
  ConsumptionResult<T> consume(final Iterable<T> inputSymbols) throws FiniteStateMachineException;

  /**
   * Same as {@link #consume(Iterable)} with an explicit enumeration mode. With
   * {@link EnumerationMode#NONDETERMINISTIC} the input is accepted if any reached state is final.
   */
  ConsumptionResult<T> consume(final EnumerationMode mode, final Iterable<T> inputSymbols)
      throws FiniteStateMachineException;


  ///// Machine-level functions /////
  /**
   * Reports the id of this FiniteStateMachine instance. You can have as many instances as you
   * like.
   */
  String getId();

  FiniteStateMachineConfiguration getConfiguration();

  FiniteStateMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class FiniteStateMachineBuilder<T> {
    private FiniteStateMachineConfiguration config;
    private StateGraph<T> graph;
    private final List<State> states = new ArrayList<>();
    private final List<Transition<T>> transitions = new ArrayList<>();
    private final List<State> finalStates = new ArrayList<>();
    private State startState;

    public static <S> FiniteStateMachineBuilder<S> newBuilder() {
      return new FiniteStateMachineBuilder<>();
    }

    public FiniteStateMachineBuilder<T> config(final FiniteStateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Use a custom, empty graph implementation instead of {@link AdjacencyStateGraph}.
     */
    public FiniteStateMachineBuilder<T> graph(final StateGraph<T> graph) {
      this.graph = graph;
      return this;
    }

    public FiniteStateMachineBuilder<T> state(final State state) {
      this.states.add(state);
      return this;
    }

    public FiniteStateMachineBuilder<T> states(final State... states) {
      this.states.addAll(Arrays.asList(states));
      return this;
    }

    public FiniteStateMachineBuilder<T> transition(final Transition<T> transition) {
      this.transitions.add(transition);
      return this;
    }

    public FiniteStateMachineBuilder<T> startState(final State startState) {
      this.startState = startState;
      return this;
    }

    public FiniteStateMachineBuilder<T> finalState(final State finalState) {
      this.finalStates.add(finalState);
      return this;
    }

    public FiniteStateMachineBuilder<T> finalStates(final State... finalStates) {
      this.finalStates.addAll(Arrays.asList(finalStates));
      return this;
    }

    public FiniteStateMachine<T> build() throws FiniteStateMachineException {
      final FiniteStateMachine<T> machine = new FiniteStateMachineImpl<>(
          config == null ? FiniteStateMachineConfiguration.defaults() : config,
          graph == null ? new AdjacencyStateGraph<>() : graph);
      machine.addStates(states);
      for (final Transition<T> transition : transitions) {
        machine.addTransition(transition);
      }
      if (startState != null) {
        machine.setStartState(startState);
      }
      machine.setFinalStates(finalStates);
      return machine;
    }

    private FiniteStateMachineBuilder() {}
  }

}
