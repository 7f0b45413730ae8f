package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.automata.FiniteStateMachineException.Code;

public class AdjacencyStateGraphTest {

  @Test
  public void testVertices() throws FiniteStateMachineException {
    final StateGraph<Character> graph = new AdjacencyStateGraph<>();
    final State a = State.named("a");
    final State b = State.named("b");
    assertTrue(graph.addVertex(b));
    assertTrue(graph.addVertex(a));
    assertFalse(graph.addVertex(a));
    assertEquals(Arrays.asList(b, a), new ArrayList<>(graph.getVertices()));
    assertTrue(graph.containsVertex(a));
    assertFalse(graph.containsVertex(null));
    try {
      graph.addVertex(State.ERROR);
      fail("error state is never a vertex");
    } catch (FiniteStateMachineException problem) {
      assertEquals(Code.RESERVED_STATE, problem.getCode());
    }
    try {
      graph.addVertex(null);
      fail("null is never a vertex");
    } catch (FiniteStateMachineException problem) {
      assertEquals(Code.INVALID_STATE_NAME, problem.getCode());
    }
  }

  @Test
  public void testRemoveVertexDropsIncidentEdgesAndNotifies()
      throws FiniteStateMachineException {
    final StateGraph<Character> graph = new AdjacencyStateGraph<>();
    final State a = State.named("a");
    final State b = State.named("b");
    final State c = State.named("c");
    graph.addVertices(Arrays.asList(a, b, c));
    final Transition<Character> aToB = new Transition<>(a, b, Guards.always());
    final Transition<Character> bToC = new Transition<>(b, c, Guards.always());
    final Transition<Character> cToA = new Transition<>(c, a, Guards.always());
    graph.addEdge(aToB);
    graph.addEdge(bToC);
    graph.addEdge(cToA);

    final List<State> removed = new ArrayList<>();
    graph.addVertexRemovedListener(removed::add);

    assertTrue(graph.removeVertex(b));
    assertFalse(graph.removeVertex(b));
    assertEquals(Collections.singletonList(b), removed);
    assertEquals(Collections.singletonList(cToA), graph.getEdges());
    assertFalse(graph.containsEdge(aToB));
    assertTrue(graph.getOutEdges(a).isEmpty());
    assertTrue(graph.getOutEdges(b).isEmpty());
  }

  @Test
  public void testEdges() throws FiniteStateMachineException {
    final StateGraph<Character> graph = new AdjacencyStateGraph<>();
    final State a = State.named("a");
    final State b = State.named("b");
    graph.addVertices(Arrays.asList(a, b));
    final Transition<Character> first = new Transition<>(a, b, Guards.equalTo('1'));
    final Transition<Character> second = new Transition<>(a, b, Guards.equalTo('2'));
    final Transition<Character> back = new Transition<>(b, a, Guards.equalTo('3'));
    graph.addEdge(first);
    graph.addEdge(second);
    graph.addEdge(back);
    assertEquals(Arrays.asList(first, second), graph.getOutEdges(a));
    assertEquals(Arrays.asList(first, second, back), graph.getEdges());
    assertTrue(graph.removeEdge(second));
    assertFalse(graph.removeEdge(second));
    assertFalse(graph.removeEdge(null));
    assertEquals(Arrays.asList(first, back), graph.getEdges());

    try {
      graph.addEdge(null);
      fail("null edge must be rejected");
    } catch (FiniteStateMachineException problem) {
      assertEquals(Code.INVALID_TRANSITION, problem.getCode());
    }
  }

}
