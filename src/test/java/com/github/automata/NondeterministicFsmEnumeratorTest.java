package com.github.automata;

import static com.github.automata.FsmFactory.symbols;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.github.automata.FiniteStateMachineException.Code;

/**
 * Tests for nondeterministic traversal.
 */
public class NondeterministicFsmEnumeratorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testOverlappingGuards() throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = FsmFactory.nondeterministicMachine();
    final FsmEnumerator<Character> enumerator =
        machine.createEnumerator(EnumerationMode.NONDETERMINISTIC, machine.getStartState());

    assertTrue(enumerator.step('a'));
    assertEquals(Arrays.asList(State.named("1"), State.named("3")),
        new ArrayList<>(enumerator.getCurrentStates()));
    assertEquals(State.named("1"), enumerator.getCurrentState());

    // 1-a->1, 1-a->3, 3-a->4
    assertTrue(enumerator.step('a'));
    assertEquals(Arrays.asList(State.named("1"), State.named("3"), State.named("4")),
        new ArrayList<>(enumerator.getCurrentStates()));

    // only 3-c->3 accepts 'c' out of {1, 3, 4}
    assertTrue(enumerator.step('c'));
    assertEquals(Collections.singleton(State.named("3")), enumerator.getCurrentStates());
  }

  @Test
  public void testErrorStateIsAbsorbing() throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = FsmFactory.nondeterministicMachine();
    final FsmEnumerator<Character> enumerator =
        machine.createEnumerator(EnumerationMode.NONDETERMINISTIC, machine.getStartState());
    assertTrue(enumerator.step('a'));
    assertFalse(enumerator.step('z'));
    assertTrue(enumerator.isInErrorState());
    assertEquals(State.ERROR, enumerator.getCurrentState());
    for (final char symbol : "abc".toCharArray()) {
      assertFalse(enumerator.step(symbol));
      assertEquals(Collections.singleton(State.ERROR), enumerator.getCurrentStates());
    }
  }

  @Test
  public void testEveryMatchingTransitionFiresOnce() throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = new FiniteStateMachineImpl<>();
    final State p = State.named("p");
    final State q = State.named("q");
    final State r = State.named("r");
    final State t = State.named("t");
    machine.addStates(Arrays.asList(p, q, r, t));
    machine.addTransition(new Transition<>(p, q, Guards.equalTo('a')));
    machine.addTransition(new Transition<>(p, r, Guards.equalTo('a')));
    final Transition<Character> qToT = new Transition<>(q, t, Guards.equalTo('b'));
    final Transition<Character> rToT = new Transition<>(r, t, Guards.equalTo('b'));
    machine.addTransition(qToT);
    machine.addTransition(rToT);

    final List<State> sources = new ArrayList<>();
    final TransitionListener<Character> listener = event -> sources.add(event.getSourceState());
    qToT.addListener(listener);
    rToT.addListener(listener);

    final FsmEnumerator<Character> enumerator =
        machine.createEnumerator(EnumerationMode.NONDETERMINISTIC, p);
    assertTrue(enumerator.step('a'));
    assertTrue(sources.isEmpty());
    assertTrue(enumerator.step('b'));
    assertEquals(Arrays.asList(q, r), sources);
    assertEquals(Collections.singleton(t), enumerator.getCurrentStates());
  }

  @Test
  public void testListenerFailureLeavesCursorInPlace() throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = FsmFactory.multipleFinalStatesMachine();
    final State start = machine.getStartState();
    final Transition<Character> last = machine.getOutgoingTransitions(start).get(2);
    last.addListener(event -> {
      throw new UnsupportedOperationException("listener refused");
    });
    final FsmEnumerator<Character> enumerator =
        machine.createEnumerator(EnumerationMode.NONDETERMINISTIC, start);
    try {
      enumerator.step('x');
      fail("listener failure must propagate");
    } catch (UnsupportedOperationException problem) {
      assertEquals("listener refused", problem.getMessage());
    }
    assertEquals(Collections.singleton(start), enumerator.getCurrentStates());
  }

  @Test
  public void testCurrentStatesViewIsReadOnly() throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = FsmFactory.multipleFinalStatesMachine();
    final FsmEnumerator<Character> enumerator =
        machine.createEnumerator(EnumerationMode.NONDETERMINISTIC, machine.getStartState());
    enumerator.step('x');
    final Set<State> currentStates = enumerator.getCurrentStates();
    try {
      currentStates.clear();
      fail("current states view must be read only");
    } catch (UnsupportedOperationException expected) {
      assertEquals(3, currentStates.size());
    }
  }

  /**
   * The deterministic enumerator tracks the first nondeterministic state until the nondeterministic
   * side has more than one accepting transition, at which point it reports the ambiguity.
   */
  @Test
  public void testDeterministicAgreesWithSubsetConstruction() throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = FsmFactory.nondeterministicMachine();
    final FsmEnumerator<Character> deterministic =
        machine.createEnumerator(EnumerationMode.DETERMINISTIC, machine.getStartState());
    final FsmEnumerator<Character> nondeterministic =
        machine.createEnumerator(EnumerationMode.NONDETERMINISTIC, machine.getStartState());

    final String input = "bbcaa";
    int position = 0;
    for (final Character symbol : symbols(input)) {
      final int matches = countMatches(machine, nondeterministic.getCurrentStates(), symbol);
      final boolean ndMoved = nondeterministic.step(symbol);
      if (matches > 1) {
        try {
          deterministic.step(symbol);
          fail("deterministic step must be ambiguous at position " + position);
        } catch (FiniteStateMachineException problem) {
          assertEquals(Code.AMBIGUOUS_TRANSITION, problem.getCode());
        }
        break;
      }
      assertEquals(ndMoved, deterministic.step(symbol));
      assertEquals(nondeterministic.getCurrentState(), deterministic.getCurrentState());
      position++;
    }
    // b, b, c, a are deterministic; the second a out of start is not
    assertEquals(4, position);
  }

  @Test
  public void testDeterministicMachineAgreesWithSubsetConstruction()
      throws FiniteStateMachineException {
    final FiniteStateMachine<Character> machine = FsmFactory.evenNumberOfZeroesMachine();
    for (final String input : Arrays.asList("", "0", "0110", "0100102", "111")) {
      final ConsumptionResult<Character> deterministic =
          machine.consume(EnumerationMode.DETERMINISTIC, symbols(input));
      final ConsumptionResult<Character> nondeterministic =
          machine.consume(EnumerationMode.NONDETERMINISTIC, symbols(input));
      assertEquals(deterministic.isAccepted(), nondeterministic.isAccepted());
      assertEquals(deterministic.getLastStates(), nondeterministic.getLastStates());
      assertEquals(deterministic.getConsumedSymbols(), nondeterministic.getConsumedSymbols());
    }
  }

  private static int countMatches(final FiniteStateMachine<Character> machine,
      final Set<State> states, final Character symbol) {
    int matches = 0;
    for (final State state : states) {
      for (final Transition<Character> transition : machine.getOutgoingTransitions(state)) {
        if (transition.accepts(symbol)) {
          matches++;
        }
      }
    }
    return matches;
  }

}
