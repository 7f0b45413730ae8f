package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.automata.FiniteStateMachineConfiguration.FiniteStateMachineConfigurationBuilder;

public class FiniteStateMachineConfigurationTest {

  @Test
  public void testDefaults() throws FiniteStateMachineException {
    final FiniteStateMachineConfiguration config =
        FiniteStateMachineConfigurationBuilder.newBuilder().build();
    assertEquals(EnumerationMode.DETERMINISTIC, config.getConsumptionMode());
    assertFalse(config.getTraceSteps());
    assertEquals(config.toString(), FiniteStateMachineConfiguration.defaults().toString());
  }

  @Test
  public void testBuilder() throws FiniteStateMachineException {
    final FiniteStateMachineConfiguration config = FiniteStateMachineConfigurationBuilder
        .newBuilder().consumptionMode(EnumerationMode.NONDETERMINISTIC).traceSteps(true).build();
    assertEquals(EnumerationMode.NONDETERMINISTIC, config.getConsumptionMode());
    assertTrue(config.getTraceSteps());
  }

  @Test
  public void testValidation() {
    try {
      FiniteStateMachineConfigurationBuilder.newBuilder().consumptionMode(null).build();
      fail("consumption mode is mandatory");
    } catch (FiniteStateMachineException problem) {
      assertEquals(FiniteStateMachineException.Code.INVALID_MACHINE_CONFIG, problem.getCode());
    }
  }

}
