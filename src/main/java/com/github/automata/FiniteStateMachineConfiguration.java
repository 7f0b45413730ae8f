package com.github.automata;

/**
 * This class encapsulates all the configuration parameters for the FiniteStateMachine. Use the
 * {@code FiniteStateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. consumptionMode picks the enumerator used by {@link FiniteStateMachine#consume(Iterable)}. If
 * it is not set, machines consume deterministically.<br>
 * 2. traceSteps logs every enumerator step at DEBUG level. This is chatty for long inputs, leave it
 * off unless debugging a machine.<br>
 */
public final class FiniteStateMachineConfiguration {
  private final EnumerationMode consumptionMode;
  private final boolean traceSteps;

  public EnumerationMode getConsumptionMode() {
    return consumptionMode;
  }

  public boolean getTraceSteps() {
    return traceSteps;
  }

  /**
   * Deterministic consumption, no step tracing.
   */
  public static FiniteStateMachineConfiguration defaults() {
    return new FiniteStateMachineConfiguration(EnumerationMode.DETERMINISTIC, false);
  }

  public final static class FiniteStateMachineConfigurationBuilder {
    private EnumerationMode consumptionMode = EnumerationMode.DETERMINISTIC;
    private boolean traceSteps;

    public static FiniteStateMachineConfigurationBuilder newBuilder() {
      return new FiniteStateMachineConfigurationBuilder();
    }

    public FiniteStateMachineConfigurationBuilder consumptionMode(
        final EnumerationMode consumptionMode) {
      this.consumptionMode = consumptionMode;
      return this;
    }

    public FiniteStateMachineConfigurationBuilder traceSteps(boolean traceSteps) {
      this.traceSteps = traceSteps;
      return this;
    }

    public FiniteStateMachineConfiguration build() throws FiniteStateMachineException {
      final FiniteStateMachineConfiguration config =
          new FiniteStateMachineConfiguration(consumptionMode, traceSteps);
      config.validate();
      return config;
    }

    private FiniteStateMachineConfigurationBuilder() {}
  }

  private void validate() throws FiniteStateMachineException {
    StringBuilder messages = new StringBuilder();
    if (consumptionMode == null) {
      messages.append("ConsumptionMode cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new FiniteStateMachineException(FiniteStateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "FiniteStateMachineConfiguration [consumptionMode=" + consumptionMode + ", traceSteps="
        + traceSteps + "]";
  }

  private FiniteStateMachineConfiguration(final EnumerationMode consumptionMode,
      final boolean traceSteps) {
    this.consumptionMode = consumptionMode;
    this.traceSteps = traceSteps;
  }

}
