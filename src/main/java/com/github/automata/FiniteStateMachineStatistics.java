package com.github.automata;

/**
 * Holder of consumption statistics for one FSM. Counters are updated by
 * {@link FiniteStateMachine#consume(Iterable)} on the calling thread and share the machine's
 * single-writer contract.
 */
public final class FiniteStateMachineStatistics {
  private final String machineId;
  private final long startTstampMillis = System.currentTimeMillis();

  private long totalConsumptions;
  private long acceptedConsumptions;
  private long rejectedConsumptions;
  private long totalConsumedSymbols;
  private long lastConsumptionMillis;

  FiniteStateMachineStatistics(final String machineId) {
    this.machineId = machineId;
  }

  void record(final ConsumptionResult<?> result) {
    totalConsumptions++;
    if (result.isAccepted()) {
      acceptedConsumptions++;
    } else {
      rejectedConsumptions++;
    }
    totalConsumedSymbols += result.getConsumedSymbols();
    lastConsumptionMillis = System.currentTimeMillis();
  }

  public String getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getTotalConsumptions() {
    return totalConsumptions;
  }

  public long getAcceptedConsumptions() {
    return acceptedConsumptions;
  }

  public long getRejectedConsumptions() {
    return rejectedConsumptions;
  }

  public long getTotalConsumedSymbols() {
    return totalConsumedSymbols;
  }

  public long getLastConsumptionMillis() {
    return lastConsumptionMillis;
  }

  @Override
  public String toString() {
    return "FiniteStateMachineStatistics [machineId=" + machineId + ", startTstampMillis="
        + startTstampMillis + ", totalConsumptions=" + totalConsumptions
        + ", acceptedConsumptions=" + acceptedConsumptions + ", rejectedConsumptions="
        + rejectedConsumptions + ", totalConsumedSymbols=" + totalConsumedSymbols
        + ", lastConsumptionMillis=" + lastConsumptionMillis + "]";
  }

}
