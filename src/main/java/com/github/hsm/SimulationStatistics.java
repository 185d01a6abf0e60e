package com.github.hsm;

/**
 * Simple statistics holder for one simulator level. Counters are bumped by the level that owns
 * them; a parent does not fold in its sub-machines' counters.
 */
public final class SimulationStatistics {
  private final long startMillis = System.currentTimeMillis();
  final String machineId;
  int steps;
  int transitionsFired;
  int eventsRejected;
  int scriptExecutions;
  int scriptFaults;
  int scriptsBlocked;
  int subMachinesStarted;
  int resets;

  SimulationStatistics(final String machineId) {
    this.machineId = machineId;
  }

  public String getMachineId() {
    return machineId;
  }

  public int getSteps() {
    return steps;
  }

  public int getTransitionsFired() {
    return transitionsFired;
  }

  /**
   * Events that were dispatched but fired no transition.
   */
  public int getEventsRejected() {
    return eventsRejected;
  }

  public int getScriptExecutions() {
    return scriptExecutions;
  }

  public int getScriptFaults() {
    return scriptFaults;
  }

  /**
   * Distinct scripts the safety analyzer refused.
   */
  public int getScriptsBlocked() {
    return scriptsBlocked;
  }

  public int getSubMachinesStarted() {
    return subMachinesStarted;
  }

  public int getResets() {
    return resets;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "SimulationStatistics [machineId=" + machineId + ", steps=" + steps
        + ", transitionsFired=" + transitionsFired + ", eventsRejected=" + eventsRejected
        + ", scriptExecutions=" + scriptExecutions + ", scriptFaults=" + scriptFaults
        + ", scriptsBlocked=" + scriptsBlocked + ", subMachinesStarted=" + subMachinesStarted
        + ", resets=" + resets + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

}
