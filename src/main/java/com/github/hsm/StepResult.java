package com.github.hsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This object encapsulates the outcome of a single {@link StateMachineSimulator#step(String)}: the
 * composite state name the simulator ended up in and every action log line drained by the step.
 *
 * A step that hits a halting action fault does not produce a result, it throws instead and leaves
 * its lines in the log for {@link StateMachineSimulator#drainLog()}.
 */
public final class StepResult {
  private final String stateName;
  private final List<String> log;

  public StepResult(final String stateName, final List<String> log) {
    this.stateName = stateName;
    this.log = log == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(log));
  }

  public String getStateName() {
    return stateName;
  }

  public List<String> getLog() {
    return log;
  }

  @Override
  public String toString() {
    return "StepResult [stateName=" + stateName + ", log=" + log + "]";
  }
}
