package com.github.hsm;

/**
 * This class encapsulates all the configuration parameters for a StateMachineSimulator. Use the
 * {@code SimulatorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. haltOnActionError is off by default: action script faults are logged and the simulation
 * carries on. When on, the first action fault freezes the simulator until reset().<br>
 * 2. logPrefix is prepended to every action log line of the root level; every nested sub-machine
 * adds {@link #subMachineLogPrefix} on top of its parent's prefix.<br>
 * 3. maxLogLines bounds the undrained action log. If this is not set, a default of 10000 lines is
 * used; callers that never drain will see the oldest lines dropped.<br>
 */
public final class SimulatorConfiguration {
  public static final String subMachineLogPrefix = "  [SUB] ";
  static final int defaultMaxLogLines = 10_000;

  private final boolean haltOnActionError;
  private final String logPrefix;
  private final int maxLogLines;

  public boolean getHaltOnActionError() {
    return haltOnActionError;
  }

  public String getLogPrefix() {
    return logPrefix;
  }

  public int getMaxLogLines() {
    return maxLogLines;
  }

  /**
   * Configuration used for the sub-machine of a superstate: same policies, deeper prefix.
   */
  SimulatorConfiguration forSubMachine() {
    return new SimulatorConfiguration(haltOnActionError, logPrefix + subMachineLogPrefix,
        maxLogLines);
  }

  public static SimulatorConfiguration defaults() {
    return new SimulatorConfiguration(false, "", defaultMaxLogLines);
  }

  public final static class SimulatorConfigurationBuilder {
    private boolean haltOnActionError;
    private String logPrefix = "";
    private int maxLogLines;

    public static SimulatorConfigurationBuilder newBuilder() {
      return new SimulatorConfigurationBuilder();
    }

    public SimulatorConfigurationBuilder haltOnActionError(final boolean haltOnActionError) {
      this.haltOnActionError = haltOnActionError;
      return this;
    }

    public SimulatorConfigurationBuilder logPrefix(final String logPrefix) {
      this.logPrefix = logPrefix;
      return this;
    }

    public SimulatorConfigurationBuilder maxLogLines(final int maxLogLines) {
      this.maxLogLines = maxLogLines;
      return this;
    }

    public SimulatorConfiguration build() throws StateMachineException {
      validate();
      return new SimulatorConfiguration(haltOnActionError, logPrefix,
          maxLogLines == 0 ? defaultMaxLogLines : maxLogLines);
    }

    private void validate() throws StateMachineException {
      StringBuilder messages = new StringBuilder();
      if (logPrefix == null) {
        messages.append("logPrefix cannot be null. ");
      }
      if (maxLogLines < 0) {
        messages.append("maxLogLines cannot be negative. ");
      }
      if (messages.length() > 0) {
        throw new StateMachineException(StateMachineException.Code.INVALID_CONFIG,
            messages.toString().trim());
      }
    }

    private SimulatorConfigurationBuilder() {}
  }

  @Override
  public String toString() {
    return "SimulatorConfiguration [haltOnActionError=" + haltOnActionError + ", logPrefix="
        + logPrefix + ", maxLogLines=" + maxLogLines + "]";
  }

  private SimulatorConfiguration(final boolean haltOnActionError, final String logPrefix,
      final int maxLogLines) {
    this.haltOnActionError = haltOnActionError;
    this.logPrefix = logPrefix;
    this.maxLogLines = maxLogLines;
  }

}
