package com.github.hsm;

/**
 * Unified single exception that's thrown and handled by this FSM simulator. The idea is to use the
 * code enum to encapsulate various error/exception conditions. That said, stack traces, where
 * available and desired, are not meant to be kept from users.
 *
 * Script faults never surface as this exception unless the simulator was configured to halt on
 * action errors, in which case the code is {@link Code#SIMULATION_HALTED}.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  // only set for SIMULATION_HALTED raised while the simulator was still being created
  private transient StateMachineSimulator haltedSimulator;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public StateMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  /**
   * When the initial entry action of a halting simulator fails, creation throws but the simulator
   * exists and sits in {@link SimulationLifecycle#HALTED}. It is handed back here so callers can
   * drain its log and reset it.
   */
  public StateMachineSimulator getHaltedSimulator() {
    return haltedSimulator;
  }

  StateMachineException withHaltedSimulator(final StateMachineSimulator haltedSimulator) {
    this.haltedSimulator = haltedSimulator;
    return this;
  }

  public static enum Code {
    // 1.
    DUPLICATE_INITIAL_STATE("More than one initial state is declared at the same machine level"),
    // 2.
    NO_STATES("No states defined in the FSM"),
    // 3.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 4.
    INVALID_MACHINE_SPEC("State machine specification is invalid"),
    // 5.
    INVALID_CONFIG("Simulator configuration is invalid"),
    // 6.
    INVALID_DIAGRAM("Diagram data could not be read"),
    // 7.
    SIMULATION_HALTED(
        "Simulation halted after an action script failed. Reset is required to continue."),
    // 8.
    UNKNOWN_FAILURE(
        "State machine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
