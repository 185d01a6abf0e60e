package com.github.hsm;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A hierarchical Finite State Machine simulator. States carry entry, during and exit scripts,
 * transitions carry guard and action scripts, and a superstate may own a complete sub-machine that
 * is started when the superstate is entered and torn down when it is left.
 *
 * Notes for users:<br>
 * 0a. scripts are untrusted; each distinct script is statically checked before it may ever run and
 * then interpreted against a small allow-listed surface. This is best-effort and not a security
 * boundary.<br>
 * 0b. script faults never escape as exceptions unless haltOnActionError is configured, everything a
 * script does or fails to do shows up in the action log.<br>
 *
 * 1. this simulator instance is NOT thread-safe; confine each instance to one thread<br>
 *
 * 2. every machine level has its own variable scope. The only value a sub-machine hands up to its
 * parent is {@code <superstate>_sub_completed}, set once the sub-machine sits in a final state.<br>
 *
 * 3. events sent to {@link #step(String)} are dispatched to this level only; the active
 * sub-machine is stepped internally, without an event. Use {@link #getActiveSubSimulator()} to
 * send events into a sub-machine.<br>
 *
 * 4. once halted, a simulator ignores every step until {@link #reset()} is called.<br>
 */
public interface StateMachineSimulator {

  /**
   * Advance the simulation by one step: run the current state's during script, step the active
   * sub-machine internally and then, if an event is given, dispatch it.
   *
   * @param event event to dispatch, or null for an internal step
   * @return the composite state name after the step and the log lines it produced
   * @throws StateMachineException with {@link StateMachineException.Code#SIMULATION_HALTED} when an
   *         action failed under haltOnActionError, at this level or below
   */
  StepResult step(final String event) throws StateMachineException;

  /**
   * Clear the variables, tear down any sub-machine and re-enter the initial state. Compiled
   * scripts are reused.
   */
  void reset() throws StateMachineException;

  /**
   * Current state name with the active sub-machine states nested in parentheses, eg.
   * {@code Processing (SubActive)}.
   */
  String getCurrentStateName();

  /**
   * Name of the deepest active state.
   */
  String getCurrentLeafStateName();

  /**
   * A copy of this level's variables.
   */
  Map<String, Object> getVariables();

  /**
   * Sorted event ids that have a transition out of the current state of the active leaf machine
   * and, when a sub-machine is active, of the level directly above that leaf. Levels further up
   * are not included. Guards are not evaluated.
   */
  List<String> getPossibleEvents();

  /**
   * Return and clear the action log lines accumulated since the last drain.
   */
  List<String> drainLog();

  SimulationLifecycle getLifecycle();

  boolean isHalted();

  /**
   * The sub-machine of the active superstate, if any.
   */
  Optional<StateMachineSimulator> getActiveSubSimulator();

  /**
   * Reports the id of this simulator instance. Sub-machines carry their parent's id suffixed with
   * the superstate name.
   */
  String getId();

  /**
   * Returns the config that this simulator is wired with.
   */
  SimulatorConfiguration getConfiguration();

  /**
   * Report statistics for this machine level.
   */
  SimulationStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build simulators.
   */
  public final static class StateMachineSimulatorBuilder {
    private MachineSpec spec;
    private SimulatorConfiguration config;

    public static StateMachineSimulatorBuilder newBuilder() {
      return new StateMachineSimulatorBuilder();
    }

    public StateMachineSimulatorBuilder spec(final MachineSpec spec) {
      this.spec = spec;
      return this;
    }

    public StateMachineSimulatorBuilder config(final SimulatorConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineSimulator build() throws StateMachineException {
      return StateMachineSimulatorImpl.create(spec, config);
    }

    private StateMachineSimulatorBuilder() {}
  }

}
