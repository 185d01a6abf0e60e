package com.github.hsm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hsm.Machine.DispatchOutcome;
import com.github.hsm.MachineDefinition.DefinedState;
import com.github.hsm.MachineDefinition.DefinedTransition;
import com.github.hsm.StateMachineException.Code;

/**
 * The runtime of one machine level: a live {@link Machine}, its variable scope, its action log and
 * at most one child runtime for the active superstate. The parent exclusively owns the child; the
 * child knows nothing of its parent.
 *
 * Notes for users:<br>
 * 1. instances are created through {@link #create(MachineSpec, SimulatorConfiguration)}, which
 * builds and validates the whole level and enters its initial state<br>
 *
 * 2. not thread-safe, see {@link StateMachineSimulator}<br>
 */
public final class StateMachineSimulatorImpl implements StateMachineSimulator {
  private static final Logger logger =
      LogManager.getLogger(StateMachineSimulatorImpl.class.getSimpleName());

  private final String machineId;
  private final SimulatorConfiguration configuration;
  private final Map<String, Object> scope = new LinkedHashMap<>();
  private final ActionLog actionLog;
  private final SimulationStatistics statistics;
  private final MachineDefinition definition;
  private final MachineHooks hooks = new SimulatorHooks();

  private SimulationLifecycle lifecycle = SimulationLifecycle.UNINITIALIZED;
  private Machine machine;
  private StateMachineSimulatorImpl activeSubSimulator;
  private String activeSuperstateName;

  private StateMachineSimulatorImpl(final MachineSpec spec,
      final SimulatorConfiguration configuration, final String machineId, final boolean root)
      throws StateMachineException {
    this.machineId = machineId;
    this.configuration = configuration;
    this.actionLog =
        new ActionLog(machineId, configuration.getLogPrefix(), configuration.getMaxLogLines());
    this.statistics = new SimulationStatistics(machineId);
    final ScriptExecutor executor = new ScriptExecutor(machineId, scope, actionLog,
        this::currentStateContext, configuration.getHaltOnActionError(),
        () -> lifecycle = SimulationLifecycle.HALTED, statistics);
    this.definition = new MachineBuilder(actionLog).build(spec, executor, root);
  }

  /**
   * Build a simulator for the given root machine and enter its initial state.
   *
   * @param configuration null for {@link SimulatorConfiguration#defaults()}
   * @throws StateMachineException for structural problems of the spec, or
   *         {@link Code#SIMULATION_HALTED} when the initial entry script halts; the halted
   *         simulator is then available from {@link StateMachineException#getHaltedSimulator()}
   */
  public static StateMachineSimulator create(final MachineSpec spec,
      final SimulatorConfiguration configuration) throws StateMachineException {
    final SimulatorConfiguration effective =
        configuration == null ? SimulatorConfiguration.defaults() : configuration;
    final StateMachineSimulatorImpl simulator = new StateMachineSimulatorImpl(spec, effective,
        UUID.randomUUID().toString(), true);
    try {
      simulator.activate();
    } catch (StateMachineException halted) {
      throw halted.withHaltedSimulator(simulator);
    }
    return simulator;
  }

  private void activate() throws StateMachineException {
    machine = definition.newMachine(hooks);
    try {
      machine.activateInitial();
    } catch (StateMachineException problem) {
      throw halt(problem);
    }
    lifecycle = SimulationLifecycle.READY;
    actionLog.log("FSM Initialized. Current state: " + machine.getCurrentState().getName());
  }

  @Override
  public void reset() throws StateMachineException {
    statistics.resets++;
    actionLog.log("--- FSM Resetting ---");
    scope.clear();
    lifecycle = SimulationLifecycle.UNINITIALIZED;
    if (activeSubSimulator != null) {
      actionLog.log("Resetting active sub-machine...");
      try {
        activeSubSimulator.reset();
      } catch (StateMachineException subProblem) {
        // the child is discarded right below, its own log already carries the halt
        logWarning(machineId, "Sub-machine in '" + activeSuperstateName
            + "' halted while resetting: " + subProblem.getMessage());
      }
      actionLog.absorb(activeSubSimulator.drainLog());
      activeSubSimulator = null;
      activeSuperstateName = null;
    }
    machine = definition.newMachine(hooks);
    try {
      machine.activateInitial();
    } catch (StateMachineException problem) {
      throw halt(problem);
    }
    lifecycle = SimulationLifecycle.READY;
    actionLog.log("FSM Reset. Current state: " + machine.getCurrentState().getName());
  }

  @Override
  public StepResult step(final String event) throws StateMachineException {
    final String eventId = event == null || event.trim().isEmpty() ? null : event.trim();
    final String eventLabel = eventId == null ? "Internal" : eventId;
    if (lifecycle == SimulationLifecycle.HALTED) {
      actionLog.log("Simulation HALTED. Event '" + eventLabel + "' ignored. Reset required.");
      return new StepResult(getCurrentStateName(), drainLog());
    }
    statistics.steps++;
    final DefinedState current = machine.getCurrentState();
    actionLog.log("--- Step. State: " + getCurrentStateName() + ". Event: " + eventLabel + " ---");
    try {
      if (current.getDuringAction() != null) {
        actionLog.log("During action for '" + current.getName() + "': "
            + current.getSpec().getDuringAction().get());
        current.getDuringAction().run();
      }
      if (activeSubSimulator != null) {
        stepSubSimulator();
      }
      if (eventId != null) {
        actionLog.log("Sending event '" + eventId + "' to FSM.");
        dispatch(eventId, current);
      } else if (activeSubSimulator == null) {
        actionLog.log("No event. 'During' actions done. State remains '" + current.getName()
            + "'.");
      }
    } catch (StateMachineException problem) {
      throw halt(problem);
    }
    return new StepResult(getCurrentStateName(), drainLog());
  }

  private void stepSubSimulator() throws StateMachineException {
    final String superstate = activeSuperstateName;
    actionLog.log("Internal step for sub-machine in '" + superstate + "'.");
    try {
      actionLog.absorb(activeSubSimulator.step(null).getLog());
    } catch (StateMachineException subHalted) {
      actionLog.absorb(activeSubSimulator.drainLog());
      throw propagate(superstate, subHalted);
    }
    final DefinedState subState = activeSubSimulator.machine.getCurrentState();
    if (subState.isFinal()) {
      actionLog.log("Sub-machine in '" + superstate + "' reached final state: '"
          + subState.getName() + "'.");
      final String completedVariable = superstate + "_sub_completed";
      scope.put(completedVariable, Boolean.TRUE);
      actionLog.log("Variable '" + completedVariable + "' set to True in parent FSM.");
    }
  }

  private void dispatch(final String event, final DefinedState from)
      throws StateMachineException {
    final DispatchOutcome outcome = machine.dispatch(event);
    switch (outcome) {
      case FIRED:
        break;
      case UNKNOWN_EVENT:
        statistics.eventsRejected++;
        actionLog.log("Event '" + event + "' not defined on FSM.");
        break;
      case NO_TRANSITION:
        statistics.eventsRejected++;
        actionLog.log(
            "Event '" + event + "' not allowed or no transition from '" + from.getName() + "'.");
        break;
      case CONDITIONS_FALSE:
        statistics.eventsRejected++;
        actionLog.log("Event '" + event + "' from '" + from.getName()
            + "' not taken: no transition condition evaluated True.");
        break;
    }
  }

  private void startSubSimulator(final DefinedState superstate) throws StateMachineException {
    final String name = superstate.getName();
    actionLog.log("Superstate '" + name + "' entered. Initializing its sub-machine.");
    final StateMachineSimulatorImpl child;
    try {
      child = new StateMachineSimulatorImpl(superstate.getSpec().getSubMachine().get(),
          configuration.forSubMachine(), machineId + "/" + name, false);
    } catch (StateMachineException invalid) {
      actionLog.log("ERROR initializing sub-machine for '" + name + "': " + invalid.getMessage());
      logError(machineId, "Sub-machine init error for '" + name + "'", invalid);
      if (configuration.getHaltOnActionError()) {
        lifecycle = SimulationLifecycle.HALTED;
        throw new StateMachineException(Code.SIMULATION_HALTED,
            "Sub-FSM init failed for " + name + ": " + invalid.getMessage(), invalid);
      }
      return;
    }
    try {
      child.activate();
    } catch (StateMachineException subHalted) {
      actionLog.absorb(child.drainLog());
      throw propagate(name, subHalted);
    }
    statistics.subMachinesStarted++;
    activeSubSimulator = child;
    activeSuperstateName = name;
    actionLog.absorb(child.drainLog());
  }

  private StateMachineException propagate(final String superstate,
      final StateMachineException subHalted) {
    lifecycle = SimulationLifecycle.HALTED;
    actionLog
        .log("Propagation: Parent HALTED due to sub-machine error in '" + superstate + "'.");
    return new StateMachineException(Code.SIMULATION_HALTED,
        "Sub-machine in '" + superstate + "' halted: " + subHalted.getMessage(), subHalted);
  }

  private StateMachineException halt(final StateMachineException problem) {
    if (problem.getCode() == Code.SIMULATION_HALTED) {
      lifecycle = SimulationLifecycle.HALTED;
      actionLog.log("[SIMULATION HALTED] " + problem.getMessage());
      logError(machineId, "Simulation halted", problem);
    }
    return problem;
  }

  private String currentStateContext() {
    return machine == null || machine.getCurrentState() == null ? "Uninitialized"
        : machine.getCurrentState().getName();
  }

  @Override
  public String getCurrentStateName() {
    if (machine == null || machine.getCurrentState() == null) {
      return "Uninitialized";
    }
    final String name = machine.getCurrentState().getName();
    if (activeSubSimulator != null) {
      return name + " (" + activeSubSimulator.getCurrentStateName() + ")";
    }
    return name;
  }

  @Override
  public String getCurrentLeafStateName() {
    if (activeSubSimulator != null) {
      return activeSubSimulator.getCurrentLeafStateName();
    }
    return currentStateContext();
  }

  @Override
  public Map<String, Object> getVariables() {
    return new LinkedHashMap<>(scope);
  }

  @Override
  public List<String> getPossibleEvents() {
    // only the active leaf and the level directly above it
    StateMachineSimulatorImpl parent = null;
    StateMachineSimulatorImpl leaf = this;
    while (leaf.activeSubSimulator != null) {
      parent = leaf;
      leaf = leaf.activeSubSimulator;
    }
    final TreeSet<String> events = new TreeSet<>();
    if (leaf.machine != null) {
      events.addAll(leaf.machine.getAllowedEvents());
    }
    if (parent != null && parent.machine != null) {
      events.addAll(parent.machine.getAllowedEvents());
    }
    return new ArrayList<>(events);
  }

  @Override
  public List<String> drainLog() {
    return actionLog.drain();
  }

  @Override
  public SimulationLifecycle getLifecycle() {
    return lifecycle;
  }

  @Override
  public boolean isHalted() {
    return lifecycle == SimulationLifecycle.HALTED;
  }

  @Override
  public Optional<StateMachineSimulator> getActiveSubSimulator() {
    return Optional.ofNullable(activeSubSimulator);
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public SimulatorConfiguration getConfiguration() {
    return configuration;
  }

  @Override
  public SimulationStatistics getStatistics() {
    return statistics;
  }

  /**
   * State-level scripts and sub-machine lifecycle, run as the {@link Machine} moves.
   */
  private final class SimulatorHooks implements MachineHooks {
    @Override
    public void onEnterState(final DefinedState state) throws StateMachineException {
      actionLog.log("Entering state: " + state.getName());
      if (state.getEntryAction() != null) {
        state.getEntryAction().run();
      }
      if (state.getSpec().isSuperstate()) {
        if (state.getSpec().hasActivatableSubMachine()) {
          startSubSimulator(state);
        } else {
          actionLog.log("Superstate '" + state.getName()
              + "' has no defined sub-machine data or states.");
        }
      }
    }

    @Override
    public void onExitState(final DefinedState state) throws StateMachineException {
      actionLog.log("Exiting state: " + state.getName());
      if (activeSubSimulator != null && state.getName().equals(activeSuperstateName)) {
        actionLog.log(
            "Superstate '" + state.getName() + "' exited. Terminating its sub-machine.");
        actionLog.absorb(activeSubSimulator.drainLog());
        activeSubSimulator = null;
        activeSuperstateName = null;
      }
      if (state.getExitAction() != null) {
        state.getExitAction().run();
      }
    }

    @Override
    public void beforeTransition(final DefinedTransition transition) {
      actionLog.log("Before transition on '" + transition.getEvent() + "' from '"
          + transition.getSource().getName() + "' to '" + transition.getTarget().getName() + "'");
    }

    @Override
    public void afterTransition(final DefinedTransition transition) {
      statistics.transitionsFired++;
      actionLog.log("After transition on '" + transition.getEvent() + "' from '"
          + transition.getSource().getName() + "' to '" + transition.getTarget().getName() + "'");
    }
  }

  private static void logError(final String machineId, final String message,
      final Throwable problem) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString(), problem);
  }

  private static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

}
