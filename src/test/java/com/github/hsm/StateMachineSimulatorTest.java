package com.github.hsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.hsm.MachineSpec.MachineSpecBuilder;
import com.github.hsm.SimulatorConfiguration.SimulatorConfigurationBuilder;
import com.github.hsm.StateMachineException.Code;
import com.github.hsm.StateMachineSimulator.StateMachineSimulatorBuilder;
import com.github.hsm.StateSpec.StateSpecBuilder;

/**
 * Tests to maintain the sanity and correctness of StateMachineSimulator.
 */
public class StateMachineSimulatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger =
      LogManager.getLogger(StateMachineSimulatorTest.class.getSimpleName());

  @Test
  public void testInitialStateIsEnteredOnCreate() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Off").build())
        .state(StateSpecBuilder.newBuilder("On").initial(true).entryAction("lit = True").build())
        .transition(TransitionSpec.of("On", "Off", "toggle")).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);

    assertEquals("On", simulator.getCurrentLeafStateName());
    assertEquals("On", simulator.getCurrentStateName());
    assertEquals(SimulationLifecycle.READY, simulator.getLifecycle());
    assertFalse(simulator.isHalted());
    assertEquals(Boolean.TRUE, simulator.getVariables().get("lit"));

    final List<String> log = simulator.drainLog();
    assertLogContains(log, "Entering state: On");
    assertLogContains(log, "FSM Initialized. Current state: On");
    assertTrue(simulator.drainLog().isEmpty());
  }

  @Test
  public void testFirstStateIsUsedWhenNoneIsInitial() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("First").build())
        .state(StateSpecBuilder.newBuilder("Second").build()).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);

    assertEquals("First", simulator.getCurrentLeafStateName());
    final List<String> log = simulator.drainLog();
    assertLogContains(log,
        "Warning: No initial state explicitly defined. Using first state 'First' as initial.");
    assertLogContains(log, "Warning: FSM has states but no transitions. "
        + "No events will be defined beyond potential state actions.");
  }

  @Test
  public void testCounterScenario() throws StateMachineException {
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(counterSpec(), null);
    assertEquals("A", simulator.getCurrentLeafStateName());
    assertEquals(Collections.singletonMap("x", 0L), simulator.getVariables());

    StepResult result = simulator.step("go");
    assertEquals("B", result.getStateName());
    assertEquals("B", simulator.getCurrentLeafStateName());
    assertEquals(0L, simulator.getVariables().get("x"));
    assertLogContains(result.getLog(), "--- Step. State: A. Event: go ---");
    assertLogContains(result.getLog(), "Sending event 'go' to FSM.");

    result = simulator.step(null);
    assertEquals("B", result.getStateName());
    assertEquals(Collections.singletonMap("x", 1L), simulator.getVariables());
    assertLogContains(result.getLog(), "During action for 'B': x=x+1");
    assertLogContains(result.getLog(), "No event. 'During' actions done. State remains 'B'.");

    simulator.step(null);
    assertEquals(Collections.singletonMap("x", 2L), simulator.getVariables());

    final SimulationStatistics statistics = simulator.getStatistics();
    logger.info(statistics);
    assertEquals(3, statistics.getSteps());
    assertEquals(1, statistics.getTransitionsFired());
    assertEquals(0, statistics.getScriptFaults());
  }

  @Test
  public void testResetIsIdempotent() throws StateMachineException {
    final StateMachineSimulator counter = StateMachineSimulatorImpl.create(counterSpec(), null);
    counter.step("go");
    counter.step(null);
    counter.reset();
    assertEquals("A", counter.getCurrentLeafStateName());
    assertEquals(Collections.singletonMap("x", 0L), counter.getVariables());
    counter.reset();
    assertEquals("A", counter.getCurrentLeafStateName());
    assertEquals(Collections.singletonMap("x", 0L), counter.getVariables());
    final List<String> log = counter.drainLog();
    assertLogContains(log, "--- FSM Resetting ---");
    assertLogContains(log, "FSM Reset. Current state: A");
    assertEquals(2, counter.getStatistics().getResets());

    // without an initial entry script the scope stays empty
    final MachineSpec plain = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).build())
        .state(StateSpecBuilder.newBuilder("B").entryAction("y = 5").build())
        .transition(TransitionSpec.of("A", "B", "go")).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(plain, null);
    simulator.step("go");
    assertEquals(5L, simulator.getVariables().get("y"));
    simulator.reset();
    assertTrue(simulator.getVariables().isEmpty());
    simulator.reset();
    assertEquals("A", simulator.getCurrentStateName());
    assertTrue(simulator.getVariables().isEmpty());
  }

  @Test
  public void testConditionFaultsNeverEscape() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).build())
        .state(StateSpecBuilder.newBuilder("B").build())
        .transition(new TransitionSpec("A", "B", "go", "undefined_var > 1", null)).build();
    // even a halting simulator only halts on action faults
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().haltOnActionError(true).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, config);
    simulator.drainLog();

    final StepResult result = simulator.step("go");
    assertEquals("A", result.getStateName());
    assertFalse(simulator.isHalted());
    assertLogContains(result.getLog(), "[Code Error] NameError in condition 'cond_t0_go' "
        + "(state context: A): name 'undefined_var' is not defined. Code: 'undefined_var > 1'");
    assertLogContains(result.getLog(),
        "Event 'go' from 'A' not taken: no transition condition evaluated True.");
    assertEquals(1, simulator.getStatistics().getEventsRejected());
  }

  @Test
  public void testDenyListedScriptNeverRuns() throws StateMachineException {
    final String script = "x = 1; eval('1'); y = 2";
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).entryAction(script).build())
        .build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);

    assertTrue(simulator.getVariables().isEmpty());
    final List<String> log = simulator.drainLog();
    assertLogContains(log, "[Safety Check Failed] SecurityError: Code execution blocked for "
        + "'entry_A'. Reason: SecurityError: Calling the function 'eval' is not allowed.");
    assertLogContains(log, "[Action Blocked by Safety Check] Unsafe code ignored: '" + script
        + "'.");
    for (final String line : log) {
      assertFalse(line, line.startsWith("[Code Error]"));
    }
    assertEquals(1, simulator.getStatistics().getScriptsBlocked());

    // analysis is not repeated on reset, the stub just runs again
    simulator.reset();
    final List<String> afterReset = simulator.drainLog();
    for (final String line : afterReset) {
      assertFalse(line, line.startsWith("[Safety Check Failed]"));
    }
    assertLogContains(afterReset,
        "[Action Blocked by Safety Check] Unsafe code ignored: '" + script + "'.");
  }

  @Test
  public void testBlockedConditionIsFalse() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).build())
        .state(StateSpecBuilder.newBuilder("B").build())
        .transition(new TransitionSpec("A", "B", "go", "__import__('os') is not None", null))
        .build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    final StepResult result = simulator.step("go");
    assertEquals("A", result.getStateName());
    assertLogContains(result.getLog(), "[Condition Blocked by Safety Check] Unsafe code: "
        + "'__import__('os') is not None' evaluated as False.");
  }

  @Test
  public void testTransitionFiringOrder() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).exitAction("a = 1").build())
        .state(StateSpecBuilder.newBuilder("B").entryAction("b = a + t").build())
        .transition(new TransitionSpec("A", "B", "go", "True", "t = 1")).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    final List<String> log = simulator.step("go").getLog();

    final int before = indexOf(log, "Before transition on 'go' from 'A' to 'B'");
    final int exiting = indexOf(log, "Exiting state: A");
    final int exitScript = indexOf(log, "[Action Runtime] Finished: 'a = 1'. Variables now: "
        + "{'a': 1}");
    final int transitionScript =
        indexOf(log, "[Action Runtime] Finished: 't = 1'. Variables now: {'a': 1, 't': 1}");
    final int entering = indexOf(log, "Entering state: B");
    final int entryScript = indexOf(log,
        "[Action Runtime] Finished: 'b = a + t'. Variables now: {'a': 1, 't': 1, 'b': 2}");
    final int after = indexOf(log, "After transition on 'go' from 'A' to 'B'");
    assertTrue(before < exiting);
    assertTrue(exiting < exitScript);
    assertTrue(exitScript < transitionScript);
    assertTrue(transitionScript < entering);
    assertTrue(entering < entryScript);
    assertTrue(entryScript < after);
  }

  @Test
  public void testFirstTransitionWithTrueConditionWins() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).entryAction("n = 3").build())
        .state(StateSpecBuilder.newBuilder("Small").build())
        .state(StateSpecBuilder.newBuilder("Medium").build())
        .state(StateSpecBuilder.newBuilder("Large").build())
        .transition(new TransitionSpec("A", "Small", "size", "n < 2", null))
        .transition(new TransitionSpec("A", "Medium", "size", "n < 5", null))
        .transition(new TransitionSpec("A", "Large", "size", null, null)).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    final StepResult result = simulator.step("size");
    assertEquals("Medium", result.getStateName());
    assertLogContains(result.getLog(), "[Condition Runtime] Result of 'n < 2': False");
    assertLogContains(result.getLog(), "[Condition Runtime] Result of 'n < 5': True");
  }

  @Test
  public void testRejectedEvents() throws StateMachineException {
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(counterSpec(), null);
    StepResult result = simulator.step("nope");
    assertEquals("A", result.getStateName());
    assertLogContains(result.getLog(), "Event 'nope' not defined on FSM.");

    simulator.step("go");
    result = simulator.step("go");
    assertEquals("B", result.getStateName());
    assertLogContains(result.getLog(), "Event 'go' not allowed or no transition from 'B'.");
    assertEquals(2, simulator.getStatistics().getEventsRejected());
  }

  @Test
  public void testSelfTransitionExitsAndReenters() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Loop").initial(true).entryAction("n = 1")
            .exitAction("left = True").build())
        .transition(TransitionSpec.of("Loop", "Loop", "again")).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    final List<String> log = simulator.step("again").getLog();
    assertLogContains(log, "Exiting state: Loop");
    assertLogContains(log, "Entering state: Loop");
    assertEquals(Boolean.TRUE, simulator.getVariables().get("left"));
  }

  @Test
  public void testActionFaultIsSwallowedByDefault() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Err").initial(true).entryAction("x = 1/0").build())
        .build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    assertEquals(SimulationLifecycle.READY, simulator.getLifecycle());
    assertLogContains(simulator.drainLog(), "[Code Error] ZeroDivisionError in action 'entry_Err' "
        + "(state context: Err): division by zero. Code: 'x = 1/0'");
    assertEquals(1, simulator.getStatistics().getScriptFaults());
  }

  @Test
  public void testHaltScenario() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Err").initial(true).entryAction("x = 1/0").build())
        .build();
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().haltOnActionError(true).build();
    StateMachineSimulator simulator = null;
    try {
      StateMachineSimulatorImpl.create(spec, config);
      fail("Expected the initial entry action to halt the simulation");
    } catch (StateMachineException halted) {
      assertEquals(Code.SIMULATION_HALTED, halted.getCode());
      simulator = halted.getHaltedSimulator();
    }
    assertNotNull(simulator);
    assertEquals(SimulationLifecycle.HALTED, simulator.getLifecycle());
    assertTrue(simulator.isHalted());
    assertEquals("Err", simulator.getCurrentLeafStateName());
    assertFalse(simulator.getVariables().containsKey("x"));

    final StepResult result = simulator.step("anything");
    assertEquals("Err", result.getStateName());
    assertLogContains(result.getLog(),
        "[SIMULATION HALTED] ZeroDivisionError in action 'entry_Err': division by zero");
    assertLogContains(result.getLog(),
        "Simulation HALTED. Event 'anything' ignored. Reset required.");
    assertLogContains(simulator.step(null).getLog(),
        "Simulation HALTED. Event 'Internal' ignored. Reset required.");

    // the same entry script runs again on reset and halts again
    try {
      simulator.reset();
      fail("Expected reset to halt again");
    } catch (StateMachineException halted) {
      assertEquals(Code.SIMULATION_HALTED, halted.getCode());
    }
    assertTrue(simulator.isHalted());
  }

  @Test
  public void testHaltDuringStepKeepsLinesForDrain() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).build())
        .state(StateSpecBuilder.newBuilder("B").entryAction("items = []; items[1] = 0").build())
        .transition(TransitionSpec.of("A", "B", "go")).build();
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().haltOnActionError(true).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, config);
    simulator.drainLog();
    try {
      simulator.step("go");
      fail("Expected the entry action of B to halt the simulation");
    } catch (StateMachineException halted) {
      assertEquals(Code.SIMULATION_HALTED, halted.getCode());
    }
    assertTrue(simulator.isHalted());
    final List<String> log = simulator.drainLog();
    assertLogContains(log, "[Code Error] IndexError in action 'entry_B' (state context: B): "
        + "list assignment index out of range. Code: 'items = []; items[1] = 0'");
    assertLogContains(log, "[SIMULATION HALTED] IndexError in action 'entry_B': "
        + "list assignment index out of range");

    simulator.reset();
    assertEquals(SimulationLifecycle.READY, simulator.getLifecycle());
    assertEquals("A", simulator.getCurrentStateName());
  }

  @Test
  public void testSubMachineLifecycle() throws StateMachineException {
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(processingSpec(
        "sub_var = 10", null), null);
    simulator.drainLog();
    assertFalse(simulator.getActiveSubSimulator().isPresent());

    // 1. entering the superstate starts its sub-machine
    StepResult result = simulator.step("start");
    assertEquals("Processing (SubIdle)", result.getStateName());
    assertEquals("SubIdle", simulator.getCurrentLeafStateName());
    assertLogContains(result.getLog(),
        "Superstate 'Processing' entered. Initializing its sub-machine.");
    assertLogContains(result.getLog(), "  [SUB] Entering state: SubIdle");
    assertLogContains(result.getLog(), "  [SUB] FSM Initialized. Current state: SubIdle");
    assertEquals(Arrays.asList("complete", "finish"), simulator.getPossibleEvents());
    assertEquals(1, simulator.getStatistics().getSubMachinesStarted());

    // 2. scopes are separate
    final StateMachineSimulator sub = simulator.getActiveSubSimulator().get();
    assertEquals(10L, sub.getVariables().get("sub_var"));
    assertFalse(simulator.getVariables().containsKey("sub_var"));

    // 3. the parent cannot leave before the sub-machine completes
    result = simulator.step("complete");
    assertEquals("Processing (SubIdle)", result.getStateName());
    assertLogContains(result.getLog(), "Internal step for sub-machine in 'Processing'.");
    assertLogContains(result.getLog(), "  [SUB] --- Step. State: SubIdle. Event: Internal ---");
    assertLogContains(result.getLog(),
        "Event 'complete' from 'Processing' not taken: no transition condition evaluated True.");

    // 4. events reach the sub-machine through its own handle
    assertEquals("SubDone", sub.step("finish").getStateName());

    // 5. the next internal step notices the final state
    result = simulator.step(null);
    assertEquals("Processing (SubDone)", result.getStateName());
    assertLogContains(result.getLog(),
        "Sub-machine in 'Processing' reached final state: 'SubDone'.");
    assertLogContains(result.getLog(),
        "Variable 'Processing_sub_completed' set to True in parent FSM.");
    assertEquals(Boolean.TRUE, simulator.getVariables().get("Processing_sub_completed"));

    // 6. leaving the superstate tears the sub-machine down, its lines come along
    result = simulator.step("complete");
    assertEquals("Done", result.getStateName());
    assertEquals("Done", simulator.getCurrentLeafStateName());
    assertFalse(simulator.getActiveSubSimulator().isPresent());
    final int subLine = indexOf(result.getLog(),
        "  [SUB] --- Step. State: SubDone. Event: Internal ---");
    final int teardown =
        indexOf(result.getLog(), "Superstate 'Processing' exited. Terminating its sub-machine.");
    assertTrue(subLine < teardown);
    assertTrue(simulator.getPossibleEvents().isEmpty());
  }

  @Test
  public void testSubMachineStartingInFinalStateCompletesOnFirstStep()
      throws StateMachineException {
    final MachineSpec sub = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Only").initial(true).finalState(true).build()).build();
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Wrap").initial(true).subMachine(sub).build())
        .state(StateSpecBuilder.newBuilder("Out").build())
        .transition(new TransitionSpec("Wrap", "Out", "leave", "Wrap_sub_completed", null))
        .build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    assertEquals("Wrap (Only)", simulator.getCurrentStateName());
    assertEquals("Out", simulator.step("leave").getStateName());
  }

  @Test
  public void testSubMachineHaltPropagates() throws StateMachineException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().haltOnActionError(true).build();
    final StateMachineSimulator simulator =
        StateMachineSimulatorImpl.create(processingSpec(null, "y = 1 / 0"), config);
    simulator.step("start");
    try {
      simulator.step(null);
      fail("Expected the sub-machine fault to halt the parent");
    } catch (StateMachineException halted) {
      assertEquals(Code.SIMULATION_HALTED, halted.getCode());
    }
    assertTrue(simulator.isHalted());
    final List<String> log = simulator.drainLog();
    assertLogContains(log, "  [SUB] During action for 'SubIdle': y = 1 / 0");
    assertLogContains(log, "  [SUB] [SIMULATION HALTED] ZeroDivisionError in action "
        + "'during_SubIdle': division by zero");
    assertLogContains(log, "Propagation: Parent HALTED due to sub-machine error in 'Processing'.");

    assertLogContains(simulator.step("complete").getLog(),
        "Simulation HALTED. Event 'complete' ignored. Reset required.");

    simulator.reset();
    assertEquals("Idle", simulator.getCurrentStateName());
    assertFalse(simulator.getActiveSubSimulator().isPresent());
    assertLogContains(simulator.drainLog(), "Resetting active sub-machine...");
  }

  @Test
  public void testSuperstateWithoutSubMachine() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Hollow").initial(true)
            .subMachine(MachineSpec.empty()).build())
        .build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    assertEquals("Hollow", simulator.getCurrentStateName());
    assertFalse(simulator.getActiveSubSimulator().isPresent());
    assertLogContains(simulator.drainLog(),
        "Superstate 'Hollow' has no defined sub-machine data or states.");
  }

  @Test
  public void testInvalidSubMachineIsSkippedUnlessHalting() throws StateMachineException {
    final MachineSpec broken = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("One").initial(true).build())
        .state(StateSpecBuilder.newBuilder("Two").initial(true).build()).build();
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Outer").initial(true).subMachine(broken).build())
        .build();

    final StateMachineSimulator lenient = StateMachineSimulatorImpl.create(spec, null);
    assertEquals("Outer", lenient.getCurrentStateName());
    assertLogContains(lenient.drainLog(), "ERROR initializing sub-machine for 'Outer': "
        + "Multiple initial states defined: 'One' and 'Two'.");

    try {
      StateMachineSimulatorImpl.create(spec,
          SimulatorConfigurationBuilder.newBuilder().haltOnActionError(true).build());
      fail("Expected the broken sub-machine to halt a halting simulator");
    } catch (StateMachineException halted) {
      assertEquals(Code.SIMULATION_HALTED, halted.getCode());
      assertTrue(halted.getHaltedSimulator().isHalted());
    }
  }

  @Test
  public void testStructuralErrors() throws StateMachineException {
    try {
      StateMachineSimulatorImpl.create(MachineSpec.empty(), null);
      fail("Expected a machine without states to be refused");
    } catch (StateMachineException expected) {
      assertEquals(Code.NO_STATES, expected.getCode());
    }
    try {
      StateMachineSimulatorImpl.create(MachineSpecBuilder.newBuilder()
          .state(StateSpecBuilder.newBuilder("A").initial(true).build())
          .state(StateSpecBuilder.newBuilder("B").initial(true).build()).build(), null);
      fail("Expected two initial states to be refused");
    } catch (StateMachineException expected) {
      assertEquals(Code.DUPLICATE_INITIAL_STATE, expected.getCode());
    }
    try {
      StateMachineSimulatorImpl.create(null, null);
      fail("Expected a null spec to be refused");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_SPEC, expected.getCode());
    }
  }

  @Test
  public void testSelfReferencingContainersAreLogged() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true)
            .entryAction("x = []; x.append(x); d = {}; d['me'] = d").build())
        .state(StateSpecBuilder.newBuilder("B").entryAction("print(x); y = 1").build())
        .transition(TransitionSpec.of("A", "B", "go")).build();

    // 1. building the cycles logs them folded
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    assertLogContains(simulator.drainLog(), "[Action Runtime] Finished: "
        + "'x = []; x.append(x); d = {}; d['me'] = d'. Variables now: "
        + "{'x': [[...]], 'd': {'me': {...}}}");

    // 2. later scripts still run against the same scope
    final StepResult result = simulator.step("go");
    assertEquals("B", result.getStateName());
    assertLogContains(result.getLog(), "[Script Output] [[...]]");
    assertEquals(1L, simulator.getVariables().get("y"));
    assertEquals(0, simulator.getStatistics().getScriptFaults());
  }

  @Test
  public void testPossibleEventsCoverTheLeafAndItsParent() throws StateMachineException {
    final MachineSpec leaves = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Leaf1").initial(true).build())
        .state(StateSpecBuilder.newBuilder("Leaf2").build())
        .transition(TransitionSpec.of("Leaf1", "Leaf2", "leaf_go")).build();
    final MachineSpec middle = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Mid1").initial(true).subMachine(leaves).build())
        .state(StateSpecBuilder.newBuilder("Mid2").build())
        .transition(TransitionSpec.of("Mid1", "Mid2", "mid_go")).build();
    final MachineSpec top = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Top1").initial(true).subMachine(middle).build())
        .state(StateSpecBuilder.newBuilder("Top2").build())
        .transition(TransitionSpec.of("Top1", "Top2", "top_go")).build();

    // 1. three levels deep, the outermost level's events are left out
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(top, null);
    assertEquals("Top1 (Mid1 (Leaf1))", simulator.getCurrentStateName());
    assertEquals(Arrays.asList("leaf_go", "mid_go"), simulator.getPossibleEvents());

    // 2. every level answers for the same active leaf
    final StateMachineSimulator mid = simulator.getActiveSubSimulator().get();
    assertEquals(Arrays.asList("leaf_go", "mid_go"), mid.getPossibleEvents());
    final StateMachineSimulator leaf = mid.getActiveSubSimulator().get();
    assertEquals(Arrays.asList("leaf_go"), leaf.getPossibleEvents());

    // 3. with the leaf level finished it has no events, its parent's remain
    leaf.step("leaf_go");
    assertEquals(Arrays.asList("mid_go"), simulator.getPossibleEvents());
  }

  @Test
  public void testPossibleEvents() throws StateMachineException {
    final MachineSpec spec = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).build())
        .state(StateSpecBuilder.newBuilder("B").build())
        .transition(new TransitionSpec("A", "B", "zeta", "False", null))
        .transition(TransitionSpec.of("A", "B", "alpha"))
        .transition(TransitionSpec.of("A", "B", null))
        .transition(TransitionSpec.of("B", "A", "back")).build();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(spec, null);
    assertEquals(Arrays.asList("_internal_t2_A_to_B", "alpha", "zeta"),
        simulator.getPossibleEvents());
    assertEquals("B", simulator.step("_internal_t2_A_to_B").getStateName());
    assertEquals(Arrays.asList("back"), simulator.getPossibleEvents());
  }

  @Test
  public void testPrintAndLogPrefix() throws StateMachineException {
    final SimulatorConfiguration config =
        SimulatorConfigurationBuilder.newBuilder().logPrefix("[main] ").build();
    final MachineSpec talking =
        processingSpec("sub_var = None; print('sub says', sub_var)", null).getStates().get(1)
            .getSubMachine().get();
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(talking, config);
    final List<String> log = simulator.drainLog();
    for (final String line : log) {
      assertTrue(line, line.startsWith("[main] "));
    }
    assertLogContains(log, "[main] [Script Output] sub says None");
  }

  @Test
  public void testBuilderAndConfiguration() throws StateMachineException {
    final SimulatorConfiguration config = SimulatorConfigurationBuilder.newBuilder()
        .haltOnActionError(true).maxLogLines(50).build();
    final StateMachineSimulator simulator = StateMachineSimulatorBuilder.newBuilder()
        .spec(counterSpec()).config(config).build();
    assertTrue(simulator.getConfiguration().getHaltOnActionError());
    assertEquals(50, simulator.getConfiguration().getMaxLogLines());
    assertEquals(simulator.getId(), simulator.getStatistics().getMachineId());

    try {
      SimulatorConfigurationBuilder.newBuilder().maxLogLines(-1).logPrefix(null).build();
      fail("Expected an invalid configuration to be refused");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_CONFIG, expected.getCode());
      assertEquals("logPrefix cannot be null. maxLogLines cannot be negative.",
          expected.getMessage());
    }
  }

  @Test
  public void testVariablesAreACopy() throws StateMachineException {
    final StateMachineSimulator simulator = StateMachineSimulatorImpl.create(counterSpec(), null);
    final Map<String, Object> variables = simulator.getVariables();
    variables.put("x", 100L);
    assertEquals(0L, simulator.getVariables().get("x"));
    assertEquals(new LinkedHashMap<>(Collections.singletonMap("x", 0L)),
        simulator.getVariables());
  }

  ///// fixtures /////
  static MachineSpec counterSpec() throws StateMachineException {
    return MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("A").initial(true).entryAction("x=0").build())
        .state(StateSpecBuilder.newBuilder("B").duringAction("x=x+1").build())
        .transition(TransitionSpec.of("A", "B", "go")).build();
  }

  /**
   * Idle -start-> Processing(SubIdle -finish-> SubDone) -complete[Processing_sub_completed]-> Done
   */
  static MachineSpec processingSpec(final String subEntry, final String subDuring)
      throws StateMachineException {
    final MachineSpec sub = MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("SubIdle").initial(true).entryAction(subEntry)
            .duringAction(subDuring).build())
        .state(StateSpecBuilder.newBuilder("SubDone").finalState(true).build())
        .transition(TransitionSpec.of("SubIdle", "SubDone", "finish")).build();
    return MachineSpecBuilder.newBuilder()
        .state(StateSpecBuilder.newBuilder("Idle").initial(true).build())
        .state(StateSpecBuilder.newBuilder("Processing").subMachine(sub).build())
        .state(StateSpecBuilder.newBuilder("Done").finalState(true).build())
        .transition(TransitionSpec.of("Idle", "Processing", "start"))
        .transition(new TransitionSpec("Processing", "Done", "complete",
            "Processing_sub_completed", null))
        .build();
  }

  static void assertLogContains(final List<String> log, final String line) {
    assertTrue("Missing '" + line + "' in " + log, log.contains(line));
  }

  private static int indexOf(final List<String> log, final String line) {
    final int index = log.indexOf(line);
    assertTrue("Missing '" + line + "' in " + log, index >= 0);
    return index;
  }

}
