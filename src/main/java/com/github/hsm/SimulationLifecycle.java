package com.github.hsm;

/**
 * Lifecycle of a simulator itself, as opposed to the states of the user's machine.
 */
public enum SimulationLifecycle {
  // not yet built, or its initial state has not been entered
  UNINITIALIZED,
  // initial state entered, stepping allowed
  READY,
  // an action script failed under haltOnActionError; only reset() leaves this state
  HALTED;
}
