package com.github.hsm;

/**
 * A compiled action script bound to its machine level. Running it mutates that level's scope.
 */
@FunctionalInterface
public interface ScriptAction {

  /**
   * @throws StateMachineException only with {@link StateMachineException.Code#SIMULATION_HALTED},
   *         when the script faulted and the simulator halts on action errors
   */
  void run() throws StateMachineException;
}
