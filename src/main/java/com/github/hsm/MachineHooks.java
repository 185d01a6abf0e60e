package com.github.hsm;

import com.github.hsm.MachineDefinition.DefinedState;
import com.github.hsm.MachineDefinition.DefinedTransition;

/**
 * Machine-wide callbacks a {@link Machine} fires while it moves between states. The simulator is
 * the only implementor; state-level scripts are run from inside these hooks.
 */
interface MachineHooks {

  void onEnterState(DefinedState state) throws StateMachineException;

  void onExitState(DefinedState state) throws StateMachineException;

  void beforeTransition(DefinedTransition transition);

  void afterTransition(DefinedTransition transition);
}
