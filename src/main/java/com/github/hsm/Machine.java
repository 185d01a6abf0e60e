package com.github.hsm;

import java.util.ArrayList;
import java.util.List;

import com.github.hsm.MachineDefinition.DefinedState;
import com.github.hsm.MachineDefinition.DefinedTransition;

/**
 * A live instance of a {@link MachineDefinition}: the current-state pointer plus event dispatch.
 * All side effects go through the {@link MachineHooks} and the compiled scripts of the
 * definition.
 */
final class Machine {
  private final MachineDefinition definition;
  private final MachineHooks hooks;
  private DefinedState currentState;

  Machine(final MachineDefinition definition, final MachineHooks hooks) {
    this.definition = definition;
    this.hooks = hooks;
  }

  /**
   * Move to the initial state and enter it. No transition hooks fire for the initial activation.
   */
  void activateInitial() throws StateMachineException {
    currentState = definition.getInitialState();
    hooks.onEnterState(currentState);
  }

  DefinedState getCurrentState() {
    return currentState;
  }

  /**
   * Fire the first transition out of the current state that is bound to the event and whose
   * condition holds.
   */
  DispatchOutcome dispatch(final String event) throws StateMachineException {
    if (!definition.getEvents().contains(event)) {
      return DispatchOutcome.UNKNOWN_EVENT;
    }
    final List<DefinedTransition> candidates = new ArrayList<>();
    for (final DefinedTransition transition : definition.getTransitionsFrom(currentState)) {
      if (transition.getEvent().equals(event)) {
        candidates.add(transition);
      }
    }
    if (candidates.isEmpty()) {
      return DispatchOutcome.NO_TRANSITION;
    }
    for (final DefinedTransition candidate : candidates) {
      final ScriptCondition condition = candidate.getCondition();
      if (condition == null || condition.test()) {
        fire(candidate);
        return DispatchOutcome.FIRED;
      }
    }
    return DispatchOutcome.CONDITIONS_FALSE;
  }

  /**
   * Events that have at least one transition out of the current state. Conditions are not
   * evaluated.
   */
  List<String> getAllowedEvents() {
    final List<String> allowed = new ArrayList<>();
    if (currentState == null) {
      return allowed;
    }
    for (final DefinedTransition transition : definition.getTransitionsFrom(currentState)) {
      if (!allowed.contains(transition.getEvent())) {
        allowed.add(transition.getEvent());
      }
    }
    return allowed;
  }

  private void fire(final DefinedTransition transition) throws StateMachineException {
    hooks.beforeTransition(transition);
    hooks.onExitState(transition.getSource());
    if (transition.getAction() != null) {
      transition.getAction().run();
    }
    currentState = transition.getTarget();
    hooks.onEnterState(currentState);
    hooks.afterTransition(transition);
  }

  static enum DispatchOutcome {
    FIRED, UNKNOWN_EVENT, NO_TRANSITION, CONDITIONS_FALSE;
  }
}
