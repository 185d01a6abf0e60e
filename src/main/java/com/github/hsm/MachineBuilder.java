package com.github.hsm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.hsm.MachineDefinition.DefinedState;
import com.github.hsm.MachineDefinition.DefinedTransition;
import com.github.hsm.StateMachineException.Code;

/**
 * Validates a {@link MachineSpec} and resolves it into a {@link MachineDefinition}. Structural
 * errors are thrown; recoverable oddities (no initial state, no transitions, blank events,
 * dangling transitions) are written to the action log as warnings and worked around.
 */
final class MachineBuilder {
  private final ActionLog actionLog;

  MachineBuilder(final ActionLog actionLog) {
    this.actionLog = actionLog;
  }

  /**
   * Build the definition of one machine level.
   *
   * @param root false for a sub-machine; an empty sub-machine is inactive and yields null instead
   *        of failing
   */
  MachineDefinition build(final MachineSpec spec, final ScriptExecutor executor,
      final boolean root) throws StateMachineException {
    if (spec == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_SPEC, "Machine spec cannot be null");
    }
    if (spec.getStates().isEmpty()) {
      if (root) {
        throw new StateMachineException(Code.NO_STATES);
      }
      actionLog.log("Sub-FSM has no states defined. It will be inactive.");
      return null;
    }

    final Map<String, DefinedState> states = new LinkedHashMap<>();
    DefinedState initialState = null;
    for (final StateSpec stateSpec : spec.getStates()) {
      if (stateSpec == null) {
        throw new StateMachineException(Code.INVALID_MACHINE_SPEC, "State spec cannot be null");
      }
      final String name = stateSpec.getName();
      if (states.containsKey(name)) {
        throw new StateMachineException(Code.INVALID_MACHINE_SPEC,
            "Duplicate state name '" + name + "'");
      }
      final DefinedState state = new DefinedState(stateSpec,
          executor.action(stateSpec.getEntryAction().orElse(null), "entry_" + name),
          executor.action(stateSpec.getDuringAction().orElse(null), "during_" + name),
          executor.action(stateSpec.getExitAction().orElse(null), "exit_" + name));
      if (stateSpec.isInitial()) {
        if (initialState != null) {
          throw new StateMachineException(Code.DUPLICATE_INITIAL_STATE,
              "Multiple initial states defined: '" + initialState.getName() + "' and '" + name
                  + "'.");
        }
        initialState = state;
      }
      states.put(name, state);
    }
    if (initialState == null) {
      initialState = states.values().iterator().next();
      actionLog.log("Warning: No initial state explicitly defined. Using first state '"
          + initialState.getName() + "' as initial.");
    }
    if (spec.getTransitions().isEmpty()) {
      actionLog.log("Warning: FSM has states but no transitions. "
          + "No events will be defined beyond potential state actions.");
    }

    final List<DefinedTransition> transitions = new ArrayList<>();
    int index = 0;
    for (final TransitionSpec transitionSpec : spec.getTransitions()) {
      final int transitionIndex = index++;
      if (transitionSpec == null) {
        throw new StateMachineException(Code.INVALID_MACHINE_SPEC,
            "Transition spec cannot be null");
      }
      final String sourceName = transitionSpec.getSource();
      final String targetName = transitionSpec.getTarget();
      String event = transitionSpec.getEvent().orElse(null);
      if (event == null) {
        event = syntheticEvent(transitionIndex, sourceName, targetName);
        actionLog.log("Warning: Transition " + sourceName + "->" + targetName
            + " has no event. Synthetic event ID: " + event);
      }
      final DefinedState source = states.get(sourceName);
      final DefinedState target = states.get(targetName);
      if (source == null || target == null) {
        actionLog.log("Warning: Skipping transition for event '" + event + "' from '" + sourceName
            + "' to '" + targetName + "' due to missing state object(s).");
        continue;
      }
      transitions.add(new DefinedTransition(transitionIndex, event, source, target,
          executor.condition(transitionSpec.getCondition().orElse(null),
              "cond_t" + transitionIndex + "_" + event),
          executor.action(transitionSpec.getAction().orElse(null),
              "action_t" + transitionIndex + "_" + event)));
    }
    return new MachineDefinition(new ArrayList<>(states.values()), initialState, transitions);
  }

  /**
   * Event id used for a transition drawn without an event. Anything but letters, digits and
   * underscores becomes an underscore.
   */
  static String syntheticEvent(final int index, final String source, final String target) {
    final String raw = "_internal_t" + index + "_" + source + "_to_" + target;
    final StringBuilder sanitized = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      final char c = raw.charAt(i);
      sanitized.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
    }
    return sanitized.toString();
  }
}
