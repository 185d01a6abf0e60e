package com.github.hsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The resolved, executable form of one machine level as produced by {@link MachineBuilder}: state
 * names bound to state objects, scripts compiled into callables, blank events replaced by
 * synthetic ones. A definition is immutable and instantiates any number of {@link Machine}s.
 */
final class MachineDefinition {
  private final Map<String, DefinedState> states;
  private final DefinedState initialState;
  private final List<DefinedTransition> transitions;
  private final Map<String, List<DefinedTransition>> transitionsBySource;
  private final Set<String> events;

  MachineDefinition(final List<DefinedState> states, final DefinedState initialState,
      final List<DefinedTransition> transitions) {
    final Map<String, DefinedState> byName = new LinkedHashMap<>();
    for (final DefinedState state : states) {
      byName.put(state.getName(), state);
    }
    this.states = Collections.unmodifiableMap(byName);
    this.initialState = initialState;
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    final Map<String, List<DefinedTransition>> bySource = new LinkedHashMap<>();
    final Set<String> eventIds = new LinkedHashSet<>();
    for (final DefinedTransition transition : transitions) {
      bySource.computeIfAbsent(transition.getSource().getName(), k -> new ArrayList<>())
          .add(transition);
      eventIds.add(transition.getEvent());
    }
    this.transitionsBySource = bySource;
    this.events = Collections.unmodifiableSet(eventIds);
  }

  Machine newMachine(final MachineHooks hooks) {
    return new Machine(this, hooks);
  }

  DefinedState getState(final String name) {
    return states.get(name);
  }

  Map<String, DefinedState> getStates() {
    return states;
  }

  DefinedState getInitialState() {
    return initialState;
  }

  List<DefinedTransition> getTransitions() {
    return transitions;
  }

  /**
   * Transitions leaving the given state, in declaration order.
   */
  List<DefinedTransition> getTransitionsFrom(final DefinedState source) {
    final List<DefinedTransition> outgoing = transitionsBySource.get(source.getName());
    return outgoing == null ? Collections.<DefinedTransition>emptyList() : outgoing;
  }

  /**
   * Every event id, declared or synthetic, in first-seen order.
   */
  Set<String> getEvents() {
    return events;
  }

  static final class DefinedState {
    private final StateSpec spec;
    private final ScriptAction entryAction;
    private final ScriptAction duringAction;
    private final ScriptAction exitAction;

    DefinedState(final StateSpec spec, final ScriptAction entryAction,
        final ScriptAction duringAction, final ScriptAction exitAction) {
      this.spec = spec;
      this.entryAction = entryAction;
      this.duringAction = duringAction;
      this.exitAction = exitAction;
    }

    String getName() {
      return spec.getName();
    }

    StateSpec getSpec() {
      return spec;
    }

    boolean isFinal() {
      return spec.isFinal();
    }

    ScriptAction getEntryAction() {
      return entryAction;
    }

    ScriptAction getDuringAction() {
      return duringAction;
    }

    ScriptAction getExitAction() {
      return exitAction;
    }

    @Override
    public String toString() {
      return spec.getName();
    }
  }

  static final class DefinedTransition {
    private final int index;
    private final String event;
    private final DefinedState source;
    private final DefinedState target;
    private final ScriptCondition condition;
    private final ScriptAction action;

    DefinedTransition(final int index, final String event, final DefinedState source,
        final DefinedState target, final ScriptCondition condition, final ScriptAction action) {
      this.index = index;
      this.event = event;
      this.source = source;
      this.target = target;
      this.condition = condition;
      this.action = action;
    }

    int getIndex() {
      return index;
    }

    String getEvent() {
      return event;
    }

    DefinedState getSource() {
      return source;
    }

    DefinedState getTarget() {
      return target;
    }

    ScriptCondition getCondition() {
      return condition;
    }

    ScriptAction getAction() {
      return action;
    }

    @Override
    public String toString() {
      return "DefinedTransition [index=" + index + ", event=" + event + ", source=" + source
          + ", target=" + target + "]";
    }
  }
}
