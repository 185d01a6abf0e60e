package com.github.hsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative description of one machine level: its states and transitions in declaration order.
 * Sub-machines nest through {@link StateSpec#getSubMachine()}.
 */
public final class MachineSpec {
  private static final MachineSpec empty =
      new MachineSpec(Collections.<StateSpec>emptyList(), Collections.<TransitionSpec>emptyList());

  private final List<StateSpec> states;
  private final List<TransitionSpec> transitions;

  public MachineSpec(final List<StateSpec> states, final List<TransitionSpec> transitions) {
    this.states = Collections.unmodifiableList(
        states == null ? new ArrayList<StateSpec>() : new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(
        transitions == null ? new ArrayList<TransitionSpec>() : new ArrayList<>(transitions));
  }

  public static MachineSpec empty() {
    return empty;
  }

  public List<StateSpec> getStates() {
    return states;
  }

  public List<TransitionSpec> getTransitions() {
    return transitions;
  }

  @Override
  public String toString() {
    return "MachineSpec [states=" + states + ", transitions=" + transitions + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to describe machines.
   */
  public final static class MachineSpecBuilder {
    private final List<StateSpec> states = new ArrayList<>();
    private final List<TransitionSpec> transitions = new ArrayList<>();

    public static MachineSpecBuilder newBuilder() {
      return new MachineSpecBuilder();
    }

    public MachineSpecBuilder state(final StateSpec state) {
      this.states.add(state);
      return this;
    }

    public MachineSpecBuilder transition(final TransitionSpec transition) {
      this.transitions.add(transition);
      return this;
    }

    public MachineSpec build() {
      return new MachineSpec(states, transitions);
    }

    private MachineSpecBuilder() {}
  }
}
