package com.github.hsm;

import java.util.Optional;

import com.github.hsm.StateMachineException.Code;

/**
 * This object represents immutable metadata about a state as drawn in a diagram. Scripts are kept
 * as raw text; they are analyzed and compiled when a simulator is built from the spec.
 */
public final class StateSpec {
  private final String name;
  private final boolean initial;
  private final boolean finalState;
  private final String entryAction;
  private final String duringAction;
  private final String exitAction;
  private final boolean superstate;
  private final MachineSpec subMachine;

  private StateSpec(final StateSpecBuilder builder) {
    this.name = builder.name.trim();
    this.initial = builder.initial;
    this.finalState = builder.finalState;
    this.entryAction = blankToNull(builder.entryAction);
    this.duringAction = blankToNull(builder.duringAction);
    this.exitAction = blankToNull(builder.exitAction);
    this.superstate = builder.superstate;
    this.subMachine = builder.subMachine;
  }

  public String getName() {
    return name;
  }

  public boolean isInitial() {
    return initial;
  }

  public boolean isFinal() {
    return finalState;
  }

  public Optional<String> getEntryAction() {
    return Optional.ofNullable(entryAction);
  }

  public Optional<String> getDuringAction() {
    return Optional.ofNullable(duringAction);
  }

  public Optional<String> getExitAction() {
    return Optional.ofNullable(exitAction);
  }

  public boolean isSuperstate() {
    return superstate;
  }

  public Optional<MachineSpec> getSubMachine() {
    return Optional.ofNullable(subMachine);
  }

  /**
   * True iff entering this state should instantiate a sub-machine.
   */
  public boolean hasActivatableSubMachine() {
    return superstate && subMachine != null && !subMachine.getStates().isEmpty();
  }

  static String blankToNull(final String script) {
    return script == null || script.trim().isEmpty() ? null : script;
  }

  @Override
  public String toString() {
    return "StateSpec [name=" + name + ", initial=" + initial + ", final=" + finalState
        + ", superstate=" + superstate + "]";
  }

  public final static class StateSpecBuilder {
    private String name;
    private boolean initial;
    private boolean finalState;
    private String entryAction;
    private String duringAction;
    private String exitAction;
    private boolean superstate;
    private MachineSpec subMachine;

    public static StateSpecBuilder newBuilder(final String name) {
      return new StateSpecBuilder(name);
    }

    public StateSpecBuilder initial(final boolean initial) {
      this.initial = initial;
      return this;
    }

    public StateSpecBuilder finalState(final boolean finalState) {
      this.finalState = finalState;
      return this;
    }

    public StateSpecBuilder entryAction(final String entryAction) {
      this.entryAction = entryAction;
      return this;
    }

    public StateSpecBuilder duringAction(final String duringAction) {
      this.duringAction = duringAction;
      return this;
    }

    public StateSpecBuilder exitAction(final String exitAction) {
      this.exitAction = exitAction;
      return this;
    }

    /**
     * Mark this state as a superstate owning the given sub-machine. An empty or null sub-machine is
     * legal, the state then simply never activates one.
     */
    public StateSpecBuilder subMachine(final MachineSpec subMachine) {
      this.superstate = true;
      this.subMachine = subMachine;
      return this;
    }

    public StateSpecBuilder superstate(final boolean superstate) {
      this.superstate = superstate;
      return this;
    }

    public StateSpec build() throws StateMachineException {
      if (name == null || name.trim().isEmpty()) {
        throw new StateMachineException(Code.INVALID_STATE_NAME);
      }
      return new StateSpec(this);
    }

    private StateSpecBuilder(final String name) {
      this.name = name;
    }
  }
}
