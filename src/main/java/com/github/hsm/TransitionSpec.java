package com.github.hsm;

import java.util.Optional;

import com.github.hsm.StateMachineException.Code;

/**
 * Immutable description of one diagram arrow. Source and target are state names; they are only
 * resolved, and dropped with a warning if unknown, when the machine is built.
 */
public final class TransitionSpec {
  private final String source;
  private final String target;
  private final String event;
  private final String condition;
  private final String action;

  public TransitionSpec(final String source, final String target, final String event,
      final String condition, final String action) throws StateMachineException {
    if (source == null || target == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_SPEC,
          "Transition source and target cannot be null");
    }
    this.source = source.trim();
    this.target = target.trim();
    this.event = event == null || event.trim().isEmpty() ? null : event.trim();
    this.condition = StateSpec.blankToNull(condition);
    this.action = StateSpec.blankToNull(action);
  }

  public static TransitionSpec of(final String source, final String target, final String event)
      throws StateMachineException {
    return new TransitionSpec(source, target, event, null, null);
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  /**
   * The event name, empty when the engine has to synthesize an internal one.
   */
  public Optional<String> getEvent() {
    return Optional.ofNullable(event);
  }

  public Optional<String> getCondition() {
    return Optional.ofNullable(condition);
  }

  public Optional<String> getAction() {
    return Optional.ofNullable(action);
  }

  @Override
  public String toString() {
    return "TransitionSpec [source=" + source + ", target=" + target + ", event=" + event
        + ", condition=" + condition + ", action=" + action + "]";
  }
}
