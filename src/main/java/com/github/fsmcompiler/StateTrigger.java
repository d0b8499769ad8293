package com.github.fsmcompiler;

import java.util.Objects;

/**
 * A trigger seen from one state: the key of a local transition and of a resolved table entry.
 */
public final class StateTrigger {
  private final String state;
  private final Trigger trigger;

  private StateTrigger(final String state, final Trigger trigger) {
    this.state = state;
    this.trigger = trigger;
  }

  public static StateTrigger of(final String state, final Trigger trigger) {
    return new StateTrigger(state, trigger);
  }

  public String getState() {
    return state;
  }

  public Trigger getTrigger() {
    return trigger;
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, trigger);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateTrigger)) {
      return false;
    }
    final StateTrigger other = (StateTrigger) obj;
    return Objects.equals(state, other.state) && Objects.equals(trigger, other.trigger);
  }

  @Override
  public String toString() {
    return state + " " + trigger;
  }
}
