package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An interrupt-style transition taken from every state, ahead of anything the state itself
 * declares for the same trigger.
 */
public final class GlobalTransition {
  private final Trigger trigger;
  private final List<Action> actions;
  private final String destination;
  private final String comment;
  private final SourcePosition position;

  public GlobalTransition(final Trigger trigger, final List<Action> actions,
      final String destination, final String comment, final SourcePosition position) {
    this.trigger = Objects.requireNonNull(trigger);
    if (trigger.isTimeout()) {
      throw new IllegalArgumentException("Global transitions cannot trigger on a timeout");
    }
    this.destination = Objects.requireNonNull(destination);
    this.actions = actions == null ? Collections.<Action>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(actions));
    this.comment = comment;
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public Trigger getTrigger() {
    return trigger;
  }

  public List<Action> getActions() {
    return actions;
  }

  public String getDestination() {
    return destination;
  }

  public String getComment() {
    return comment;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(trigger, actions, destination);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GlobalTransition)) {
      return false;
    }
    final GlobalTransition other = (GlobalTransition) obj;
    return trigger.equals(other.trigger) && actions.equals(other.actions)
        && destination.equals(other.destination);
  }

  @Override
  public String toString() {
    return "GlobalTransition [trigger=" + trigger + ", actions=" + actions + ", destination="
        + destination + "]";
  }
}
