package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One arm of an if/elseif/else chain: when the guard holds, go to the destination and fire the
 * actions. A null destination means STAY.
 */
public final class GuardedBranch {
  private final Condition condition;
  private final String destination;
  private final List<Action> actions;
  private final String comment;
  private final SourcePosition position;

  public GuardedBranch(final Condition condition, final String destination,
      final List<Action> actions, final String comment, final SourcePosition position) {
    this.condition = condition == null ? Condition.ALWAYS : condition;
    this.destination = destination;
    this.actions = actions == null ? Collections.<Action>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(actions));
    this.comment = comment;
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public Condition getCondition() {
    return condition;
  }

  public String getDestination() {
    return destination;
  }

  public boolean isStay() {
    return destination == null;
  }

  /**
   * Where the machine ends up when leaving {@code source} through this branch.
   */
  public String destinationFrom(final String source) {
    return destination == null ? source : destination;
  }

  public List<Action> getActions() {
    return actions;
  }

  public String getComment() {
    return comment;
  }

  public SourcePosition getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, destination, actions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GuardedBranch)) {
      return false;
    }
    final GuardedBranch other = (GuardedBranch) obj;
    return condition.equals(other.condition) && Objects.equals(destination, other.destination)
        && actions.equals(other.actions);
  }

  @Override
  public String toString() {
    return (condition.isAlways() ? "ELSE" : "IF (" + condition.canonical() + ")")
        + (actions.isEmpty() ? "" : " DO(" + actions + ")")
        + (destination == null ? " -> STAY" : " -> TO(" + destination + ")");
  }
}
