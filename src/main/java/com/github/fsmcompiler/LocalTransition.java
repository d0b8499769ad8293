package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything a state does on one trigger: an ordered guard chain where the first branch whose
 * guard holds wins. When no branch holds the machine stays put.
 */
public final class LocalTransition {
  private final String source;
  private final Trigger trigger;
  private final List<GuardedBranch> branches;
  private final SourcePosition position;

  public LocalTransition(final String source, final Trigger trigger,
      final List<GuardedBranch> branches, final SourcePosition position) {
    this.source = Objects.requireNonNull(source);
    this.trigger = Objects.requireNonNull(trigger);
    if (branches == null || branches.isEmpty()) {
      throw new IllegalArgumentException("Local transition " + source + "/" + trigger
          + " needs at least one branch");
    }
    this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public String getSource() {
    return source;
  }

  public Trigger getTrigger() {
    return trigger;
  }

  public List<GuardedBranch> getBranches() {
    return branches;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /**
   * True when the chain ends in a catch-all branch, so the implicit STAY is never reached.
   */
  public boolean isExhaustive() {
    for (final GuardedBranch branch : branches) {
      if (branch.getCondition().isAlways()) {
        return true;
      }
    }
    return false;
  }

  public StateTrigger key() {
    return StateTrigger.of(source, trigger);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, trigger, branches);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LocalTransition)) {
      return false;
    }
    final LocalTransition other = (LocalTransition) obj;
    return source.equals(other.source) && trigger.equals(other.trigger)
        && branches.equals(other.branches);
  }

  @Override
  public String toString() {
    return "LocalTransition [source=" + source + ", trigger=" + trigger + ", branches=" + branches
        + "]";
  }
}
