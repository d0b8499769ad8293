package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one evaluation step: where the machine goes and which actions fire on the way.
 */
public final class Resolution {
  private final ResolvedEntry.Source source;
  private final String destination;
  private final List<Action> actions;
  private final int branchIndex;

  Resolution(final ResolvedEntry.Source source, final String destination,
      final List<Action> actions, final int branchIndex) {
    this.source = Objects.requireNonNull(source);
    this.destination = Objects.requireNonNull(destination);
    this.actions = actions == null ? Collections.<Action>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(actions));
    this.branchIndex = branchIndex;
  }

  public ResolvedEntry.Source getSource() {
    return source;
  }

  public String getDestination() {
    return destination;
  }

  public List<Action> getActions() {
    return actions;
  }

  /**
   * Index of the branch taken in the local chain, -1 unless the source is LOCAL.
   */
  public int getBranchIndex() {
    return branchIndex;
  }

  public boolean isImplicitStay() {
    return source == ResolvedEntry.Source.IMPLICIT_STAY;
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, destination, actions, branchIndex);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Resolution)) {
      return false;
    }
    final Resolution other = (Resolution) obj;
    return source == other.source && destination.equals(other.destination)
        && actions.equals(other.actions) && branchIndex == other.branchIndex;
  }

  @Override
  public String toString() {
    return "Resolution [source=" + source + ", destination=" + destination + ", actions="
        + actions + ", branchIndex=" + branchIndex + "]";
  }
}
