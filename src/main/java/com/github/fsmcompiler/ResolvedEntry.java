package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The effective next-state function of one (state, trigger) pair. A GLOBAL entry always takes the
 * global transition; a LOCAL entry runs the state's guard chain and stays when nothing holds.
 */
public final class ResolvedEntry {
  private final String state;
  private final Trigger trigger;
  private final Source source;
  private final GlobalTransition global;
  private final List<GuardedBranch> branches;

  private ResolvedEntry(final String state, final Trigger trigger, final Source source,
      final GlobalTransition global, final List<GuardedBranch> branches) {
    this.state = Objects.requireNonNull(state);
    this.trigger = Objects.requireNonNull(trigger);
    this.source = source;
    this.global = global;
    this.branches = branches == null ? Collections.<GuardedBranch>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(branches));
  }

  static ResolvedEntry global(final String state, final GlobalTransition global) {
    return new ResolvedEntry(state, global.getTrigger(), Source.GLOBAL, global, null);
  }

  static ResolvedEntry local(final LocalTransition local) {
    return new ResolvedEntry(local.getSource(), local.getTrigger(), Source.LOCAL, null,
        local.getBranches());
  }

  static ResolvedEntry implicitStay(final String state, final Trigger trigger) {
    return new ResolvedEntry(state, trigger, Source.IMPLICIT_STAY, null, null);
  }

  public String getState() {
    return state;
  }

  public Trigger getTrigger() {
    return trigger;
  }

  public Source getSource() {
    return source;
  }

  /**
   * The winning global transition, null unless the source is GLOBAL.
   */
  public GlobalTransition getGlobal() {
    return global;
  }

  /**
   * The guard chain in first-match order, empty unless the source is LOCAL.
   */
  public List<GuardedBranch> getBranches() {
    return branches;
  }

  /**
   * Evaluates the entry against input values. See {@link Condition#evaluate(Map)}.
   */
  public Resolution evaluate(final Map<String, ?> bindings) {
    switch (source) {
      case GLOBAL:
        return new Resolution(source, global.getDestination(), global.getActions(), -1);
      case LOCAL:
        for (int index = 0; index < branches.size(); index++) {
          final GuardedBranch branch = branches.get(index);
          if (branch.getCondition().evaluate(bindings)) {
            return new Resolution(source, branch.destinationFrom(state), branch.getActions(),
                index);
          }
        }
        return new Resolution(Source.IMPLICIT_STAY, state, null, -1);
      default:
        return new Resolution(Source.IMPLICIT_STAY, state, null, -1);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, trigger, source, global, branches);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ResolvedEntry)) {
      return false;
    }
    final ResolvedEntry other = (ResolvedEntry) obj;
    return state.equals(other.state) && trigger.equals(other.trigger) && source == other.source
        && Objects.equals(global, other.global) && branches.equals(other.branches);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder().append(state).append(' ').append(trigger)
        .append(": ");
    switch (source) {
      case GLOBAL:
        builder.append("GLOBAL -> ").append(global.getDestination());
        if (!global.getActions().isEmpty()) {
          builder.append(" DO").append(global.getActions());
        }
        break;
      case LOCAL:
        builder.append("LOCAL ").append(branches);
        break;
      default:
        builder.append("STAY");
        break;
    }
    return builder.toString();
  }

  public static enum Source {
    GLOBAL, LOCAL, IMPLICIT_STAY;
  }
}
