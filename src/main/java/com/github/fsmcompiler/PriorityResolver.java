package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies the single conflict-resolution rule of the language: a global transition beats the
 * state's own guard chain, which beats the implicit STAY.
 */
public final class PriorityResolver {
  private static final Logger logger =
      LogManager.getLogger(PriorityResolver.class.getSimpleName());

  public TransitionTable resolve(final Specification specification) {
    final List<ResolvedEntry> entries = new ArrayList<>();
    int globals = 0;
    int locals = 0;
    for (final State state : specification.getStates().values()) {
      for (final Trigger trigger : specification.triggersFor(state.getName())) {
        final GlobalTransition global =
            trigger.isTimeout() ? null : specification.getGlobalTransition(trigger);
        if (global != null) {
          entries.add(ResolvedEntry.global(state.getName(), global));
          globals++;
          continue;
        }
        final LocalTransition local = specification.getLocalTransition(state.getName(), trigger);
        if (local != null) {
          entries.add(ResolvedEntry.local(local));
          locals++;
        }
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Resolved " + globals + " global and " + locals + " local entries over "
          + specification.getStates().size() + " states");
    }
    return new TransitionTable(entries);
  }
}
