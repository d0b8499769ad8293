package com.github.fsmcompiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs every check over a {@link Specification} and reports what it finds. No check stops the
 * others: one pass yields every defect, and errors among them block code generation.
 */
public final class SemanticValidator {
  private static final Logger logger =
      LogManager.getLogger(SemanticValidator.class.getSimpleName());

  private final Diagnostics diagnostics;

  public SemanticValidator(final Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  public void validate(final Specification specification) {
    final int before = diagnostics.size();
    checkReferences(specification);
    checkGlobalDuplicates(specification);
    checkEventSpelling(specification);
    checkInitialState(specification);
    checkOutputCompleteness(specification);
    checkCompleteness(specification);
    checkDeterminism(specification);
    checkShadowing(specification);
    final Set<String> reachable = reachableStates(specification);
    checkTimers(specification, reachable);
    checkReachability(specification, reachable);
    if (logger.isDebugEnabled()) {
      logger.debug("Validation reported " + (diagnostics.size() - before) + " diagnostics for "
          + specification.getStates().size() + " states");
    }
  }

  private void checkReferences(final Specification specification) {
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      if (!specification.hasState(global.getDestination())) {
        diagnostics.report(DiagnosticKind.UNRESOLVED_REFERENCE,
            "Global transition on " + global.getTrigger().getEvent() + " targets undeclared state "
                + global.getDestination(),
            global.getPosition());
      }
    }
    final Set<String> reportedSources = new HashSet<>();
    for (final LocalTransition local : specification.getLocalTransitions()) {
      if (!specification.hasState(local.getSource()) && reportedSources.add(local.getSource())) {
        diagnostics.report(DiagnosticKind.UNRESOLVED_REFERENCE,
            "FROM names undeclared state " + local.getSource(), local.getPosition());
      }
      for (final GuardedBranch branch : local.getBranches()) {
        if (!branch.isStay() && !specification.hasState(branch.getDestination())) {
          diagnostics.report(DiagnosticKind.UNRESOLVED_REFERENCE,
              "Transition from " + local.getSource() + " on " + local.getTrigger()
                  + " targets undeclared state " + branch.getDestination(),
              branch.getPosition());
        }
      }
    }
  }

  private void checkGlobalDuplicates(final Specification specification) {
    final Map<Trigger, GlobalTransition> first = new LinkedHashMap<>();
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      final GlobalTransition earlier = first.putIfAbsent(global.getTrigger(), global);
      if (earlier != null) {
        diagnostics.report(DiagnosticKind.DUPLICATE_GLOBAL_TRANSITION,
            "Global transition on " + global.getTrigger().getEvent() + " is already declared at "
                + earlier.getPosition() + " and will never fire",
            global.getPosition());
      }
    }
  }

  /**
   * Event names that differ only in case or underscores are most likely one event misspelled.
   */
  private void checkEventSpelling(final Specification specification) {
    final Map<String, SourcePosition> firstSeen = eventPositions(specification);
    final Map<String, String> bySpelling = new LinkedHashMap<>();
    for (final String event : specification.getEvents()) {
      final String normalized = event.replace("_", "").toLowerCase(Locale.ROOT);
      final String earlier = bySpelling.putIfAbsent(normalized, event);
      if (earlier != null) {
        diagnostics.report(DiagnosticKind.INCONSISTENT_EVENT_NAME,
            "Event " + event + " differs from " + earlier + " only in spelling; they are treated "
                + "as two different events",
            firstSeen.get(event));
      }
    }
  }

  private static Map<String, SourcePosition> eventPositions(final Specification specification) {
    final Map<String, SourcePosition> positions = new LinkedHashMap<>();
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      earliest(positions, global.getTrigger().getEvent(), global.getPosition());
    }
    for (final LocalTransition local : specification.getLocalTransitions()) {
      if (!local.getTrigger().isTimeout()) {
        earliest(positions, local.getTrigger().getEvent(), local.getPosition());
      }
    }
    return positions;
  }

  private static void earliest(final Map<String, SourcePosition> positions, final String event,
      final SourcePosition position) {
    final SourcePosition current = positions.get(event);
    if (current == null || position.compareTo(current) < 0) {
      positions.put(event, position);
    }
  }

  private void checkInitialState(final Specification specification) {
    if (specification.getStates().isEmpty()) {
      diagnostics.report(DiagnosticKind.MISSING_INITIAL_STATE,
          "STATE_LIST declares no states, so there is no power-on state", SourcePosition.UNKNOWN);
      return;
    }
    State marked = null;
    for (final State state : specification.getStates().values()) {
      if (!state.isMarkedInitial()) {
        continue;
      }
      if (marked == null) {
        marked = state;
      } else {
        diagnostics.report(DiagnosticKind.MULTIPLE_INITIAL_STATES,
            "State " + state.getName() + " is marked INITIAL but " + marked.getName()
                + " already is",
            state.getPosition());
      }
    }
  }

  /**
   * Moore rule: every state drives every output signal.
   */
  private void checkOutputCompleteness(final Specification specification) {
    for (final State state : specification.getStates().values()) {
      final List<String> missing = new ArrayList<>();
      for (final String signal : specification.getSignals().keySet()) {
        if (state.getOutputLevel(signal) == null) {
          missing.add(signal);
        }
      }
      if (!missing.isEmpty()) {
        diagnostics.report(DiagnosticKind.MISSING_OUTPUT_IN_STATE,
            "State " + state.getName() + " declares no level for " + String.join(", ", missing),
            state.getPosition());
      }
    }
  }

  private void checkCompleteness(final Specification specification) {
    for (final State state : specification.getStates().values()) {
      for (final Trigger trigger : specification.triggersFor(state.getName())) {
        if (specification.getLocalTransition(state.getName(), trigger) != null) {
          continue;
        }
        if (!trigger.isTimeout() && specification.getGlobalTransition(trigger) != null) {
          continue;
        }
        diagnostics.report(DiagnosticKind.IMPLICIT_STAY,
            "State " + state.getName() + " has no transition " + trigger + " and will stay",
            state.getPosition());
      }
    }
  }

  private void checkDeterminism(final Specification specification) {
    for (final LocalTransition local : specification.getLocalTransitions()) {
      final Set<Condition> seen = new HashSet<>();
      boolean catchAll = false;
      for (final GuardedBranch branch : local.getBranches()) {
        if (catchAll) {
          diagnostics.report(DiagnosticKind.DEAD_CONDITION,
              "Branch of " + local.getSource() + " " + local.getTrigger()
                  + " follows an ELSE and can never be taken",
              branch.getPosition());
        } else if (!seen.add(branch.getCondition())) {
          diagnostics.report(DiagnosticKind.DEAD_CONDITION,
              "Condition " + branch.getCondition().canonical() + " of " + local.getSource() + " "
                  + local.getTrigger() + " repeats an earlier branch and can never be taken",
              branch.getPosition());
        }
        catchAll |= branch.getCondition().isAlways();
      }
      if (!catchAll && logger.isDebugEnabled()) {
        logger.debug("Implicit default: " + local.getSource() + " " + local.getTrigger()
            + " has no ELSE and stays when no condition holds");
      }
    }
  }

  private void checkShadowing(final Specification specification) {
    for (final LocalTransition local : specification.getLocalTransitions()) {
      final Trigger trigger = local.getTrigger();
      if (trigger.isTimeout()) {
        continue;
      }
      final GlobalTransition global = specification.getGlobalTransition(trigger);
      if (global != null) {
        diagnostics.report(DiagnosticKind.SHADOWED_BY_GLOBAL,
            "Transition from " + local.getSource() + " " + trigger
                + " is overridden by the global transition to " + global.getDestination(),
            local.getPosition());
      }
    }
  }

  /**
   * A timer is owned only through a START_TIMER edge that can fire: globals fire from any
   * reachable state, a local edge needs a reachable source and must not be overridden by a
   * global transition on the same event.
   */
  private void checkTimers(final Specification specification, final Set<String> reachable) {
    final Set<String> started = new HashSet<>();
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      final Action start = checkActionList(global.getActions(), global.getPosition());
      if (start == null) {
        continue;
      }
      if (!reachable.isEmpty()) {
        started.add(global.getDestination());
      }
      checkStartedTimer(specification, global.getDestination(), start, global.getPosition());
      if (!stops(global.getActions())) {
        final List<String> running = new ArrayList<>();
        for (final String owner : specification.getTimers().keySet()) {
          if (!owner.equals(global.getDestination())) {
            running.add(owner);
          }
        }
        if (!running.isEmpty()) {
          diagnostics.report(DiagnosticKind.TIMER_CONFLICT,
              "Global transition on " + global.getTrigger().getEvent() + " starts a timer "
                  + "without stopping the running timer of " + String.join(", ", running),
              global.getPosition());
        }
      }
    }

    for (final LocalTransition local : specification.getLocalTransitions()) {
      final String source = local.getSource();
      final boolean fires = reachable.contains(source) && !isOverridden(specification, local);
      for (final GuardedBranch branch : local.getBranches()) {
        final Action start = checkActionList(branch.getActions(), branch.getPosition());
        if (start == null) {
          continue;
        }
        final String destination = branch.destinationFrom(source);
        if (fires) {
          started.add(destination);
        }
        checkStartedTimer(specification, destination, start, branch.getPosition());
        if (!destination.equals(source) && specification.isTimed(source)
            && !local.getTrigger().isTimeout() && !stops(branch.getActions())) {
          diagnostics.report(DiagnosticKind.TIMER_CONFLICT,
              "Transition from " + source + " to " + destination + " starts a timer while the "
                  + "timer of " + source + " is still running; add STOP_TIMER",
              branch.getPosition());
        }
      }
    }

    for (final Timer timer : specification.getTimers().values()) {
      if (!started.contains(timer.getOwner())) {
        diagnostics.report(DiagnosticKind.ORPHANED_TIMEOUT,
            "State " + timer.getOwner() + " waits on a timer but no transition into it issues "
                + "START_TIMER",
            specification.getState(timer.getOwner()).getPosition());
      }
    }
  }

  /**
   * Reports an action list that starts more than one timer and returns its first START_TIMER.
   */
  private Action checkActionList(final List<Action> actions, final SourcePosition position) {
    Action first = null;
    for (final Action action : actions) {
      if (action.getType() != Action.Type.START_TIMER) {
        continue;
      }
      if (first == null) {
        first = action;
      } else {
        diagnostics.report(DiagnosticKind.TIMER_CONFLICT,
            "Action list starts a second timer " + action + " after " + first, position);
        break;
      }
    }
    return first;
  }

  private void checkStartedTimer(final Specification specification, final String destination,
      final Action start, final SourcePosition position) {
    if (!specification.hasState(destination)) {
      return;
    }
    final Timer timer = specification.getTimer(destination);
    if (timer == null) {
      diagnostics.report(DiagnosticKind.UNUSED_TIMER,
          start + " enters " + destination + ", which never waits on a timeout", position);
    } else if (timer.getDuration() != null && !timer.getDuration().equals(start.getDuration())) {
      diagnostics.report(DiagnosticKind.TIMER_DURATION_MISMATCH,
          start + " enters " + destination + ", whose timer runs for " + timer.getDuration(),
          position);
    }
  }

  private static boolean stops(final List<Action> actions) {
    for (final Action action : actions) {
      if (action.stopsTimer()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Walks the transition graph from the power-on state. Global transitions leave every state, so
   * their destinations are reachable from anywhere. Empty when there is no state at all.
   */
  private static Set<String> reachableStates(final Specification specification) {
    final Set<String> reachable = new LinkedHashSet<>();
    final State initial = specification.getInitialState();
    if (initial == null) {
      return reachable;
    }
    final Deque<String> pending = new ArrayDeque<>();
    reachable.add(initial.getName());
    pending.add(initial.getName());
    while (!pending.isEmpty()) {
      final String current = pending.poll();
      for (final String next : successors(specification, current)) {
        if (specification.hasState(next) && reachable.add(next)) {
          pending.add(next);
        }
      }
    }
    return reachable;
  }

  private void checkReachability(final Specification specification,
      final Set<String> reachable) {
    final State initial = specification.getInitialState();
    if (initial == null) {
      return;
    }
    for (final State state : specification.getStates().values()) {
      final String name = state.getName();
      if (!reachable.contains(name)) {
        diagnostics.report(DiagnosticKind.UNREACHABLE_STATE,
            "State " + name + " cannot be reached from " + initial.getName(),
            state.getPosition());
        continue;
      }
      boolean exits = false;
      for (final String next : successors(specification, name)) {
        if (!next.equals(name)) {
          exits = true;
          break;
        }
      }
      if (!exits) {
        diagnostics.report(DiagnosticKind.POTENTIAL_DEADLOCK,
            "State " + name + " has no transition to any other state", state.getPosition());
      }
    }
  }

  private static Set<String> successors(final Specification specification, final String state) {
    final Set<String> successors = new LinkedHashSet<>();
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      successors.add(global.getDestination());
    }
    for (final LocalTransition local : specification.getLocalTransitions(state)) {
      if (isOverridden(specification, local)) {
        continue;
      }
      for (final GuardedBranch branch : local.getBranches()) {
        successors.add(branch.destinationFrom(state));
      }
    }
    return successors;
  }

  private static boolean isOverridden(final Specification specification,
      final LocalTransition local) {
    return !local.getTrigger().isTimeout()
        && specification.getGlobalTransition(local.getTrigger()) != null;
  }
}
