package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The intermediate representation: one immutable, validated-or-not description of a flat Moore
 * machine. Built once by {@link IrBuilder} (or read back by {@link IrSerializer}) and only ever
 * read afterwards; recompiling means building a fresh one.
 *
 * Notes for users:<br>
 * 1. states, signals, events, variables and timers keep declaration order so that everything
 * derived from a specification is reproducible byte for byte<br>
 * 2. local transitions are already merged: there is exactly one per (state, trigger) and its
 * branches are in source order<br>
 * 3. local transitions may name states that were never declared; the validator reports them<br>
 */
public final class Specification {
  private final SpecificationHeader header;
  private final Map<String, State> states;
  private final List<GlobalTransition> globalTransitions;
  private final List<LocalTransition> localTransitions;
  private final Map<StateTrigger, LocalTransition> localIndex;
  private final Map<String, OutputSignal> signals;
  private final List<String> events;
  private final Map<String, ConditionVariable> variables;
  private final Map<String, Timer> timers;
  private final List<Annotation> annotations;

  public Specification(final SpecificationHeader header, final List<State> states,
      final List<GlobalTransition> globalTransitions,
      final List<LocalTransition> localTransitions, final List<OutputSignal> signals,
      final List<String> events, final List<ConditionVariable> variables,
      final List<Timer> timers, final List<Annotation> annotations) {
    this.header = header == null ? SpecificationHeader.EMPTY : header;

    final Map<String, State> stateMap = new LinkedHashMap<>();
    for (final State state : nonNull(states)) {
      if (stateMap.putIfAbsent(state.getName(), state) != null) {
        throw new IllegalArgumentException("Duplicate state " + state.getName());
      }
    }
    this.states = Collections.unmodifiableMap(stateMap);

    this.globalTransitions = freeze(globalTransitions);

    final Map<StateTrigger, LocalTransition> index = new LinkedHashMap<>();
    for (final LocalTransition local : nonNull(localTransitions)) {
      if (index.putIfAbsent(local.key(), local) != null) {
        throw new IllegalArgumentException("Local transitions must be merged per (state, trigger): "
            + local.key());
      }
    }
    this.localIndex = Collections.unmodifiableMap(index);
    this.localTransitions = Collections.unmodifiableList(new ArrayList<>(index.values()));

    final Map<String, OutputSignal> signalMap = new LinkedHashMap<>();
    for (final OutputSignal signal : nonNull(signals)) {
      signalMap.put(signal.getName(), signal);
    }
    this.signals = Collections.unmodifiableMap(signalMap);

    this.events = freeze(events);

    final Map<String, ConditionVariable> variableMap = new LinkedHashMap<>();
    for (final ConditionVariable variable : nonNull(variables)) {
      variableMap.put(variable.getName(), variable);
    }
    this.variables = Collections.unmodifiableMap(variableMap);

    final Map<String, Timer> timerMap = new LinkedHashMap<>();
    for (final Timer timer : nonNull(timers)) {
      timerMap.put(timer.getOwner(), timer);
    }
    this.timers = Collections.unmodifiableMap(timerMap);

    this.annotations = freeze(annotations);
  }

  /**
   * Returns a copy carrying {@code additional} annotations after the existing ones.
   */
  public Specification withAnnotations(final List<Annotation> additional) {
    final List<Annotation> merged = new ArrayList<>(annotations);
    merged.addAll(nonNull(additional));
    return new Specification(header, new ArrayList<>(states.values()), globalTransitions,
        localTransitions, new ArrayList<>(signals.values()), events,
        new ArrayList<>(variables.values()), new ArrayList<>(timers.values()), merged);
  }

  public SpecificationHeader getHeader() {
    return header;
  }

  public Map<String, State> getStates() {
    return states;
  }

  public State getState(final String name) {
    return states.get(name);
  }

  public boolean hasState(final String name) {
    return states.containsKey(name);
  }

  /**
   * The power-on state: the one marked INITIAL, else the first declared. With several marked the
   * first marked one is returned; the validator reports the conflict.
   */
  public State getInitialState() {
    for (final State state : states.values()) {
      if (state.isMarkedInitial()) {
        return state;
      }
    }
    return states.isEmpty() ? null : states.values().iterator().next();
  }

  public List<GlobalTransition> getGlobalTransitions() {
    return globalTransitions;
  }

  /**
   * The global transition that fires on {@code trigger}, the first declared when there are
   * several, or null.
   */
  public GlobalTransition getGlobalTransition(final Trigger trigger) {
    for (final GlobalTransition global : globalTransitions) {
      if (global.getTrigger().equals(trigger)) {
        return global;
      }
    }
    return null;
  }

  public List<LocalTransition> getLocalTransitions() {
    return localTransitions;
  }

  public LocalTransition getLocalTransition(final String state, final Trigger trigger) {
    return localIndex.get(StateTrigger.of(state, trigger));
  }

  /**
   * Local transitions leaving {@code state}, in declaration order.
   */
  public List<LocalTransition> getLocalTransitions(final String state) {
    final List<LocalTransition> leaving = new ArrayList<>();
    for (final LocalTransition local : localTransitions) {
      if (local.getSource().equals(state)) {
        leaving.add(local);
      }
    }
    return leaving;
  }

  public Map<String, OutputSignal> getSignals() {
    return signals;
  }

  /**
   * Event names in first-appearance order.
   */
  public List<String> getEvents() {
    return events;
  }

  public Map<String, ConditionVariable> getVariables() {
    return variables;
  }

  public Map<String, Timer> getTimers() {
    return timers;
  }

  public Timer getTimer(final String state) {
    return timers.get(state);
  }

  public boolean isTimed(final String state) {
    return timers.containsKey(state);
  }

  /**
   * Every trigger {@code state} can see: all events, plus its own timeout if it owns a timer.
   */
  public List<Trigger> triggersFor(final String state) {
    final List<Trigger> triggers = new ArrayList<>();
    for (final String event : events) {
      triggers.add(Trigger.event(event));
    }
    if (isTimed(state)) {
      triggers.add(Trigger.timeout(timers.get(state).getDuration()));
    }
    return triggers;
  }

  public List<Annotation> getAnnotations() {
    return annotations;
  }

  public List<Annotation> getAnnotations(final Annotation.Target target, final String subject) {
    final List<Annotation> matching = new ArrayList<>();
    for (final Annotation annotation : annotations) {
      if (annotation.getTarget() == target && annotation.getSubject().equals(subject)) {
        matching.add(annotation);
      }
    }
    return matching;
  }

  public boolean hasHint(final Annotation.Hint hint) {
    for (final Annotation annotation : annotations) {
      if (annotation.getHint() == hint) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Specification [feature=" + header.getFeature() + ", states=" + states.keySet()
        + ", globalTransitions=" + globalTransitions.size() + ", localTransitions="
        + localTransitions.size() + ", events=" + events + "]";
  }

  private static <T> List<T> nonNull(final List<T> list) {
    return list == null ? Collections.<T>emptyList() : list;
  }

  private static <T> List<T> freeze(final List<T> list) {
    return Collections.unmodifiableList(new ArrayList<>(nonNull(list)));
  }
}
