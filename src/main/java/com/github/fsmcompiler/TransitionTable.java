package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The resolved next-state function of a whole machine, keyed by (state, trigger). Keys without an
 * entry fall back to the implicit STAY in exactly one place, {@link #lookup(String, Trigger)}.
 */
public final class TransitionTable {
  private final Map<StateTrigger, ResolvedEntry> entries;

  TransitionTable(final List<ResolvedEntry> entries) {
    final Map<StateTrigger, ResolvedEntry> index = new LinkedHashMap<>();
    for (final ResolvedEntry entry : entries) {
      index.put(StateTrigger.of(entry.getState(), entry.getTrigger()), entry);
    }
    this.entries = Collections.unmodifiableMap(index);
  }

  /**
   * Explicit entries only, state-major in declaration order.
   */
  public List<ResolvedEntry> getEntries() {
    return Collections.unmodifiableList(new ArrayList<>(entries.values()));
  }

  public ResolvedEntry lookup(final String state, final Trigger trigger) {
    final ResolvedEntry entry = entries.get(StateTrigger.of(state, trigger));
    if (entry != null) {
      return entry;
    }
    return ResolvedEntry.implicitStay(state, trigger);
  }

  public Resolution resolve(final String state, final Trigger trigger,
      final Map<String, ?> bindings) {
    return lookup(state, trigger).evaluate(bindings);
  }

  public int size() {
    return entries.size();
  }

  /**
   * One line per entry, stable across compiles of the same input.
   */
  public String describe() {
    final StringBuilder builder = new StringBuilder();
    for (final ResolvedEntry entry : entries.values()) {
      builder.append(entry).append('\n');
    }
    return builder.toString();
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TransitionTable)) {
      return false;
    }
    return new ArrayList<>(entries.values())
        .equals(new ArrayList<>(((TransitionTable) obj).entries.values()));
  }

  @Override
  public String toString() {
    return "TransitionTable [entries=" + entries.size() + "]";
  }
}
