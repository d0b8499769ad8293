package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The admissible levels of an output signal. A level's index in {@link #getLevels()} is its
 * hardware encoding, so built-in domains list their "off" level first.
 *
 * Closed domains are registered up front. An open domain belongs to a single signal whose first
 * level matched no registered domain; its levels are whatever that signal is assigned.
 */
public final class OutputDomain {
  public static final OutputDomain DIGITAL = new OutputDomain("DIGITAL", false, "LOW", "HIGH");
  public static final OutputDomain INDICATOR =
      new OutputDomain("INDICATOR", false, "OFF", "ON", "BLINK");
  public static final OutputDomain TIMER = new OutputDomain("TIMER", false, "STOPPED", "RUNNING");

  private final String name;
  private final boolean open;
  private final List<String> levels;

  private OutputDomain(final String name, final boolean open, final String... levels) {
    this(name, open, Arrays.asList(levels));
  }

  private OutputDomain(final String name, final boolean open, final List<String> levels) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Output domain name cannot be null or empty");
    }
    if (levels == null || levels.isEmpty()) {
      throw new IllegalArgumentException("Output domain " + name + " needs at least one level");
    }
    if (levels.size() != levels.stream().distinct().count()) {
      throw new IllegalArgumentException("Output domain " + name + " repeats a level");
    }
    this.name = name;
    this.open = open;
    this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
  }

  /**
   * A closed domain with the given levels, encoded in the given order.
   */
  public static OutputDomain of(final String name, final List<String> levels) {
    return new OutputDomain(name, false, levels);
  }

  /**
   * The open domain of one signal.
   */
  public static OutputDomain open(final String signal, final List<String> levels) {
    return new OutputDomain(signal, true, levels);
  }

  public static List<OutputDomain> builtIns() {
    return Collections.unmodifiableList(Arrays.asList(DIGITAL, INDICATOR, TIMER));
  }

  public String getName() {
    return name;
  }

  public boolean isOpen() {
    return open;
  }

  public List<String> getLevels() {
    return levels;
  }

  public boolean admits(final String level) {
    return levels.contains(level);
  }

  /**
   * Hardware value for {@code level}, -1 if the domain does not admit it.
   */
  public int encode(final String level) {
    return levels.indexOf(level);
  }

  /**
   * Bits needed to hold every level, at least 1.
   */
  public int width() {
    return Math.max(1, 32 - Integer.numberOfLeadingZeros(levels.size() - 1));
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + levels.hashCode() + (open ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof OutputDomain)) {
      return false;
    }
    final OutputDomain other = (OutputDomain) obj;
    return open == other.open && name.equals(other.name) && levels.equals(other.levels);
  }

  @Override
  public String toString() {
    return "OutputDomain [name=" + name + ", open=" + open + ", levels=" + levels + "]";
  }
}
