package com.github.fsmcompiler;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Immutable timer duration as written in the specification, eg. {@code 30s} or {@code 5min}.
 */
public final class Duration {
  private final long amount;
  private final TimeUnit unit;

  public Duration(final long amount, final TimeUnit unit) {
    if (amount < 0L) {
      throw new IllegalArgumentException("Duration cannot be negative: " + amount);
    }
    if (unit == null) {
      throw new IllegalArgumentException("Duration unit cannot be null");
    }
    this.amount = amount;
    this.unit = unit;
  }

  /**
   * Parses {@code <digits><unit>}. Returns null if the text is not a well-formed duration.
   */
  public static Duration parse(final String text) {
    if (text == null) {
      return null;
    }
    int split = 0;
    while (split < text.length() && Character.isDigit(text.charAt(split))) {
      split++;
    }
    if (split == 0 || split == text.length()) {
      return null;
    }
    final TimeUnit unit = unitFor(text.substring(split));
    if (unit == null) {
      return null;
    }
    try {
      return new Duration(Long.parseLong(text.substring(0, split)), unit);
    } catch (NumberFormatException overflow) {
      return null;
    }
  }

  /**
   * Maps a unit suffix to its {@link TimeUnit}, or null when the suffix is unknown.
   */
  public static TimeUnit unitFor(final String suffix) {
    switch (suffix.toLowerCase(Locale.ROOT)) {
      case "ms":
        return TimeUnit.MILLISECONDS;
      case "s":
      case "sec":
      case "secs":
      case "seconds":
        return TimeUnit.SECONDS;
      case "m":
      case "min":
      case "mins":
      case "minutes":
        return TimeUnit.MINUTES;
      case "h":
      case "hr":
      case "hours":
        return TimeUnit.HOURS;
      default:
        return null;
    }
  }

  public long getAmount() {
    return amount;
  }

  public TimeUnit getUnit() {
    return unit;
  }

  public long toMillis() {
    return unit.toMillis(amount);
  }

  /**
   * Number of clock cycles this duration spans at the given clock frequency, at least 1.
   */
  public long toCycles(final long clockHz) {
    final long millis = toMillis();
    final long cycles;
    if (millis != 0L && clockHz > Long.MAX_VALUE / millis) {
      cycles = Long.MAX_VALUE;
    } else {
      cycles = millis * clockHz / 1000L;
    }
    return Math.max(1L, cycles);
  }

  /**
   * Canonical spelling, stable across re-parsing.
   */
  public String canonical() {
    switch (unit) {
      case MILLISECONDS:
        return amount + "ms";
      case SECONDS:
        return amount + "s";
      case MINUTES:
        return amount + "min";
      case HOURS:
        return amount + "h";
      default:
        return unit.toMillis(amount) + "ms";
    }
  }

  /**
   * Durations are equal when they span the same time, so {@code 60s} equals {@code 1min}.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Duration)) {
      return false;
    }
    return toMillis() == ((Duration) obj).toMillis();
  }

  @Override
  public int hashCode() {
    return Long.hashCode(toMillis());
  }

  @Override
  public String toString() {
    return canonical();
  }
}
