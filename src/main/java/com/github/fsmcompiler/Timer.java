package com.github.fsmcompiler;

import java.util.Objects;

/**
 * The single timer a timed state owns. The duration is null when neither the ON_TIMEOUT trigger
 * nor any START_TIMER into the state names one.
 */
public final class Timer {
  private final String owner;
  private final Duration duration;

  public Timer(final String owner, final Duration duration) {
    this.owner = Objects.requireNonNull(owner);
    this.duration = duration;
  }

  public String getOwner() {
    return owner;
  }

  public String getName() {
    return owner + "_timer";
  }

  public Duration getDuration() {
    return duration;
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, duration);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Timer)) {
      return false;
    }
    final Timer other = (Timer) obj;
    return owner.equals(other.owner) && Objects.equals(duration, other.duration);
  }

  @Override
  public String toString() {
    return "Timer [owner=" + owner + ", duration=" + duration + "]";
  }
}
