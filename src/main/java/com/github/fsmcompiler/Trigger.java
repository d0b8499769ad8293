package com.github.fsmcompiler;

import java.util.Objects;

/**
 * What makes a state machine leave its current state: an external event or the expiry of the
 * current state's timer.
 *
 * A state owns at most one timer, so all timeouts are the same trigger. The duration written in
 * {@code ON_TIMEOUT(30s)} is carried along for the timer declaration but takes no part in
 * equality.
 */
public final class Trigger {
  /**
   * Event name that is read as a timeout, {@code ON_EVENT(TIMER_EXPIRED)}.
   */
  public static final String timerExpiredEvent = "TIMER_EXPIRED";

  private final Kind kind;
  private final String event;
  private final Duration duration;

  private Trigger(final Kind kind, final String event, final Duration duration) {
    this.kind = kind;
    this.event = event;
    this.duration = duration;
  }

  public static Trigger event(final String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Event name cannot be null or empty");
    }
    return new Trigger(Kind.EVENT, name, null);
  }

  public static Trigger timeout(final Duration duration) {
    return new Trigger(Kind.TIMEOUT, null, duration);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isTimeout() {
    return kind == Kind.TIMEOUT;
  }

  public String getEvent() {
    return event;
  }

  public Duration getDuration() {
    return duration;
  }

  /**
   * Stable identity of the trigger, {@code EVENT:<name>} or {@code TIMEOUT}.
   */
  public String key() {
    return kind == Kind.EVENT ? "EVENT:" + event : "TIMEOUT";
  }

  @Override
  public int hashCode() {
    return key().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Trigger)) {
      return false;
    }
    final Trigger other = (Trigger) obj;
    return kind == other.kind && Objects.equals(event, other.event);
  }

  @Override
  public String toString() {
    if (kind == Kind.EVENT) {
      return "ON_EVENT(" + event + ")";
    }
    return duration == null ? "ON_TIMEOUT" : "ON_TIMEOUT(" + duration + ")";
  }

  public static enum Kind {
    EVENT, TIMEOUT;
  }
}
