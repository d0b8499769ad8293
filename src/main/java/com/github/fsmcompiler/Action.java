package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Something done exactly once on the edge of a transition. Actions never become part of a state's
 * steady outputs.
 */
public final class Action {
  private final Type type;
  private final String name;
  private final List<String> arguments;
  private final Duration duration;

  private Action(final Type type, final String name, final List<String> arguments,
      final Duration duration) {
    this.type = type;
    this.name = name;
    this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    this.duration = duration;
  }

  public static Action startTimer(final Duration duration) {
    if (duration == null) {
      throw new IllegalArgumentException("START_TIMER needs a duration");
    }
    return new Action(Type.START_TIMER, Type.START_TIMER.name(),
        Collections.singletonList(duration.canonical()), duration);
  }

  /**
   * Builds the action named {@code name}. Built-in names are recognized in any case; everything
   * else becomes an opaque {@link Type#CUSTOM} action keeping its spelling.
   */
  public static Action of(final String name, final List<String> arguments,
      final Duration duration) {
    final Type type = Type.forName(name);
    if (type == Type.START_TIMER) {
      return startTimer(duration);
    }
    final List<String> args = arguments == null ? Collections.<String>emptyList() : arguments;
    return new Action(type, type == Type.CUSTOM ? name : type.name(), args, null);
  }

  public static Action of(final String name) {
    return of(name, null, null);
  }

  public Type getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public List<String> getArguments() {
    return arguments;
  }

  /**
   * Non-null only for START_TIMER.
   */
  public Duration getDuration() {
    return duration;
  }

  public boolean isTimerControl() {
    return type == Type.START_TIMER || type == Type.STOP_TIMER || type == Type.STOP_ALL_TIMERS;
  }

  public boolean stopsTimer() {
    return type == Type.STOP_TIMER || type == Type.STOP_ALL_TIMERS;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, arguments);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Action)) {
      return false;
    }
    final Action other = (Action) obj;
    return type == other.type && name.equals(other.name) && arguments.equals(other.arguments);
  }

  @Override
  public String toString() {
    if (arguments.isEmpty()) {
      return name;
    }
    return name + "(" + String.join(", ", arguments) + ")";
  }

  public static enum Type {
    START_TIMER, STOP_TIMER, STOP_ALL_TIMERS, CLEAR_ALARM, CUSTOM;

    static Type forName(final String name) {
      final String upper = name.toUpperCase(Locale.ROOT);
      for (final Type type : values()) {
        if (type != CUSTOM && type.name().equals(upper)) {
          return type;
        }
      }
      return CUSTOM;
    }
  }
}
