package com.github.fsmcompiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This object represents immutable metadata about a state: its name and its Moore output function,
 * ie. the level every output signal holds while the machine sits in this state.
 */
public final class State {
  private final String name;
  private final Map<String, String> outputs;
  private final boolean markedInitial;
  private final String comment; // optional
  private final SourcePosition position;

  public State(final String name, final Map<String, String> outputs, final boolean markedInitial,
      final String comment, final SourcePosition position) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("State name cannot be null or empty");
    }
    this.name = name;
    this.outputs = Collections.unmodifiableMap(
        outputs == null ? new LinkedHashMap<String, String>() : new LinkedHashMap<>(outputs));
    this.markedInitial = markedInitial;
    this.comment = comment;
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public String getName() {
    return name;
  }

  /**
   * Output signal name to level, in declaration order.
   */
  public Map<String, String> getOutputs() {
    return outputs;
  }

  public String getOutputLevel(final String signal) {
    return outputs.get(signal);
  }

  /**
   * True only when the declaration carries the INITIAL marker. See
   * {@link Specification#getInitialState()} for the power-on state itself.
   */
  public boolean isMarkedInitial() {
    return markedInitial;
  }

  public String getComment() {
    return comment;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /**
   * True when the state declares {@code Timer=RUNNING}.
   */
  public boolean declaresRunningTimer() {
    for (final Map.Entry<String, String> output : outputs.entrySet()) {
      if (OutputSignal.timerSignal.equalsIgnoreCase(output.getKey())
          && OutputSignal.timerRunningLevel.equalsIgnoreCase(output.getValue())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + outputs.hashCode();
    result = prime * result + (markedInitial ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (!name.equals(other.name)) {
      return false;
    }
    if (!outputs.equals(other.outputs)) {
      return false;
    }
    return markedInitial == other.markedInitial;
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", outputs=" + outputs + ", markedInitial=" + markedInitial
        + "]";
  }
}
