package com.github.fsmcompiler;

import java.util.Objects;

/**
 * An output pin of the generated machine together with the domain its levels come from.
 */
public final class OutputSignal {
  /**
   * Signal name whose RUNNING level marks a timed state.
   */
  public static final String timerSignal = "Timer";
  public static final String timerRunningLevel = "RUNNING";

  private final String name;
  private final OutputDomain domain;

  public OutputSignal(final String name, final OutputDomain domain) {
    this.name = Objects.requireNonNull(name);
    this.domain = Objects.requireNonNull(domain);
  }

  public String getName() {
    return name;
  }

  public OutputDomain getDomain() {
    return domain;
  }

  public int width() {
    return domain.width();
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, domain);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof OutputSignal)) {
      return false;
    }
    final OutputSignal other = (OutputSignal) obj;
    return name.equals(other.name) && domain.equals(other.domain);
  }

  @Override
  public String toString() {
    return "OutputSignal [name=" + name + ", domain=" + domain.getName() + "]";
  }
}
