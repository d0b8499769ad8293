package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An input the guards read. Its kind is inferred from how the guards use it and decides the
 * shape of the generated input port.
 */
public final class ConditionVariable {
  private final String name;
  private final Kind kind;
  private final List<String> symbols;
  private final long maxLiteral;

  public ConditionVariable(final String name, final Kind kind, final List<String> symbols,
      final long maxLiteral) {
    this.name = Objects.requireNonNull(name);
    this.kind = Objects.requireNonNull(kind);
    this.symbols = symbols == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(symbols));
    this.maxLiteral = maxLiteral;
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Symbolic constants in first-use order; the index is the encoding. Empty unless SYMBOLIC.
   */
  public List<String> getSymbols() {
    return symbols;
  }

  /**
   * Largest literal this variable is compared against. Zero unless NUMERIC.
   */
  public long getMaxLiteral() {
    return maxLiteral;
  }

  /**
   * Port width in bits. Numeric variables use at least {@code numericWidth} bits and are widened
   * until their largest literal fits.
   */
  public int width(final int numericWidth) {
    switch (kind) {
      case BOOLEAN:
        return 1;
      case SYMBOLIC:
        return Math.max(1, 32 - Integer.numberOfLeadingZeros(Math.max(0, symbols.size() - 1)));
      case NUMERIC:
        return Math.max(numericWidth, 64 - Long.numberOfLeadingZeros(maxLiteral));
      default:
        throw new IllegalStateException("Unhandled kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, symbols, maxLiteral);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ConditionVariable)) {
      return false;
    }
    final ConditionVariable other = (ConditionVariable) obj;
    return name.equals(other.name) && kind == other.kind && symbols.equals(other.symbols)
        && maxLiteral == other.maxLiteral;
  }

  @Override
  public String toString() {
    return "ConditionVariable [name=" + name + ", kind=" + kind + ", symbols=" + symbols
        + ", maxLiteral=" + maxLiteral + "]";
  }

  public static enum Kind {
    // used bare, eg. IF (Door_Open)
    BOOLEAN,
    // compared with == or != against named constants
    SYMBOLIC,
    // compared against integers
    NUMERIC;
  }
}
