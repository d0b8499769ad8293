package com.github.fsmcompiler;

/**
 * A 1-based line/column location in specification source text.
 */
public final class SourcePosition implements Comparable<SourcePosition> {
  public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

  private final int line;
  private final int column;

  public SourcePosition(final int line, final int column) {
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public boolean isKnown() {
    return line > 0;
  }

  @Override
  public int compareTo(final SourcePosition other) {
    if (line != other.line) {
      return Integer.compare(line, other.line);
    }
    return Integer.compare(column, other.column);
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourcePosition)) {
      return false;
    }
    final SourcePosition other = (SourcePosition) obj;
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return isKnown() ? line + ":" + column : "?:?";
  }
}
