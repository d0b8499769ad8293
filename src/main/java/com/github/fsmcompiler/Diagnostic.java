package com.github.fsmcompiler;

import java.util.Objects;

import com.github.fsmcompiler.DiagnosticKind.Severity;

/**
 * A single immutable problem report: severity, kind, message and where in the source it was found.
 */
public final class Diagnostic {
  private final Severity severity;
  private final DiagnosticKind kind;
  private final String message;
  private final SourcePosition position;

  public Diagnostic(final DiagnosticKind kind, final String message,
      final SourcePosition position) {
    this(kind.getSeverity(), kind, message, position);
  }

  public Diagnostic(final Severity severity, final DiagnosticKind kind, final String message,
      final SourcePosition position) {
    this.severity = Objects.requireNonNull(severity);
    this.kind = Objects.requireNonNull(kind);
    this.message = message == null ? kind.getDescription() : message;
    this.position = position == null ? SourcePosition.UNKNOWN : position;
  }

  public Severity getSeverity() {
    return severity;
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /**
   * Renders as {@code line:col: severity: [KIND] message}.
   */
  public String format() {
    return new StringBuilder().append(position).append(": ")
        .append(severity.name().toLowerCase()).append(": [").append(kind.name()).append("] ")
        .append(message).toString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(severity, kind, message, position);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    final Diagnostic other = (Diagnostic) obj;
    return severity == other.severity && kind == other.kind && message.equals(other.message)
        && position.equals(other.position);
  }

  @Override
  public String toString() {
    return "Diagnostic [" + format() + "]";
  }
}
