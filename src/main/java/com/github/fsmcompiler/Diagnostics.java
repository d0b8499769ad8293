package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Accumulates diagnostics for one compile invocation. Nothing in the pipeline stops at the first
 * problem; every stage appends here and the caller decides what to do once the stage is over.
 * 
 * Instances are confined to the compile that created them and are not thread-safe.
 */
public final class Diagnostics {
  private static final Comparator<Diagnostic> byPosition =
      Comparator.comparing(Diagnostic::getPosition);

  private final List<Diagnostic> reported = new ArrayList<>();

  public void report(final DiagnosticKind kind, final String message,
      final SourcePosition position) {
    reported.add(new Diagnostic(kind, message, position));
  }

  public void report(final Diagnostic diagnostic) {
    reported.add(diagnostic);
  }

  public void reportAll(final List<Diagnostic> diagnostics) {
    reported.addAll(diagnostics);
  }

  public boolean hasErrors() {
    for (final Diagnostic diagnostic : reported) {
      if (diagnostic.isError()) {
        return true;
      }
    }
    return false;
  }

  public int errorCount() {
    int errors = 0;
    for (final Diagnostic diagnostic : reported) {
      if (diagnostic.isError()) {
        errors++;
      }
    }
    return errors;
  }

  public int warningCount() {
    return reported.size() - errorCount();
  }

  public int size() {
    return reported.size();
  }

  /**
   * Snapshot in report order.
   */
  public List<Diagnostic> toList() {
    return Collections.unmodifiableList(new ArrayList<>(reported));
  }

  /**
   * Snapshot in source order. The sort is stable so diagnostics at the same position keep their
   * report order.
   */
  public List<Diagnostic> sorted() {
    final List<Diagnostic> sorted = new ArrayList<>(reported);
    sorted.sort(byPosition);
    return Collections.unmodifiableList(sorted);
  }

  public static String format(final List<Diagnostic> diagnostics) {
    final StringBuilder builder = new StringBuilder();
    for (final Diagnostic diagnostic : diagnostics) {
      builder.append(diagnostic.format()).append('\n');
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return "Diagnostics [errors=" + errorCount() + ", warnings=" + warningCount() + "]";
  }
}
