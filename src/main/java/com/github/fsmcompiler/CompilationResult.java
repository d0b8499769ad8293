package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one compile produced. Stages that did not run leave their part null: there is no
 * specification after a lexical or syntax error, and no design whenever errors were reported.
 */
public final class CompilationResult {
  private final String compileId;
  private final List<Diagnostic> diagnostics;
  private final Specification specification;
  private final TransitionTable transitionTable;
  private final GeneratedDesign design;
  private final CompilationStatistics statistics;

  CompilationResult(final String compileId, final List<Diagnostic> diagnostics,
      final Specification specification, final TransitionTable transitionTable,
      final GeneratedDesign design, final CompilationStatistics statistics) {
    this.compileId = compileId;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    this.specification = specification;
    this.transitionTable = transitionTable;
    this.design = design;
    this.statistics = statistics;
  }

  public String getCompileId() {
    return compileId;
  }

  /**
   * All diagnostics in source order.
   */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> getErrors() {
    final List<Diagnostic> errors = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        errors.add(diagnostic);
      }
    }
    return errors;
  }

  public List<Diagnostic> getWarnings() {
    final List<Diagnostic> warnings = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      if (!diagnostic.isError()) {
        warnings.add(diagnostic);
      }
    }
    return warnings;
  }

  /**
   * Diagnostics of the given kind, in source order.
   */
  public List<Diagnostic> getDiagnostics(final DiagnosticKind kind) {
    final List<Diagnostic> matching = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getKind() == kind) {
        matching.add(diagnostic);
      }
    }
    return matching;
  }

  public boolean hasErrors() {
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Exit status for a wrapping command-line tool: 0 iff no error was reported.
   */
  public int exitCode() {
    return hasErrors() ? 1 : 0;
  }

  public Specification getSpecification() {
    return specification;
  }

  public TransitionTable getTransitionTable() {
    return transitionTable;
  }

  public GeneratedDesign getDesign() {
    return design;
  }

  /**
   * Generated HDL text, null when generation did not run.
   */
  public String getHdl() {
    return design == null ? null : design.getHdl();
  }

  public CompilationStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "CompilationResult [compileId=" + compileId + ", errors=" + getErrors().size()
        + ", warnings=" + getWarnings().size() + ", generated=" + (design != null) + "]";
  }
}
