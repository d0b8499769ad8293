package com.github.fsmcompiler;

/**
 * Every problem the compiler can report about a specification. Each kind belongs to the pipeline
 * stage that detects it and carries the severity it is reported with.
 */
public enum DiagnosticKind {
  // lexing
  UNKNOWN_SYMBOL(Category.LEX, Severity.ERROR, "Unknown symbol"),
  UNTERMINATED_LITERAL(Category.LEX, Severity.ERROR, "Unterminated string literal"),
  INVALID_DURATION(Category.LEX, Severity.ERROR, "Duration has an unknown time unit"),

  // parsing
  EXPECTED_TOKEN(Category.PARSE, Severity.ERROR, "Unexpected token"),
  SECTION_OUT_OF_ORDER(Category.PARSE, Severity.ERROR,
      "Sections must appear as GLOBAL_TRANSITIONS, STATE_LIST, TRANSITIONS"),

  // ir building
  DUPLICATE_STATE_NAME(Category.IR, Severity.ERROR, "State declared more than once"),
  UNKNOWN_OUTPUT_DOMAIN(Category.IR, Severity.ERROR,
      "Output signal assigned levels from incompatible vocabularies"),
  DUPLICATE_OUTPUT_ASSIGNMENT(Category.IR, Severity.ERROR,
      "Output signal assigned twice in the same state"),
  INCOMPATIBLE_VARIABLE_USAGE(Category.IR, Severity.ERROR,
      "Condition variable used with incompatible kinds of comparison"),
  TIMEOUT_IN_GLOBAL_TRANSITION(Category.IR, Severity.ERROR,
      "Timeouts belong to a state and cannot trigger a global transition"),

  // validation
  UNRESOLVED_REFERENCE(Category.VALIDATION, Severity.ERROR, "Reference to an undeclared state"),
  MISSING_OUTPUT_IN_STATE(Category.VALIDATION, Severity.ERROR,
      "State does not declare a level for every output signal"),
  ORPHANED_TIMEOUT(Category.VALIDATION, Severity.ERROR,
      "Timed state is never entered through a START_TIMER transition"),
  TIMER_CONFLICT(Category.VALIDATION, Severity.ERROR,
      "Second timer started while another is still running"),
  MISSING_INITIAL_STATE(Category.VALIDATION, Severity.ERROR, "No power-on state"),
  MULTIPLE_INITIAL_STATES(Category.VALIDATION, Severity.ERROR,
      "More than one state is marked INITIAL"),
  INCONSISTENT_EVENT_NAME(Category.VALIDATION, Severity.WARNING,
      "Event names differ only in spelling or case"),
  IMPLICIT_STAY(Category.VALIDATION, Severity.WARNING,
      "No transition for this event; the state holds"),
  DEAD_CONDITION(Category.VALIDATION, Severity.WARNING, "Branch can never be taken"),
  SHADOWED_BY_GLOBAL(Category.VALIDATION, Severity.WARNING,
      "Local transition is overridden by a global transition"),
  POTENTIAL_DEADLOCK(Category.VALIDATION, Severity.WARNING,
      "Reachable state has no way out"),
  UNREACHABLE_STATE(Category.VALIDATION, Severity.WARNING, "State is never entered"),
  UNUSED_TIMER(Category.VALIDATION, Severity.WARNING,
      "Timer started for a state that never waits on a timeout"),
  TIMER_DURATION_MISMATCH(Category.VALIDATION, Severity.WARNING,
      "Timer started with a different duration than the timeout declares"),
  DUPLICATE_GLOBAL_TRANSITION(Category.VALIDATION, Severity.WARNING,
      "Event already has a global transition; the first one wins");

  private final Category category;
  private final Severity severity;
  private final String description;

  private DiagnosticKind(final Category category, final Severity severity,
      final String description) {
    this.category = category;
    this.severity = severity;
    this.description = description;
  }

  public Category getCategory() {
    return category;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Pipeline stage that reports the diagnostic.
   */
  public static enum Category {
    LEX, PARSE, IR, VALIDATION;
  }

  public static enum Severity {
    ERROR, WARNING;
  }
}
