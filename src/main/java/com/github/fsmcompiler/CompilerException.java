package com.github.fsmcompiler;

/**
 * Unified single exception that's thrown by the compiler for misuse and internal failures. Problems
 * in the specification itself are never thrown, they are reported as {@link Diagnostic}s. The code
 * enum encapsulates the various failure conditions.
 */
public final class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public CompilerException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public CompilerException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public CompilerException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_COMPILER_CONFIG("Compiler configuration is invalid"),
    // 2.
    INVALID_SOURCE("Specification source cannot be null"),
    // 3.
    IR_SERIALIZATION_FAILURE("Failed to read or write the IR interchange document"),
    // 4.
    INTERNAL_INVARIANT_VIOLATION(
        "Compiler pipeline invariant violated. This is a bug in the compiler, not the input."),
    // 5.
    IO_FAILURE("Failed to read specification or write generated output"),
    // 6.
    UNKNOWN_FAILURE("Compiler failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
