package com.github.fsmcompiler;

import java.nio.file.Path;

/**
 * Compiles flat state-machine specifications into synthesizable Verilog.
 * 
 * Notes for users:<br>
 * 1. this compiler instance is immutable and thread-safe; every compile owns its tokens, IR,
 * diagnostics and output, so independent specifications may be compiled in parallel<br>
 * 
 * 2. problems in the specification never throw: they come back as diagnostics on the
 * {@link CompilationResult}, and generation only runs when there are no errors among them<br>
 * 
 * 3. {@link CompilerException} is reserved for misuse (a null source, an unreadable file, a
 * malformed IR document) and for failures of the compiler itself<br>
 * 
 * 4. there is no cancellation; a caller with a time budget abandons the whole call<br>
 */
public interface FsmCompiler {

  /**
   * Compile specification text.
   */
  CompilationResult compile(final String source) throws CompilerException;

  /**
   * Compile the UTF-8 specification file at {@code path}.
   */
  CompilationResult compile(final Path path) throws CompilerException;

  /**
   * Run the back end alone on an IR obtained elsewhere, typically from {@link IrSerializer}:
   * validation, priority resolution and generation.
   */
  CompilationResult compile(final Specification specification) throws CompilerException;

  /**
   * Reports the id of this compiler instance.
   */
  String getId();

  /**
   * Returns the config that this compiler is wired with.
   */
  CompilerConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build compilers.
   */
  public final static class FsmCompilerBuilder {
    private CompilerConfiguration config;
    private AnnotationProvider annotationProvider;

    public static FsmCompilerBuilder newBuilder() {
      return new FsmCompilerBuilder();
    }

    public FsmCompilerBuilder config(final CompilerConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Optional side channel for hints; none is consulted by default.
     */
    public FsmCompilerBuilder annotationProvider(final AnnotationProvider annotationProvider) {
      this.annotationProvider = annotationProvider;
      return this;
    }

    public FsmCompiler build() throws CompilerException {
      final CompilerConfiguration effective = config != null ? config
          : CompilerConfiguration.CompilerConfigurationBuilder.newBuilder().build();
      return new FsmCompilerImpl(effective, annotationProvider);
    }

    private FsmCompilerBuilder() {}
  }

}
