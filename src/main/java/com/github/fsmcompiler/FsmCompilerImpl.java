package com.github.fsmcompiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default compiler. Holds nothing but its configuration, so a single instance can serve any number
 * of threads; everything a compile touches is created inside the call.
 */
public final class FsmCompilerImpl implements FsmCompiler {
  private static final Logger logger = LogManager.getLogger(FsmCompilerImpl.class.getSimpleName());

  private final String compilerId = UUID.randomUUID().toString();
  private final CompilerConfiguration config;
  private final AnnotationProvider annotationProvider;

  FsmCompilerImpl(final CompilerConfiguration config,
      final AnnotationProvider annotationProvider) {
    this.config = config;
    this.annotationProvider = annotationProvider;
    logInfo(compilerId, null, "Compiler ready with " + config);
  }

  @Override
  public CompilationResult compile(final String source) throws CompilerException {
    if (source == null) {
      throw new CompilerException(CompilerException.Code.INVALID_SOURCE);
    }
    final String compileId = UUID.randomUUID().toString();
    final CompilationStatistics stats = new CompilationStatistics(compileId);
    final Diagnostics diagnostics = new Diagnostics();
    logInfo(compilerId, compileId, "Compiling " + source.length() + " characters");
    try {
      long start = System.nanoTime();
      final List<Token> tokens = new Lexer(source, diagnostics).tokenize();
      stats.recordStage("lex", System.nanoTime() - start);
      stats.tokens = tokens.size();

      start = System.nanoTime();
      final Ast.Document document = new Parser(tokens, diagnostics).parse();
      stats.recordStage("parse", System.nanoTime() - start);
      if (diagnostics.hasErrors()) {
        logWarning(compilerId, compileId, "Syntax errors, skipping semantic analysis");
        return finish(compileId, stats, diagnostics, null, null, null);
      }

      start = System.nanoTime();
      Specification specification =
          new IrBuilder(config.getOutputDomains(), diagnostics).build(document);
      stats.recordStage("ir", System.nanoTime() - start);

      if (annotationProvider != null) {
        start = System.nanoTime();
        specification = specification.withAnnotations(annotationProvider.annotate(specification));
        stats.recordStage("annotate", System.nanoTime() - start);
      }
      return backEnd(compileId, stats, diagnostics, specification);
    } catch (RuntimeException problem) {
      logError(compilerId, compileId, "Compile failed unexpectedly", problem);
      throw new CompilerException(CompilerException.Code.UNKNOWN_FAILURE, problem);
    }
  }

  @Override
  public CompilationResult compile(final Path path) throws CompilerException {
    if (path == null) {
      throw new CompilerException(CompilerException.Code.INVALID_SOURCE);
    }
    final String source;
    try {
      source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException problem) {
      logError(compilerId, null, "Failed to read " + path, problem);
      throw new CompilerException(CompilerException.Code.IO_FAILURE, problem);
    }
    return compile(source);
  }

  @Override
  public CompilationResult compile(final Specification specification) throws CompilerException {
    if (specification == null) {
      throw new CompilerException(CompilerException.Code.INVALID_SOURCE,
          "Specification cannot be null");
    }
    final String compileId = UUID.randomUUID().toString();
    logInfo(compilerId, compileId, "Compiling IR " + specification);
    try {
      return backEnd(compileId, new CompilationStatistics(compileId), new Diagnostics(),
          specification);
    } catch (RuntimeException problem) {
      logError(compilerId, compileId, "Compile failed unexpectedly", problem);
      throw new CompilerException(CompilerException.Code.UNKNOWN_FAILURE, problem);
    }
  }

  /**
   * Validation, resolution and, when nothing blocks it, generation.
   */
  private CompilationResult backEnd(final String compileId, final CompilationStatistics stats,
      final Diagnostics diagnostics, final Specification specification) throws CompilerException {
    stats.states = specification.getStates().size();
    stats.globalTransitions = specification.getGlobalTransitions().size();
    stats.localTransitions = specification.getLocalTransitions().size();

    long start = System.nanoTime();
    new SemanticValidator(diagnostics).validate(specification);
    stats.recordStage("validate", System.nanoTime() - start);

    start = System.nanoTime();
    final TransitionTable table = new PriorityResolver().resolve(specification);
    stats.recordStage("resolve", System.nanoTime() - start);
    stats.resolvedEntries = table.size();

    final Diagnostics effective = config.isWarningsAsErrors() ? promote(diagnostics) : diagnostics;
    if (effective.hasErrors()) {
      logWarning(compilerId, compileId,
          effective.errorCount() + " errors, skipping code generation");
      return finish(compileId, stats, effective, specification, table, null);
    }

    start = System.nanoTime();
    final GeneratedDesign design =
        new VerilogGenerator(config).generate(specification, table, effective);
    stats.recordStage("generate", System.nanoTime() - start);
    stats.generatedLines = design.getLineCount();
    return finish(compileId, stats, effective, specification, table, design);
  }

  private static Diagnostics promote(final Diagnostics diagnostics) {
    final Diagnostics promoted = new Diagnostics();
    for (final Diagnostic diagnostic : diagnostics.toList()) {
      if (diagnostic.isError()) {
        promoted.report(diagnostic);
      } else {
        promoted.report(new Diagnostic(DiagnosticKind.Severity.ERROR, diagnostic.getKind(),
            diagnostic.getMessage(), diagnostic.getPosition()));
      }
    }
    return promoted;
  }

  private CompilationResult finish(final String compileId, final CompilationStatistics stats,
      final Diagnostics diagnostics, final Specification specification,
      final TransitionTable table, final GeneratedDesign design) {
    stats.errors = diagnostics.errorCount();
    stats.warnings = diagnostics.warningCount();
    final List<Diagnostic> sorted = diagnostics.sorted();
    if (logger.isDebugEnabled() && !sorted.isEmpty()) {
      logDebug(compilerId, compileId, "Diagnostics:\n" + Diagnostics.format(sorted));
    }
    logInfo(compilerId, compileId, "Finished " + stats);
    return new CompilationResult(compileId, sorted, specification, table, design, stats);
  }

  @Override
  public String getId() {
    return compilerId;
  }

  @Override
  public CompilerConfiguration getConfiguration() {
    return config;
  }

  private static void logError(final String compilerId, final String compileId,
      final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(compilerId).append("][c:")
        .append(compileId).append("] ").append(message).toString(), error);
  }

  private static void logWarning(final String compilerId, final String compileId,
      final String message) {
    logger.warn(new StringBuilder().append("[m:").append(compilerId).append("][c:")
        .append(compileId).append("] ").append(message).toString());
  }

  private static void logInfo(final String compilerId, final String compileId,
      final String message) {
    logger.info(new StringBuilder().append("[m:").append(compilerId).append("][c:")
        .append(compileId).append("] ").append(message).toString());
  }

  private static void logDebug(final String compilerId, final String compileId,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(compilerId).append("][c:")
          .append(compileId).append("] ").append(message).toString());
    }
  }
}
