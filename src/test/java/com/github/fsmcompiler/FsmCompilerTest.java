package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the whole compile pipeline.
 */
public final class FsmCompilerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(FsmCompilerTest.class.getSimpleName());

  @Test
  public void testSmartLockCompiles() throws Exception {
    // 1. prep the compiler
    final CompilerConfiguration config = CompilerConfiguration.CompilerConfigurationBuilder
        .newBuilder().moduleName("smart_lock").build();
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().config(config)
        .build();
    assertNotNull(compiler.getId());
    assertEquals("smart_lock", compiler.getConfiguration().getModuleName());

    // 2. compile the file
    final CompilationResult result =
        compiler.compile(TestSpecifications.path(TestSpecifications.smartLock));
    logger.info(result.toString());

    // 3. only warnings, and the module came out
    assertFalse(result.hasErrors());
    assertEquals(0, result.exitCode());
    assertEquals(5, result.getWarnings().size());
    assertEquals(4, result.getDiagnostics(DiagnosticKind.IMPLICIT_STAY).size());
    assertEquals(1, result.getDiagnostics(DiagnosticKind.SHADOWED_BY_GLOBAL).size());
    assertNotNull(result.getHdl());
    assertTrue(result.getHdl().contains("module smart_lock ("));

    // 4. diagnostics are in source order
    final List<Diagnostic> diagnostics = result.getDiagnostics();
    for (int iter = 1; iter < diagnostics.size(); iter++) {
      assertTrue(diagnostics.get(iter - 1).getPosition()
          .compareTo(diagnostics.get(iter).getPosition()) <= 0);
    }

    // 5. statistics
    final CompilationStatistics stats = result.getStatistics();
    assertEquals(result.getCompileId(), stats.getCompileId());
    assertTrue(stats.getTokens() > 0);
    assertEquals(3, stats.getStates());
    assertEquals(1, stats.getGlobalTransitions());
    assertEquals(4, stats.getLocalTransitions());
    assertEquals(6, stats.getResolvedEntries());
    assertEquals(0, stats.getErrors());
    assertEquals(5, stats.getWarnings());
    assertEquals(result.getDesign().getLineCount(), stats.getGeneratedLines());
    assertEquals(Arrays.asList("lex", "parse", "ir", "validate", "resolve", "generate"),
        new ArrayList<>(stats.getStageNanos().keySet()));
  }

  @Test
  public void testOrphanedTimerBlocksGeneration() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    final CompilationResult result =
        compiler.compile(TestSpecifications.load(TestSpecifications.smartLockOrphanedTimer));

    assertEquals(1, result.getErrors().size());
    final Diagnostic orphaned = result.getErrors().get(0);
    assertEquals(DiagnosticKind.ORPHANED_TIMEOUT, orphaned.getKind());
    assertEquals(7, orphaned.getPosition().getLine());
    assertTrue(orphaned.getMessage().contains("ENTRY_ALLOWED"));
    assertNull(result.getHdl());
    assertNull(result.getDesign());
    assertEquals(1, result.exitCode());
    assertEquals(0, result.getStatistics().getGeneratedLines());
    // the front end still produced everything up to generation
    assertNotNull(result.getSpecification());
    assertNotNull(result.getTransitionTable());
  }

  @Test
  public void testSyntaxErrorsStopBeforeTheIr() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    final CompilationResult result = compiler.compile("STATE_LIST:\n"
        + "  A [Output: Bolt=HIGH] INITIAL\n"
        + "  B [Output: Bolt=]\n"
        + "TRANSITIONS:\n"
        + "  FROM(A):\n"
        + "    ON_EVENT(GO) -> TO(B) @\n");

    // both the syntax error and the lexical error are reported in one pass
    assertEquals(3, result.getErrors().size());
    assertEquals(1, result.getDiagnostics(DiagnosticKind.UNKNOWN_SYMBOL).size());
    final List<Diagnostic> syntax = result.getDiagnostics(DiagnosticKind.EXPECTED_TOKEN);
    assertEquals(2, syntax.size());
    assertEquals(3, syntax.get(0).getPosition().getLine());
    assertEquals(6, syntax.get(1).getPosition().getLine());
    assertNull(result.getSpecification());
    assertNull(result.getTransitionTable());
    assertNull(result.getHdl());
  }

  @Test
  public void testCompilationIsIdempotent() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    final String source = TestSpecifications.load(TestSpecifications.smartLock);
    final CompilationResult first = compiler.compile(source);
    final CompilationResult second = compiler.compile(source);

    assertFalse(first.getCompileId().equals(second.getCompileId()));
    assertEquals(first.getDiagnostics(), second.getDiagnostics());
    assertEquals(first.getTransitionTable(), second.getTransitionTable());
    assertEquals(first.getHdl(), second.getHdl());
  }

  @Test
  public void testImplicitStay() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    final CompilationResult result = compiler.compile("STATE_LIST:\n"
        + "  IDLE [Output: Lamp=OFF] INITIAL\n"
        + "  ON_STATE [Output: Lamp=ON]\n"
        + "TRANSITIONS:\n"
        + "  FROM(IDLE):\n"
        + "    ON_EVENT(PRESS): -> TO(ON_STATE)\n"
        + "  FROM(ON_STATE):\n"
        + "    ON_EVENT(RELEASE): -> TO(IDLE)\n");

    // 1. each state ignores the other state's event, with a warning
    assertFalse(result.hasErrors());
    final List<Diagnostic> stays = result.getDiagnostics(DiagnosticKind.IMPLICIT_STAY);
    assertEquals(2, stays.size());

    // 2. and holds when it fires
    final Resolution resolution = result.getTransitionTable().resolve("IDLE",
        Trigger.event("RELEASE"), Collections.<String, Object>emptyMap());
    assertTrue(resolution.isImplicitStay());
    assertEquals("IDLE", resolution.getDestination());

    // 3. the generated next-state logic defaults to holding the state
    assertTrue(result.getHdl().contains("state_d = state_q;\n"));
  }

  @Test
  public void testWarningsAsErrors() throws Exception {
    final CompilerConfiguration config = CompilerConfiguration.CompilerConfigurationBuilder
        .newBuilder().warningsAsErrors(true).build();
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().config(config)
        .build();
    final CompilationResult result =
        compiler.compile(TestSpecifications.load(TestSpecifications.smartLock));

    assertEquals(5, result.getErrors().size());
    assertEquals(0, result.getWarnings().size());
    assertEquals(4, result.getDiagnostics(DiagnosticKind.IMPLICIT_STAY).size());
    assertNull(result.getHdl());
    assertEquals(1, result.exitCode());
  }

  @Test
  public void testAnnotationProviders() throws Exception {
    // 1. comment hints end up in the IR and as remarks in the HDL
    FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder()
        .annotationProvider(new CommentHintAnnotator()).build();
    CompilationResult result =
        compiler.compile(TestSpecifications.load(TestSpecifications.smartLock));
    final List<Annotation> critical = result.getSpecification().getAnnotations(
        Annotation.Target.TRANSITION, "*/EVENT:USER_ENTERS_MASTER_CODE");
    assertEquals(1, critical.size());
    assertEquals(Annotation.Hint.CRITICAL, critical.get(0).getHint());
    assertTrue(result.getHdl().contains("// CRITICAL: critical override\n"));

    // 2. a machine hint picks the encoding under AUTO, but never changes behaviour
    compiler = FsmCompiler.FsmCompilerBuilder.newBuilder()
        .annotationProvider(new AnnotationProvider() {
          @Override
          public List<Annotation> annotate(final Specification specification) {
            return Collections.singletonList(new Annotation(Annotation.Target.MACHINE,
                "machine", Annotation.Hint.PREFER_ONE_HOT, "test"));
          }
        }).build();
    result = compiler.compile(TestSpecifications.load(TestSpecifications.smartLock));
    assertEquals(EncodingStyle.ONE_HOT, result.getDesign().getEncoding().getStyle());
    assertTrue(result.getHdl().contains("// Hint: PREFER_ONE_HOT test\n"));

    final CompilationResult plain = FsmCompiler.FsmCompilerBuilder.newBuilder().build()
        .compile(TestSpecifications.load(TestSpecifications.smartLock));
    assertEquals(plain.getTransitionTable(), result.getTransitionTable());
  }

  @Test
  public void testMisuse() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder().build();
    try {
      compiler.compile((String) null);
      fail("null source must be rejected");
    } catch (CompilerException expected) {
      assertEquals(CompilerException.Code.INVALID_SOURCE, expected.getCode());
    }
    try {
      compiler.compile((Specification) null);
      fail("null specification must be rejected");
    } catch (CompilerException expected) {
      assertEquals(CompilerException.Code.INVALID_SOURCE, expected.getCode());
    }
    final Path missing = Paths.get("does", "not", "exist.fsm");
    try {
      compiler.compile(missing);
      fail("missing file must be rejected");
    } catch (CompilerException expected) {
      assertEquals(CompilerException.Code.IO_FAILURE, expected.getCode());
    }
  }

  @Test
  public void testConfigurationValidation() throws Exception {
    expectInvalid(CompilerConfiguration.CompilerConfigurationBuilder.newBuilder()
        .moduleName("1st_module"));
    expectInvalid(CompilerConfiguration.CompilerConfigurationBuilder.newBuilder()
        .numericVariableWidth(65));
    expectInvalid(CompilerConfiguration.CompilerConfigurationBuilder.newBuilder()
        .outputDomain(OutputDomain.open("Fan", Arrays.asList("SLOW", "FAST"))));
    expectInvalid(CompilerConfiguration.CompilerConfigurationBuilder.newBuilder()
        .outputDomain(OutputDomain.of("DIGITAL", Arrays.asList("OFF", "ON"))));
    expectInvalid(CompilerConfiguration.CompilerConfigurationBuilder.newBuilder()
        .outputDomain(null));

    // defaults
    final CompilerConfiguration config =
        CompilerConfiguration.CompilerConfigurationBuilder.newBuilder().build();
    assertEquals("fsm", config.getModuleName());
    assertEquals(1000L, config.getClockHz());
    assertEquals(EncodingStyle.AUTO, config.getEncoding());
    assertEquals(8, config.getNumericVariableWidth());
    assertFalse(config.isResetActiveLow());
    assertFalse(config.isWarningsAsErrors());
    assertEquals(OutputDomain.builtIns(), config.getOutputDomains());
  }

  @Test
  public void testCompilerThreadSafety() throws Exception {
    final FsmCompiler compiler = FsmCompiler.FsmCompilerBuilder.newBuilder()
        .annotationProvider(new CommentHintAnnotator()).build();
    final String smartLock = TestSpecifications.load(TestSpecifications.smartLock);
    final String orphaned = TestSpecifications.load(TestSpecifications.smartLockOrphanedTimer);
    final String expectedHdl = compiler.compile(smartLock).getHdl();

    final AtomicInteger generated = new AtomicInteger();
    final AtomicInteger rejected = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final Runnable compileWorker = new Runnable() {
      @Override
      public void run() {
        try {
          for (int iter = 0; iter < 10; iter++) {
            final CompilationResult good = compiler.compile(smartLock);
            if (expectedHdl.equals(good.getHdl())) {
              generated.incrementAndGet();
            } else {
              failures.incrementAndGet();
            }
            final CompilationResult bad = compiler.compile(orphaned);
            if (bad.getHdl() == null && bad.getErrors().size() == 1) {
              rejected.incrementAndGet();
            } else {
              failures.incrementAndGet();
            }
          }
        } catch (CompilerException problem) {
          logger.error("compiler:" + compiler.getId() + " encountered an issue", problem);
          failures.incrementAndGet();
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      final Thread worker = new Thread(compileWorker, "test-compile-worker-" + iter);
      workers.add(worker);
    }
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    assertEquals(workerCount * 10, generated.get());
    assertEquals(workerCount * 10, rejected.get());
    assertEquals(0, failures.get());
  }

  private static void expectInvalid(
      final CompilerConfiguration.CompilerConfigurationBuilder builder) {
    try {
      builder.build();
      fail("Configuration should have been rejected");
    } catch (CompilerException expected) {
      assertEquals(CompilerException.Code.INVALID_COMPILER_CONFIG, expected.getCode());
    }
  }
}
