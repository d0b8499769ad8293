package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the Parser.
 */
public final class ParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testSmartLockDocument() throws Exception {
    final Diagnostics diagnostics = new Diagnostics();
    final String source = TestSpecifications.load(TestSpecifications.smartLock);
    final Ast.Document document = parse(source, diagnostics, true);

    // 1. no syntax errors and the header is kept verbatim
    assertFalse(diagnostics.toString(), diagnostics.hasErrors());
    assertTrue(document.getHeader().startsWith("# FEATURE: Smart Lock\n"));
    assertTrue(document.getHeader().contains("Master code entry is always honoured"));

    // 2. global transitions
    assertEquals(1, document.getGlobalTransitions().size());
    final Ast.GlobalTransitionNode global = document.getGlobalTransitions().get(0);
    assertEquals("USER_ENTERS_MASTER_CODE", global.getTrigger().getEvent());
    assertEquals(2, global.getActions().size());
    assertEquals("STOP_ALL_TIMERS", global.getActions().get(0).getName());
    assertEquals("CLEAR_ALARM", global.getActions().get(1).getName());
    assertEquals("IDLE_LOCKED", global.getDestination());
    assertEquals("critical override", global.getComment());

    // 3. states
    assertEquals(3, document.getStates().size());
    final Ast.StateNode idle = document.getStates().get(0);
    assertEquals("IDLE_LOCKED", idle.getName());
    assertTrue(idle.isInitial());
    assertEquals("secured", idle.getComment());
    assertEquals(3, idle.getOutputs().size());
    assertEquals("Bolt", idle.getOutputs().get(0).getSignal());
    assertEquals("HIGH", idle.getOutputs().get(0).getLevel());
    assertFalse(document.getStates().get(1).isInitial());

    // 4. FROM blocks and their rules
    assertEquals(3, document.getFromBlocks().size());
    final List<Ast.RuleNode> rules = document.getFromBlocks().get(0).getRules();
    assertEquals("IDLE_LOCKED", document.getFromBlocks().get(0).getState());
    assertEquals(3, rules.size());
    assertEquals("Code == VALID", rules.get(0).getCondition().canonical());
    assertEquals("START_TIMER", rules.get(0).getActions().get(0).getName());
    assertEquals(new Duration(30, TimeUnit.SECONDS),
        rules.get(0).getActions().get(0).getDuration());
    assertEquals("ENTRY_ALLOWED", rules.get(0).getDestination());
    assertEquals("(Code == INVALID AND Attempt_Count < 3)",
        rules.get(1).getCondition().canonical());
    assertNull(rules.get(1).getDestination());

    final List<Ast.RuleNode> entryRules = document.getFromBlocks().get(1).getRules();
    assertTrue(entryRules.get(1).getTrigger().isTimeout());
    assertEquals(30000L, entryRules.get(1).getTrigger().getDuration().toMillis());
    assertSame(Condition.ALWAYS, entryRules.get(1).getCondition());

    final Ast.RuleNode alarmRule = document.getFromBlocks().get(2).getRules().get(0);
    assertNull(alarmRule.getDestination());
    assertEquals("never taken, the global wins", alarmRule.getComment());
  }

  @Test
  public void testRecoveryReportsEveryMalformedEntry() {
    final Diagnostics diagnostics = new Diagnostics();
    final String source = "STATE_LIST:\n"
        + "  A [Output: X=HIGH] INITIAL\n"
        + "  B [Output: X=]\n"
        + "  C\n"
        + "TRANSITIONS:\n"
        + "  FROM(A):\n"
        + "    ON_EVENT(GO) -> TO(B)\n"
        + "    ON_EVENT(GO): -> TO(C)\n"
        + "  FROM(B)\n"
        + "    ON_TIMEOUT(5s): -> TO(A)\n";
    final Ast.Document document = parse(source, diagnostics, true);

    // 1. one diagnostic per broken entry, in source order
    final List<Diagnostic> reported = diagnostics.toList();
    assertEquals(diagnostics.toString(), 4, reported.size());
    final int[] lines = {3, 7, 9, 10};
    for (int iter = 0; iter < lines.length; iter++) {
      assertEquals(DiagnosticKind.EXPECTED_TOKEN, reported.get(iter).getKind());
      assertEquals(lines[iter], reported.get(iter).getPosition().getLine());
    }

    // 2. the well-formed entries still made it into the tree
    assertEquals(2, document.getStates().size());
    assertEquals("A", document.getStates().get(0).getName());
    assertEquals("C", document.getStates().get(1).getName());
    assertEquals(1, document.getFromBlocks().size());
    assertEquals(1, document.getFromBlocks().get(0).getRules().size());
    assertEquals("C", document.getFromBlocks().get(0).getRules().get(0).getDestination());
  }

  @Test
  public void testSectionOutOfOrder() {
    final Diagnostics diagnostics = new Diagnostics();
    final Ast.Document document =
        parse("TRANSITIONS:\nSTATE_LIST:\n  A INITIAL\n", diagnostics, true);

    assertEquals(1, diagnostics.size());
    assertEquals(DiagnosticKind.SECTION_OUT_OF_ORDER, diagnostics.toList().get(0).getKind());
    assertEquals(2, diagnostics.toList().get(0).getPosition().getLine());
    assertEquals(1, document.getStates().size());
  }

  @Test
  public void testEntryOutsideAnySection() {
    final Diagnostics diagnostics = new Diagnostics();
    final Ast.Document document = parse("A INITIAL\nSTATE_LIST:\n  B\n", diagnostics, false);

    assertEquals(1, diagnostics.errorCount());
    assertEquals(new SourcePosition(1, 1), diagnostics.toList().get(0).getPosition());
    assertEquals(1, document.getStates().size());
    assertEquals("B", document.getStates().get(0).getName());
  }

  @Test
  public void testStartTimerNeedsDuration() {
    final Diagnostics diagnostics = new Diagnostics();
    parse("GLOBAL_TRANSITIONS:\n  ON_EVENT(X): DO(START_TIMER) -> TO(A)\n", diagnostics, true);
    assertEquals(1, diagnostics.errorCount());
    assertEquals(DiagnosticKind.EXPECTED_TOKEN, diagnostics.toList().get(0).getKind());
  }

  @Test
  public void testConditionPrecedenceAndEvaluation() {
    final Diagnostics diagnostics = new Diagnostics();
    final Condition condition =
        Parser.parseCondition("Armed OR Code == VALID AND NOT Count >= 3", diagnostics);

    assertFalse(diagnostics.hasErrors());
    assertEquals("(Armed OR (Code == VALID AND NOT (Count >= 3)))", condition.canonical());
    // canonical text parses back to an equal condition
    assertEquals(condition, Parser.parseCondition(condition.canonical(), diagnostics));

    final Map<String, Object> bindings = new HashMap<>();
    bindings.put("Armed", Boolean.FALSE);
    bindings.put("Code", "VALID");
    bindings.put("Count", 2L);
    assertTrue(condition.evaluate(bindings));
    bindings.put("Count", 3L);
    assertFalse(condition.evaluate(bindings));
    bindings.put("Armed", Boolean.TRUE);
    assertTrue(condition.evaluate(bindings));
  }

  @Test
  public void testMalformedConditions() {
    Diagnostics diagnostics = new Diagnostics();
    assertNull(Parser.parseCondition("Code ==", diagnostics));
    assertEquals(DiagnosticKind.EXPECTED_TOKEN, diagnostics.toList().get(0).getKind());

    diagnostics = new Diagnostics();
    assertNull(Parser.parseCondition("Code == \"VALID\"", diagnostics));
    assertTrue(diagnostics.hasErrors());

    diagnostics = new Diagnostics();
    assertSame(Condition.ALWAYS, Parser.parseCondition("ELSE", diagnostics));
    assertFalse(diagnostics.hasErrors());
  }

  private static Ast.Document parse(final String source, final Diagnostics diagnostics,
      final boolean headerAllowed) {
    final List<Token> tokens = new Lexer(source, diagnostics, headerAllowed).tokenize();
    return new Parser(tokens, diagnostics).parse();
  }
}
