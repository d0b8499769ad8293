package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the Lexer.
 */
public final class LexerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testHeaderIsOneOpaqueToken() {
    final Diagnostics diagnostics = new Diagnostics();
    final String source = "# FEATURE: Lock\nAny (unbalanced text @ here\nSTATE_LIST:\n  A\n";
    final List<Token> tokens = new Lexer(source, diagnostics).tokenize();

    assertFalse(diagnostics.hasErrors());
    assertEquals(TokenType.HEADER, tokens.get(0).getType());
    assertEquals("# FEATURE: Lock\nAny (unbalanced text @ here\n", tokens.get(0).getText());
    assertEquals(TokenType.STATE_LIST, tokens.get(1).getType());
    assertEquals(3, tokens.get(1).getPosition().getLine());
    assertEquals(1, tokens.get(1).getPosition().getColumn());
    assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).getType());
  }

  @Test
  public void testHeaderProseMayStartWithASectionWord() {
    final Diagnostics diagnostics = new Diagnostics();
    final String prose = "ASSUMPTIONS:\n"
        + "  Transitions happen on the rising clock edge\n"
        + "  state list order is the encoding order\n"
        + "  Global_Transitions are checked first\n";
    final List<Token> tokens =
        new Lexer(prose + "STATE_LIST:\n  A [Output: L=LOW] INITIAL\n", diagnostics).tokenize();

    // 1. only a section word followed by ':' ends the header
    assertFalse(diagnostics.hasErrors());
    assertEquals(TokenType.HEADER, tokens.get(0).getType());
    assertEquals(prose, tokens.get(0).getText());
    assertEquals(TokenType.STATE_LIST, tokens.get(1).getType());
    assertEquals(5, tokens.get(1).getPosition().getLine());

    // 2. and the whole document parses cleanly
    final Specification specification = TestSpecifications
        .build(prose + "STATE_LIST:\n  A [Output: L=LOW] INITIAL\n", diagnostics);
    assertFalse(diagnostics.hasErrors());
    assertEquals(3, specification.getHeader().getAssumptions().size());
    assertEquals("Transitions happen on the rising clock edge",
        specification.getHeader().getAssumptions().get(0));
  }

  @Test
  public void testKeywordsAreCaseInsensitiveAndIdentifiersKeepTheirSpelling() {
    final Diagnostics diagnostics = new Diagnostics();
    final List<Token> tokens =
        new Lexer("from(Idle_Locked): on_event(Keypad) -> stay", diagnostics, false).tokenize();

    assertFalse(diagnostics.hasErrors());
    assertEquals(TokenType.FROM, tokens.get(0).getType());
    assertEquals(TokenType.IDENTIFIER, tokens.get(2).getType());
    assertEquals("Idle_Locked", tokens.get(2).getText());
    assertEquals(TokenType.ON_EVENT, tokens.get(5).getType());
    assertEquals("Keypad", tokens.get(7).getText());
    assertEquals(TokenType.ARROW, tokens.get(9).getType());
    assertEquals(TokenType.STAY, tokens.get(10).getType());
  }

  @Test
  public void testOperatorsAndAlternateSpellings() {
    final Diagnostics diagnostics = new Diagnostics();
    final List<TokenType> types = types(new Lexer(
        "a == b != c < d <= e > f >= g && h || !i → x -> y = z", diagnostics, false).tokenize());

    assertFalse(diagnostics.hasErrors());
    assertTrue(types.contains(TokenType.EQ));
    assertTrue(types.contains(TokenType.NE));
    assertTrue(types.contains(TokenType.LT));
    assertTrue(types.contains(TokenType.LE));
    assertTrue(types.contains(TokenType.GT));
    assertTrue(types.contains(TokenType.GE));
    assertTrue(types.contains(TokenType.AND));
    assertTrue(types.contains(TokenType.OR));
    assertTrue(types.contains(TokenType.NOT));
    assertTrue(types.contains(TokenType.ASSIGN));
    int arrows = 0;
    for (final TokenType type : types) {
      if (type == TokenType.ARROW) {
        arrows++;
      }
    }
    assertEquals(2, arrows);
  }

  @Test
  public void testDurationsAndNumbers() {
    final Diagnostics diagnostics = new Diagnostics();
    final List<Token> tokens = new Lexer("30s 5min 250ms 2h 42", diagnostics, false).tokenize();

    assertFalse(diagnostics.hasErrors());
    assertEquals(TokenType.DURATION, tokens.get(0).getType());
    assertEquals(30000L, Duration.parse(tokens.get(0).getText()).toMillis());
    assertEquals(300000L, Duration.parse(tokens.get(1).getText()).toMillis());
    assertEquals(TokenType.DURATION, tokens.get(2).getType());
    assertEquals(TokenType.DURATION, tokens.get(3).getType());
    assertEquals(TokenType.NUMBER, tokens.get(4).getType());
    assertEquals("42", tokens.get(4).getText());
  }

  @Test
  public void testCommentsAndNewlines() {
    final Diagnostics diagnostics = new Diagnostics();
    final List<Token> tokens =
        new Lexer("A  # the first state\nB\n", diagnostics, false).tokenize();

    assertFalse(diagnostics.hasErrors());
    assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
    assertEquals(TokenType.COMMENT, tokens.get(1).getType());
    assertEquals("the first state", tokens.get(1).getText());
    assertEquals(TokenType.NEWLINE, tokens.get(2).getType());
    assertEquals(TokenType.IDENTIFIER, tokens.get(3).getType());
    assertEquals(2, tokens.get(3).getPosition().getLine());
  }

  @Test
  public void testErrorsAreReportedAndLexingContinues() {
    final Diagnostics diagnostics = new Diagnostics();
    final String source = "A @ B\nDO(NOTIFY(\"unterminated)\nSTART_TIMER(30parsecs)\nC $\n";
    final List<Token> tokens = new Lexer(source, diagnostics, false).tokenize();

    // 1. every problem is reported
    assertEquals(4, diagnostics.errorCount());
    final List<Diagnostic> reported = diagnostics.toList();
    assertEquals(DiagnosticKind.UNKNOWN_SYMBOL, reported.get(0).getKind());
    assertEquals(new SourcePosition(1, 3), reported.get(0).getPosition());
    assertEquals(DiagnosticKind.UNTERMINATED_LITERAL, reported.get(1).getKind());
    assertEquals(2, reported.get(1).getPosition().getLine());
    assertEquals(DiagnosticKind.INVALID_DURATION, reported.get(2).getKind());
    assertEquals(DiagnosticKind.UNKNOWN_SYMBOL, reported.get(3).getKind());
    assertEquals(4, reported.get(3).getPosition().getLine());

    // 2. the good tokens around them survive
    final List<String> identifiers = new ArrayList<>();
    for (final Token token : tokens) {
      if (token.is(TokenType.IDENTIFIER)) {
        identifiers.add(token.getText());
      }
    }
    assertTrue(identifiers.contains("A"));
    assertTrue(identifiers.contains("B"));
    assertTrue(identifiers.contains("C"));
    assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).getType());
  }

  @Test
  public void testNonAsciiLettersAreRejected() {
    final Diagnostics diagnostics = new Diagnostics();
    new Lexer("Zustand_ä", diagnostics, false).tokenize();
    assertEquals(1, diagnostics.errorCount());
    assertEquals(DiagnosticKind.UNKNOWN_SYMBOL, diagnostics.toList().get(0).getKind());
  }

  private static List<TokenType> types(final List<Token> tokens) {
    final List<TokenType> types = new ArrayList<>();
    for (final Token token : tokens) {
      types.add(token.getType());
    }
    return types;
  }
}
