package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.Ast.ActionNode;
import com.github.fsmcompiler.Ast.Document;
import com.github.fsmcompiler.Ast.FromBlock;
import com.github.fsmcompiler.Ast.GlobalTransitionNode;
import com.github.fsmcompiler.Ast.OutputNode;
import com.github.fsmcompiler.Ast.RuleNode;
import com.github.fsmcompiler.Ast.StateNode;
import com.github.fsmcompiler.Ast.TriggerNode;

/**
 * Recursive descent parser over the token stream. Only syntax is checked here.
 *
 * Every entry is one line. When an entry is malformed a single EXPECTED_TOKEN diagnostic is
 * reported and parsing resumes at the next line that can start an entry (FROM, ON_EVENT,
 * ON_TIMEOUT, a state name or a section keyword), so one pass surfaces the problems of every
 * entry.
 */
public final class Parser {
  private static final Logger logger = LogManager.getLogger(Parser.class.getSimpleName());

  static final String startTimerAction = "START_TIMER";

  private final List<Token> tokens;
  private final Diagnostics diagnostics;
  private int cursor;

  private final List<GlobalTransitionNode> globalTransitions = new ArrayList<>();
  private final List<StateNode> states = new ArrayList<>();
  private final List<FromBlock> fromBlocks = new ArrayList<>();

  // the FROM block currently receiving rules
  private String openBlockState;
  private SourcePosition openBlockPosition;
  private List<RuleNode> openBlockRules;

  public Parser(final List<Token> tokens, final Diagnostics diagnostics) {
    if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
      throw new IllegalArgumentException("Token stream must end with EOF");
    }
    this.tokens = tokens;
    this.diagnostics = diagnostics;
  }

  /**
   * Parses a complete specification.
   */
  public Document parse() {
    String header = null;
    if (peek().is(TokenType.HEADER)) {
      header = next().getText();
    }
    TokenType lastSection = null;
    TokenType section = null;
    while (!peek().is(TokenType.EOF)) {
      if (skipBlankLine()) {
        continue;
      }
      final Token token = peek();
      if (token.getType().isSection() && startsLine()) {
        next();
        if (lastSection != null && token.getType().ordinal() <= lastSection.ordinal()) {
          diagnostics.report(DiagnosticKind.SECTION_OUT_OF_ORDER, "Section "
              + token.getType().name() + " cannot follow " + lastSection.name(),
              token.getPosition());
        } else {
          lastSection = token.getType();
        }
        closeFromBlock();
        section = token.getType();
        try {
          expect(TokenType.COLON, "':' after " + section.name());
          expectEndOfLine();
        } catch (SyntaxError error) {
          recover(error);
        }
        continue;
      }
      if (section == null) {
        recover(new SyntaxError("a section keyword", token));
        continue;
      }
      try {
        switch (section) {
          case GLOBAL_TRANSITIONS:
            parseGlobalTransition();
            break;
          case STATE_LIST:
            parseStateDeclaration();
            break;
          case TRANSITIONS:
            parseTransitionEntry();
            break;
          default:
            throw new IllegalStateException("Unhandled section " + section);
        }
      } catch (SyntaxError error) {
        recover(error);
      }
    }
    closeFromBlock();
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Parsed %d global transitions, %d states, %d FROM blocks",
          globalTransitions.size(), states.size(), fromBlocks.size()));
    }
    return new Document(header, globalTransitions, states, fromBlocks);
  }

  /**
   * Parses a standalone guard expression such as {@code (Code == VALID AND Count < 3)}. Returns
   * null and reports to {@code diagnostics} when the text is not a well-formed guard.
   */
  public static Condition parseCondition(final String text, final Diagnostics diagnostics) {
    final List<Token> tokens = new Lexer(text, diagnostics, false).tokenize();
    if (diagnostics.hasErrors()) {
      return null;
    }
    final Parser parser = new Parser(tokens, diagnostics);
    try {
      if (parser.peek().is(TokenType.ELSE)) {
        parser.next();
        parser.expect(TokenType.EOF, "end of condition");
        return Condition.ALWAYS;
      }
      final Condition condition = parser.parseOr();
      parser.expect(TokenType.EOF, "end of condition");
      return condition;
    } catch (SyntaxError error) {
      parser.report(error);
      return null;
    }
  }

  // ON_EVENT(name): [DO(actions)] -> TO(state)
  private void parseGlobalTransition() {
    final Token start = peek();
    final TriggerNode trigger = parseTrigger();
    expect(TokenType.COLON, "':' after trigger");
    final List<ActionNode> actions = new ArrayList<>();
    if (peek().is(TokenType.DO)) {
      actions.addAll(parseActions());
    }
    expect(TokenType.ARROW, "'->'");
    expect(TokenType.TO, "TO");
    expect(TokenType.LPAREN, "'('");
    final Token destination = expect(TokenType.IDENTIFIER, "destination state");
    expect(TokenType.RPAREN, "')'");
    if (peek().is(TokenType.DO)) {
      actions.addAll(parseActions());
    }
    final String comment = expectEndOfLine();
    globalTransitions.add(new GlobalTransitionNode(trigger, actions, destination.getText(),
        destination.getPosition(), comment, start.getPosition()));
  }

  // NAME [Output: signal=LEVEL, ...] [INITIAL]
  private void parseStateDeclaration() {
    final Token name = expect(TokenType.IDENTIFIER, "state name");
    final List<OutputNode> outputs = new ArrayList<>();
    boolean initial = false;
    if (peek().is(TokenType.INITIAL)) {
      next();
      initial = true;
    }
    if (peek().is(TokenType.LBRACKET)) {
      next();
      if (peek().is(TokenType.OUTPUT)) {
        next();
        expect(TokenType.COLON, "':' after Output");
      }
      if (!peek().is(TokenType.RBRACKET)) {
        outputs.add(parseOutput());
        while (peek().is(TokenType.COMMA)) {
          next();
          outputs.add(parseOutput());
        }
      }
      expect(TokenType.RBRACKET, "']' or ','");
    }
    if (peek().is(TokenType.INITIAL)) {
      next();
      initial = true;
    }
    final String comment = expectEndOfLine();
    states.add(new StateNode(name.getText(), outputs, initial, comment, name.getPosition()));
  }

  private OutputNode parseOutput() {
    final Token signal = expect(TokenType.IDENTIFIER, "output signal name");
    expect(TokenType.ASSIGN, "'='");
    final Token level = nextOnLine("output level");
    if (!level.is(TokenType.IDENTIFIER) && !level.is(TokenType.NUMBER)
        && !level.getType().isKeyword()) {
      throw new SyntaxError("output level", level);
    }
    return new OutputNode(signal.getText(), level.getText(), signal.getPosition());
  }

  // FROM(state): [rule]  |  rule
  private void parseTransitionEntry() {
    if (peek().is(TokenType.FROM)) {
      closeFromBlock();
      final Token from = next();
      expect(TokenType.LPAREN, "'('");
      final Token state = expect(TokenType.IDENTIFIER, "source state");
      expect(TokenType.RPAREN, "')'");
      expect(TokenType.COLON, "':' after FROM(...)");
      openBlockState = state.getText();
      openBlockPosition = from.getPosition();
      openBlockRules = new ArrayList<>();
      if (atEndOfLine()) {
        expectEndOfLine();
        return;
      }
    }
    if (openBlockRules == null) {
      throw new SyntaxError("FROM(state):", peek());
    }
    openBlockRules.add(parseRule());
  }

  // ON_EVENT(name): [IF (cond) | ELSE] [DO(actions)] -> (TO(state) | STAY) [DO(actions)]
  private RuleNode parseRule() {
    final Token start = peek();
    final TriggerNode trigger = parseTrigger();
    expect(TokenType.COLON, "':' after trigger");
    Condition condition = Condition.ALWAYS;
    boolean explicitElse = false;
    if (peek().is(TokenType.IF)) {
      next();
      condition = parseOr();
    } else if (peek().is(TokenType.ELSE)) {
      next();
      explicitElse = true;
    }
    final List<ActionNode> actions = new ArrayList<>();
    if (peek().is(TokenType.DO)) {
      actions.addAll(parseActions());
    }
    expect(TokenType.ARROW, "'->'");
    String destination = null;
    SourcePosition destinationPosition = peek().getPosition();
    if (peek().is(TokenType.STAY)) {
      next();
    } else {
      expect(TokenType.TO, "TO or STAY");
      expect(TokenType.LPAREN, "'('");
      final Token target = expect(TokenType.IDENTIFIER, "destination state");
      expect(TokenType.RPAREN, "')'");
      destination = target.getText();
      destinationPosition = target.getPosition();
    }
    if (peek().is(TokenType.DO)) {
      actions.addAll(parseActions());
    }
    final String comment = expectEndOfLine();
    return new RuleNode(trigger, condition, explicitElse, actions, destination,
        destinationPosition, comment, start.getPosition());
  }

  private TriggerNode parseTrigger() {
    final Token keyword = nextOnLine("ON_EVENT or ON_TIMEOUT");
    if (keyword.is(TokenType.ON_EVENT)) {
      expect(TokenType.LPAREN, "'('");
      final Token event = expect(TokenType.IDENTIFIER, "event name");
      expect(TokenType.RPAREN, "')'");
      return TriggerNode.onEvent(event.getText(), keyword.getPosition());
    }
    if (keyword.is(TokenType.ON_TIMEOUT)) {
      Duration duration = null;
      if (peek().is(TokenType.LPAREN)) {
        next();
        duration = Duration.parse(expect(TokenType.DURATION, "timeout duration").getText());
        expect(TokenType.RPAREN, "')'");
      }
      return TriggerNode.onTimeout(duration, keyword.getPosition());
    }
    throw new SyntaxError("ON_EVENT or ON_TIMEOUT", keyword);
  }

  private List<ActionNode> parseActions() {
    expect(TokenType.DO, "DO");
    expect(TokenType.LPAREN, "'('");
    final List<ActionNode> actions = new ArrayList<>();
    if (!peek().is(TokenType.RPAREN)) {
      actions.add(parseAction());
      while (peek().is(TokenType.COMMA)) {
        next();
        actions.add(parseAction());
      }
    }
    expect(TokenType.RPAREN, "')' or ','");
    return actions;
  }

  private ActionNode parseAction() {
    final Token name = expect(TokenType.IDENTIFIER, "action name");
    final List<String> arguments = new ArrayList<>();
    Duration duration = null;
    final boolean startTimer =
        startTimerAction.equals(name.getText().toUpperCase(Locale.ROOT));
    if (peek().is(TokenType.LPAREN)) {
      next();
      if (startTimer) {
        final Token amount = expect(TokenType.DURATION, "timer duration");
        duration = Duration.parse(amount.getText());
        arguments.add(amount.getText());
      } else if (!peek().is(TokenType.RPAREN)) {
        arguments.add(parseActionArgument());
        while (peek().is(TokenType.COMMA)) {
          next();
          arguments.add(parseActionArgument());
        }
      }
      expect(TokenType.RPAREN, "')'");
    } else if (startTimer) {
      throw new SyntaxError("'(' and a timer duration", peek());
    }
    return new ActionNode(name.getText(), arguments, duration, name.getPosition());
  }

  private String parseActionArgument() {
    final Token argument = nextOnLine("action argument");
    switch (argument.getType()) {
      case IDENTIFIER:
      case NUMBER:
      case DURATION:
      case STRING:
        return argument.getText();
      default:
        throw new SyntaxError("action argument", argument);
    }
  }

  private Condition parseOr() {
    Condition condition = parseAnd();
    while (peek().is(TokenType.OR)) {
      next();
      condition = Condition.or(condition, parseAnd());
    }
    return condition;
  }

  private Condition parseAnd() {
    Condition condition = parseUnary();
    while (peek().is(TokenType.AND)) {
      next();
      condition = Condition.and(condition, parseUnary());
    }
    return condition;
  }

  private Condition parseUnary() {
    if (peek().is(TokenType.NOT)) {
      next();
      return Condition.not(parseUnary());
    }
    return parsePrimary();
  }

  private Condition parsePrimary() {
    if (peek().is(TokenType.LPAREN)) {
      next();
      final Condition inner = parseOr();
      expect(TokenType.RPAREN, "')'");
      return inner;
    }
    final Token variable = expect(TokenType.IDENTIFIER, "condition variable");
    final Condition.Operator operator = Condition.Operator.of(peek().getType());
    if (operator == null) {
      return Condition.variable(variable.getText());
    }
    next();
    final Token literal = nextOnLine("number or constant after " + operator.getSymbol());
    switch (literal.getType()) {
      case NUMBER:
        try {
          return Condition.comparison(variable.getText(), operator,
              Long.valueOf(literal.getText()));
        } catch (NumberFormatException overflow) {
          throw new SyntaxError("a number that fits 64 bits", literal);
        }
      case IDENTIFIER:
        return Condition.comparison(variable.getText(), operator, literal.getText());
      default:
        throw new SyntaxError("number or constant after " + operator.getSymbol(), literal);
    }
  }

  /**
   * Consumes an optional trailing comment and the line break. Returns the comment text or null.
   */
  private String expectEndOfLine() {
    String comment = null;
    if (peek().is(TokenType.COMMENT)) {
      comment = next().getText();
    }
    if (peek().is(TokenType.NEWLINE)) {
      next();
    } else if (!peek().is(TokenType.EOF)) {
      throw new SyntaxError("end of line", peek());
    }
    return comment;
  }

  private boolean atEndOfLine() {
    return peek().is(TokenType.NEWLINE) || peek().is(TokenType.COMMENT)
        || peek().is(TokenType.EOF);
  }

  private boolean skipBlankLine() {
    if (peek().is(TokenType.NEWLINE)) {
      next();
      return true;
    }
    if (peek().is(TokenType.COMMENT)) {
      next();
      return true;
    }
    return false;
  }

  private boolean startsLine() {
    if (cursor == 0) {
      return true;
    }
    final TokenType previous = tokens.get(cursor - 1).getType();
    return previous == TokenType.NEWLINE || previous == TokenType.HEADER;
  }

  private void recover(final SyntaxError error) {
    report(error);
    // skip the rest of the broken line, then any line that cannot start an entry
    do {
      while (!peek().is(TokenType.NEWLINE) && !peek().is(TokenType.EOF)) {
        next();
      }
      if (peek().is(TokenType.NEWLINE)) {
        next();
      }
    } while (!peek().is(TokenType.EOF) && !canStartEntry(peek()));
  }

  private static boolean canStartEntry(final Token token) {
    switch (token.getType()) {
      case FROM:
      case ON_EVENT:
      case ON_TIMEOUT:
      case IDENTIFIER:
      case GLOBAL_TRANSITIONS:
      case STATE_LIST:
      case TRANSITIONS:
      case NEWLINE:
      case COMMENT:
        return true;
      default:
        return false;
    }
  }

  private void report(final SyntaxError error) {
    diagnostics.report(DiagnosticKind.EXPECTED_TOKEN,
        "Expected " + error.expected + " but found " + error.found.describe(),
        error.found.getPosition());
  }

  private void closeFromBlock() {
    if (openBlockRules != null) {
      fromBlocks.add(new FromBlock(openBlockState, openBlockPosition, openBlockRules));
    }
    openBlockState = null;
    openBlockPosition = null;
    openBlockRules = null;
  }

  private Token expect(final TokenType type, final String expected) {
    if (!peek().is(type)) {
      throw new SyntaxError(expected, peek());
    }
    return next();
  }

  /**
   * Like {@link #next()} but never consumes the line break, so recovery still sees it.
   */
  private Token nextOnLine(final String expected) {
    if (peek().is(TokenType.NEWLINE) || peek().is(TokenType.EOF)) {
      throw new SyntaxError(expected, peek());
    }
    return next();
  }

  private Token peek() {
    return tokens.get(cursor);
  }

  private Token next() {
    final Token token = tokens.get(cursor);
    if (!token.is(TokenType.EOF)) {
      cursor++;
    }
    return token;
  }

  /**
   * Unwinds the entry being parsed back to the section loop.
   */
  private static final class SyntaxError extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final String expected;
    private final Token found;

    private SyntaxError(final String expected, final Token found) {
      super("Expected " + expected + " but found " + found.describe(), null, false, false);
      this.expected = expected;
      this.found = found;
    }
  }
}
