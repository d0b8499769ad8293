package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns specification text into tokens. Problems are reported to the supplied {@link Diagnostics}
 * and the offending characters skipped, so a single pass reports every lexical error in the input.
 *
 * Everything ahead of the first line that opens a section is returned as one HEADER token and is
 * never tokenized further: it may hold arbitrary prose.
 */
public final class Lexer {
  private static final Logger logger = LogManager.getLogger(Lexer.class.getSimpleName());

  private static final Pattern sectionLine =
      Pattern.compile("^\\s*(GLOBAL_TRANSITIONS|STATE_LIST|TRANSITIONS)\\s*:.*",
          Pattern.CASE_INSENSITIVE);

  private final String source;
  private final Diagnostics diagnostics;
  private final boolean headerAllowed;
  private final List<Token> tokens = new ArrayList<>();

  private int offset;
  private int line = 1;
  private int column = 1;

  public Lexer(final String source, final Diagnostics diagnostics) {
    this(source, diagnostics, true);
  }

  /**
   * With {@code headerAllowed} false every line is tokenized, which is what fragments such as a
   * lone condition need.
   */
  public Lexer(final String source, final Diagnostics diagnostics, final boolean headerAllowed) {
    this.source = source == null ? "" : source;
    this.diagnostics = diagnostics;
    this.headerAllowed = headerAllowed;
  }

  /**
   * Tokenizes the whole source. The returned list always ends with an EOF token.
   */
  public List<Token> tokenize() {
    tokens.clear();
    offset = 0;
    line = 1;
    column = 1;

    if (headerAllowed) {
      lexHeader();
    }
    while (offset < source.length()) {
      lexNext();
    }
    tokens.add(new Token(TokenType.EOF, "", position()));
    if (logger.isDebugEnabled()) {
      logger.debug("Lexed " + tokens.size() + " tokens from " + line + " lines");
    }
    return Collections.unmodifiableList(new ArrayList<>(tokens));
  }

  private void lexHeader() {
    final SourcePosition start = position();
    final StringBuilder header = new StringBuilder();
    while (offset < source.length()) {
      int end = source.indexOf('\n', offset);
      end = end < 0 ? source.length() : end;
      final String text = source.substring(offset, end);
      if (sectionLine.matcher(text).matches()) {
        break;
      }
      header.append(text);
      offset = end;
      if (offset < source.length()) {
        header.append('\n');
        offset++;
        line++;
      }
      column = 1;
    }
    if (header.toString().trim().length() > 0) {
      tokens.add(new Token(TokenType.HEADER, header.toString(), start));
    }
  }

  private void lexNext() {
    final char current = source.charAt(offset);
    final SourcePosition start = position();
    switch (current) {
      case ' ':
      case '\t':
      case '\r':
      case '\f':
        advance();
        return;
      case '\n':
        tokens.add(new Token(TokenType.NEWLINE, "\n", start));
        advance();
        return;
      case '#':
        lexComment(start);
        return;
      case '"':
        lexString(start);
        return;
      case '(':
        single(TokenType.LPAREN, start);
        return;
      case ')':
        single(TokenType.RPAREN, start);
        return;
      case '[':
        single(TokenType.LBRACKET, start);
        return;
      case ']':
        single(TokenType.RBRACKET, start);
        return;
      case ':':
        single(TokenType.COLON, start);
        return;
      case ',':
        single(TokenType.COMMA, start);
        return;
      case '→':
        single(TokenType.ARROW, start);
        return;
      case '-':
        if (peek(1) == '>') {
          pair(TokenType.ARROW, start);
        } else {
          unknown(start);
        }
        return;
      case '=':
        if (peek(1) == '=') {
          pair(TokenType.EQ, start);
        } else {
          single(TokenType.ASSIGN, start);
        }
        return;
      case '!':
        if (peek(1) == '=') {
          pair(TokenType.NE, start);
        } else {
          single(TokenType.NOT, start);
        }
        return;
      case '<':
        if (peek(1) == '=') {
          pair(TokenType.LE, start);
        } else {
          single(TokenType.LT, start);
        }
        return;
      case '>':
        if (peek(1) == '=') {
          pair(TokenType.GE, start);
        } else {
          single(TokenType.GT, start);
        }
        return;
      case '&':
        if (peek(1) == '&') {
          pair(TokenType.AND, start);
        } else {
          unknown(start);
        }
        return;
      case '|':
        if (peek(1) == '|') {
          pair(TokenType.OR, start);
        } else {
          unknown(start);
        }
        return;
      default:
        break;
    }
    if (isDigit(current)) {
      lexNumberOrDuration(start);
    } else if (isIdentifierStart(current)) {
      lexWord(start);
    } else {
      unknown(start);
    }
  }

  private void lexComment(final SourcePosition start) {
    final int begin = offset + 1;
    while (offset < source.length() && source.charAt(offset) != '\n') {
      advance();
    }
    tokens.add(new Token(TokenType.COMMENT, source.substring(begin, offset).trim(), start));
  }

  private void lexString(final SourcePosition start) {
    final int begin = offset;
    advance();
    while (offset < source.length()) {
      final char current = source.charAt(offset);
      if (current == '"') {
        advance();
        tokens.add(new Token(TokenType.STRING, source.substring(begin + 1, offset - 1), start));
        return;
      }
      if (current == '\n') {
        break;
      }
      advance();
    }
    diagnostics.report(DiagnosticKind.UNTERMINATED_LITERAL,
        "Unterminated string literal " + source.substring(begin, offset).trim(), start);
  }

  private void lexNumberOrDuration(final SourcePosition start) {
    final int begin = offset;
    while (offset < source.length() && isDigit(source.charAt(offset))) {
      advance();
    }
    if (offset < source.length() && isIdentifierStart(source.charAt(offset))) {
      final int unitBegin = offset;
      while (offset < source.length() && isIdentifierPart(source.charAt(offset))) {
        advance();
      }
      final String text = source.substring(begin, offset);
      if (Duration.unitFor(source.substring(unitBegin, offset)) == null
          || Duration.parse(text) == null) {
        diagnostics.report(DiagnosticKind.INVALID_DURATION,
            "Invalid duration '" + text + "', expected a unit of ms, s, min or h", start);
        return;
      }
      tokens.add(new Token(TokenType.DURATION, text, start));
      return;
    }
    tokens.add(new Token(TokenType.NUMBER, source.substring(begin, offset), start));
  }

  private void lexWord(final SourcePosition start) {
    final int begin = offset;
    while (offset < source.length() && isIdentifierPart(source.charAt(offset))) {
      advance();
    }
    final String word = source.substring(begin, offset);
    final TokenType keyword = TokenType.keyword(word);
    tokens.add(new Token(keyword == null ? TokenType.IDENTIFIER : keyword, word, start));
  }

  private void unknown(final SourcePosition start) {
    diagnostics.report(DiagnosticKind.UNKNOWN_SYMBOL,
        "Unknown symbol '" + source.charAt(offset) + "'", start);
    advance();
  }

  private void single(final TokenType type, final SourcePosition start) {
    tokens.add(new Token(type, String.valueOf(source.charAt(offset)), start));
    advance();
  }

  private void pair(final TokenType type, final SourcePosition start) {
    tokens.add(new Token(type, source.substring(offset, offset + 2), start));
    advance();
    advance();
  }

  private char peek(final int ahead) {
    final int index = offset + ahead;
    return index < source.length() ? source.charAt(index) : '\0';
  }

  private void advance() {
    if (source.charAt(offset) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    offset++;
  }

  private SourcePosition position() {
    return new SourcePosition(line, column);
  }

  // identifiers end up as HDL names, so ASCII only
  private static boolean isIdentifierStart(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(final char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }
}
