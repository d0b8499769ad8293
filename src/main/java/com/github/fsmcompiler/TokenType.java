package com.github.fsmcompiler;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lexical categories of the specification language. Keywords are recognized case-insensitively.
 */
public enum TokenType {
  // section keywords
  GLOBAL_TRANSITIONS(true), STATE_LIST(true), TRANSITIONS(true),

  // statement keywords
  FROM(true), ON_EVENT(true), ON_TIMEOUT(true), IF(true), ELSE(true), DO(true), TO(true),
  STAY(true), INITIAL(true), OUTPUT(true),

  // boolean operators, also spelled && || !
  AND(true), OR(true), NOT(true),

  IDENTIFIER, NUMBER, DURATION, STRING,
  LPAREN, RPAREN, LBRACKET, RBRACKET, COLON, COMMA, ARROW, ASSIGN,
  EQ, NE, LT, LE, GT, GE,

  // free text ahead of the first section, kept verbatim
  HEADER, COMMENT, NEWLINE, EOF;

  private static final Map<String, TokenType> keywords = new HashMap<>();
  static {
    for (final TokenType type : values()) {
      if (type.keyword) {
        keywords.put(type.name(), type);
      }
    }
  }

  private final boolean keyword;

  private TokenType() {
    this(false);
  }

  private TokenType(final boolean keyword) {
    this.keyword = keyword;
  }

  public boolean isKeyword() {
    return keyword;
  }

  public boolean isSection() {
    return this == GLOBAL_TRANSITIONS || this == STATE_LIST || this == TRANSITIONS;
  }

  public boolean isComparison() {
    return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
  }

  /**
   * Returns the keyword spelled by {@code word} in any case, or null if it is not a keyword.
   */
  public static TokenType keyword(final String word) {
    return keywords.get(word.toUpperCase(Locale.ROOT));
  }
}
