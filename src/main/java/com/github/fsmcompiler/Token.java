package com.github.fsmcompiler;

/**
 * An immutable lexeme with its type and starting position.
 */
public final class Token {
  private final TokenType type;
  private final String text;
  private final SourcePosition position;

  public Token(final TokenType type, final String text, final SourcePosition position) {
    this.type = type;
    this.text = text;
    this.position = position;
  }

  public TokenType getType() {
    return type;
  }

  /**
   * The lexeme as written. For COMMENT tokens this is the comment body without the leading '#'.
   */
  public String getText() {
    return text;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public boolean is(final TokenType other) {
    return type == other;
  }

  /**
   * Human readable spelling used in parse error messages.
   */
  public String describe() {
    switch (type) {
      case EOF:
        return "end of input";
      case NEWLINE:
        return "end of line";
      case HEADER:
        return "header text";
      default:
        return "'" + text + "'";
    }
  }

  @Override
  public String toString() {
    return "Token [type=" + type + ", text=" + text + ", position=" + position + "]";
  }
}
