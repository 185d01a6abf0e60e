package com.github.hsm.script;

/**
 * A lexical token of the script language along with its source position.
 */
final class Token {
  final Type type;
  final String text;
  final Object literal;
  final int line;
  final int column;

  Token(final Type type, final String text, final Object literal, final int line,
      final int column) {
    this.type = type;
    this.text = text;
    this.literal = literal;
    this.line = line;
    this.column = column;
  }

  boolean is(final Type type) {
    return this.type == type;
  }

  boolean isKeyword(final String keyword) {
    return type == Type.KEYWORD && text.equals(keyword);
  }

  boolean isOperator(final String operator) {
    return type == Type.OPERATOR && text.equals(operator);
  }

  @Override
  public String toString() {
    return "Token [type=" + type + ", text=" + text + ", line=" + line + ", column=" + column
        + "]";
  }

  static enum Type {
    NAME, KEYWORD, INT, FLOAT, STRING, OPERATOR, NEWLINE, END;
  }
}
