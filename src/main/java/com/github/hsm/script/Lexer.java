package com.github.hsm.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.hsm.script.Token.Type;

/**
 * Turns script text into a flat token list. Newlines are significant statement separators except
 * inside brackets or after a trailing backslash. Indentation carries no meaning since the
 * language has no block statements.
 */
final class Lexer {
  static final Set<String> keywords = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
      "True", "False", "None", "and", "or", "not", "in", "is", "if", "else", "pass", "import",
      "from", "as",
      // reserved, never accepted by the parser
      "def", "class", "lambda", "while", "for", "return", "global", "nonlocal", "with", "try",
      "except", "finally", "raise", "yield", "del", "assert", "async", "await", "elif", "break",
      "continue")));

  private static final String[] operators = {"**=", "//=", "**", "//", "==", "!=", "<=", ">=",
      "+=", "-=", "*=", "/=", "%=", "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "+", "-",
      "*", "/", "%", "<", ">", "="};

  private final String source;
  private final List<Token> tokens = new ArrayList<>();
  private int position;
  private int line = 1;
  private int lineStart;
  private int bracketDepth;

  Lexer(final String source) {
    this.source = source == null ? "" : source;
  }

  List<Token> tokenize() {
    while (position < source.length()) {
      final char current = source.charAt(position);
      if (current == '\n') {
        if (bracketDepth == 0) {
          add(Type.NEWLINE, "\n", null, position);
        }
        newLine();
      } else if (current == ' ' || current == '\t' || current == '\r' || current == '\f') {
        position++;
      } else if (current == '#') {
        while (position < source.length() && source.charAt(position) != '\n') {
          position++;
        }
      } else if (current == '\\') {
        lineContinuation();
      } else if (Character.isDigit(current) || (current == '.' && position + 1 < source.length()
          && Character.isDigit(source.charAt(position + 1)))) {
        number();
      } else if (current == '\'' || current == '"') {
        string(current);
      } else if (Character.isLetter(current) || current == '_') {
        name();
      } else {
        operator();
      }
    }
    add(Type.NEWLINE, "", null, position);
    add(Type.END, "", null, position);
    return tokens;
  }

  private void newLine() {
    position++;
    line++;
    lineStart = position;
  }

  private void lineContinuation() {
    int cursor = position + 1;
    while (cursor < source.length() && source.charAt(cursor) == '\r') {
      cursor++;
    }
    if (cursor < source.length() && source.charAt(cursor) == '\n') {
      position = cursor;
      newLine();
    } else {
      throw error("unexpected character after line continuation character");
    }
  }

  private void number() {
    final int start = position;
    boolean floating = false;
    while (position < source.length() && Character.isDigit(source.charAt(position))) {
      position++;
    }
    if (position < source.length() && source.charAt(position) == '.') {
      floating = true;
      position++;
      while (position < source.length() && Character.isDigit(source.charAt(position))) {
        position++;
      }
    }
    if (position < source.length()
        && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
      int cursor = position + 1;
      if (cursor < source.length()
          && (source.charAt(cursor) == '+' || source.charAt(cursor) == '-')) {
        cursor++;
      }
      if (cursor < source.length() && Character.isDigit(source.charAt(cursor))) {
        floating = true;
        position = cursor;
        while (position < source.length() && Character.isDigit(source.charAt(position))) {
          position++;
        }
      }
    }
    if (position < source.length() && (Character.isLetter(source.charAt(position))
        || source.charAt(position) == '_')) {
      throw error("invalid decimal literal");
    }
    final String text = source.substring(start, position);
    if (floating) {
      add(Type.FLOAT, text, Double.valueOf(text), start);
    } else {
      try {
        add(Type.INT, text, Long.valueOf(text), start);
      } catch (NumberFormatException tooLarge) {
        throw ScriptFault.syntax("integer literal too large: " + text, line,
            start - lineStart + 1);
      }
    }
  }

  private void string(final char quote) {
    final int start = position;
    position++;
    final StringBuilder value = new StringBuilder();
    while (true) {
      if (position >= source.length() || source.charAt(position) == '\n') {
        throw ScriptFault.syntax("unterminated string literal", line, start - lineStart + 1);
      }
      final char current = source.charAt(position);
      if (current == quote) {
        position++;
        break;
      }
      if (current == '\\' && position + 1 < source.length()) {
        final char escaped = source.charAt(position + 1);
        switch (escaped) {
          case 'n':
            value.append('\n');
            break;
          case 't':
            value.append('\t');
            break;
          case 'r':
            value.append('\r');
            break;
          case '0':
            value.append('\0');
            break;
          case '\\':
          case '\'':
          case '"':
            value.append(escaped);
            break;
          default:
            // unknown escapes are kept verbatim
            value.append('\\').append(escaped);
        }
        position += 2;
        continue;
      }
      value.append(current);
      position++;
    }
    add(Type.STRING, source.substring(start, position), value.toString(), start);
  }

  private void name() {
    final int start = position;
    while (position < source.length() && (Character.isLetterOrDigit(source.charAt(position))
        || source.charAt(position) == '_')) {
      position++;
    }
    final String text = source.substring(start, position);
    add(keywords.contains(text) ? Type.KEYWORD : Type.NAME, text, null, start);
  }

  private void operator() {
    for (final String operator : operators) {
      if (source.startsWith(operator, position)) {
        final int start = position;
        position += operator.length();
        if (operator.equals("(") || operator.equals("[") || operator.equals("{")) {
          bracketDepth++;
        } else if (operator.equals(")") || operator.equals("]") || operator.equals("}")) {
          bracketDepth = Math.max(0, bracketDepth - 1);
        }
        add(Type.OPERATOR, operator, null, start);
        return;
      }
    }
    throw error("invalid character '" + source.charAt(position) + "'");
  }

  private void add(final Type type, final String text, final Object literal, final int start) {
    tokens.add(new Token(type, text, literal, line, start - lineStart + 1));
  }

  private ScriptFault error(final String message) {
    return ScriptFault.syntax(message, line, position - lineStart + 1);
  }
}
