package com.github.hsm.script;

import java.util.ArrayList;
import java.util.List;

import com.github.hsm.script.Token.Type;

/**
 * Recursive-descent parser for the script language. The grammar has no blocks: simple
 * statements separated by newlines or semicolons, and expressions with the usual precedence
 * ladder (conditional, or, and, not, comparison chain, additive, multiplicative, unary,
 * power, postfix).
 */
public final class Parser {
  private final List<Token> tokens;
  private int position;

  private Parser(final String source) {
    this.tokens = new Lexer(source).tokenize();
  }

  /**
   * Parse statements, as an action body is run.
   *
   * @throws ScriptFault of kind {@link ScriptFault.Kind#SYNTAX_ERROR}
   */
  public static Ast.Script parseScript(final String source) {
    return new Parser(source).script();
  }

  /**
   * Parse exactly one expression, as a transition condition is evaluated. Surrounding blank lines
   * are tolerated, anything else after the expression is a syntax error.
   *
   * @throws ScriptFault of kind {@link ScriptFault.Kind#SYNTAX_ERROR}
   */
  public static Ast.Node parseExpression(final String source) {
    final Parser parser = new Parser(source);
    parser.skipNewlines();
    if (parser.peek().is(Type.END)) {
      throw parser.error("expected an expression");
    }
    final Ast.Node expression = parser.expressionList();
    parser.skipNewlines();
    if (!parser.peek().is(Type.END)) {
      throw parser.error("invalid syntax");
    }
    return expression;
  }

  private Ast.Script script() {
    final List<Ast.Node> statements = new ArrayList<>();
    skipSeparators();
    while (!peek().is(Type.END)) {
      statements.add(statement());
      final Token separator = peek();
      if (!separator.is(Type.END) && !separator.is(Type.NEWLINE)
          && !separator.isOperator(";")) {
        throw error("invalid syntax");
      }
      skipSeparators();
    }
    return new Ast.Script(statements);
  }

  private Ast.Node statement() {
    final Token first = peek();
    if (first.isKeyword("pass")) {
      advance();
      return new Ast.Pass(first.line);
    }
    if (first.isKeyword("import")) {
      return importStatement();
    }
    if (first.isKeyword("from")) {
      return fromImportStatement();
    }
    if (first.is(Type.KEYWORD) && !isExpressionKeyword(first.text)) {
      throw error("'" + first.text + "' statements are not supported");
    }
    final Ast.Node expression = expressionList();
    final Token next = peek();
    if (next.isOperator("=")) {
      advance();
      checkAssignable(expression);
      final Ast.Node value = expressionList();
      if (peek().isOperator("=")) {
        throw error("chained assignment is not supported");
      }
      return new Ast.Assign(first.line, expression, value);
    }
    if (next.is(Type.OPERATOR) && next.text.length() >= 2 && next.text.endsWith("=")
        && !next.text.equals("==") && !next.text.equals("!=") && !next.text.equals("<=")
        && !next.text.equals(">=")) {
      advance();
      checkAssignable(expression);
      if (expression instanceof Ast.Sequence) {
        throw error("illegal expression for augmented assignment");
      }
      final String operator = next.text.substring(0, next.text.length() - 1);
      return new Ast.AugAssign(first.line, expression, operator, expressionList());
    }
    return new Ast.ExpressionStatement(first.line, expression);
  }

  private Ast.Node importStatement() {
    final int line = advance().line;
    final List<String> names = new ArrayList<>();
    names.add(dottedName());
    aliasIfPresent();
    while (peek().isOperator(",")) {
      advance();
      names.add(dottedName());
      aliasIfPresent();
    }
    return new Ast.Import(line, names.get(0), names, false);
  }

  private Ast.Node fromImportStatement() {
    final int line = advance().line;
    final String module = dottedName();
    if (!peek().isKeyword("import")) {
      throw error("expected 'import'");
    }
    advance();
    final List<String> names = new ArrayList<>();
    if (peek().isOperator("*")) {
      advance();
      names.add("*");
    } else {
      final boolean parenthesized = peek().isOperator("(");
      if (parenthesized) {
        advance();
      }
      names.add(expectName());
      aliasIfPresent();
      while (peek().isOperator(",")) {
        advance();
        names.add(expectName());
        aliasIfPresent();
      }
      if (parenthesized) {
        expectOperator(")");
      }
    }
    return new Ast.Import(line, module, names, true);
  }

  private String dottedName() {
    final StringBuilder name = new StringBuilder(expectName());
    while (peek().isOperator(".")) {
      advance();
      name.append('.').append(expectName());
    }
    return name.toString();
  }

  private void aliasIfPresent() {
    if (peek().isKeyword("as")) {
      advance();
      expectName();
    }
  }

  private void checkAssignable(final Ast.Node target) {
    if (target instanceof Ast.Name || target instanceof Ast.Index
        || target instanceof Ast.Attribute) {
      return;
    }
    throw ScriptFault.syntax("cannot assign to expression", target.line, 1);
  }

  ///// expressions /////
  private Ast.Node expressionList() {
    final int line = peek().line;
    final Ast.Node first = expression();
    if (!peek().isOperator(",")) {
      return first;
    }
    final List<Ast.Node> elements = new ArrayList<>();
    elements.add(first);
    while (peek().isOperator(",")) {
      advance();
      if (!startsExpression(peek())) {
        break;
      }
      elements.add(expression());
    }
    return new Ast.Sequence(line, elements, true);
  }

  private Ast.Node expression() {
    final Ast.Node body = orExpression();
    if (peek().isKeyword("if")) {
      final int line = advance().line;
      final Ast.Node test = orExpression();
      if (!peek().isKeyword("else")) {
        throw error("expected 'else' after conditional expression");
      }
      advance();
      final Ast.Node orElse = expression();
      return new Ast.Conditional(line, test, body, orElse);
    }
    return body;
  }

  private Ast.Node orExpression() {
    Ast.Node left = andExpression();
    while (peek().isKeyword("or")) {
      final int line = advance().line;
      left = new Ast.BoolOp(line, false, left, andExpression());
    }
    return left;
  }

  private Ast.Node andExpression() {
    Ast.Node left = notExpression();
    while (peek().isKeyword("and")) {
      final int line = advance().line;
      left = new Ast.BoolOp(line, true, left, notExpression());
    }
    return left;
  }

  private Ast.Node notExpression() {
    if (peek().isKeyword("not")) {
      final int line = advance().line;
      return new Ast.Unary(line, "not", notExpression());
    }
    return comparison();
  }

  private Ast.Node comparison() {
    final int line = peek().line;
    final Ast.Node left = arithmetic();
    final List<String> operators = new ArrayList<>();
    final List<Ast.Node> comparators = new ArrayList<>();
    while (true) {
      final String operator = comparisonOperator();
      if (operator == null) {
        break;
      }
      operators.add(operator);
      comparators.add(arithmetic());
    }
    if (operators.isEmpty()) {
      return left;
    }
    return new Ast.Compare(line, left, operators, comparators);
  }

  private String comparisonOperator() {
    final Token token = peek();
    if (token.is(Type.OPERATOR)) {
      switch (token.text) {
        case "==":
        case "!=":
        case "<":
        case "<=":
        case ">":
        case ">=":
          advance();
          return token.text;
        default:
          return null;
      }
    }
    if (token.isKeyword("in")) {
      advance();
      return "in";
    }
    if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
      advance();
      advance();
      return "not in";
    }
    if (token.isKeyword("is")) {
      advance();
      if (peek().isKeyword("not")) {
        advance();
        return "is not";
      }
      return "is";
    }
    return null;
  }

  private Ast.Node arithmetic() {
    Ast.Node left = term();
    while (peek().isOperator("+") || peek().isOperator("-")) {
      final Token operator = advance();
      left = new Ast.Binary(operator.line, operator.text, left, term());
    }
    return left;
  }

  private Ast.Node term() {
    Ast.Node left = factor();
    while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("//")
        || peek().isOperator("%")) {
      final Token operator = advance();
      left = new Ast.Binary(operator.line, operator.text, left, factor());
    }
    return left;
  }

  private Ast.Node factor() {
    if (peek().isOperator("-") || peek().isOperator("+")) {
      final Token operator = advance();
      return new Ast.Unary(operator.line, operator.text, factor());
    }
    return power();
  }

  private Ast.Node power() {
    final Ast.Node base = postfix();
    if (peek().isOperator("**")) {
      final Token operator = advance();
      // right associative and binds tighter than a unary minus on its left only
      return new Ast.Binary(operator.line, "**", base, factor());
    }
    return base;
  }

  private Ast.Node postfix() {
    Ast.Node node = atom();
    while (true) {
      final Token token = peek();
      if (token.isOperator("(")) {
        advance();
        node = new Ast.Call(token.line, node, arguments());
      } else if (token.isOperator(".")) {
        advance();
        node = new Ast.Attribute(token.line, node, expectName());
      } else if (token.isOperator("[")) {
        advance();
        final Ast.Node index = expressionList();
        expectOperator("]");
        node = new Ast.Index(token.line, node, index);
      } else {
        return node;
      }
    }
  }

  private List<Ast.Node> arguments() {
    final List<Ast.Node> arguments = new ArrayList<>();
    while (!peek().isOperator(")")) {
      if (peek().is(Type.NAME) && peekAhead(1).isOperator("=")) {
        throw error("keyword arguments are not supported");
      }
      arguments.add(expression());
      if (peek().isOperator(",")) {
        advance();
      } else {
        break;
      }
    }
    expectOperator(")");
    return arguments;
  }

  private Ast.Node atom() {
    final Token token = peek();
    switch (token.type) {
      case INT:
      case FLOAT:
        advance();
        return new Ast.Literal(token.line, token.literal);
      case STRING: {
        advance();
        final StringBuilder value = new StringBuilder((String) token.literal);
        // adjacent string literals concatenate
        while (peek().is(Type.STRING)) {
          value.append((String) advance().literal);
        }
        return new Ast.Literal(token.line, value.toString());
      }
      case NAME:
        advance();
        return new Ast.Name(token.line, token.text);
      case KEYWORD:
        if (token.text.equals("True")) {
          advance();
          return new Ast.Literal(token.line, Boolean.TRUE);
        }
        if (token.text.equals("False")) {
          advance();
          return new Ast.Literal(token.line, Boolean.FALSE);
        }
        if (token.text.equals("None")) {
          advance();
          return new Ast.Literal(token.line, null);
        }
        throw error("invalid syntax near '" + token.text + "'");
      case OPERATOR:
        if (token.isOperator("(")) {
          return parenthesized();
        }
        if (token.isOperator("[")) {
          return list();
        }
        if (token.isOperator("{")) {
          return dict();
        }
        throw error("invalid syntax near '" + token.text + "'");
      default:
        throw error("unexpected end of input");
    }
  }

  private Ast.Node parenthesized() {
    final int line = advance().line;
    if (peek().isOperator(")")) {
      advance();
      return new Ast.Sequence(line, new ArrayList<>(), true);
    }
    final Ast.Node inner = expressionList();
    expectOperator(")");
    return inner;
  }

  private Ast.Node list() {
    final int line = advance().line;
    final List<Ast.Node> elements = new ArrayList<>();
    while (!peek().isOperator("]")) {
      elements.add(expression());
      if (peek().isOperator(",")) {
        advance();
      } else {
        break;
      }
    }
    expectOperator("]");
    return new Ast.Sequence(line, elements, false);
  }

  private Ast.Node dict() {
    final int line = advance().line;
    final List<Ast.Node> keys = new ArrayList<>();
    final List<Ast.Node> values = new ArrayList<>();
    while (!peek().isOperator("}")) {
      keys.add(expression());
      if (!peek().isOperator(":")) {
        throw error("set displays are not supported, use set([...])");
      }
      advance();
      values.add(expression());
      if (peek().isOperator(",")) {
        advance();
      } else {
        break;
      }
    }
    expectOperator("}");
    return new Ast.Dict(line, keys, values);
  }

  ///// token plumbing /////
  private static boolean isExpressionKeyword(final String keyword) {
    return keyword.equals("True") || keyword.equals("False") || keyword.equals("None")
        || keyword.equals("not");
  }

  private static boolean startsExpression(final Token token) {
    switch (token.type) {
      case INT:
      case FLOAT:
      case STRING:
      case NAME:
        return true;
      case KEYWORD:
        return isExpressionKeyword(token.text);
      case OPERATOR:
        return token.isOperator("(") || token.isOperator("[") || token.isOperator("{")
            || token.isOperator("-") || token.isOperator("+");
      default:
        return false;
    }
  }

  private void skipSeparators() {
    while (peek().is(Type.NEWLINE) || peek().isOperator(";")) {
      advance();
    }
  }

  private void skipNewlines() {
    while (peek().is(Type.NEWLINE)) {
      advance();
    }
  }

  private String expectName() {
    final Token token = peek();
    if (!token.is(Type.NAME)) {
      throw error("expected a name");
    }
    advance();
    return token.text;
  }

  private void expectOperator(final String operator) {
    if (!peek().isOperator(operator)) {
      throw error("expected '" + operator + "'");
    }
    advance();
  }

  private Token peek() {
    return tokens.get(position);
  }

  private Token peekAhead(final int offset) {
    return tokens.get(Math.min(position + offset, tokens.size() - 1));
  }

  private Token advance() {
    final Token token = tokens.get(position);
    if (position < tokens.size() - 1) {
      position++;
    }
    return token;
  }

  private ScriptFault error(final String message) {
    final Token token = peek();
    return ScriptFault.syntax(message, token.line, token.column);
  }
}
