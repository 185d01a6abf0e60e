package com.github.hsm.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Syntax tree of the script language. Nodes are immutable once the parser hands them out.
 */
public final class Ast {

  public abstract static class Node {
    final int line;

    Node(final int line) {
      this.line = line;
    }

    public int getLine() {
      return line;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public abstract List<Node> children();
  }

  /**
   * Root of a parsed script: the statements in source order.
   */
  public static final class Script extends Node {
    final List<Node> statements;

    Script(final List<Node> statements) {
      super(1);
      this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public List<Node> getStatements() {
      return statements;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitScript(this);
    }

    @Override
    public List<Node> children() {
      return statements;
    }
  }

  ///// statements /////
  public static final class Assign extends Node {
    final Node target;
    final Node value;

    Assign(final int line, final Node target, final Node value) {
      super(line);
      this.target = target;
      this.value = value;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public List<Node> children() {
      return Arrays.asList(target, value);
    }
  }

  public static final class AugAssign extends Node {
    final Node target;
    // the binary operator without its trailing '=', eg. "+" for "+="
    final String operator;
    final Node value;

    AugAssign(final int line, final Node target, final String operator, final Node value) {
      super(line);
      this.target = target;
      this.operator = operator;
      this.value = value;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAugAssign(this);
    }

    @Override
    public List<Node> children() {
      return Arrays.asList(target, value);
    }
  }

  public static final class ExpressionStatement extends Node {
    final Node expression;

    ExpressionStatement(final int line, final Node expression) {
      super(line);
      this.expression = expression;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitExpressionStatement(this);
    }

    @Override
    public List<Node> children() {
      return Collections.singletonList(expression);
    }
  }

  public static final class Pass extends Node {
    Pass(final int line) {
      super(line);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitPass(this);
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }
  }

  /**
   * Both {@code import a.b} and {@code from a import b}. Parsed only so the safety analyzer can
   * reject them; the interpreter never loads anything.
   */
  public static final class Import extends Node {
    final String module;
    final List<String> names;
    final boolean fromImport;

    Import(final int line, final String module, final List<String> names,
        final boolean fromImport) {
      super(line);
      this.module = module;
      this.names = Collections.unmodifiableList(new ArrayList<>(names));
      this.fromImport = fromImport;
    }

    public String getModule() {
      return module;
    }

    public boolean isFromImport() {
      return fromImport;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitImport(this);
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }
  }

  ///// expressions /////
  public static final class Literal extends Node {
    final Object value;

    Literal(final int line, final Object value) {
      super(line);
      this.value = value;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitLiteral(this);
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }
  }

  public static final class Name extends Node {
    final String id;

    Name(final int line, final String id) {
      super(line);
      this.id = id;
    }

    public String getId() {
      return id;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitName(this);
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }
  }

  /**
   * List or tuple display.
   */
  public static final class Sequence extends Node {
    final List<Node> elements;
    final boolean tuple;

    Sequence(final int line, final List<Node> elements, final boolean tuple) {
      super(line);
      this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
      this.tuple = tuple;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitSequence(this);
    }

    @Override
    public List<Node> children() {
      return elements;
    }
  }

  public static final class Dict extends Node {
    final List<Node> keys;
    final List<Node> values;

    Dict(final int line, final List<Node> keys, final List<Node> values) {
      super(line);
      this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
      this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitDict(this);
    }

    @Override
    public List<Node> children() {
      final List<Node> children = new ArrayList<>(keys);
      children.addAll(values);
      return children;
    }
  }

  public static final class Unary extends Node {
    final String operator;
    final Node operand;

    Unary(final int line, final String operator, final Node operand) {
      super(line);
      this.operator = operator;
      this.operand = operand;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public List<Node> children() {
      return Collections.singletonList(operand);
    }
  }

  public static final class Binary extends Node {
    final String operator;
    final Node left;
    final Node right;

    Binary(final int line, final String operator, final Node left, final Node right) {
      super(line);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public List<Node> children() {
      return Arrays.asList(left, right);
    }
  }

  /**
   * Short-circuiting {@code and} / {@code or}.
   */
  public static final class BoolOp extends Node {
    final boolean and;
    final Node left;
    final Node right;

    BoolOp(final int line, final boolean and, final Node left, final Node right) {
      super(line);
      this.and = and;
      this.left = left;
      this.right = right;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitBoolOp(this);
    }

    @Override
    public List<Node> children() {
      return Arrays.asList(left, right);
    }
  }

  /**
   * A comparison chain such as {@code 0 <= x < 10}; operators.size() == comparators.size().
   */
  public static final class Compare extends Node {
    final Node left;
    final List<String> operators;
    final List<Node> comparators;

    Compare(final int line, final Node left, final List<String> operators,
        final List<Node> comparators) {
      super(line);
      this.left = left;
      this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
      this.comparators = Collections.unmodifiableList(new ArrayList<>(comparators));
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitCompare(this);
    }

    @Override
    public List<Node> children() {
      final List<Node> children = new ArrayList<>();
      children.add(left);
      children.addAll(comparators);
      return children;
    }
  }

  public static final class Conditional extends Node {
    final Node test;
    final Node body;
    final Node orElse;

    Conditional(final int line, final Node test, final Node body, final Node orElse) {
      super(line);
      this.test = test;
      this.body = body;
      this.orElse = orElse;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitConditional(this);
    }

    @Override
    public List<Node> children() {
      return Arrays.asList(test, body, orElse);
    }
  }

  public static final class Call extends Node {
    final Node function;
    final List<Node> arguments;

    Call(final int line, final Node function, final List<Node> arguments) {
      super(line);
      this.function = function;
      this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public Node getFunction() {
      return function;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public List<Node> children() {
      final List<Node> children = new ArrayList<>();
      children.add(function);
      children.addAll(arguments);
      return children;
    }
  }

  public static final class Attribute extends Node {
    final Node value;
    final String name;

    Attribute(final int line, final Node value, final String name) {
      super(line);
      this.value = value;
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAttribute(this);
    }

    @Override
    public List<Node> children() {
      return Collections.singletonList(value);
    }
  }

  public static final class Index extends Node {
    final Node value;
    final Node index;

    Index(final int line, final Node value, final Node index) {
      super(line);
      this.value = value;
      this.index = index;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitIndex(this);
    }

    @Override
    public List<Node> children() {
      return Arrays.asList(value, index);
    }
  }

  public interface Visitor<R> {
    R visitScript(Script node);

    R visitAssign(Assign node);

    R visitAugAssign(AugAssign node);

    R visitExpressionStatement(ExpressionStatement node);

    R visitPass(Pass node);

    R visitImport(Import node);

    R visitLiteral(Literal node);

    R visitName(Name node);

    R visitSequence(Sequence node);

    R visitDict(Dict node);

    R visitUnary(Unary node);

    R visitBinary(Binary node);

    R visitBoolOp(BoolOp node);

    R visitCompare(Compare node);

    R visitConditional(Conditional node);

    R visitCall(Call node);

    R visitAttribute(Attribute node);

    R visitIndex(Index node);
  }

  /**
   * Visits every node of a tree depth-first. Subclasses override the node types they care about
   * and call {@link #walkChildren(Node)} to keep descending.
   */
  public abstract static class TreeWalker implements Visitor<Void> {
    protected final void walkChildren(final Node node) {
      for (final Node child : node.children()) {
        if (child != null) {
          child.accept(this);
        }
      }
    }

    @Override
    public Void visitScript(final Script node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitAssign(final Assign node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitAugAssign(final AugAssign node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitExpressionStatement(final ExpressionStatement node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitPass(final Pass node) {
      return null;
    }

    @Override
    public Void visitImport(final Import node) {
      return null;
    }

    @Override
    public Void visitLiteral(final Literal node) {
      return null;
    }

    @Override
    public Void visitName(final Name node) {
      return null;
    }

    @Override
    public Void visitSequence(final Sequence node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitDict(final Dict node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitUnary(final Unary node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitBinary(final Binary node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitBoolOp(final BoolOp node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitCompare(final Compare node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitConditional(final Conditional node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitCall(final Call node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitAttribute(final Attribute node) {
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitIndex(final Index node) {
      walkChildren(node);
      return null;
    }
  }

  private Ast() {}
}
