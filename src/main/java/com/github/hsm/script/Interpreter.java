package com.github.hsm.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.github.hsm.script.ScriptFault.Kind;
import com.github.hsm.script.ScriptValues.Tuple;

/**
 * Tree-walking evaluator for parsed scripts. The variable scope handed in is the only namespace a
 * script can read or write; names that are not in it resolve against the {@link Builtins}
 * allow-list and nothing else.
 *
 * Notes:<br>
 * 1. an interpreter instance is cheap and meant to be used for a single execution<br>
 * 2. it is not thread-safe, same as the scope map it mutates<br>
 */
public final class Interpreter implements Ast.Visitor<Object> {
  private final Map<String, Object> scope;
  private final Consumer<String> printSink;

  public Interpreter(final Map<String, Object> scope, final Consumer<String> printSink) {
    this.scope = scope;
    this.printSink = printSink;
  }

  /**
   * Run every statement of the script in order. Faults abort the remaining statements but keep
   * whatever the earlier ones already wrote to the scope.
   */
  public void execute(final Ast.Script script) {
    script.accept(this);
  }

  public Object evaluate(final Ast.Node expression) {
    return expression.accept(this);
  }

  void print(final String line) {
    if (printSink != null) {
      printSink.accept(line);
    }
  }

  ///// statements /////
  @Override
  public Object visitScript(final Ast.Script node) {
    for (final Ast.Node statement : node.statements) {
      statement.accept(this);
    }
    return null;
  }

  @Override
  public Object visitAssign(final Ast.Assign node) {
    final Object value = evaluate(node.value);
    assign(node.target, value);
    return null;
  }

  @Override
  public Object visitAugAssign(final Ast.AugAssign node) {
    if (node.target instanceof Ast.Index) {
      final Ast.Index target = (Ast.Index) node.target;
      final Object container = evaluate(target.value);
      final Object index = evaluate(target.index);
      final Object current = getItem(container, index);
      setItem(container, index, inPlace(node.operator, current, evaluate(node.value)));
    } else {
      final Object current = evaluate(node.target);
      assign(node.target, inPlace(node.operator, current, evaluate(node.value)));
    }
    return null;
  }

  @Override
  public Object visitExpressionStatement(final Ast.ExpressionStatement node) {
    evaluate(node.expression);
    return null;
  }

  @Override
  public Object visitPass(final Ast.Pass node) {
    return null;
  }

  @Override
  public Object visitImport(final Ast.Import node) {
    // normally rejected up front by the safety analyzer
    throw new ScriptFault(Kind.RUNTIME_ERROR, "imports are not available to scripts");
  }

  ///// expressions /////
  @Override
  public Object visitLiteral(final Ast.Literal node) {
    return node.value;
  }

  @Override
  public Object visitName(final Ast.Name node) {
    if (scope.containsKey(node.id)) {
      return scope.get(node.id);
    }
    final ScriptCallable builtin = Builtins.lookup(node.id);
    if (builtin != null) {
      return builtin;
    }
    throw new ScriptFault(Kind.NAME_ERROR, "name '" + node.id + "' is not defined");
  }

  @Override
  public Object visitSequence(final Ast.Sequence node) {
    final List<Object> elements = new ArrayList<>(node.elements.size());
    for (final Ast.Node element : node.elements) {
      elements.add(evaluate(element));
    }
    return node.tuple ? new Tuple(elements) : elements;
  }

  @Override
  public Object visitDict(final Ast.Dict node) {
    final Map<Object, Object> dict = new LinkedHashMap<>();
    for (int index = 0; index < node.keys.size(); index++) {
      final Object key = evaluate(node.keys.get(index));
      checkHashable(key);
      dict.put(key, evaluate(node.values.get(index)));
    }
    return dict;
  }

  @Override
  public Object visitUnary(final Ast.Unary node) {
    final Object operand = evaluate(node.operand);
    switch (node.operator) {
      case "not":
        return !ScriptValues.truthy(operand);
      case "-":
        if (operand instanceof Double) {
          return -(Double) operand;
        }
        if (ScriptValues.isIntegral(operand)) {
          return Math.negateExact(ScriptValues.asLong(operand));
        }
        break;
      default:
        if (operand instanceof Double) {
          return operand;
        }
        if (ScriptValues.isIntegral(operand)) {
          return ScriptValues.asLong(operand);
        }
    }
    throw ScriptFault.type("bad operand type for unary " + node.operator + ": '"
        + ScriptValues.typeName(operand) + "'");
  }

  @Override
  public Object visitBinary(final Ast.Binary node) {
    return arithmetic(node.operator, evaluate(node.left), evaluate(node.right));
  }

  @Override
  public Object visitBoolOp(final Ast.BoolOp node) {
    final Object left = evaluate(node.left);
    final boolean leftTruth = ScriptValues.truthy(left);
    if (node.and ? !leftTruth : leftTruth) {
      return left;
    }
    return evaluate(node.right);
  }

  @Override
  public Object visitCompare(final Ast.Compare node) {
    Object left = evaluate(node.left);
    for (int index = 0; index < node.operators.size(); index++) {
      final Object right = evaluate(node.comparators.get(index));
      if (!compare(node.operators.get(index), left, right)) {
        return false;
      }
      left = right;
    }
    return true;
  }

  @Override
  public Object visitConditional(final Ast.Conditional node) {
    return ScriptValues.truthy(evaluate(node.test)) ? evaluate(node.body) : evaluate(node.orElse);
  }

  @Override
  public Object visitCall(final Ast.Call node) {
    final Object function = evaluate(node.function);
    final List<Object> arguments = new ArrayList<>(node.arguments.size());
    for (final Ast.Node argument : node.arguments) {
      arguments.add(evaluate(argument));
    }
    if (!(function instanceof ScriptCallable)) {
      throw ScriptFault.type("'" + ScriptValues.typeName(function) + "' object is not callable");
    }
    return ((ScriptCallable) function).call(this, arguments);
  }

  @Override
  public Object visitAttribute(final Ast.Attribute node) {
    return Builtins.bindMethod(evaluate(node.value), node.name);
  }

  @Override
  public Object visitIndex(final Ast.Index node) {
    return getItem(evaluate(node.value), evaluate(node.index));
  }

  ///// helpers /////
  private void assign(final Ast.Node target, final Object value) {
    if (target instanceof Ast.Name) {
      scope.put(((Ast.Name) target).id, value);
    } else if (target instanceof Ast.Index) {
      final Ast.Index index = (Ast.Index) target;
      setItem(evaluate(index.value), evaluate(index.index), value);
    } else {
      final Ast.Attribute attribute = (Ast.Attribute) target;
      final Object owner = evaluate(attribute.value);
      throw new ScriptFault(Kind.ATTRIBUTE_ERROR, "'" + ScriptValues.typeName(owner)
          + "' object has no attribute '" + attribute.name + "'");
    }
  }

  private static Object inPlace(final String operator, final Object current, final Object value) {
    // lists extend in place for +=, everything else rebinds
    if (operator.equals("+") && current instanceof List && !(current instanceof Tuple)
        && value instanceof List && !(value instanceof Tuple)) {
      @SuppressWarnings("unchecked")
      final List<Object> list = (List<Object>) current;
      checkLength((long) list.size() + ((List<?>) value).size());
      list.addAll((List<?>) value);
      return list;
    }
    return arithmetic(operator, current, value);
  }

  static Object arithmetic(final String operator, final Object left, final Object right) {
    if (ScriptValues.isNumber(left) && ScriptValues.isNumber(right)) {
      return numeric(operator, left, right);
    }
    switch (operator) {
      case "+":
        if (left instanceof String && right instanceof String) {
          checkLength((long) ((String) left).length() + ((String) right).length());
          return (String) left + right;
        }
        if (left instanceof Tuple && right instanceof Tuple) {
          checkLength((long) ((Tuple) left).size() + ((Tuple) right).size());
          final List<Object> joined = new ArrayList<>((Tuple) left);
          joined.addAll((Tuple) right);
          return new Tuple(joined);
        }
        if (left instanceof List && right instanceof List && !(left instanceof Tuple)
            && !(right instanceof Tuple)) {
          checkLength((long) ((List<?>) left).size() + ((List<?>) right).size());
          final List<Object> joined = new ArrayList<>((List<?>) left);
          joined.addAll((List<?>) right);
          return joined;
        }
        break;
      case "*":
        if (ScriptValues.isIntegral(right) && (left instanceof String || left instanceof List)) {
          return repeat(left, ScriptValues.asLong(right));
        }
        if (ScriptValues.isIntegral(left) && (right instanceof String || right instanceof List)) {
          return repeat(right, ScriptValues.asLong(left));
        }
        break;
      default:
        break;
    }
    throw ScriptFault.type("unsupported operand type(s) for " + operator + ": '"
        + ScriptValues.typeName(left) + "' and '" + ScriptValues.typeName(right) + "'");
  }

  private static Object numeric(final String operator, final Object left, final Object right) {
    final boolean integral = ScriptValues.isIntegral(left) && ScriptValues.isIntegral(right);
    try {
      switch (operator) {
        case "+":
          return integral ? (Object) Math.addExact(ScriptValues.asLong(left),
              ScriptValues.asLong(right))
              : (Object) (ScriptValues.asDouble(left) + ScriptValues.asDouble(right));
        case "-":
          return integral ? (Object) Math.subtractExact(ScriptValues.asLong(left),
              ScriptValues.asLong(right))
              : (Object) (ScriptValues.asDouble(left) - ScriptValues.asDouble(right));
        case "*":
          return integral ? (Object) Math.multiplyExact(ScriptValues.asLong(left),
              ScriptValues.asLong(right))
              : (Object) (ScriptValues.asDouble(left) * ScriptValues.asDouble(right));
        case "/":
          if (ScriptValues.asDouble(right) == 0.0d) {
            throw new ScriptFault(Kind.ZERO_DIVISION_ERROR, "division by zero");
          }
          return ScriptValues.asDouble(left) / ScriptValues.asDouble(right);
        case "//":
          if (ScriptValues.asDouble(right) == 0.0d) {
            throw new ScriptFault(Kind.ZERO_DIVISION_ERROR,
                "integer division or modulo by zero");
          }
          if (integral) {
            final long dividend = ScriptValues.asLong(left);
            final long divisor = ScriptValues.asLong(right);
            // floorDiv wraps silently on this single pair
            if (dividend == Long.MIN_VALUE && divisor == -1L) {
              throw new ArithmeticException("long overflow");
            }
            return Math.floorDiv(dividend, divisor);
          }
          return Math.floor(ScriptValues.asDouble(left) / ScriptValues.asDouble(right));
        case "%":
          if (ScriptValues.asDouble(right) == 0.0d) {
            throw new ScriptFault(Kind.ZERO_DIVISION_ERROR,
                "integer division or modulo by zero");
          }
          if (integral) {
            return Math.floorMod(ScriptValues.asLong(left), ScriptValues.asLong(right));
          }
          final double dividend = ScriptValues.asDouble(left);
          final double divisor = ScriptValues.asDouble(right);
          return dividend - divisor * Math.floor(dividend / divisor);
        case "**":
          return power(left, right, integral);
        default:
          throw ScriptFault.type("unsupported operator " + operator);
      }
    } catch (ArithmeticException overflow) {
      throw new ScriptFault(Kind.RUNTIME_ERROR,
          "integer overflow in '" + operator + "'", overflow);
    }
  }

  private static Object power(final Object left, final Object right, final boolean integral) {
    if (integral && ScriptValues.asLong(right) >= 0L) {
      long base = ScriptValues.asLong(left);
      long exponent = ScriptValues.asLong(right);
      long result = 1L;
      while (exponent > 0) {
        if ((exponent & 1L) == 1L) {
          result = Math.multiplyExact(result, base);
        }
        exponent >>= 1;
        if (exponent > 0) {
          base = Math.multiplyExact(base, base);
        }
      }
      return result;
    }
    if (ScriptValues.asDouble(left) == 0.0d && ScriptValues.asDouble(right) < 0.0d) {
      throw new ScriptFault(Kind.ZERO_DIVISION_ERROR,
          "0.0 cannot be raised to a negative power");
    }
    return Math.pow(ScriptValues.asDouble(left), ScriptValues.asDouble(right));
  }

  private static Object repeat(final Object sequence, final long times) {
    final long unit = sequence instanceof String ? ((String) sequence).length()
        : ((List<?>) sequence).size();
    if (times <= 0L || unit == 0L) {
      return sequence instanceof String ? "" : sequence instanceof Tuple
          ? new Tuple(new ArrayList<>()) : new ArrayList<>();
    }
    checkLength(times > Builtins.maxSequenceLength ? times : unit * times);
    if (sequence instanceof String) {
      final StringBuilder repeated = new StringBuilder();
      for (long count = 0; count < times; count++) {
        repeated.append((String) sequence);
      }
      return repeated.toString();
    }
    final List<Object> repeated = new ArrayList<>();
    for (long count = 0; count < times; count++) {
      repeated.addAll((List<?>) sequence);
    }
    return sequence instanceof Tuple ? new Tuple(repeated) : repeated;
  }

  private static void checkLength(final long length) {
    if (length > Builtins.maxSequenceLength) {
      throw new ScriptFault(Kind.RUNTIME_ERROR, "sequence longer than "
          + Builtins.maxSequenceLength + " elements is not supported");
    }
  }

  private static boolean compare(final String operator, final Object left, final Object right) {
    switch (operator) {
      case "==":
        return ScriptValues.equal(left, right);
      case "!=":
        return !ScriptValues.equal(left, right);
      case "<":
        return ScriptValues.compare(left, right, operator) < 0;
      case "<=":
        return ScriptValues.compare(left, right, operator) <= 0;
      case ">":
        return ScriptValues.compare(left, right, operator) > 0;
      case ">=":
        return ScriptValues.compare(left, right, operator) >= 0;
      case "in":
        return ScriptValues.contains(right, left);
      case "not in":
        return !ScriptValues.contains(right, left);
      case "is":
        return identical(left, right);
      default:
        return !identical(left, right);
    }
  }

  private static boolean identical(final Object left, final Object right) {
    if (left == right) {
      return true;
    }
    // boxed immutables have no stable identity on the JVM
    if (left instanceof Boolean || left instanceof Long || left instanceof String) {
      return left.equals(right);
    }
    return false;
  }

  private static Object getItem(final Object container, final Object index) {
    if (container instanceof Map) {
      final Map<?, ?> dict = (Map<?, ?>) container;
      if (!dict.containsKey(index)) {
        throw new ScriptFault(Kind.KEY_ERROR, ScriptValues.repr(index));
      }
      return dict.get(index);
    }
    if (container instanceof List) {
      final List<?> list = (List<?>) container;
      return list.get(normalizeIndex(integerIndex(container, index), list.size(),
          ScriptValues.typeName(container) + " index"));
    }
    if (container instanceof String) {
      final String text = (String) container;
      final int at = normalizeIndex(integerIndex(container, index), text.length(), "string index");
      return String.valueOf(text.charAt(at));
    }
    throw ScriptFault
        .type("'" + ScriptValues.typeName(container) + "' object is not subscriptable");
  }

  @SuppressWarnings("unchecked")
  private static void setItem(final Object container, final Object index, final Object value) {
    if (container instanceof Map) {
      checkHashable(index);
      ((Map<Object, Object>) container).put(index, value);
      return;
    }
    if (container instanceof List && !(container instanceof Tuple)) {
      final List<Object> list = (List<Object>) container;
      list.set(normalizeIndex(integerIndex(container, index), list.size(),
          "list assignment index"), value);
      return;
    }
    throw ScriptFault.type(
        "'" + ScriptValues.typeName(container) + "' object does not support item assignment");
  }

  private static long integerIndex(final Object container, final Object index) {
    if (!ScriptValues.isIntegral(index)) {
      throw ScriptFault.type(ScriptValues.typeName(container) + " indices must be integers, not "
          + ScriptValues.typeName(index));
    }
    return ScriptValues.asLong(index);
  }

  static int normalizeIndex(final long index, final int size, final String what) {
    final long normalized = index < 0 ? index + size : index;
    if (normalized < 0 || normalized >= size) {
      throw new ScriptFault(Kind.INDEX_ERROR, what + " out of range");
    }
    return (int) normalized;
  }

  private static void checkHashable(final Object key) {
    if (key instanceof Map || key instanceof Set
        || (key instanceof List && !(key instanceof Tuple))) {
      throw ScriptFault.type("unhashable type: '" + ScriptValues.typeName(key) + "'");
    }
  }
}
