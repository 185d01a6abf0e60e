package com.github.hsm.script;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.hsm.script.ScriptFault.Kind;
import com.github.hsm.script.ScriptValues.Tuple;

/**
 * The fixed allow-list of functions a script can call, plus the small method surface available
 * on built-in values. The table is assembled once per process and never mutated.
 */
public final class Builtins {
  // ranges and repeated or concatenated sequences are materialized, cap their length
  static final int maxSequenceLength = 1_000_000;

  private static final Map<String, ScriptCallable> functions;
  private static final Map<String, Set<String>> methods;

  static {
    final Map<String, ScriptCallable> table = new LinkedHashMap<>();
    register(table, "print", (interpreter, args) -> {
      final StringBuilder line = new StringBuilder();
      for (final Object argument : args) {
        if (line.length() > 0) {
          line.append(' ');
        }
        line.append(ScriptValues.str(argument));
      }
      interpreter.print(line.toString());
      return null;
    });
    register(table, "len", (interpreter, args) -> {
      arity("len", args, 1, 1);
      return (long) length(args.get(0));
    });
    register(table, "abs", (interpreter, args) -> {
      arity("abs", args, 1, 1);
      final Object value = args.get(0);
      if (value instanceof Double) {
        return Math.abs((Double) value);
      }
      if (ScriptValues.isIntegral(value)) {
        final long number = ScriptValues.asLong(value);
        if (number == Long.MIN_VALUE) {
          throw new ScriptFault(Kind.RUNTIME_ERROR, "integer overflow in abs()");
        }
        return Math.abs(number);
      }
      throw ScriptFault.type("bad operand type for abs(): '" + ScriptValues.typeName(value) + "'");
    });
    register(table, "min", (interpreter, args) -> extreme("min", args, -1));
    register(table, "max", (interpreter, args) -> extreme("max", args, 1));
    register(table, "int", (interpreter, args) -> {
      arity("int", args, 0, 1);
      return args.isEmpty() ? 0L : toInt(args.get(0));
    });
    register(table, "float", (interpreter, args) -> {
      arity("float", args, 0, 1);
      return args.isEmpty() ? 0.0d : toFloat(args.get(0));
    });
    register(table, "str", (interpreter, args) -> {
      arity("str", args, 0, 1);
      return args.isEmpty() ? "" : ScriptValues.str(args.get(0));
    });
    register(table, "bool", (interpreter, args) -> {
      arity("bool", args, 0, 1);
      return !args.isEmpty() && ScriptValues.truthy(args.get(0));
    });
    register(table, "round", (interpreter, args) -> {
      arity("round", args, 1, 2);
      return round(args.get(0), args.size() == 2 ? args.get(1) : null);
    });
    register(table, "list", (interpreter, args) -> {
      arity("list", args, 0, 1);
      return args.isEmpty() ? new ArrayList<>() : ScriptValues.iterate(args.get(0));
    });
    register(table, "tuple", (interpreter, args) -> {
      arity("tuple", args, 0, 1);
      return args.isEmpty() ? Tuple.of() : new Tuple(ScriptValues.iterate(args.get(0)));
    });
    register(table, "set", (interpreter, args) -> {
      arity("set", args, 0, 1);
      return args.isEmpty() ? new LinkedHashSet<>()
          : new LinkedHashSet<>(ScriptValues.iterate(args.get(0)));
    });
    register(table, "dict", (interpreter, args) -> {
      arity("dict", args, 0, 1);
      return args.isEmpty() ? new LinkedHashMap<>() : toDict(args.get(0));
    });
    register(table, "range", (interpreter, args) -> range(args));
    register(table, "sorted", (interpreter, args) -> {
      arity("sorted", args, 1, 1);
      final List<Object> sorted = ScriptValues.iterate(args.get(0));
      sorted.sort((left, right) -> ScriptValues.compare(left, right, "<"));
      return sorted;
    });
    register(table, "sum", (interpreter, args) -> {
      arity("sum", args, 1, 2);
      Object total = args.size() == 2 ? args.get(1) : 0L;
      for (final Object element : ScriptValues.iterate(args.get(0))) {
        total = Interpreter.arithmetic("+", total, element);
      }
      return total;
    });
    register(table, "all", (interpreter, args) -> {
      arity("all", args, 1, 1);
      for (final Object element : ScriptValues.iterate(args.get(0))) {
        if (!ScriptValues.truthy(element)) {
          return false;
        }
      }
      return true;
    });
    register(table, "any", (interpreter, args) -> {
      arity("any", args, 1, 1);
      for (final Object element : ScriptValues.iterate(args.get(0))) {
        if (ScriptValues.truthy(element)) {
          return true;
        }
      }
      return false;
    });
    register(table, "isinstance", (interpreter, args) -> {
      arity("isinstance", args, 2, 2);
      return isInstance(args.get(0), args.get(1));
    });
    register(table, "hasattr", (interpreter, args) -> {
      arity("hasattr", args, 2, 2);
      if (!(args.get(1) instanceof String)) {
        throw ScriptFault.type("hasattr(): attribute name must be string");
      }
      return hasMethod(args.get(0), (String) args.get(1));
    });
    functions = Collections.unmodifiableMap(table);

    final Map<String, Set<String>> surface = new HashMap<>();
    surface.put("str", names("upper", "lower", "strip", "startswith", "endswith", "split",
        "replace", "join", "find", "count"));
    surface.put("list",
        names("append", "pop", "extend", "insert", "remove", "index", "count", "clear"));
    surface.put("tuple", names("index", "count"));
    surface.put("dict", names("get", "keys", "values", "items", "pop", "update", "clear"));
    surface.put("set", names("add", "discard", "clear"));
    methods = Collections.unmodifiableMap(surface);
  }

  public static boolean isBuiltin(final String name) {
    return functions.containsKey(name);
  }

  static ScriptCallable lookup(final String name) {
    return functions.get(name);
  }

  static boolean hasMethod(final Object receiver, final String name) {
    final Set<String> available = methods.get(ScriptValues.typeName(receiver));
    return available != null && available.contains(name);
  }

  static ScriptCallable bindMethod(final Object receiver, final String name) {
    if (!hasMethod(receiver, name)) {
      throw new ScriptFault(Kind.ATTRIBUTE_ERROR,
          "'" + ScriptValues.typeName(receiver) + "' object has no attribute '" + name + "'");
    }
    return new BoundMethod(receiver, name);
  }

  ///// function bodies /////
  private static void register(final Map<String, ScriptCallable> table, final String name,
      final Body body) {
    table.put(name, new BuiltinFunction(name, body));
  }

  private static Set<String> names(final String... names) {
    return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
  }

  static void arity(final String name, final List<Object> args, final int min, final int max) {
    if (args.size() < min || args.size() > max) {
      final String expected = min == max ? String.valueOf(min) : min + " to " + max;
      throw ScriptFault.type(
          name + "() takes " + expected + " argument(s) but " + args.size() + " were given");
    }
  }

  private static int length(final Object value) {
    if (value instanceof String) {
      return ((String) value).length();
    }
    if (value instanceof java.util.Collection) {
      return ((java.util.Collection<?>) value).size();
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).size();
    }
    throw ScriptFault.type("object of type '" + ScriptValues.typeName(value) + "' has no len()");
  }

  private static Object extreme(final String name, final List<Object> args, final int sign) {
    if (args.isEmpty()) {
      throw ScriptFault.type(name + " expected at least 1 argument, got 0");
    }
    final List<Object> candidates =
        args.size() == 1 ? ScriptValues.iterate(args.get(0)) : new ArrayList<>(args);
    if (candidates.isEmpty()) {
      throw new ScriptFault(Kind.VALUE_ERROR, name + "() arg is an empty sequence");
    }
    Object best = candidates.get(0);
    for (final Object candidate : candidates.subList(1, candidates.size())) {
      if (ScriptValues.compare(candidate, best, sign > 0 ? ">" : "<") * sign > 0) {
        best = candidate;
      }
    }
    return best;
  }

  static long toInt(final Object value) {
    if (ScriptValues.isIntegral(value)) {
      return ScriptValues.asLong(value);
    }
    if (value instanceof Double) {
      final double number = (Double) value;
      if (Double.isNaN(number) || Double.isInfinite(number)) {
        throw new ScriptFault(Kind.VALUE_ERROR,
            "cannot convert float " + ScriptValues.repr(value) + " to integer");
      }
      // the cast saturates, out of range values must fail instead
      if (number >= 0x1p63 || number < -0x1p63) {
        throw new ScriptFault(Kind.RUNTIME_ERROR, "integer overflow in int()");
      }
      return (long) number;
    }
    if (value instanceof String) {
      try {
        return Long.parseLong(((String) value).trim());
      } catch (NumberFormatException notANumber) {
        throw new ScriptFault(Kind.VALUE_ERROR,
            "invalid literal for int() with base 10: " + ScriptValues.repr(value));
      }
    }
    throw ScriptFault.type("int() argument must be a string or a number, not '"
        + ScriptValues.typeName(value) + "'");
  }

  static double toFloat(final Object value) {
    if (ScriptValues.isNumber(value)) {
      return ScriptValues.asDouble(value);
    }
    if (value instanceof String) {
      final String text = ((String) value).trim().toLowerCase();
      switch (text) {
        case "inf":
        case "+inf":
        case "infinity":
          return Double.POSITIVE_INFINITY;
        case "-inf":
        case "-infinity":
          return Double.NEGATIVE_INFINITY;
        case "nan":
          return Double.NaN;
        default:
          try {
            return Double.parseDouble(text);
          } catch (NumberFormatException notANumber) {
            throw new ScriptFault(Kind.VALUE_ERROR,
                "could not convert string to float: " + ScriptValues.repr(value));
          }
      }
    }
    throw ScriptFault.type("float() argument must be a string or a number, not '"
        + ScriptValues.typeName(value) + "'");
  }

  private static Object round(final Object value, final Object digits) {
    if (!ScriptValues.isNumber(value)) {
      throw ScriptFault.type(
          "type " + ScriptValues.typeName(value) + " doesn't define __round__ method");
    }
    if (digits != null && !ScriptValues.isIntegral(digits)) {
      throw ScriptFault.type("'" + ScriptValues.typeName(digits)
          + "' object cannot be interpreted as an integer");
    }
    if (ScriptValues.isIntegral(value)) {
      return ScriptValues.asLong(value);
    }
    final double number = (Double) value;
    if (Double.isNaN(number) || Double.isInfinite(number)) {
      if (digits == null) {
        throw new ScriptFault(Kind.VALUE_ERROR, "cannot convert float to integer");
      }
      return number;
    }
    // half-even on the exact binary value, round(2.5) == 2
    final int scale = digits == null ? 0 : (int) ScriptValues.asLong(digits);
    final BigDecimal rounded = new BigDecimal(number).setScale(scale, RoundingMode.HALF_EVEN);
    if (digits != null) {
      return rounded.doubleValue();
    }
    try {
      return rounded.longValueExact();
    } catch (ArithmeticException overflow) {
      throw new ScriptFault(Kind.RUNTIME_ERROR, "integer overflow in round()");
    }
  }

  private static Map<Object, Object> toDict(final Object value) {
    final Map<Object, Object> dict = new LinkedHashMap<>();
    if (value instanceof Map) {
      dict.putAll((Map<?, ?>) value);
      return dict;
    }
    for (final Object pair : ScriptValues.iterate(value)) {
      final List<Object> entry = ScriptValues.iterate(pair);
      if (entry.size() != 2) {
        throw new ScriptFault(Kind.VALUE_ERROR, "dictionary update sequence element has length "
            + entry.size() + "; 2 is required");
      }
      dict.put(entry.get(0), entry.get(1));
    }
    return dict;
  }

  private static List<Object> range(final List<Object> args) {
    arity("range", args, 1, 3);
    for (final Object argument : args) {
      if (!ScriptValues.isIntegral(argument)) {
        throw ScriptFault.type("'" + ScriptValues.typeName(argument)
            + "' object cannot be interpreted as an integer");
      }
    }
    final long start = args.size() == 1 ? 0L : ScriptValues.asLong(args.get(0));
    final long stop = ScriptValues.asLong(args.get(args.size() == 1 ? 0 : 1));
    final long step = args.size() == 3 ? ScriptValues.asLong(args.get(2)) : 1L;
    if (step == 0L) {
      throw new ScriptFault(Kind.VALUE_ERROR, "range() arg 3 must not be zero");
    }
    final List<Object> values = new ArrayList<>();
    for (long current = start; step > 0 ? current < stop : current > stop; current += step) {
      if (values.size() >= maxSequenceLength) {
        throw new ScriptFault(Kind.VALUE_ERROR,
            "range() longer than " + maxSequenceLength + " elements is not supported");
      }
      values.add(current);
    }
    return new Tuple(values);
  }

  private static boolean isInstance(final Object value, final Object type) {
    if (type instanceof Tuple) {
      for (final Object candidate : (Tuple) type) {
        if (isInstance(value, candidate)) {
          return true;
        }
      }
      return false;
    }
    if (!(type instanceof BuiltinFunction)) {
      throw ScriptFault.type("isinstance() arg 2 must be a type or tuple of types");
    }
    final String typeName = ((BuiltinFunction) type).getName();
    final String actual = ScriptValues.typeName(value);
    switch (typeName) {
      case "int":
        return actual.equals("int") || actual.equals("bool");
      case "float":
      case "str":
      case "bool":
      case "list":
      case "tuple":
      case "dict":
      case "set":
        return actual.equals(typeName);
      default:
        throw ScriptFault.type("isinstance() arg 2 must be a type or tuple of types");
    }
  }

  ///// methods on values /////
  @SuppressWarnings("unchecked")
  private static Object invokeMethod(final Object receiver, final String name,
      final List<Object> args) {
    if (receiver instanceof String) {
      return stringMethod((String) receiver, name, args);
    }
    if (receiver instanceof Tuple) {
      return sequenceMethod((Tuple) receiver, name, args);
    }
    if (receiver instanceof List) {
      return listMethod((List<Object>) receiver, name, args);
    }
    if (receiver instanceof Map) {
      return dictMethod((Map<Object, Object>) receiver, name, args);
    }
    return setMethod((Set<Object>) receiver, name, args);
  }

  private static Object stringMethod(final String text, final String name,
      final List<Object> args) {
    switch (name) {
      case "upper":
        arity(name, args, 0, 0);
        return text.toUpperCase();
      case "lower":
        arity(name, args, 0, 0);
        return text.toLowerCase();
      case "strip":
        arity(name, args, 0, 0);
        return text.trim();
      case "startswith":
        arity(name, args, 1, 1);
        return text.startsWith(stringArgument(name, args.get(0)));
      case "endswith":
        arity(name, args, 1, 1);
        return text.endsWith(stringArgument(name, args.get(0)));
      case "split": {
        arity(name, args, 0, 1);
        final List<Object> parts = new ArrayList<>();
        if (args.isEmpty()) {
          for (final String part : text.trim().split("\\s+")) {
            if (!part.isEmpty()) {
              parts.add(part);
            }
          }
        } else {
          final String separator = stringArgument(name, args.get(0));
          if (separator.isEmpty()) {
            throw new ScriptFault(Kind.VALUE_ERROR, "empty separator");
          }
          int from = 0;
          int at;
          while ((at = text.indexOf(separator, from)) >= 0) {
            parts.add(text.substring(from, at));
            from = at + separator.length();
          }
          parts.add(text.substring(from));
        }
        return parts;
      }
      case "replace":
        arity(name, args, 2, 2);
        return text.replace(stringArgument(name, args.get(0)), stringArgument(name, args.get(1)));
      case "join": {
        arity(name, args, 1, 1);
        final StringBuilder joined = new StringBuilder();
        boolean first = true;
        for (final Object element : ScriptValues.iterate(args.get(0))) {
          if (!first) {
            joined.append(text);
          }
          first = false;
          joined.append(stringArgument(name, element));
        }
        return joined.toString();
      }
      case "find":
        arity(name, args, 1, 1);
        return (long) text.indexOf(stringArgument(name, args.get(0)));
      default: {
        arity(name, args, 1, 1);
        final String needle = stringArgument(name, args.get(0));
        if (needle.isEmpty()) {
          return (long) text.length() + 1;
        }
        long count = 0;
        int from = 0;
        int at;
        while ((at = text.indexOf(needle, from)) >= 0) {
          count++;
          from = at + needle.length();
        }
        return count;
      }
    }
  }

  private static Object sequenceMethod(final List<Object> sequence, final String name,
      final List<Object> args) {
    arity(name, args, 1, 1);
    if (name.equals("count")) {
      long count = 0;
      for (final Object element : sequence) {
        if (ScriptValues.equal(element, args.get(0))) {
          count++;
        }
      }
      return count;
    }
    for (int index = 0; index < sequence.size(); index++) {
      if (ScriptValues.equal(sequence.get(index), args.get(0))) {
        return (long) index;
      }
    }
    throw new ScriptFault(Kind.VALUE_ERROR,
        ScriptValues.repr(args.get(0)) + " is not in " + ScriptValues.typeName(sequence));
  }

  private static Object listMethod(final List<Object> list, final String name,
      final List<Object> args) {
    switch (name) {
      case "append":
        arity(name, args, 1, 1);
        list.add(args.get(0));
        return null;
      case "extend":
        arity(name, args, 1, 1);
        list.addAll(ScriptValues.iterate(args.get(0)));
        return null;
      case "insert": {
        arity(name, args, 2, 2);
        final int size = list.size();
        long at = Builtins.toInt(args.get(0));
        if (at < 0) {
          at = Math.max(0, at + size);
        }
        list.add((int) Math.min(at, size), args.get(1));
        return null;
      }
      case "pop": {
        arity(name, args, 0, 1);
        if (list.isEmpty()) {
          throw new ScriptFault(Kind.INDEX_ERROR, "pop from empty list");
        }
        final long at = args.isEmpty() ? list.size() - 1 : Builtins.toInt(args.get(0));
        return list.remove(Interpreter.normalizeIndex(at, list.size(), "pop index"));
      }
      case "remove":
        arity(name, args, 1, 1);
        for (int index = 0; index < list.size(); index++) {
          if (ScriptValues.equal(list.get(index), args.get(0))) {
            list.remove(index);
            return null;
          }
        }
        throw new ScriptFault(Kind.VALUE_ERROR, "list.remove(x): x not in list");
      case "clear":
        arity(name, args, 0, 0);
        list.clear();
        return null;
      default:
        return sequenceMethod(list, name, args);
    }
  }

  private static Object dictMethod(final Map<Object, Object> dict, final String name,
      final List<Object> args) {
    switch (name) {
      case "get":
        arity(name, args, 1, 2);
        return dict.containsKey(args.get(0)) ? dict.get(args.get(0))
            : (args.size() == 2 ? args.get(1) : null);
      case "keys":
        arity(name, args, 0, 0);
        return new ArrayList<>(dict.keySet());
      case "values":
        arity(name, args, 0, 0);
        return new ArrayList<>(dict.values());
      case "items": {
        arity(name, args, 0, 0);
        final List<Object> items = new ArrayList<>();
        for (final Map.Entry<Object, Object> entry : dict.entrySet()) {
          items.add(Tuple.of(entry.getKey(), entry.getValue()));
        }
        return items;
      }
      case "pop":
        arity(name, args, 1, 2);
        if (dict.containsKey(args.get(0))) {
          return dict.remove(args.get(0));
        }
        if (args.size() == 2) {
          return args.get(1);
        }
        throw new ScriptFault(Kind.KEY_ERROR, ScriptValues.repr(args.get(0)));
      case "update":
        arity(name, args, 1, 1);
        dict.putAll(toDict(args.get(0)));
        return null;
      default:
        arity(name, args, 0, 0);
        dict.clear();
        return null;
    }
  }

  private static Object setMethod(final Set<Object> set, final String name,
      final List<Object> args) {
    switch (name) {
      case "add":
        arity(name, args, 1, 1);
        set.add(args.get(0));
        return null;
      case "discard":
        arity(name, args, 1, 1);
        set.remove(args.get(0));
        return null;
      default:
        arity(name, args, 0, 0);
        set.clear();
        return null;
    }
  }

  private static String stringArgument(final String method, final Object value) {
    if (!(value instanceof String)) {
      throw ScriptFault.type(
          method + "() argument must be str, not " + ScriptValues.typeName(value));
    }
    return (String) value;
  }

  @FunctionalInterface
  private interface Body {
    Object apply(Interpreter interpreter, List<Object> arguments);
  }

  static final class BuiltinFunction implements ScriptCallable {
    private final String name;
    private final Body body;

    private BuiltinFunction(final String name, final Body body) {
      this.name = name;
      this.body = body;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public Object call(final Interpreter interpreter, final List<Object> arguments) {
      return body.apply(interpreter, arguments);
    }
  }

  static final class BoundMethod implements ScriptCallable {
    private final Object receiver;
    private final String name;

    private BoundMethod(final Object receiver, final String name) {
      this.receiver = receiver;
      this.name = name;
    }

    @Override
    public String getName() {
      return ScriptValues.typeName(receiver) + "." + name;
    }

    @Override
    public Object call(final Interpreter interpreter, final List<Object> arguments) {
      return invokeMethod(receiver, name, arguments);
    }
  }

  private Builtins() {}
}
