package com.github.hsm.script;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Value semantics shared by the interpreter and the builtins. Script values are plain Java
 * objects: Long (int), Double (float), String, Boolean, null (None), ArrayList (list),
 * {@link Tuple}, LinkedHashMap (dict), LinkedHashSet (set) and {@link ScriptCallable}.
 */
public final class ScriptValues {

  public static String typeName(final Object value) {
    if (value == null) {
      return "NoneType";
    }
    if (value instanceof Boolean) {
      return "bool";
    }
    if (value instanceof Long) {
      return "int";
    }
    if (value instanceof Double) {
      return "float";
    }
    if (value instanceof String) {
      return "str";
    }
    if (value instanceof Tuple) {
      return "tuple";
    }
    if (value instanceof List) {
      return "list";
    }
    if (value instanceof Map) {
      return "dict";
    }
    if (value instanceof Set) {
      return "set";
    }
    if (value instanceof ScriptCallable) {
      return "builtin_function_or_method";
    }
    return value.getClass().getSimpleName();
  }

  public static boolean truthy(final Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Long) {
      return (Long) value != 0L;
    }
    if (value instanceof Double) {
      return (Double) value != 0.0d;
    }
    if (value instanceof String) {
      return !((String) value).isEmpty();
    }
    if (value instanceof Collection) {
      return !((Collection<?>) value).isEmpty();
    }
    if (value instanceof Map) {
      return !((Map<?, ?>) value).isEmpty();
    }
    return true;
  }

  static boolean isNumber(final Object value) {
    return value instanceof Long || value instanceof Double || value instanceof Boolean;
  }

  static boolean isIntegral(final Object value) {
    return value instanceof Long || value instanceof Boolean;
  }

  static long asLong(final Object value) {
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1L : 0L;
    }
    return (Long) value;
  }

  static double asDouble(final Object value) {
    if (value instanceof Double) {
      return (Double) value;
    }
    return asLong(value);
  }

  /**
   * The str() form of a value: strings print bare, everything else prints as its repr.
   */
  public static String str(final Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    return repr(value);
  }

  public static String repr(final Object value) {
    return repr(value, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  // containers already on the path print as [...], {...} or (...)
  private static String repr(final Object value, final Set<Object> path) {
    if (value == null) {
      return "None";
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "True" : "False";
    }
    if (value instanceof Double) {
      return reprDouble((Double) value);
    }
    if (value instanceof String) {
      return "'" + ((String) value).replace("\\", "\\\\").replace("'", "\\'").replace("\n",
          "\\n") + "'";
    }
    if (value instanceof ScriptCallable) {
      return "<built-in function " + ((ScriptCallable) value).getName() + ">";
    }
    if (!(value instanceof Collection) && !(value instanceof Map)) {
      return String.valueOf(value);
    }
    if (value instanceof Set && ((Set<?>) value).isEmpty()) {
      return "set()";
    }
    final String open = value instanceof Tuple ? "(" : value instanceof List ? "[" : "{";
    final String close = value instanceof Tuple ? ")" : value instanceof List ? "]" : "}";
    if (!path.add(value)) {
      return open + "..." + close;
    }
    try {
      if (value instanceof Map) {
        final StringBuilder builder = new StringBuilder(open);
        boolean first = true;
        for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
          if (!first) {
            builder.append(", ");
          }
          first = false;
          builder.append(repr(entry.getKey(), path)).append(": ")
              .append(repr(entry.getValue(), path));
        }
        return builder.append(close).toString();
      }
      if (value instanceof Tuple && ((Tuple) value).size() == 1) {
        return open + repr(((Tuple) value).get(0), path) + ",)";
      }
      return join((Collection<?>) value, open, close, path);
    } finally {
      path.remove(value);
    }
  }

  private static String reprDouble(final double value) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e16) {
      return String.valueOf((long) value) + ".0";
    }
    return String.valueOf(value);
  }

  private static String join(final Collection<?> values, final String open, final String close,
      final Set<Object> path) {
    final StringBuilder builder = new StringBuilder(open);
    boolean first = true;
    for (final Object element : values) {
      if (!first) {
        builder.append(", ");
      }
      first = false;
      builder.append(repr(element, path));
    }
    return builder.append(close).toString();
  }

  /**
   * Script equality: numbers compare by value across int/float/bool, containers compare
   * element-wise.
   */
  public static boolean equal(final Object left, final Object right) {
    if (left == right) {
      return true;
    }
    if (left == null || right == null) {
      return false;
    }
    if (isNumber(left) && isNumber(right)) {
      if (isIntegral(left) && isIntegral(right)) {
        return asLong(left) == asLong(right);
      }
      return asDouble(left) == asDouble(right);
    }
    if (left instanceof Tuple != right instanceof Tuple) {
      return false;
    }
    if (left instanceof List && right instanceof List) {
      final List<?> first = (List<?>) left;
      final List<?> second = (List<?>) right;
      if (first.size() != second.size()) {
        return false;
      }
      for (int index = 0; index < first.size(); index++) {
        if (!equal(first.get(index), second.get(index))) {
          return false;
        }
      }
      return true;
    }
    if (left instanceof Map && right instanceof Map) {
      final Map<?, ?> first = (Map<?, ?>) left;
      final Map<?, ?> second = (Map<?, ?>) right;
      if (first.size() != second.size()) {
        return false;
      }
      for (final Map.Entry<?, ?> entry : first.entrySet()) {
        if (!second.containsKey(entry.getKey())
            || !equal(entry.getValue(), second.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    return left.equals(right);
  }

  /**
   * Ordering for {@code < <= > >=}, sorted(), min() and max().
   */
  public static int compare(final Object left, final Object right, final String operator) {
    if (isNumber(left) && isNumber(right)) {
      if (isIntegral(left) && isIntegral(right)) {
        return Long.compare(asLong(left), asLong(right));
      }
      return Double.compare(asDouble(left), asDouble(right));
    }
    if (left instanceof String && right instanceof String) {
      return ((String) left).compareTo((String) right);
    }
    if (left instanceof List && right instanceof List
        && (left instanceof Tuple == right instanceof Tuple)) {
      final List<?> first = (List<?>) left;
      final List<?> second = (List<?>) right;
      for (int index = 0; index < Math.min(first.size(), second.size()); index++) {
        if (!equal(first.get(index), second.get(index))) {
          return compare(first.get(index), second.get(index), operator);
        }
      }
      return Integer.compare(first.size(), second.size());
    }
    throw ScriptFault.type("'" + operator + "' not supported between instances of '"
        + typeName(left) + "' and '" + typeName(right) + "'");
  }

  static boolean contains(final Object container, final Object element) {
    if (container instanceof String) {
      if (!(element instanceof String)) {
        throw ScriptFault.type("'in <string>' requires string as left operand, not "
            + typeName(element));
      }
      return ((String) container).contains((String) element);
    }
    if (container instanceof Map) {
      return ((Map<?, ?>) container).containsKey(element);
    }
    if (container instanceof Set) {
      return ((Set<?>) container).contains(element);
    }
    if (container instanceof List) {
      for (final Object candidate : (List<?>) container) {
        if (equal(candidate, element)) {
          return true;
        }
      }
      return false;
    }
    throw ScriptFault.type("argument of type '" + typeName(container) + "' is not iterable");
  }

  /**
   * Materialize anything iterable into a list snapshot.
   */
  static List<Object> iterate(final Object value) {
    final List<Object> elements = new ArrayList<>();
    if (value instanceof String) {
      final String text = (String) value;
      for (int index = 0; index < text.length(); index++) {
        elements.add(String.valueOf(text.charAt(index)));
      }
    } else if (value instanceof Collection) {
      elements.addAll((Collection<?>) value);
    } else if (value instanceof Map) {
      elements.addAll(((Map<?, ?>) value).keySet());
    } else {
      throw ScriptFault.type("'" + typeName(value) + "' object is not iterable");
    }
    return elements;
  }

  /**
   * Immutable sequence backing the script's tuple type.
   */
  public static final class Tuple extends AbstractList<Object> {
    private final Object[] elements;

    public Tuple(final Collection<?> elements) {
      this.elements = elements.toArray();
    }

    public static Tuple of(final Object... elements) {
      return new Tuple(Arrays.asList(elements));
    }

    @Override
    public Object get(final int index) {
      return elements[index];
    }

    @Override
    public int size() {
      return elements.length;
    }

    @Override
    public Iterator<Object> iterator() {
      return Arrays.asList(elements).iterator();
    }
  }

  private ScriptValues() {}
}
