package com.github.hsm.script;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Static safety checks run on every script before it is allowed anywhere near the interpreter.
 * The script is parsed once and the tree is walked looking for module loading, calls to
 * reflective or I/O-capable functions and access to introspection attributes.
 *
 * Notes for users:<br>
 * 1. this is a best-effort block-list/allow-list and not a security boundary<br>
 * 2. calls to unknown names that are not on the deny-list are tolerated so that scripts using
 * their own variables as call targets are not rejected; the allow-list of builtins is a set of
 * recommended defaults, see {@link Builtins}<br>
 * 3. instances are stateless and may be shared<br>
 */
public final class SafetyAnalyzer {
  private static final Logger logger = LogManager.getLogger(SafetyAnalyzer.class.getSimpleName());

  static final Set<String> deniedCalls = set("eval", "exec", "compile", "open", "input",
      "getattr", "setattr", "delattr", "globals", "locals", "vars", "__import__", "memoryview",
      "bytearray", "bytes");

  // protocol dunders that ordinary expressions are allowed to name
  static final Set<String> allowedDunderAttributes = set("__len__", "__getitem__",
      "__setitem__", "__delitem__", "__contains__", "__add__", "__sub__", "__mul__",
      "__truediv__", "__floordiv__", "__mod__", "__pow__", "__eq__", "__ne__", "__lt__", "__le__",
      "__gt__", "__ge__", "__iter__", "__next__", "__call__", "__str__", "__repr__", "__bool__",
      "__hash__", "__abs__");

  static final Set<String> deniedAttributes;
  static {
    final Set<String> denied = new HashSet<>(Arrays.asList("__globals__", "__builtins__",
        "__code__", "__closure__", "__self__", "__class__", "__bases__", "__subclasses__",
        "__mro__", "__init__", "__new__", "__del__", "__dict__", "__getattribute__",
        "__setattr__", "__delattr__", "__get__", "__set__", "__delete__", "__init_subclass__",
        "__prepare__", "f_locals", "f_globals", "f_builtins", "f_code", "f_back", "f_trace",
        "gi_frame", "gi_code", "gi_running", "gi_yieldfrom", "co_code", "co_consts", "co_names",
        "co_varnames", "co_freevars", "co_cellvars", "func_code", "func_globals",
        "func_builtins", "func_closure", "func_defaults", "__file__", "__cached__", "__loader__",
        "__package__", "__spec__", "_as_parameter_", "_fields_", "_length_", "_type_",
        "__annotations__", "__qualname__", "__module__", "__slots__", "__weakref__",
        "__set_name__", "format_map", "mro", "with_traceback"));
    denied.removeAll(allowedDunderAttributes);
    deniedAttributes = Collections.unmodifiableSet(denied);
  }

  /**
   * Analyze a script. Blank scripts are always safe.
   *
   * @param knownVariableNames names currently bound in the scope the script will run against
   */
  public SafetyReport analyze(final String script, final Set<String> knownVariableNames) {
    if (script == null || script.trim().isEmpty()) {
      return SafetyReport.safe(null);
    }
    final Ast.Script tree;
    try {
      tree = Parser.parseScript(script);
    } catch (ScriptFault syntaxError) {
      return SafetyReport.syntaxError(syntaxError.getMessage());
    } catch (StackOverflowError tooDeep) {
      return SafetyReport.unsafe(Collections.singletonList(
          "Unexpected error during code safety check: script is nested too deeply"));
    }
    final ViolationCollector collector = new ViolationCollector(
        knownVariableNames == null ? Collections.<String>emptySet() : knownVariableNames);
    try {
      tree.accept(collector);
    } catch (StackOverflowError tooDeep) {
      collector.violations
          .add("Unexpected error during code safety check: script is nested too deeply");
    }
    if (collector.violations.isEmpty()) {
      return SafetyReport.safe(tree);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Rejected script '" + script + "': " + collector.violations);
    }
    return SafetyReport.unsafe(collector.violations);
  }

  private static Set<String> set(final String... values) {
    return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(values)));
  }

  private static boolean isDunder(final String name) {
    return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
  }

  private static final class ViolationCollector extends Ast.TreeWalker {
    private final List<String> violations = new ArrayList<>();
    private final Set<String> knownVariableNames;

    private ViolationCollector(final Set<String> knownVariableNames) {
      this.knownVariableNames = knownVariableNames;
    }

    @Override
    public Void visitImport(final Ast.Import node) {
      if (node.isFromImport()) {
        violations
            .add("SecurityError: From-imports (from ... import) are not allowed in FSM code.");
      } else {
        violations.add("SecurityError: Imports (import) are not allowed in FSM code.");
      }
      return null;
    }

    @Override
    public Void visitCall(final Ast.Call node) {
      if (node.getFunction() instanceof Ast.Name) {
        final String name = ((Ast.Name) node.getFunction()).getId();
        if (deniedCalls.contains(name)) {
          violations.add("SecurityError: Calling the function '" + name + "' is not allowed.");
        } else if (!Builtins.isBuiltin(name) && !knownVariableNames.contains(name)) {
          // tolerated, runtime resolution decides whether the name is callable at all
          if (logger.isDebugEnabled()) {
            logger.debug("Tolerating call to unknown name '" + name + "'");
          }
        }
      }
      walkChildren(node);
      return null;
    }

    @Override
    public Void visitAttribute(final Ast.Attribute node) {
      final String name = node.getName();
      if (deniedAttributes.contains(name)) {
        violations.add("SecurityError: Access to the attribute '" + name + "' is restricted.");
      } else if (isDunder(name) && !allowedDunderAttributes.contains(name)) {
        violations
            .add("SecurityError: Access to the special attribute '" + name + "' is restricted.");
      }
      walkChildren(node);
      return null;
    }
  }
}
