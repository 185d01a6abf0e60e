package com.github.hsm;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hsm.StateMachineException.Code;
import com.github.hsm.script.Ast;
import com.github.hsm.script.Interpreter;
import com.github.hsm.script.Parser;
import com.github.hsm.script.SafetyAnalyzer;
import com.github.hsm.script.SafetyReport;
import com.github.hsm.script.ScriptFault;
import com.github.hsm.script.ScriptValues;

/**
 * Turns script text into callables bound to one machine level: its scope, its action log, its
 * current state and its halt policy. Every distinct script text is analyzed once and compiled
 * once per (text, kind); both caches live as long as the simulator that owns this executor,
 * resets included.
 *
 * Script faults never leave this class as {@link ScriptFault}. They are written to the action log
 * and, for actions under haltOnActionError only, converted into
 * {@link Code#SIMULATION_HALTED}.
 */
final class ScriptExecutor {
  private static final Logger logger = LogManager.getLogger(ScriptExecutor.class.getSimpleName());
  private static final SafetyAnalyzer analyzer = new SafetyAnalyzer();

  private final String machineId;
  private final Map<String, Object> scope;
  private final ActionLog actionLog;
  private final Supplier<String> stateContext;
  private final boolean haltOnActionError;
  private final Runnable haltCallback;
  private final SimulationStatistics statistics;
  private final Map<String, CompiledScript> registry = new HashMap<>();
  // by text alone, an unsafe script is reported once whatever it is used for
  private final Map<String, SafetyReport> reports = new HashMap<>();

  ScriptExecutor(final String machineId, final Map<String, Object> scope,
      final ActionLog actionLog, final Supplier<String> stateContext,
      final boolean haltOnActionError, final Runnable haltCallback,
      final SimulationStatistics statistics) {
    this.machineId = machineId;
    this.scope = scope;
    this.actionLog = actionLog;
    this.stateContext = stateContext;
    this.haltOnActionError = haltOnActionError;
    this.haltCallback = haltCallback;
    this.statistics = statistics;
  }

  /**
   * Compile an action script. Null or blank text yields null: there is nothing to run.
   */
  ScriptAction action(final String script, final String label) {
    if (StateSpec.blankToNull(script) == null) {
      return null;
    }
    final CompiledScript compiled = compile(script, ScriptKind.ACTION, label);
    if (!compiled.report.isSafe()) {
      return () -> actionLog
          .log("[Action Blocked by Safety Check] Unsafe code ignored: '" + script + "'.");
    }
    return () -> runAction(compiled, label);
  }

  /**
   * Compile a guard. Null or blank text yields null, which callers treat as always true.
   */
  ScriptCondition condition(final String script, final String label) {
    if (StateSpec.blankToNull(script) == null) {
      return null;
    }
    final CompiledScript compiled = compile(script, ScriptKind.CONDITION, label);
    if (!compiled.report.isSafe()) {
      return () -> {
        actionLog.log("[Condition Blocked by Safety Check] Unsafe code: '" + script
            + "' evaluated as False.");
        return false;
      };
    }
    return () -> evaluateCondition(compiled, label);
  }

  int registrySize() {
    return registry.size();
  }

  private CompiledScript compile(final String script, final ScriptKind kind, final String label) {
    final String key = kind.name() + ':' + script;
    CompiledScript compiled = registry.get(key);
    if (compiled != null) {
      return compiled;
    }
    final SafetyReport report = analyze(script, label);
    if (!report.isSafe()) {
      compiled = new CompiledScript(script, report, null, null);
    } else if (kind == ScriptKind.CONDITION) {
      Ast.Node expression = null;
      ScriptFault syntaxFault = null;
      try {
        expression = Parser.parseExpression(script);
      } catch (ScriptFault fault) {
        // surfaced on every evaluation, the guard just never holds
        syntaxFault = fault;
      }
      compiled = new CompiledScript(script, report, expression, syntaxFault);
    } else {
      compiled = new CompiledScript(script, report, null, null);
    }
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] Compiled ")
          .append(kind).append(" '").append(label).append("': ").append(report.getVerdict())
          .toString());
    }
    registry.put(key, compiled);
    return compiled;
  }

  private SafetyReport analyze(final String script, final String label) {
    SafetyReport report = reports.get(script);
    if (report == null) {
      report = analyzer.analyze(script, scope.keySet());
      reports.put(script, report);
      if (!report.isSafe()) {
        statistics.scriptsBlocked++;
        actionLog.log("[Safety Check Failed] SecurityError: Code execution blocked for '" + label
            + "'. Reason: " + report.getReason());
      }
    }
    return report;
  }

  private void runAction(final CompiledScript compiled, final String label)
      throws StateMachineException {
    final String state = stateContext.get();
    statistics.scriptExecutions++;
    try {
      actionLog.log("[Action Runtime] Executing: '" + compiled.text + "' in state '" + state
          + "' for '" + shortLabel(label) + "' with vars: " + ScriptValues.repr(scope));
      new Interpreter(scope, this::print).execute(compiled.report.getTree());
      actionLog.log("[Action Runtime] Finished: '" + compiled.text + "'. Variables now: "
          + ScriptValues.repr(scope));
    } catch (ScriptFault fault) {
      actionFailed(compiled, label, state, fault.getKind().getLabel(), fault.getMessage(), fault);
    } catch (StackOverflowError overflow) {
      actionFailed(compiled, label, state, ScriptFault.Kind.RUNTIME_ERROR.getLabel(),
          "maximum recursion depth exceeded", overflow);
    } catch (RuntimeException unexpected) {
      actionFailed(compiled, label, state, ScriptFault.Kind.RUNTIME_ERROR.getLabel(),
          String.valueOf(unexpected), unexpected);
    }
  }

  private void actionFailed(final CompiledScript compiled, final String label, final String state,
      final String kind, final String message, final Throwable cause)
      throws StateMachineException {
    statistics.scriptFaults++;
    actionLog.log(codeError(compiled, "action", label, state, kind, message));
    if (haltOnActionError) {
      haltCallback.run();
      throw new StateMachineException(Code.SIMULATION_HALTED,
          kind + " in action '" + label + "': " + message, cause);
    }
  }

  private boolean evaluateCondition(final CompiledScript compiled, final String label) {
    final String state = stateContext.get();
    statistics.scriptExecutions++;
    try {
      actionLog.log("[Condition Runtime] Executing: '" + compiled.text + "' in state '" + state
          + "' for '" + shortLabel(label) + "' with vars: " + ScriptValues.repr(scope));
      if (compiled.syntaxFault != null) {
        conditionFailed(compiled, label, state, compiled.syntaxFault.getKind().getLabel(),
            compiled.syntaxFault.getMessage());
        return false;
      }
      // guards see a shallow copy, assignments inside them cannot leak
      final Object result = new Interpreter(new LinkedHashMap<>(scope), this::print)
          .evaluate(compiled.expression);
      actionLog.log("[Condition Runtime] Result of '" + compiled.text + "': "
          + ScriptValues.repr(result));
      return ScriptValues.truthy(result);
    } catch (ScriptFault fault) {
      conditionFailed(compiled, label, state, fault.getKind().getLabel(), fault.getMessage());
    } catch (StackOverflowError overflow) {
      conditionFailed(compiled, label, state, ScriptFault.Kind.RUNTIME_ERROR.getLabel(),
          "maximum recursion depth exceeded");
    } catch (RuntimeException unexpected) {
      conditionFailed(compiled, label, state, ScriptFault.Kind.RUNTIME_ERROR.getLabel(),
          String.valueOf(unexpected));
    }
    return false;
  }

  private void conditionFailed(final CompiledScript compiled, final String label,
      final String state, final String kind, final String message) {
    statistics.scriptFaults++;
    actionLog.log(codeError(compiled, "condition", label, state, kind, message));
  }

  private static String codeError(final CompiledScript compiled, final String what,
      final String label, final String state, final String kind, final String message) {
    return "[Code Error] " + kind + " in " + what + " '" + label + "' (state context: " + state
        + "): " + message + ". Code: '" + compiled.text + "'";
  }

  // entry_Idle -> Idle, cond_t0_go -> go
  static String shortLabel(final String label) {
    final int underscore = label.lastIndexOf('_');
    return underscore < 0 ? label : label.substring(underscore + 1);
  }

  private void print(final String line) {
    actionLog.log("[Script Output] " + line);
  }

  private static enum ScriptKind {
    ACTION, CONDITION;
  }

  private static final class CompiledScript {
    private final String text;
    private final SafetyReport report;
    // conditions only
    private final Ast.Node expression;
    private final ScriptFault syntaxFault;

    private CompiledScript(final String text, final SafetyReport report,
        final Ast.Node expression, final ScriptFault syntaxFault) {
      this.text = text;
      this.report = report;
      this.expression = expression;
      this.syntaxFault = syntaxFault;
    }
  }
}
