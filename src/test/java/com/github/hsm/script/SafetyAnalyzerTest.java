package com.github.hsm.script;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import org.junit.Test;

import com.github.hsm.script.SafetyReport.Verdict;

/**
 * Tests for the static script checks.
 */
public class SafetyAnalyzerTest {
  private final SafetyAnalyzer analyzer = new SafetyAnalyzer();

  private SafetyReport analyze(final String script) {
    return analyzer.analyze(script, Collections.<String>emptySet());
  }

  @Test
  public void testOrdinaryScriptsAreSafe() {
    for (final String script : new String[] {"x = 1", "counter += 1; print('at', counter)",
        "items.append(len(items))", "total = sum([1, 2]) if flag else 0", "x > 0 and y < 3",
        "d = {'a': [1, 2]}; d['a'].pop()", "n = (5).__abs__()"}) {
      final SafetyReport report = analyze(script);
      assertTrue(script + " -> " + report, report.isSafe());
      assertEquals(Verdict.SAFE, report.getVerdict());
      assertTrue(report.getViolations().isEmpty());
    }
  }

  @Test
  public void testBlankScriptsAreSafe() {
    assertTrue(analyze(null).isSafe());
    assertTrue(analyze("  \n ").isSafe());
  }

  @Test
  public void testImportsAreRejected() {
    SafetyReport report = analyze("import os");
    assertEquals(Verdict.UNSAFE, report.getVerdict());
    assertEquals("SecurityError: Imports (import) are not allowed in FSM code.",
        report.getReason());

    report = analyze("from os import path");
    assertEquals(Verdict.UNSAFE, report.getVerdict());
    assertEquals("SecurityError: From-imports (from ... import) are not allowed in FSM code.",
        report.getReason());
  }

  @Test
  public void testDeniedCallsAreRejected() {
    for (final String name : new String[] {"eval", "exec", "compile", "open", "input", "getattr",
        "setattr", "delattr", "globals", "locals", "vars", "__import__"}) {
      final SafetyReport report = analyze("x = " + name + "('1')");
      assertFalse(name, report.isSafe());
      assertEquals("SecurityError: Calling the function '" + name + "' is not allowed.",
          report.getViolations().get(0));
    }
  }

  @Test
  public void testDeniedCallAnywhereInTheScriptRejectsAllOfIt() {
    final SafetyReport report = analyze("x = 1; eval('1'); y = 2");
    assertEquals(Verdict.UNSAFE, report.getVerdict());
    assertEquals(1, report.getViolations().size());
    // nested inside arguments and containers too
    assertFalse(analyze("print([1, {'k': open('f')}])").isSafe());
  }

  @Test
  public void testRestrictedAttributesAreRejected() {
    SafetyReport report = analyze("x = ().__class__");
    assertFalse(report.isSafe());
    assertEquals("SecurityError: Access to the attribute '__class__' is restricted.",
        report.getReason());

    report = analyze("x = y.__reduce_ex__");
    assertFalse(report.isSafe());
    assertEquals("SecurityError: Access to the special attribute '__reduce_ex__' is restricted.",
        report.getReason());

    assertFalse(analyze("x = f.f_globals").isSafe());
    assertFalse(analyze("x = e.with_traceback").isSafe());
  }

  @Test
  public void testEveryViolationIsReported() {
    final SafetyReport report =
        analyze("import os\nx = eval('1')\ny = ().__class__.__subclasses__()");
    assertEquals(4, report.getViolations().size());
    assertTrue(report.getReason().contains("; "));
  }

  @Test
  public void testUnknownCallsAreTolerated() {
    assertTrue(analyze("result = my_helper(1)").isSafe());
    assertTrue(analyzer.analyze("result = callback()", new HashSet<>(Arrays.asList("callback")))
        .isSafe());
  }

  @Test
  public void testSyntaxErrorsAreTheirOwnVerdict() {
    final SafetyReport report = analyze("x = = 1");
    assertEquals(Verdict.SYNTAX_ERROR, report.getVerdict());
    assertFalse(report.isSafe());
    assertTrue(report.getReason().startsWith("SyntaxError in user code: "));
  }

  @Test
  public void testDeeplyNestedScriptIsRejectedNotCrashed() {
    final StringBuilder script = new StringBuilder("x = ");
    for (int i = 0; i < 50_000; i++) {
      script.append('(');
    }
    script.append('1');
    for (int i = 0; i < 50_000; i++) {
      script.append(')');
    }
    final SafetyReport report = analyze(script.toString());
    assertFalse(report.isSafe());
  }

}
