package com.github.hsm.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of statically analyzing one script. A syntax error is reported as its own verdict and is
 * never conflated with a safety violation.
 */
public final class SafetyReport {
  private static final SafetyReport safe = new SafetyReport(Verdict.SAFE, null, null);

  private final Verdict verdict;
  private final List<String> violations;
  private final Ast.Script tree;

  private SafetyReport(final Verdict verdict, final List<String> violations,
      final Ast.Script tree) {
    this.verdict = verdict;
    this.violations = violations == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(violations));
    this.tree = tree;
  }

  static SafetyReport safe(final Ast.Script tree) {
    return tree == null ? safe : new SafetyReport(Verdict.SAFE, null, tree);
  }

  static SafetyReport unsafe(final List<String> violations) {
    return new SafetyReport(Verdict.UNSAFE, violations, null);
  }

  static SafetyReport syntaxError(final String message) {
    return new SafetyReport(Verdict.SYNTAX_ERROR,
        Collections.singletonList("SyntaxError in user code: " + message), null);
  }

  public boolean isSafe() {
    return verdict == Verdict.SAFE;
  }

  public Verdict getVerdict() {
    return verdict;
  }

  public List<String> getViolations() {
    return violations;
  }

  /**
   * The statement tree the analysis walked; empty scripts carry none.
   */
  public Ast.Script getTree() {
    return tree;
  }

  /**
   * All violations joined into one human-readable reason.
   */
  public String getReason() {
    return String.join("; ", violations);
  }

  @Override
  public String toString() {
    return "SafetyReport [verdict=" + verdict + ", violations=" + violations + "]";
  }

  public static enum Verdict {
    SAFE, UNSAFE, SYNTAX_ERROR;
  }
}
