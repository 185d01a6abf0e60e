package com.github.hsm.script;

/**
 * Unified runtime fault raised while parsing or interpreting a user script. The kind mirrors the
 * error names that diagram authors see in the action log.
 */
public final class ScriptFault extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private final Kind kind;

  public ScriptFault(final Kind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  public ScriptFault(final Kind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  static ScriptFault syntax(final String message, final int line, final int column) {
    return new ScriptFault(Kind.SYNTAX_ERROR,
        message + " (line " + line + ", offset " + column + ")");
  }

  static ScriptFault type(final String message) {
    return new ScriptFault(Kind.TYPE_ERROR, message);
  }

  public static enum Kind {
    SYNTAX_ERROR("SyntaxError"),
    NAME_ERROR("NameError"),
    TYPE_ERROR("TypeError"),
    VALUE_ERROR("ValueError"),
    ATTRIBUTE_ERROR("AttributeError"),
    INDEX_ERROR("IndexError"),
    KEY_ERROR("KeyError"),
    ZERO_DIVISION_ERROR("ZeroDivisionError"),
    // anything the interpreter did not anticipate, eg. stack overflow on runaway recursion
    RUNTIME_ERROR("RuntimeError");

    private final String label;

    private Kind(final String label) {
      this.label = label;
    }

    public String getLabel() {
      return label;
    }
  }

}
