package com.github.hsm.script;

import java.util.List;

/**
 * Anything a script may call: an allow-listed builtin function or a method bound to a value.
 */
public interface ScriptCallable {

  String getName();

  Object call(Interpreter interpreter, List<Object> arguments);
}
