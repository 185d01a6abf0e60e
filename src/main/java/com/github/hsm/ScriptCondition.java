package com.github.hsm;

/**
 * A compiled transition guard. Evaluation never mutates the scope and never throws: faults and
 * blocked scripts evaluate to false.
 */
@FunctionalInterface
public interface ScriptCondition {

  boolean test();
}
