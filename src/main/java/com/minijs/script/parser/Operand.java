package com.minijs.script.parser;

/**
 * Result of evaluating an expression: either a {@link Value} or a {@link Reference}
 * that still has to be dereferenced.
 */
public interface Operand {
}
