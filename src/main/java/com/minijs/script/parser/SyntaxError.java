package com.minijs.script.parser;

/**
 * An AST node carries an operator the interpreter does not know.
 *
 * This is a parser/interpreter contract fault, not a recoverable script condition.
 * Malformed source text is reported by {@link ParseError} instead.
 */
public class SyntaxError extends JsException {

    private static final long serialVersionUID = 1L;

    public SyntaxError(String message) {
        super("SyntaxError", message);
    }
}
