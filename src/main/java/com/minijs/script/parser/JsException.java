package com.minijs.script.parser;

/**
 * Base class of every error raised while evaluating a script.
 *
 * Errors are fatal to the current evaluation: they unwind to the host, which decides how to
 * present them. {@link #getErrorName()} is the script-level error name, e.g. "ReferenceError".
 */
public class JsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorName;

    public JsException(String errorName, String message) {
        super(message);
        this.errorName = errorName;
    }

    public String getErrorName() {
        return errorName;
    }

    @Override
    public String toString() {
        return errorName + ": " + getMessage();
    }
}
