package com.minijs.script.parser;

/** Raised when the call stack grows past the configured maximum depth. */
public class RangeError extends JsException {

    private static final long serialVersionUID = 1L;

    public RangeError(String message) {
        super("RangeError", message);
    }
}
