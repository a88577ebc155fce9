package com.minijs.script.parser;

/** Unresolved name, write to a non-reference, or access through an unresolvable reference. */
public class ReferenceError extends JsException {

    private static final long serialVersionUID = 1L;

    public ReferenceError(String message) {
        super("ReferenceError", message);
    }
}
