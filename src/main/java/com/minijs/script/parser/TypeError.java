package com.minijs.script.parser;

/** Operation applied to a value of the wrong kind, e.g. calling something that is not a function. */
public class TypeError extends JsException {

    private static final long serialVersionUID = 1L;

    public TypeError(String message) {
        super("TypeError", message);
    }
}
