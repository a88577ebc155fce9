package com.minijs.script.parser;

/** Lexer or parser rejected the source text. */
public class ParseError extends JsException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseError(int line, String message) {
        super("SyntaxError", "[line " + line + "] " + message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
