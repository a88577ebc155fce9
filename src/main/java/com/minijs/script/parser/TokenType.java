package com.minijs.script.parser;

public enum TokenType {
    // Delimiters
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, DOT, SEMICOLON, COLON, QUESTION,

    // Arithmetic / bitwise / logical operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    PIPE, AMP, TILDE, CARET,
    OR_OR, AND_AND, BANG,
    LESS_LESS, GREATER_GREATER,

    // Comparison
    EQUAL_EQUAL, BANG_EQUAL, EQUAL_EQUAL_EQUAL, BANG_EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Assignment
    EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL, PLUS_EQUAL, MINUS_EQUAL,
    LESS_LESS_EQUAL, GREATER_GREATER_EQUAL, AMP_EQUAL, CARET_EQUAL, PIPE_EQUAL,

    // Increment / decrement
    PLUS_PLUS, MINUS_MINUS,

    // Literals
    IDENTIFIER, NUMBER, STRING,

    // Keywords (several are reserved only; the parser rejects them)
    BREAK, CASE, CATCH, CONTINUE, DEBUGGER, DEFAULT, DELETE, DO, ELSE, FINALLY, FOR,
    FUNCTION, IF, IN, INSTANCEOF, NEW, RETURN, SWITCH, THIS, THROW, TRY, TYPEOF,
    VAR, VOID, WHILE, WITH,
    TRUE, FALSE, NULL,

    EOF
}
