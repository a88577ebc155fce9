package com.minijs.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("break", TokenType.BREAK);
        map.put("case", TokenType.CASE);
        map.put("catch", TokenType.CATCH);
        map.put("continue", TokenType.CONTINUE);
        map.put("debugger", TokenType.DEBUGGER);
        map.put("default", TokenType.DEFAULT);
        map.put("delete", TokenType.DELETE);
        map.put("do", TokenType.DO);
        map.put("else", TokenType.ELSE);
        map.put("finally", TokenType.FINALLY);
        map.put("for", TokenType.FOR);
        map.put("function", TokenType.FUNCTION);
        map.put("if", TokenType.IF);
        map.put("in", TokenType.IN);
        map.put("instanceof", TokenType.INSTANCEOF);
        map.put("new", TokenType.NEW);
        map.put("return", TokenType.RETURN);
        map.put("switch", TokenType.SWITCH);
        map.put("this", TokenType.THIS);
        map.put("throw", TokenType.THROW);
        map.put("try", TokenType.TRY);
        map.put("typeof", TokenType.TYPEOF);
        map.put("var", TokenType.VAR);
        map.put("void", TokenType.VOID);
        map.put("while", TokenType.WHILE);
        map.put("with", TokenType.WITH);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("null", TokenType.NULL);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '~': addToken(TokenType.TILDE); break;
            case '+':
                if (match('+')) addToken(TokenType.PLUS_PLUS);
                else addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
                break;
            case '-':
                if (match('-')) addToken(TokenType.MINUS_MINUS);
                else addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
                break;
            case '*': addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '^': addToken(match('=') ? TokenType.CARET_EQUAL : TokenType.CARET); break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case '!':
                if (match('=')) addToken(match('=') ? TokenType.BANG_EQUAL_EQUAL : TokenType.BANG_EQUAL);
                else addToken(TokenType.BANG);
                break;
            case '=':
                if (match('=')) addToken(match('=') ? TokenType.EQUAL_EQUAL_EQUAL : TokenType.EQUAL_EQUAL);
                else addToken(TokenType.EQUAL);
                break;
            case '<':
                if (match('<')) addToken(match('=') ? TokenType.LESS_LESS_EQUAL : TokenType.LESS_LESS);
                else addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                break;
            case '>':
                if (match('>')) addToken(match('=') ? TokenType.GREATER_GREATER_EQUAL : TokenType.GREATER_GREATER);
                else addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else addToken(match('=') ? TokenType.AMP_EQUAL : TokenType.AMP);
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else addToken(match('=') ? TokenType.PIPE_EQUAL : TokenType.PIPE);
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void blockComment() {
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (peek() == '\n') line++;
            advance();
        }
        if (isAtEnd()) throw error("Unterminated comment");
        advance();
        advance();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') throw error("Unterminated string");
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) break;
            char esc = advance();
            switch (esc) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case '0': sb.append('\0'); break;
                default: sb.append(esc); // \\ \' \" and unknown escapes keep the character
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private ParseError error(String msg) {
        return new ParseError(line, msg);
    }
}
