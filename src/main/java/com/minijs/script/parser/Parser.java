package com.minijs.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.minijs.script.parser.Expr.ExprInterface;
import com.minijs.script.parser.Statement.Block;
import com.minijs.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser. Operator precedence follows ECMA-262 3rd edition, lowest first:
 * comma, assignment, conditional, ||, &&, |, ^, &, equality, relational, shift, additive,
 * multiplicative, unary, postfix, call/member.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;
    private int loopDepth = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public Parser(String source) {
        this(new Lexer(source).tokenize());
    }

    // -------------------------
    // Entry points
    // -------------------------

    /** A whole program: statements up to end of input, wrapped in a root block. */
    public Block parseProgram() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return new Block(statements);
    }

    public Stmt parseStatement() {
        Stmt stmt = statement();
        expectEnd();
        return stmt;
    }

    public ExprInterface parseExpression() {
        ExprInterface expr = expression();
        expectEnd();
        return expr;
    }

    private void expectEnd() {
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' after end of input");
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (check(TokenType.LEFT_BRACE)) return block();
        if (match(TokenType.VAR)) return varList();
        if (match(TokenType.SEMICOLON)) return new Statement.Empty();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.DO)) return doWhileStatement();
        if (match(TokenType.CONTINUE)) {
            if (loopDepth <= 0) throw error(previous(), "'continue' outside of loop");
            match(TokenType.SEMICOLON);
            return new Statement.ContinueStmt();
        }
        if (match(TokenType.BREAK)) {
            if (loopDepth <= 0) throw error(previous(), "'break' outside of loop");
            match(TokenType.SEMICOLON);
            return new Statement.BreakStmt();
        }
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.DEBUGGER)) {
            consume(TokenType.SEMICOLON, "Expected ';' after 'debugger'");
            return new Statement.DebuggerStmt();
        }
        if (match(TokenType.FOR, TokenType.SWITCH, TokenType.TRY, TokenType.THROW, TokenType.WITH,
                TokenType.CASE, TokenType.DEFAULT, TokenType.CATCH, TokenType.FINALLY)) {
            throw error(previous(), "Unsupported statement '" + previous().lexeme + "'");
        }

        ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new Statement.ExprStmt(expr);
    }

    private Block block() {
        consume(TokenType.LEFT_BRACE, "Expected '{'");
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after block");
        return new Block(statements);
    }

    private Stmt varList() {
        List<Statement.VarDecl> decls = new ArrayList<>();
        do {
            Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
            ExprInterface init = null;
            if (match(TokenType.EQUAL)) init = assignment();
            decls.add(new Statement.VarDecl(new Expr.Identifier(name.lexeme), init));
        } while (match(TokenType.COMMA));
        consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        return new Statement.VarList(decls);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        ExprInterface cond = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition");
        Stmt thenBranch = statement();
        // else binds to the nearest if
        Stmt elseBranch = match(TokenType.ELSE) ? statement() : null;
        return new Statement.If(cond, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'");
        ExprInterface cond = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after while condition");
        loopDepth++;
        try {
            return new Statement.While(cond, statement());
        } finally {
            loopDepth--;
        }
    }

    private Stmt doWhileStatement() {
        Stmt body;
        loopDepth++;
        try {
            body = statement();
        } finally {
            loopDepth--;
        }
        consume(TokenType.WHILE, "Expected 'while' after do body");
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'");
        ExprInterface cond = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after do-while condition");
        match(TokenType.SEMICOLON);
        return new Statement.DoWhile(body, cond);
    }

    private Stmt returnStatement() {
        ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) value = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after return value");
        return new Statement.ReturnStmt(value);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        ExprInterface expr = assignment();
        while (match(TokenType.COMMA)) {
            expr = new Expr.Multi(expr, assignment());
        }
        return expr;
    }

    private ExprInterface assignment() {
        ExprInterface target = conditional();
        if (match(TokenType.EQUAL, TokenType.STAR_EQUAL, TokenType.SLASH_EQUAL, TokenType.PERCENT_EQUAL,
                TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.LESS_LESS_EQUAL,
                TokenType.GREATER_GREATER_EQUAL, TokenType.AMP_EQUAL, TokenType.CARET_EQUAL,
                TokenType.PIPE_EQUAL)) {
            Token op = previous();
            if (!isLeftHandSide(target)) throw error(op, "Invalid assignment target");
            ExprInterface value = assignment();
            return new Expr.Assign(op.lexeme, target, value);
        }
        return target;
    }

    private static boolean isLeftHandSide(ExprInterface e) {
        return e instanceof Expr.Identifier
                || e instanceof Expr.Literal
                || e instanceof Expr.This
                || e instanceof Expr.PropertyAccess
                || e instanceof Expr.FunctionCall
                || e instanceof Expr.Constructor
                || e instanceof Expr.ArrayLiteral
                || e instanceof Expr.ObjectLiteral
                || e instanceof Expr.Function;
    }

    private ExprInterface conditional() {
        ExprInterface cond = logicalOr();
        if (match(TokenType.QUESTION)) {
            ExprInterface whenTrue = assignment();
            consume(TokenType.COLON, "Expected ':' in conditional expression");
            ExprInterface whenFalse = assignment();
            return new Expr.Conditional(cond, whenTrue, whenFalse);
        }
        return cond;
    }

    private ExprInterface logicalOr() {
        ExprInterface expr = logicalAnd();
        while (match(TokenType.OR_OR)) expr = new Expr.Binary("||", expr, logicalAnd());
        return expr;
    }

    private ExprInterface logicalAnd() {
        ExprInterface expr = bitwiseOr();
        while (match(TokenType.AND_AND)) expr = new Expr.Binary("&&", expr, bitwiseOr());
        return expr;
    }

    private ExprInterface bitwiseOr() {
        ExprInterface expr = bitwiseXor();
        while (match(TokenType.PIPE)) expr = new Expr.Binary("|", expr, bitwiseXor());
        return expr;
    }

    private ExprInterface bitwiseXor() {
        ExprInterface expr = bitwiseAnd();
        while (match(TokenType.CARET)) expr = new Expr.Binary("^", expr, bitwiseAnd());
        return expr;
    }

    private ExprInterface bitwiseAnd() {
        ExprInterface expr = equality();
        while (match(TokenType.AMP)) expr = new Expr.Binary("&", expr, equality());
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = relational();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL_EQUAL,
                TokenType.BANG_EQUAL_EQUAL)) {
            String op = previous().lexeme;
            expr = new Expr.Binary(op, expr, relational());
        }
        return expr;
    }

    private ExprInterface relational() {
        ExprInterface expr = shift();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
                TokenType.INSTANCEOF, TokenType.IN)) {
            String op = previous().lexeme;
            expr = new Expr.Binary(op, expr, shift());
        }
        return expr;
    }

    private ExprInterface shift() {
        ExprInterface expr = additive();
        while (match(TokenType.LESS_LESS, TokenType.GREATER_GREATER)) {
            String op = previous().lexeme;
            expr = new Expr.Binary(op, expr, additive());
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            String op = previous().lexeme;
            expr = new Expr.Binary(op, expr, multiplicative());
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            String op = previous().lexeme;
            expr = new Expr.Binary(op, expr, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.DELETE, TokenType.VOID, TokenType.TYPEOF, TokenType.PLUS_PLUS,
                TokenType.MINUS_MINUS, TokenType.PLUS, TokenType.MINUS, TokenType.TILDE, TokenType.BANG)) {
            String op = previous().lexeme;
            return new Expr.Unary(op, unary());
        }
        return postfix();
    }

    private ExprInterface postfix() {
        ExprInterface expr = leftHandSide();
        // No line break is allowed between the operand and a postfix operator.
        if ((check(TokenType.PLUS_PLUS) || check(TokenType.MINUS_MINUS)) && peek().line == previous().line) {
            Token op = advance();
            return new Expr.Unary("postfix" + op.lexeme, expr);
        }
        return expr;
    }

    private ExprInterface leftHandSide() {
        ExprInterface expr = match(TokenType.NEW) ? newExpression() : primary();
        while (true) {
            if (match(TokenType.DOT)) {
                expr = new Expr.PropertyAccess(expr, propertyName());
            } else if (match(TokenType.LEFT_BRACKET)) {
                ExprInterface key = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after property key");
                expr = new Expr.PropertyAccess(expr, key);
            } else if (match(TokenType.LEFT_PAREN)) {
                expr = new Expr.FunctionCall(expr, arguments());
            } else {
                break;
            }
        }
        return expr;
    }

    /** After 'new': a member expression with optional arguments. */
    private ExprInterface newExpression() {
        ExprInterface callee = match(TokenType.NEW) ? newExpression() : primary();
        while (true) {
            if (match(TokenType.DOT)) {
                callee = new Expr.PropertyAccess(callee, propertyName());
            } else if (match(TokenType.LEFT_BRACKET)) {
                ExprInterface key = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after property key");
                callee = new Expr.PropertyAccess(callee, key);
            } else {
                break;
            }
        }
        List<ExprInterface> args = match(TokenType.LEFT_PAREN) ? arguments() : new ArrayList<>();
        return new Expr.Constructor(callee, args);
    }

    private ExprInterface propertyName() {
        Token name = consume(TokenType.IDENTIFIER, "Expected property name after '.'");
        return new Expr.Literal(Value.string(name.lexeme));
    }

    /** Argument list; the opening '(' is already consumed. */
    private List<ExprInterface> arguments() {
        List<ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(assignment());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return args;
    }

    private ExprInterface primary() {
        if (match(TokenType.THIS)) return new Expr.This();
        if (match(TokenType.IDENTIFIER)) return new Expr.Identifier(previous().lexeme);
        if (match(TokenType.NUMBER)) return new Expr.Literal(Value.number((Double) previous().literal));
        if (match(TokenType.STRING)) return new Expr.Literal(Value.string((String) previous().literal));
        if (match(TokenType.TRUE)) return new Expr.Literal(Value.bool(true));
        if (match(TokenType.FALSE)) return new Expr.Literal(Value.bool(false));
        if (match(TokenType.NULL)) return new Expr.Literal(Value.nil());
        if (match(TokenType.LEFT_BRACKET)) return arrayLiteral();
        if (match(TokenType.LEFT_BRACE)) return objectLiteral();
        if (match(TokenType.FUNCTION)) return functionExpression();
        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
            return expr;
        }
        if (isAtEnd()) throw error(peek(), "Unexpected end of input");
        throw error(peek(), "Unexpected '" + peek().lexeme + "'");
    }

    /** Elisions become null items; the '[' is already consumed. */
    private ExprInterface arrayLiteral() {
        List<ExprInterface> items = new ArrayList<>();
        if (match(TokenType.RIGHT_BRACKET)) return new Expr.ArrayLiteral(items);
        while (true) {
            if (check(TokenType.COMMA) || check(TokenType.RIGHT_BRACKET)) {
                items.add(null);
            } else {
                items.add(assignment());
            }
            if (match(TokenType.COMMA)) continue;
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after array elements");
            break;
        }
        return new Expr.ArrayLiteral(items);
    }

    private ExprInterface objectLiteral() {
        Map<String, ExprInterface> items = new LinkedHashMap<>();
        if (!check(TokenType.RIGHT_BRACE)) {
            do {
                String key;
                if (match(TokenType.IDENTIFIER)) {
                    key = previous().lexeme;
                } else if (match(TokenType.STRING)) {
                    key = (String) previous().literal;
                } else if (match(TokenType.NUMBER)) {
                    key = Value.numberToKey((Double) previous().literal);
                } else {
                    throw error(peek(), "Expected property name in object literal");
                }
                consume(TokenType.COLON, "Expected ':' after property name");
                items.put(key, assignment());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after object literal");
        return new Expr.ObjectLiteral(items);
    }

    private ExprInterface functionExpression() {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'function'");
        List<Expr.Identifier> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token p = consume(TokenType.IDENTIFIER, "Expected parameter name");
                params.add(new Expr.Identifier(p.lexeme));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");

        // break/continue never cross a function boundary
        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        try {
            return new Expr.Function(params, block());
        } finally {
            loopDepth = savedLoopDepth;
        }
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(token.line, message);
    }
}
