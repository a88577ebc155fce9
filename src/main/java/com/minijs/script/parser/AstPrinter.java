package com.minijs.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.minijs.script.parser.Expr.ExprInterface;
import com.minijs.script.parser.Statement.Block;
import com.minijs.script.parser.Statement.Stmt;

/**
 * Renders an AST back to source text. Compound operands are parenthesised, so the output
 * parses back to an equal tree.
 *
 * One shape has no brace-free rendering: an if without else used as the then-branch of an
 * if with else. It is printed inside a block, which re-parses to a tree with an extra Block.
 */
public class AstPrinter implements Expr.ExprVisitor<String>, Statement.StmtVisitor<String> {
    private static final String INDENT = "    ";

    private int depth = 0;

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    public String print(Stmt stmt) {
        return stmt.accept(this);
    }

    /** Top-level statements without the surrounding braces. */
    public String printProgram(Block program) {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : program.statements) {
            sb.append(s.accept(this)).append('\n');
        }
        return sb.toString();
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public String visitBlockStmt(Block stmt) {
        if (stmt.statements.isEmpty()) return "{}";
        StringBuilder sb = new StringBuilder("{\n");
        depth++;
        for (Stmt s : stmt.statements) {
            sb.append(indent()).append(s.accept(this)).append('\n');
        }
        depth--;
        return sb.append(indent()).append('}').toString();
    }

    @Override
    public String visitVarListStmt(Statement.VarList stmt) {
        List<String> parts = new ArrayList<>();
        for (Statement.VarDecl d : stmt.declarations) parts.add(declaration(d));
        return "var " + String.join(", ", parts) + ";";
    }

    @Override
    public String visitVarDeclStmt(Statement.VarDecl stmt) {
        return "var " + declaration(stmt) + ";";
    }

    private String declaration(Statement.VarDecl d) {
        if (d.initializer == null) return d.name.name;
        return d.name.name + " = " + operand(d.initializer);
    }

    @Override
    public String visitEmptyStmt(Statement.Empty stmt) {
        return ";";
    }

    @Override
    public String visitExprStmt(Statement.ExprStmt stmt) {
        String text = stmt.expression.accept(this);
        // a leading '{' would start a block
        if (text.startsWith("{")) text = "(" + text + ")";
        return text + ";";
    }

    @Override
    public String visitIfStmt(Statement.If stmt) {
        String head = "if (" + stmt.condition.accept(this) + ") ";
        if (stmt.elseBranch == null) return head + stmt.thenBranch.accept(this);
        String then = endsWithOpenIf(stmt.thenBranch)
                ? new Block(List.of(stmt.thenBranch)).accept(this)
                : stmt.thenBranch.accept(this);
        return head + then + " else " + stmt.elseBranch.accept(this);
    }

    private static boolean endsWithOpenIf(Stmt s) {
        if (s instanceof Statement.If) {
            Statement.If i = (Statement.If) s;
            return i.elseBranch == null || endsWithOpenIf(i.elseBranch);
        }
        if (s instanceof Statement.While) return endsWithOpenIf(((Statement.While) s).body);
        return false;
    }

    @Override
    public String visitWhileStmt(Statement.While stmt) {
        return "while (" + stmt.condition.accept(this) + ") " + stmt.body.accept(this);
    }

    @Override
    public String visitDoWhileStmt(Statement.DoWhile stmt) {
        return "do " + stmt.body.accept(this) + " while (" + stmt.condition.accept(this) + ");";
    }

    @Override
    public String visitContinueStmt(Statement.ContinueStmt stmt) {
        return "continue;";
    }

    @Override
    public String visitBreakStmt(Statement.BreakStmt stmt) {
        return "break;";
    }

    @Override
    public String visitReturnStmt(Statement.ReturnStmt stmt) {
        if (stmt.value == null) return "return;";
        return "return " + stmt.value.accept(this) + ";";
    }

    @Override
    public String visitDebuggerStmt(Statement.DebuggerStmt stmt) {
        return "debugger;";
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public String visitThisExpr(Expr.This expr) {
        return "this";
    }

    @Override
    public String visitIdentifierExpr(Expr.Identifier expr) {
        return expr.name;
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        Value v = expr.value;
        switch (v.type) {
            case NUMBER: return formatNumber(v.asNumber());
            case STRING: return quote(v.asString());
            case BOOL: return String.valueOf(v.asBool());
            case NULL: return "null";
            default: return v.toDisplayString();
        }
    }

    @Override
    public String visitArrayLiteralExpr(Expr.ArrayLiteral expr) {
        List<String> parts = new ArrayList<>();
        for (ExprInterface item : expr.items) parts.add(item == null ? "" : operand(item));
        return "[" + String.join(", ", parts) + "]";
    }

    @Override
    public String visitObjectLiteralExpr(Expr.ObjectLiteral expr) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, ExprInterface> e : expr.items.entrySet()) {
            parts.add(propertyKey(e.getKey()) + ": " + operand(e.getValue()));
        }
        return "{" + String.join(", ", parts) + "}";
    }

    @Override
    public String visitPropertyAccessExpr(Expr.PropertyAccess expr) {
        String base = member(expr.object);
        if (expr.key instanceof Expr.Literal) {
            Value k = ((Expr.Literal) expr.key).value;
            if (k.type == Value.Type.STRING && isIdentifierName(k.asString())) {
                return base + "." + k.asString();
            }
        }
        return base + "[" + expr.key.accept(this) + "]";
    }

    @Override
    public String visitFunctionCallExpr(Expr.FunctionCall expr) {
        return member(expr.callee) + "(" + arguments(expr.arguments) + ")";
    }

    @Override
    public String visitConstructorExpr(Expr.Constructor expr) {
        String callee = isCallFree(expr.callee) ? expr.callee.accept(this) : "(" + expr.callee.accept(this) + ")";
        return "new " + callee + "(" + arguments(expr.arguments) + ")";
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        String op = expr.operator;
        if (op.startsWith("postfix")) {
            return member(expr.operand) + op.substring("postfix".length());
        }
        String sep = Character.isLetter(op.charAt(0)) ? " " : "";
        return op + sep + operand(expr.operand);
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return operand(expr.left) + " " + expr.operator + " " + operand(expr.right);
    }

    @Override
    public String visitConditionalExpr(Expr.Conditional expr) {
        return operand(expr.condition) + " ? " + operand(expr.whenTrue) + " : " + operand(expr.whenFalse);
    }

    @Override
    public String visitAssignExpr(Expr.Assign expr) {
        return operand(expr.target) + " " + expr.operator + " " + operand(expr.value);
    }

    @Override
    public String visitMultiExpr(Expr.Multi expr) {
        return operand(expr.left) + ", " + operand(expr.right);
    }

    @Override
    public String visitFunctionExpr(Expr.Function expr) {
        return "function (" + String.join(", ", expr.parameterNames()) + ") " + expr.body.accept(this);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private String indent() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) sb.append(INDENT);
        return sb.toString();
    }

    private String arguments(List<ExprInterface> args) {
        List<String> parts = new ArrayList<>();
        for (ExprInterface a : args) parts.add(operand(a));
        return String.join(", ", parts);
    }

    /** Parenthesises operator expressions. */
    private String operand(ExprInterface e) {
        String text = e.accept(this);
        if (e instanceof Expr.Binary || e instanceof Expr.Unary || e instanceof Expr.Assign
                || e instanceof Expr.Conditional || e instanceof Expr.Multi) {
            return "(" + text + ")";
        }
        return text;
    }

    /** Text usable in front of '.', '[' or '('. */
    private String member(ExprInterface e) {
        String text = e.accept(this);
        if (e instanceof Expr.Identifier || e instanceof Expr.This || e instanceof Expr.PropertyAccess
                || e instanceof Expr.FunctionCall || e instanceof Expr.ArrayLiteral
                || e instanceof Expr.ObjectLiteral || e instanceof Expr.Constructor) {
            return text;
        }
        if (e instanceof Expr.Literal && ((Expr.Literal) e).value.type != Value.Type.NUMBER) {
            return text;
        }
        return "(" + text + ")";
    }

    /** True when the expression has no call, so 'new' takes all of it as its callee. */
    private static boolean isCallFree(ExprInterface e) {
        if (e instanceof Expr.Identifier || e instanceof Expr.This) return true;
        if (e instanceof Expr.PropertyAccess) return isCallFree(((Expr.PropertyAccess) e).object);
        return false;
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return BigDecimal.valueOf(d).toPlainString();
    }

    private static String propertyKey(String key) {
        return isIdentifierName(key) ? key : quote(key);
    }

    private static boolean isIdentifierName(String s) {
        if (s.isEmpty() || Lexer.isKeyword(s)) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
            boolean digit = c >= '0' && c <= '9';
            if (!letter && !(digit && i > 0)) return false;
        }
        return true;
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
