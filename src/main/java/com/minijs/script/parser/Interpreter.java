package com.minijs.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.minijs.debug.Debug;
import com.minijs.debug.DebugLevel;
import com.minijs.script.parser.Expr.ArrayLiteral;
import com.minijs.script.parser.Expr.Assign;
import com.minijs.script.parser.Expr.Binary;
import com.minijs.script.parser.Expr.Conditional;
import com.minijs.script.parser.Expr.Constructor;
import com.minijs.script.parser.Expr.ExprInterface;
import com.minijs.script.parser.Expr.ExprVisitor;
import com.minijs.script.parser.Expr.Function;
import com.minijs.script.parser.Expr.FunctionCall;
import com.minijs.script.parser.Expr.Identifier;
import com.minijs.script.parser.Expr.Literal;
import com.minijs.script.parser.Expr.Multi;
import com.minijs.script.parser.Expr.ObjectLiteral;
import com.minijs.script.parser.Expr.PropertyAccess;
import com.minijs.script.parser.Expr.This;
import com.minijs.script.parser.Expr.Unary;
import com.minijs.script.parser.Statement.Block;
import com.minijs.script.parser.Statement.BreakStmt;
import com.minijs.script.parser.Statement.ContinueStmt;
import com.minijs.script.parser.Statement.DebuggerStmt;
import com.minijs.script.parser.Statement.DoWhile;
import com.minijs.script.parser.Statement.Empty;
import com.minijs.script.parser.Statement.ExprStmt;
import com.minijs.script.parser.Statement.If;
import com.minijs.script.parser.Statement.ReturnStmt;
import com.minijs.script.parser.Statement.Stmt;
import com.minijs.script.parser.Statement.StmtVisitor;
import com.minijs.script.parser.Statement.VarDecl;
import com.minijs.script.parser.Statement.VarList;
import com.minijs.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Expressions evaluate to an {@link Operand} (a value or a
 * reference), statements to a {@link Completion}.
 */
public class Interpreter implements ExprVisitor<Operand>, StmtVisitor<Completion> {
    private static final String TAG = "minijs.interpreter";

    /** Operators allowed in front of "=" in a compound assignment. */
    private static final Set<String> COMPOUND_OPERATORS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("*", "/", "%", "+", "-", "<<", ">>", "&", "^", "|")));

    public static final int DEFAULT_MAX_DEPTH = 256;
    private static final int REPORTED_FRAMES = 5;

    Environment env;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final boolean strictAssignment;

    public Interpreter(Environment env) {
        this(env, DEFAULT_MAX_DEPTH, false);
    }

    public Interpreter(Environment env, int maxDepth, boolean strictAssignment) {
        this.env = env;
        this.maxDepth = maxDepth;
        this.strictAssignment = strictAssignment;
    }

    // -------------------------
    // Entry points
    // -------------------------

    public Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    /** Evaluates an expression and dereferences the result. */
    public Value evaluate(ExprInterface expr) {
        return getValue(expr.accept(this));
    }

    /** Executes with the statement's {@code var} names hoisted into the current scope first. */
    public Completion executeProgram(Stmt program) {
        hoist(program, env);
        return program.accept(this);
    }

    static void hoist(Stmt stmt, Environment target) {
        for (String name : stmt.declaredVars()) {
            if (!target.hasOwn(name)) target.declare(name, Value.undefined());
        }
    }

    // -------------------------
    // References
    // -------------------------

    public Value getValue(Operand operand) {
        if (operand instanceof Reference) return ((Reference) operand).getValue();
        return (Value) operand;
    }

    public void putValue(Operand operand, Value value) {
        if (!(operand instanceof Reference)) {
            throw new ReferenceError("Invalid assignment target: " + operand);
        }
        ((Reference) operand).putValue(value, strictAssignment);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitBlockStmt(Block stmt) {
        Value last = null;
        for (Stmt s : stmt.statements) {
            Completion c = s.accept(this);
            if (c.isAbrupt()) return c;
            if (c.value != null) last = c.value;
        }
        return Completion.normal(last);
    }

    @Override
    public Completion visitVarListStmt(VarList stmt) {
        for (VarDecl d : stmt.declarations) d.accept(this);
        return Completion.EMPTY;
    }

    @Override
    public Completion visitVarDeclStmt(VarDecl stmt) {
        if (stmt.initializer != null) {
            Value v = evaluate(stmt.initializer);
            putValue(stmt.name.accept(this), v);
        }
        return Completion.EMPTY;
    }

    @Override
    public Completion visitEmptyStmt(Empty stmt) {
        return Completion.EMPTY;
    }

    @Override
    public Completion visitExprStmt(ExprStmt stmt) {
        return Completion.normal(evaluate(stmt.expression));
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (evaluate(stmt.condition).toBoolean()) {
            return stmt.thenBranch.accept(this);
        }
        if (stmt.elseBranch != null) {
            return stmt.elseBranch.accept(this);
        }
        return Completion.EMPTY;
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        Value value = null;
        while (evaluate(stmt.condition).toBoolean()) {
            Completion c = stmt.body.accept(this);
            if (c.value != null) value = c.value;
            if (c.type == Completion.Type.BREAK) break;
            if (c.type == Completion.Type.CONTINUE) continue;
            if (c.isAbrupt()) return c;
        }
        return Completion.normal(value);
    }

    @Override
    public Completion visitDoWhileStmt(DoWhile stmt) {
        Value value = null;
        do {
            Completion c = stmt.body.accept(this);
            if (c.value != null) value = c.value;
            if (c.type == Completion.Type.BREAK) break;
            if (c.type == Completion.Type.CONTINUE) continue;
            if (c.isAbrupt()) return c;
        } while (evaluate(stmt.condition).toBoolean());
        return Completion.normal(value);
    }

    @Override
    public Completion visitContinueStmt(ContinueStmt stmt) {
        return Completion.ofContinue(null);
    }

    @Override
    public Completion visitBreakStmt(BreakStmt stmt) {
        return Completion.ofBreak(null);
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt) {
        Value v = (stmt.value == null) ? Value.undefined() : evaluate(stmt.value);
        return Completion.ofReturn(v);
    }

    @Override
    public Completion visitDebuggerStmt(DebuggerStmt stmt) {
        return Completion.EMPTY;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Operand visitThisExpr(This expr) {
        return env.getThis();
    }

    @Override
    public Operand visitIdentifierExpr(Identifier expr) {
        return Reference.binding(expr.name, env);
    }

    @Override
    public Operand visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Operand visitArrayLiteralExpr(ArrayLiteral expr) {
        List<ExprInterface> items = expr.items;
        int n = items.size();
        // A single trailing elision only terminates the list.
        if (n > 0 && items.get(n - 1) == null) n--;
        List<Value> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ExprInterface item = items.get(i);
            values.add(item == null ? Value.undefined() : evaluate(item));
        }
        return Value.newArray(values);
    }

    @Override
    public Operand visitObjectLiteralExpr(ObjectLiteral expr) {
        JsObject obj = new JsObject();
        for (Map.Entry<String, ExprInterface> e : expr.items.entrySet()) {
            obj.put(e.getKey(), evaluate(e.getValue()));
        }
        return Value.object(obj);
    }

    @Override
    public Operand visitPropertyAccessExpr(PropertyAccess expr) {
        Value base = evaluate(expr.object);
        String key = evaluate(expr.key).toPropertyKey();
        if (base.type == Value.Type.UNDEFINED || base.type == Value.Type.NULL) {
            return Reference.unresolvable(key);
        }
        return Reference.property(base, key);
    }

    @Override
    public Operand visitFunctionCallExpr(FunctionCall expr) {
        Operand calleeOperand = expr.callee.accept(this);
        Value callee = getValue(calleeOperand);

        Value thisValue = null;
        if (calleeOperand instanceof Reference) {
            Reference ref = (Reference) calleeOperand;
            if (ref.isProperty() && ref.getBase().isAggregate()) thisValue = ref.getBase();
        }

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(evaluate(a));

        return callFunction(describe(expr.callee), callee, thisValue, args);
    }

    /**
     * Calls a script or native function.
     *
     * @param thisValue receiver for method calls; null for plain calls
     */
    public Value callFunction(String name, Value callee, Value thisValue, List<Value> args) {
        if (!callee.isCallable()) {
            throw new TypeError(name + " is not a function");
        }
        if (callStack.size() >= maxDepth) {
            throw new RangeError("Max call depth exceeded (" + maxDepth + "): " + recentFrames());
        }

        Debug dbg = Debug.get();
        if (dbg.isEnabled(DebugLevel.TRACE)) {
            dbg.t(TAG, "call " + name + " depth=" + (callStack.size() + 1) + " args=" + args.size());
        }

        callStack.push(new CallFrame(name, args.size()));
        try {
            if (callee.type == Value.Type.NATIVE_FUNCTION) {
                Value r = callee.asNativeFunction().call(thisValue == null ? Value.undefined() : thisValue, args);
                return r == null ? Value.undefined() : r;
            }
            return callee.asFunction().call(this, thisValue, args);
        } finally {
            callStack.pop();
        }
    }

    /** Innermost frames first, e.g. "f/1 <- f/1 <- main/0 <- ...". */
    private String recentFrames() {
        StringBuilder sb = new StringBuilder();
        int shown = 0;
        for (CallFrame frame : callStack) {
            if (shown == REPORTED_FRAMES) {
                sb.append(" <- ...");
                break;
            }
            if (shown > 0) sb.append(" <- ");
            sb.append(frame);
            shown++;
        }
        return sb.toString();
    }

    @Override
    public Operand visitConstructorExpr(Constructor expr) {
        // Construction is not modelled yet; the arguments are still evaluated for their effects.
        for (ExprInterface a : expr.arguments) evaluate(a);
        return Value.newObject();
    }

    @Override
    public Operand visitUnaryExpr(Unary expr) {
        Operand operand = expr.operand.accept(this);
        switch (expr.operator) {
            case "delete":
                return Value.bool(true);
            case "void":
                getValue(operand);
                return Value.undefined();
            case "typeof":
                return Value.string("object");
            case "++":
            case "--": {
                double old = getValue(operand).toNumber();
                Value updated = Value.number("++".equals(expr.operator) ? old + 1 : old - 1);
                putValue(operand, updated);
                return updated;
            }
            case "postfix++":
            case "postfix--": {
                double old = getValue(operand).toNumber();
                putValue(operand, Value.number("postfix++".equals(expr.operator) ? old + 1 : old - 1));
                return Value.number(old);
            }
            case "+":
                return Value.number(getValue(operand).toNumber());
            case "-":
                return Value.number(-getValue(operand).toNumber());
            case "~":
                return Value.number(~getValue(operand).toInt32());
            case "!":
                return Value.bool(!getValue(operand).toBoolean());
            default:
                throw new SyntaxError("Unknown unary operator: " + expr.operator);
        }
    }

    @Override
    public Operand visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        switch (expr.operator) {
            case "&&":
                return left.toBoolean() ? evaluate(expr.right) : left;
            case "||":
                return left.toBoolean() ? left : evaluate(expr.right);
            default:
                return binaryOp(expr.operator, left, evaluate(expr.right));
        }
    }

    Value binaryOp(String op, Value left, Value right) {
        switch (op) {
            case "*": return Value.number(left.toNumber() * right.toNumber());
            case "/": return Value.number(left.toNumber() / right.toNumber());
            case "%": return Value.number(left.toNumber() % right.toNumber());
            case "+": return add(left, right);
            case "-": return Value.number(left.toNumber() - right.toNumber());
            case "<<": return Value.number(left.toInt32() << (right.toInt32() & 0x1f));
            case ">>": return Value.number(left.toInt32() >> (right.toInt32() & 0x1f));
            case "&": return Value.number(left.toInt32() & right.toInt32());
            case "^": return Value.number(left.toInt32() ^ right.toInt32());
            case "|": return Value.number(left.toInt32() | right.toInt32());
            case "<": return Value.bool(compare(left, right, (a, b) -> a < b, c -> c < 0));
            case "<=": return Value.bool(compare(left, right, (a, b) -> a <= b, c -> c <= 0));
            case ">": return Value.bool(compare(left, right, (a, b) -> a > b, c -> c > 0));
            case ">=": return Value.bool(compare(left, right, (a, b) -> a >= b, c -> c >= 0));
            case "==":
            case "===":
                return Value.bool(isEqual(left, right));
            case "!=":
            case "!==":
                return Value.bool(!isEqual(left, right));
            case "instanceof":
            case "in":
                return Value.bool(false);
            default:
                throw new SyntaxError("Unknown binary operator: " + op);
        }
    }

    private static Value add(Value left, Value right) {
        if (concatenates(left) || concatenates(right)) {
            return Value.string(left.toJsString() + right.toJsString());
        }
        return Value.number(left.toNumber() + right.toNumber());
    }

    private static boolean concatenates(Value v) {
        return v.type == Value.Type.STRING || v.isAggregate() || v.isCallable();
    }

    private interface NumberComparison { boolean test(double a, double b); }
    private interface OrderComparison { boolean test(int c); }

    private static boolean compare(Value left, Value right, NumberComparison numbers, OrderComparison strings) {
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            return strings.test(left.asString().compareTo(right.asString()));
        }
        return numbers.test(left.toNumber(), right.toNumber());
    }

    /** Structural equality; numbers compare by IEEE value so NaN never equals itself. */
    public static boolean isEqual(Value a, Value b) {
        if (a.type == Value.Type.NUMBER && b.type == Value.Type.NUMBER) {
            return a.asNumber() == b.asNumber();
        }
        return a.equals(b);
    }

    @Override
    public Operand visitConditionalExpr(Conditional expr) {
        if (evaluate(expr.condition).toBoolean()) return evaluate(expr.whenTrue);
        return evaluate(expr.whenFalse);
    }

    @Override
    public Operand visitAssignExpr(Assign expr) {
        Operand target = expr.target.accept(this);
        Value rhs = evaluate(expr.value);
        Value result;
        if ("=".equals(expr.operator)) {
            result = rhs;
        } else {
            String op = expr.operator.endsWith("=")
                    ? expr.operator.substring(0, expr.operator.length() - 1)
                    : expr.operator;
            if (!COMPOUND_OPERATORS.contains(op)) {
                throw new SyntaxError("Unknown assignment operator: " + expr.operator);
            }
            result = binaryOp(op, getValue(target), rhs);
        }
        putValue(target, result);
        return result;
    }

    @Override
    public Operand visitMultiExpr(Multi expr) {
        getValue(expr.left.accept(this));
        return expr.right.accept(this);
    }

    @Override
    public Operand visitFunctionExpr(Function expr) {
        return Value.function(new JsFunction(expr.parameterNames(), expr.body, env));
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static String describe(ExprInterface callee) {
        if (callee instanceof Identifier) return ((Identifier) callee).name;
        if (callee instanceof PropertyAccess) {
            PropertyAccess p = (PropertyAccess) callee;
            if (p.key instanceof Literal && ((Literal) p.key).value.type == Value.Type.STRING) {
                return describe(p.object) + "." + ((Literal) p.key).value.asString();
            }
            return describe(p.object) + "[...]";
        }
        if (callee instanceof Function) return "function";
        return "expression";
    }
}
