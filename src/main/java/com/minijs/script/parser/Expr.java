package com.minijs.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expression nodes. Nodes are immutable and compare structurally, so a parsed tree can be
 * checked against a hand-built one.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitThisExpr(This expr);
        R visitIdentifierExpr(Identifier expr);
        R visitLiteralExpr(Literal expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitObjectLiteralExpr(ObjectLiteral expr);
        R visitPropertyAccessExpr(PropertyAccess expr);
        R visitFunctionCallExpr(FunctionCall expr);
        R visitConstructorExpr(Constructor expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitConditionalExpr(Conditional expr);
        R visitAssignExpr(Assign expr);
        R visitMultiExpr(Multi expr);
        R visitFunctionExpr(Function expr);
    }

    // -------------------------
    // Primary
    // -------------------------

    public static final class This implements ExprInterface {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitThisExpr(this);
        }

        @Override public boolean equals(Object o) { return o instanceof This; }
        @Override public int hashCode() { return This.class.hashCode(); }
        @Override public String toString() { return "This()"; }
    }

    public static final class Identifier implements ExprInterface {
        public final String name;

        public Identifier(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Identifier && name.equals(((Identifier) o).name);
        }

        @Override public int hashCode() { return name.hashCode(); }
        @Override public String toString() { return "Identifier(" + name + ")"; }
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && value.equals(((Literal) o).value);
        }

        @Override public int hashCode() { return value.hashCode(); }
        @Override public String toString() { return "Literal(" + value.type + " " + value + ")"; }
    }

    /** Null items are elisions. */
    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ArrayLiteral(List<ExprInterface> items) {
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ArrayLiteral && items.equals(((ArrayLiteral) o).items);
        }

        @Override public int hashCode() { return items.hashCode(); }
        @Override public String toString() { return "ArrayLiteral" + items; }
    }

    /** Keys are already normalised property keys. */
    public static final class ObjectLiteral implements ExprInterface {
        public final Map<String, ExprInterface> items;

        public ObjectLiteral(Map<String, ExprInterface> items) {
            this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitObjectLiteralExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ObjectLiteral && items.equals(((ObjectLiteral) o).items);
        }

        @Override public int hashCode() { return items.hashCode(); }
        @Override public String toString() { return "ObjectLiteral" + items; }
    }

    // -------------------------
    // Left-hand side
    // -------------------------

    public static final class PropertyAccess implements ExprInterface {
        public final ExprInterface object;
        public final ExprInterface key;

        public PropertyAccess(ExprInterface object, ExprInterface key) {
            this.object = object;
            this.key = key;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPropertyAccessExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof PropertyAccess)) return false;
            PropertyAccess p = (PropertyAccess) o;
            return object.equals(p.object) && key.equals(p.key);
        }

        @Override public int hashCode() { return Objects.hash(object, key); }
        @Override public String toString() { return "PropertyAccess(" + object + ", " + key + ")"; }
    }

    public static final class FunctionCall implements ExprInterface {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;

        public FunctionCall(ExprInterface callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionCallExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionCall)) return false;
            FunctionCall c = (FunctionCall) o;
            return callee.equals(c.callee) && arguments.equals(c.arguments);
        }

        @Override public int hashCode() { return Objects.hash(callee, arguments); }
        @Override public String toString() { return "FunctionCall(" + callee + ", " + arguments + ")"; }
    }

    /** {@code new X(args)}. */
    public static final class Constructor implements ExprInterface {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;

        public Constructor(ExprInterface callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstructorExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Constructor)) return false;
            Constructor c = (Constructor) o;
            return callee.equals(c.callee) && arguments.equals(c.arguments);
        }

        @Override public int hashCode() { return Objects.hash(callee, arguments); }
        @Override public String toString() { return "Constructor(" + callee + ", " + arguments + ")"; }
    }

    // -------------------------
    // Operators
    // -------------------------

    /** Postfix increment and decrement use the operators "postfix++" and "postfix--". */
    public static final class Unary implements ExprInterface {
        public final String operator;
        public final ExprInterface operand;

        public Unary(String operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary u = (Unary) o;
            return operator.equals(u.operator) && operand.equals(u.operand);
        }

        @Override public int hashCode() { return Objects.hash(operator, operand); }
        @Override public String toString() { return "Unary(" + operator + ", " + operand + ")"; }
    }

    public static final class Binary implements ExprInterface {
        public final String operator;
        public final ExprInterface left;
        public final ExprInterface right;

        public Binary(String operator, ExprInterface left, ExprInterface right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary b = (Binary) o;
            return operator.equals(b.operator) && left.equals(b.left) && right.equals(b.right);
        }

        @Override public int hashCode() { return Objects.hash(operator, left, right); }
        @Override public String toString() { return "Binary(" + operator + ", " + left + ", " + right + ")"; }
    }

    public static final class Conditional implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface whenTrue;
        public final ExprInterface whenFalse;

        public Conditional(ExprInterface condition, ExprInterface whenTrue, ExprInterface whenFalse) {
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Conditional)) return false;
            Conditional c = (Conditional) o;
            return condition.equals(c.condition) && whenTrue.equals(c.whenTrue) && whenFalse.equals(c.whenFalse);
        }

        @Override public int hashCode() { return Objects.hash(condition, whenTrue, whenFalse); }
        @Override public String toString() { return "Conditional(" + condition + ", " + whenTrue + ", " + whenFalse + ")"; }
    }

    /** Plain ("=") or compound ("+=", "<<=", ...) assignment. */
    public static final class Assign implements ExprInterface {
        public final String operator;
        public final ExprInterface target;
        public final ExprInterface value;

        public Assign(String operator, ExprInterface target, ExprInterface value) {
            this.operator = operator;
            this.target = target;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assign)) return false;
            Assign a = (Assign) o;
            return operator.equals(a.operator) && target.equals(a.target) && value.equals(a.value);
        }

        @Override public int hashCode() { return Objects.hash(operator, target, value); }
        @Override public String toString() { return "Assign(" + operator + ", " + target + ", " + value + ")"; }
    }

    /** Comma operator. */
    public static final class Multi implements ExprInterface {
        public final ExprInterface left;
        public final ExprInterface right;

        public Multi(ExprInterface left, ExprInterface right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMultiExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Multi)) return false;
            Multi m = (Multi) o;
            return left.equals(m.left) && right.equals(m.right);
        }

        @Override public int hashCode() { return Objects.hash(left, right); }
        @Override public String toString() { return "Multi(" + left + ", " + right + ")"; }
    }

    /** Anonymous function expression. */
    public static final class Function implements ExprInterface {
        public final List<Identifier> parameters;
        public final Statement.Block body;

        public Function(List<Identifier> parameters, Statement.Block body) {
            this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
            this.body = body;
        }

        public List<String> parameterNames() {
            List<String> out = new ArrayList<>(parameters.size());
            for (Identifier p : parameters) out.add(p.name);
            return out;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionExpr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Function)) return false;
            Function f = (Function) o;
            return parameters.equals(f.parameters) && body.equals(f.body);
        }

        @Override public int hashCode() { return Objects.hash(parameters, body); }
        @Override public String toString() { return "Function(" + parameters + ", " + body + ")"; }
    }
}
