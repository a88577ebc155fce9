package com.minijs.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);

        /** Names declared with {@code var} in this statement, excluding nested functions. */
        default Set<String> declaredVars() {
            return Collections.emptySet();
        }
    }

    public interface StmtVisitor<R> {
        R visitBlockStmt(Block stmt);
        R visitVarListStmt(VarList stmt);
        R visitVarDeclStmt(VarDecl stmt);
        R visitEmptyStmt(Empty stmt);
        R visitExprStmt(ExprStmt stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitDoWhileStmt(DoWhile stmt);
        R visitContinueStmt(ContinueStmt stmt);
        R visitBreakStmt(BreakStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitDebuggerStmt(DebuggerStmt stmt);
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;

        public Block(List<Stmt> statements) {
            this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }

        @Override
        public Set<String> declaredVars() {
            Set<String> out = new LinkedHashSet<>();
            for (Stmt s : statements) out.addAll(s.declaredVars());
            return out;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Block && statements.equals(((Block) o).statements);
        }

        @Override public int hashCode() { return statements.hashCode(); }
        @Override public String toString() { return "Block" + statements; }
    }

    /** {@code var a = 1, b;} */
    public static final class VarList implements Stmt {
        public final List<VarDecl> declarations;

        public VarList(List<VarDecl> declarations) {
            this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarListStmt(this); }

        @Override
        public Set<String> declaredVars() {
            Set<String> out = new LinkedHashSet<>();
            for (VarDecl d : declarations) out.addAll(d.declaredVars());
            return out;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof VarList && declarations.equals(((VarList) o).declarations);
        }

        @Override public int hashCode() { return declarations.hashCode(); }
        @Override public String toString() { return "VarList" + declarations; }
    }

    public static final class VarDecl implements Stmt {
        public final Expr.Identifier name;
        /** May be null. */
        public final Expr.ExprInterface initializer;

        public VarDecl(Expr.Identifier name, Expr.ExprInterface initializer) {
            this.name = name;
            this.initializer = initializer;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarDeclStmt(this); }

        @Override
        public Set<String> declaredVars() {
            return Collections.singleton(name.name);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof VarDecl)) return false;
            VarDecl d = (VarDecl) o;
            return name.equals(d.name) && Objects.equals(initializer, d.initializer);
        }

        @Override public int hashCode() { return Objects.hash(name, initializer); }
        @Override public String toString() { return "VarDecl(" + name + ", " + initializer + ")"; }
    }

    public static final class Empty implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitEmptyStmt(this); }

        @Override public boolean equals(Object o) { return o instanceof Empty; }
        @Override public int hashCode() { return Empty.class.hashCode(); }
        @Override public String toString() { return "Empty()"; }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof ExprStmt && expression.equals(((ExprStmt) o).expression);
        }

        @Override public int hashCode() { return expression.hashCode(); }
        @Override public String toString() { return "ExprStmt(" + expression + ")"; }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        /** May be null. */
        public final Stmt elseBranch;

        public If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }

        @Override
        public Set<String> declaredVars() {
            Set<String> out = new LinkedHashSet<>(thenBranch.declaredVars());
            if (elseBranch != null) out.addAll(elseBranch.declaredVars());
            return out;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof If)) return false;
            If i = (If) o;
            return condition.equals(i.condition) && thenBranch.equals(i.thenBranch)
                    && Objects.equals(elseBranch, i.elseBranch);
        }

        @Override public int hashCode() { return Objects.hash(condition, thenBranch, elseBranch); }
        @Override public String toString() { return "If(" + condition + ", " + thenBranch + ", " + elseBranch + ")"; }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;

        public While(Expr.ExprInterface condition, Stmt body) {
            this.condition = condition;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }

        @Override
        public Set<String> declaredVars() {
            return body.declaredVars();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof While)) return false;
            While w = (While) o;
            return condition.equals(w.condition) && body.equals(w.body);
        }

        @Override public int hashCode() { return Objects.hash(condition, body); }
        @Override public String toString() { return "While(" + condition + ", " + body + ")"; }
    }

    public static final class DoWhile implements Stmt {
        public final Stmt body;
        public final Expr.ExprInterface condition;

        public DoWhile(Stmt body, Expr.ExprInterface condition) {
            this.body = body;
            this.condition = condition;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitDoWhileStmt(this); }

        @Override
        public Set<String> declaredVars() {
            return body.declaredVars();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof DoWhile)) return false;
            DoWhile d = (DoWhile) o;
            return body.equals(d.body) && condition.equals(d.condition);
        }

        @Override public int hashCode() { return Objects.hash(body, condition); }
        @Override public String toString() { return "DoWhile(" + body + ", " + condition + ")"; }
    }

    public static final class ContinueStmt implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }

        @Override public boolean equals(Object o) { return o instanceof ContinueStmt; }
        @Override public int hashCode() { return ContinueStmt.class.hashCode(); }
        @Override public String toString() { return "Continue()"; }
    }

    public static final class BreakStmt implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }

        @Override public boolean equals(Object o) { return o instanceof BreakStmt; }
        @Override public int hashCode() { return BreakStmt.class.hashCode(); }
        @Override public String toString() { return "Break()"; }
    }

    public static final class ReturnStmt implements Stmt {
        /** May be null. */
        public final Expr.ExprInterface value;

        public ReturnStmt(Expr.ExprInterface value) { this.value = value; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof ReturnStmt && Objects.equals(value, ((ReturnStmt) o).value);
        }

        @Override public int hashCode() { return Objects.hashCode(value); }
        @Override public String toString() { return "Return(" + value + ")"; }
    }

    public static final class DebuggerStmt implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitDebuggerStmt(this); }

        @Override public boolean equals(Object o) { return o instanceof DebuggerStmt; }
        @Override public int hashCode() { return DebuggerStmt.class.hashCode(); }
        @Override public String toString() { return "Debugger()"; }
    }
}
