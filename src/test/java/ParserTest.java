import org.junit.jupiter.api.Test;

import com.minijs.script.parser.Expr;
import com.minijs.script.parser.Expr.ExprInterface;
import com.minijs.script.parser.ParseError;
import com.minijs.script.parser.Parser;
import com.minijs.script.parser.Statement;
import com.minijs.script.parser.Statement.Stmt;
import com.minijs.script.parser.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static ExprInterface expr(String source) {
        return new Parser(source).parseExpression();
    }

    private static Stmt stmt(String source) {
        return new Parser(source).parseStatement();
    }

    private static Expr.Literal lit(double d) { return new Expr.Literal(Value.number(d)); }
    private static Expr.Literal lit(String s) { return new Expr.Literal(Value.string(s)); }
    private static Expr.Identifier id(String name) { return new Expr.Identifier(name); }

    private static Expr.Binary bin(String op, ExprInterface l, ExprInterface r) {
        return new Expr.Binary(op, l, r);
    }

    @Test
    void objectLiteral_normalisesKeys() {
        Map<String, ExprInterface> inner = new LinkedHashMap<>();
        inner.put("3", lit(4));
        Map<String, ExprInterface> outer = new LinkedHashMap<>();
        outer.put("7", new Expr.ArrayLiteral(Arrays.asList(lit(9), lit(10), lit("ala ma kota"))));
        outer.put("ala ma kota", new Expr.ObjectLiteral(inner));

        assertEquals(new Expr.ObjectLiteral(outer),
                expr("{7: [9, 10, \"ala ma kota\"], \"ala ma kota\": {3: 4}}"));
    }

    @Test
    void binaryOp_precedence() {
        assertEquals(bin("+", lit(1), bin("*", lit(2), lit(7))), expr("1 + 2 * 7"));
        assertEquals(bin("||", id("a"), bin("&&", id("b"), id("c"))), expr("a || b && c"));
        assertEquals(bin("==", id("a"), bin("<", id("b"), id("c"))), expr("a == b < c"));
        assertEquals(bin("<<", lit(1), bin("+", lit(2), lit(3))), expr("1 << 2 + 3"));
        assertEquals(bin("|", id("a"), bin("^", id("b"), bin("&", id("c"), id("d")))), expr("a | b ^ c & d"));
    }

    @Test
    void binaryOp_leftAssociative() {
        assertEquals(bin("-", bin("-", lit(1), lit(2)), lit(3)), expr("1 - 2 - 3"));
    }

    @Test
    void unaryOp() {
        assertEquals(new Expr.Unary("+", new Expr.Unary("-", lit(1))), expr("+-1"));
        assertEquals(new Expr.Unary("typeof", id("x")), expr("typeof x"));
    }

    @Test
    void prefixAndPostfixOps() {
        assertEquals(new Expr.Unary("++", id("x")), expr("++x"));
        assertEquals(new Expr.Unary("postfix--", id("x")), expr("x--"));
    }

    @Test
    void compoundAssignment() {
        assertEquals(new Expr.Assign("/=", id("x"), bin("-", lit(5), lit(2))), expr("x /= 5 - 2"));
    }

    @Test
    void assignment_isRightAssociative() {
        assertEquals(new Expr.Assign("=", id("a"), new Expr.Assign("=", id("b"), lit(1))), expr("a = b = 1"));
    }

    @Test
    void conditional_nestsToTheRight() {
        assertEquals(new Expr.Conditional(id("a"), id("b"), new Expr.Conditional(id("c"), id("d"), id("e"))),
                expr("a ? b : c ? d : e"));
    }

    @Test
    void comma_isLeftAssociative() {
        assertEquals(new Expr.Multi(new Expr.Multi(id("a"), id("b")), id("c")), expr("a, b, c"));
    }

    @Test
    void functionExpression() {
        Statement.Block body = new Statement.Block(Collections.singletonList(
                new Statement.ReturnStmt(bin("+", id("x"), id("y")))));
        assertEquals(new Expr.Function(Arrays.asList(id("x"), id("y")), body),
                expr("function (x, y) { return x + y; }"));
    }

    @Test
    void memberAccessAndCalls() {
        ExprInterface ab = new Expr.PropertyAccess(id("a"), lit("b"));
        assertEquals(new Expr.FunctionCall(new Expr.PropertyAccess(ab, lit("c")), Collections.singletonList(lit(1))),
                expr("a.b.c(1)"));
        assertEquals(new Expr.PropertyAccess(id("a"), lit("b")), expr("a['b']"));
        assertEquals(new Expr.FunctionCall(new Expr.FunctionCall(id("f"), Collections.emptyList()),
                Collections.emptyList()), expr("f()()"));
    }

    @Test
    void newExpressions() {
        assertEquals(new Expr.Constructor(id("Foo"), Collections.emptyList()), expr("new Foo"));
        assertEquals(new Expr.PropertyAccess(new Expr.Constructor(id("Foo"), Collections.singletonList(lit(1))), lit("bar")),
                expr("new Foo(1).bar"));
        assertEquals(new Expr.Constructor(new Expr.PropertyAccess(id("a"), lit("B")), Collections.emptyList()),
                expr("new a.B()"));
    }

    @Test
    void arrayElisions_keepNullSlots() {
        assertEquals(new Expr.ArrayLiteral(Arrays.asList(null, null)), expr("[,]"));
        assertEquals(new Expr.ArrayLiteral(Arrays.asList(lit(1), lit(2), null)), expr("[1, 2,]"));
        assertEquals(new Expr.ArrayLiteral(Arrays.asList(lit(1), null, lit(2))), expr("[1,,2]"));
        assertEquals(new Expr.ArrayLiteral(Collections.emptyList()), expr("[]"));
    }

    @Test
    void block() {
        assertEquals(new Statement.Block(Arrays.asList(
                        new Statement.ExprStmt(lit(1)),
                        new Statement.ExprStmt(lit(3)))),
                stmt("{ 1; 3; }"));
    }

    @Test
    void variableStatement() {
        assertEquals(new Statement.VarList(Arrays.asList(
                        new Statement.VarDecl(id("x"), lit(7)),
                        new Statement.VarDecl(id("y"), lit(5)))),
                stmt("var x = 7, y = 5;"));
        assertEquals(new Statement.VarList(Arrays.asList(
                        new Statement.VarDecl(id("x"), null),
                        new Statement.VarDecl(id("y"), lit(5)))),
                stmt("var x, y = 5;"));
    }

    @Test
    void danglingElse_attachesToInnerIf() {
        Stmt inner = new Statement.If(new Expr.Literal(Value.bool(true)),
                new Statement.ExprStmt(lit(3)), new Statement.ExprStmt(lit(5)));
        assertEquals(new Statement.If(new Expr.Literal(Value.bool(false)), inner, null),
                stmt("if (false) if (true) 3; else 5;"));
    }

    @Test
    void loops() {
        Stmt body = new Statement.ExprStmt(new Expr.Unary("++", id("x")));
        assertEquals(new Statement.While(bin("<", id("x"), lit(5)), body), stmt("while (x < 5) ++x;"));
        assertEquals(new Statement.DoWhile(body, bin("<", id("x"), lit(3))), stmt("do ++x; while (x < 3);"));
        assertEquals(new Statement.While(new Expr.Literal(Value.bool(true)),
                        new Statement.Block(Arrays.asList(new Statement.BreakStmt(), new Statement.ContinueStmt()))),
                stmt("while (true) { break continue }"));
    }

    @Test
    void declaredVars_collectsVarNamesButNotNestedFunctions() {
        Statement.Block program = new Parser(
                "var a = 1;\n"
                        + "if (a) { var b; } else var c;\n"
                        + "while (false) { var d, e; }\n"
                        + "do var f; while (false);\n"
                        + "var g = function () { var hidden; };\n").parseProgram();
        Set<String> expected = new LinkedHashSet<>(Arrays.asList("a", "b", "c", "d", "e", "f", "g"));
        assertEquals(expected, program.declaredVars());
    }

    @Test
    void syntaxErrors_carryLineNumbers() {
        ParseError e = assertThrows(ParseError.class, () -> new Parser("var a = 1;\nvar = 2;").parseProgram());
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().startsWith("[line 2]"));
        assertEquals("SyntaxError", e.getErrorName());
    }

    @Test
    void rejectedSources() {
        assertThrows(ParseError.class, () -> expr("1 +"));
        assertThrows(ParseError.class, () -> expr("a + b = 3"));
        assertThrows(ParseError.class, () -> expr("(a ? b : c) = 1"));
        assertThrows(ParseError.class, () -> expr("1 2"));
        assertThrows(ParseError.class, () -> stmt("break;"));
        assertThrows(ParseError.class, () -> stmt("continue;"));
        assertThrows(ParseError.class, () -> stmt("for (;;) {}"));
        assertThrows(ParseError.class, () -> stmt("x = 1"));
        assertThrows(ParseError.class, () -> stmt("var 1 = 2;"));
        assertThrows(ParseError.class, () -> expr("function f() {}"));
        assertThrows(ParseError.class, () -> expr("{a: 1,}"));
    }

    @Test
    void postfix_requiresSameLine() {
        assertEquals(new Statement.ExprStmt(new Expr.Unary("postfix++", id("x"))), stmt("x++;"));
        // no automatic semicolon insertion, so a "++" on the next line leaves "x" unterminated
        assertThrows(ParseError.class, () -> new Parser("x\n++y;").parseProgram());
    }
}
