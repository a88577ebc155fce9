import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.minijs.debug.Debug;
import com.minijs.debug.DebugLevel;
import com.minijs.script.MiniJs;
import com.minijs.script.ProgramResult;
import com.minijs.script.parser.Completion;
import com.minijs.script.parser.Environment;
import com.minijs.script.parser.ParseError;
import com.minijs.script.parser.RangeError;
import com.minijs.script.parser.ReferenceError;
import com.minijs.script.parser.TypeError;
import com.minijs.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MiniJsProgramTest {

    private static ProgramResult run(String source) {
        return new MiniJs().run(source);
    }

    private static double number(ProgramResult r) {
        return r.value().asNumber();
    }

    @Test
    void returnStatement_stopsFunctionBody() {
        ProgramResult r = run("function () { return 4; 7; } ();");
        assertEquals(Completion.normal(Value.number(4)), r.completion());
    }

    @Test
    void functionAsVariable() {
        assertEquals(42.0, number(run("var f = function () { return 42; };\nf();")), 1e-9);
    }

    @Test
    void arguments() {
        assertEquals(49.0, number(run("var sqr = function (x) { return x * x; };\nsqr(7);")), 1e-9);
    }

    @Test
    void functionAsArgument() {
        String program = "var double = function (f, x) { return f(f(x)); };\n"
                + "double(function (x) { return x * x; }, 2);";
        assertEquals(16.0, number(run(program)), 1e-9);
    }

    @Test
    void modifyGlobalVariable() {
        String program = "var x = 1, incrementX = function () { x += 1; };\n"
                + "incrementX();\n"
                + "incrementX();\n"
                + "x;";
        assertEquals(3.0, number(run(program)), 1e-9);
    }

    @Test
    void shadowing_leavesOuterBindingAlone() {
        String program = "var x = 1;\n"
                + "var shadow = function () {\n"
                + "    var x = 3; x += 1; return x;\n"
                + "};\n"
                + "shadow();";
        ProgramResult r = run(program);
        assertEquals(4.0, number(r), 1e-9);
        assertEquals(1.0, r.get("x").asNumber(), 1e-9);
    }

    @Test
    void closures_keepIndependentState() {
        String program = "var fibgen = function () {\n"
                + "    var a = 0, b = 1;\n"
                + "    return function () {\n"
                + "        var old = a;\n"
                + "        a = b;\n"
                + "        b = b + old;\n"
                + "        return old;\n"
                + "    };\n"
                + "};\n"
                + "var fib = fibgen();\n"
                + "var f1 = fib();\n"
                + "var f2 = fib();\n"
                + "fib(); fib(); fib(); fib();\n"
                + "var f7 = fib();\n"
                + "fib(); fib(); fib(); fib();\n"
                + "var fib2 = fibgen();\n"
                + "fib2(); fib2(); fib2(); fib2();\n"
                + "var f5 = fib2();\n"
                + "fib(); // f12\n";
        ProgramResult r = run(program);
        assertEquals(Completion.normal(Value.number(89)), r.completion());
        assertEquals(0.0, r.get("f1").asNumber(), 1e-9);
        assertEquals(1.0, r.get("f2").asNumber(), 1e-9);
        assertEquals(3.0, r.get("f5").asNumber(), 1e-9);
        assertEquals(8.0, r.get("f7").asNumber(), 1e-9);
    }

    @Test
    void closuresOverOneScope_seeEachOthersWrites() {
        String program = "var make = function () {\n"
                + "    var n = 0;\n"
                + "    return {inc: function () { n += 1; }, get: function () { return n; }};\n"
                + "};\n"
                + "var c = make();\n"
                + "c.inc(); c.inc();\n"
                + "c.get();";
        assertEquals(2.0, number(run(program)), 1e-9);
    }

    @Test
    void argumentsObject_andMissingParameters() {
        assertEquals(3.0, number(run("var f = function () { return arguments.length; }; f(1, 2, 3);")), 1e-9);
        assertEquals(20.0, number(run("var f = function (a) { return arguments[1]; }; f(10, 20);")), 1e-9);
        assertTrue(run("var f = function (a, b) { return b; }; f(1);").value().isUndefined());
    }

    @Test
    void functionWithoutReturn_yieldsUndefined() {
        assertTrue(run("var f = function () { 1; }; f();").value().isUndefined());
    }

    @Test
    void returnFromInsideLoop() {
        String program = "var f = function () {\n"
                + "    var i = 0;\n"
                + "    while (true) { ++i; if (i == 3) return i; }\n"
                + "};\n"
                + "f();";
        assertEquals(3.0, number(run(program)), 1e-9);
    }

    @Test
    void recursion() {
        String program = "var fact = function (n) { if (n <= 1) return 1; return n * fact(n - 1); };\n"
                + "fact(10);";
        assertEquals(3628800.0, number(run(program)), 1e-9);
    }

    @Test
    void hoisting_makesLaterVarsVisibleAsUndefined() {
        ProgramResult r = run("var seen = later; var later = 1; seen;");
        assertTrue(r.value().isUndefined());
        assertEquals(1.0, r.get("later").asNumber(), 1e-9);

        String fn = "var f = function () { var before = inner; if (false) { var inner = 2; } return before; };\n"
                + "f();";
        assertTrue(run(fn).value().isUndefined());
    }

    @Test
    void methodCall_bindsThis() {
        String program = "var o = {n: 2, get: function () { return this.n; }};\n"
                + "o.get();";
        assertEquals(2.0, number(run(program)), 1e-9);
    }

    @Test
    void topLevelThis_isUndefined() {
        assertTrue(run("this;").value().isUndefined());
    }

    @Test
    void plainCall_resolvesThisLexically() {
        String program = "var o = {n: 5, m: function () { var g = function () { return this; }; return g(); }};\n"
                + "o.m();";
        Value v = run(program).value();
        assertEquals(Value.Type.OBJECT, v.getType());
        assertEquals(5.0, v.asObject().get("n").asNumber(), 1e-9);
    }

    @Test
    void lenientAssignment_createsGlobal() {
        ProgramResult r = run("var f = function () { g = 5; }; f(); g;");
        assertEquals(5.0, number(r), 1e-9);
        assertTrue(r.environment().hasOwn("g"));
    }

    @Test
    void strictAssignment_rejectsUndeclaredNames() {
        MiniJs js = new MiniJs();
        js.setStrictAssignment(true);
        assertThrows(ReferenceError.class, () -> js.run("y = 1;"));
        assertEquals(1.0, js.run("var y; y = 1; y;").value().asNumber(), 1e-9);
    }

    @Test
    void callDepthGuard_raisesRangeError() {
        MiniJs js = new MiniJs();
        js.setMaxCallDepth(50);
        RangeError e = assertThrows(RangeError.class, () -> js.run("var f = function () { return f(); }; f();"));
        assertEquals("RangeError", e.getErrorName());
        assertTrue(e.getMessage().startsWith("Max call depth exceeded (50): f/0 <- f/0 <- "), e.getMessage());
        assertTrue(e.getMessage().endsWith(" <- ..."), e.getMessage());

        // the guard is exact: depth 50 is still allowed
        String countdown = "var f = function (n) { if (n <= 1) return 1; return f(n - 1); }; f(50);";
        assertEquals(1.0, js.run(countdown).value().asNumber(), 1e-9);
    }

    @Test
    void callingUndefinedVariable_isTypeError() {
        TypeError e = assertThrows(TypeError.class, () -> run("var x; x();"));
        assertEquals("x is not a function", e.getMessage());
    }

    @Test
    void breakOutsideLoop_isParseError() {
        assertThrows(ParseError.class, () -> run("break;"));
        assertThrows(ParseError.class, () -> run("while (true) { var f = function () { break; }; }"));
    }

    @Test
    void consoleObject_printsNumbersWithHostRendering() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        MiniJs js = new MiniJs();
        js.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));

        String program = "var i = 0;\n"
                + "while (i < 10) {\n"
                + "    console.log(i);\n"
                + "    i++;\n"
                + "}\n";
        ProgramResult r = js.run(program);

        assertEquals(Completion.normal(Value.number(9)), r.completion());
        assertEquals("0.0\n1.0\n2.0\n3.0\n4.0\n5.0\n6.0\n7.0\n8.0\n9.0\n", buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void consoleLog_joinsArgumentsWithSpaces() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        MiniJs js = new MiniJs();
        js.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));

        js.run("console.log('n =', 1, [1, 'a'], {k: null}, true);");
        assertEquals("n = 1.0 [1.0, \"a\"] {k: null} true\n", buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void consoleLog_truncatesLongAggregates() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        MiniJs js = new MiniJs();
        js.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));
        js.setMaxDisplayLength(10);

        js.run("console.log([100, 200, 300, 400, 500]);");
        String out = buf.toString(StandardCharsets.UTF_8);
        assertEquals("[100.0, 20...\n", out);
    }

    @Test
    void displayCap_doesNotTruncateStrings() {
        MiniJs js = new MiniJs();
        js.setMaxDisplayLength(5);

        assertEquals("[1.0, 2.0, 3.0, 4.0, 5.0, 6.0]", js.run("'' + [1, 2, 3, 4, 5, 6];").value().asString());
        assertEquals("x{a: 1.0, b: 2.0}", js.run("'x' + {a: 1, b: 2};").value().asString());
        // aggregate property keys use the full rendering too
        assertEquals(1.0, js.run("var o = {}; o[[1, 2, 3]] = 1; o['[1.0, 2.0, 3.0]'];").value().asNumber(), 1e-9);
    }

    @Test
    void hugeSparseArrayToString_isRangeError() {
        RangeError e = assertThrows(RangeError.class, () -> run("var a = []; a[100000000] = 1; '' + a;"));
        assertEquals("Invalid string length", e.getMessage());
    }

    @Test
    void cyclicObjects_compareStructurally() {
        assertTrue(run("var a = {}, b = {}; a.s = a; b.s = b; a == b;").value().asBool());
        assertFalse(run("var a = {n: 1}, b = {n: 2}; a.s = a; b.s = b; a == b;").value().asBool());
        assertTrue(run("var a = [], b = []; a[0] = b; b[0] = a; a == b;").value().asBool());
    }

    @Test
    void cyclicGlobals_exportWithoutTheBackReference() {
        ProgramResult r = run("var a = {n: 1}; a.self = a; var list = [1]; list[1] = list;");
        ObjectNode json = r.globalsJson();
        assertEquals(1.0, json.get("a").get("n").asDouble(), 1e-9);
        assertFalse(json.get("a").has("self"));
        assertEquals(2, json.get("list").size());
        assertTrue(json.get("list").get(1).isNull());
    }

    @Test
    void run_worksWithoutAnyDebugSetup() {
        Debug dbg = Debug.get();
        assertNotNull(dbg.getSink());
        assertFalse(dbg.isEnabled(DebugLevel.ERROR));
        assertEquals(3.0, number(run("var f = function (x) { return x + 1; }; f(2);")), 1e-9);
    }

    @Test
    void hostConsole_replacesDefault() {
        MiniJs js = new MiniJs();
        Map<String, Value> seen = new LinkedHashMap<>();
        js.registerGlobal("console", Value.newObject());
        js.registerFunction("record", (thisValue, args) -> {
            seen.put("arg", args.get(0));
            return Value.undefined();
        });
        js.run("console.x = 1; record(console.x);");
        assertEquals(1.0, seen.get("arg").asNumber(), 1e-9);
    }

    @Test
    void registeredFunction_receivesArguments() {
        MiniJs js = new MiniJs();
        js.registerFunction("add", (thisValue, args) ->
                Value.number(args.get(0).toNumber() + args.get(1).toNumber()));
        assertEquals(5.0, js.run("add(2, 3);").value().asNumber(), 1e-9);
    }

    @Test
    void registeredFunction_seesReceiverOnMethodCall() {
        MiniJs js = new MiniJs();
        js.registerFunction("self", (thisValue, args) -> thisValue);
        assertTrue(js.run("self();").value().isUndefined());
        Value v = js.run("var o = {f: self, tag: 'o'}; o.f();").value();
        assertEquals("o", v.asObject().get("tag").asString());
    }

    @Test
    void jsonGlobals_inAndOut() {
        MiniJs js = new MiniJs();
        js.registerGlobalJson("config", "{\"limit\": 3, \"names\": [\"a\", \"b\"]}");
        ProgramResult r = js.run("var n = config.limit * 2, first = config.names[0], f = function () {};\nn;");

        assertEquals(6.0, r.value().asNumber(), 1e-9);
        ObjectNode json = r.globalsJson();
        assertEquals(6.0, json.get("n").asDouble(), 1e-9);
        assertEquals("a", json.get("first").asText());
        assertEquals(3.0, json.get("config").get("limit").asDouble(), 1e-9);
        assertFalse(json.has("f"));
        assertFalse(json.has("console"));
        assertFalse(json.has("this"));
    }

    @Test
    void malformedJsonGlobal_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MiniJs().registerGlobalJson("x", "{oops"));
    }

    @Test
    void initialBindings_areVisibleAndMutable() {
        Map<String, Value> init = new LinkedHashMap<>();
        init.put("x", Value.number(3));
        ProgramResult r = new MiniJs().run("x = x * 2;", init);
        assertEquals(6.0, r.get("x").asNumber(), 1e-9);
        assertEquals(6.0, r.globals().get("x").asNumber(), 1e-9);
    }

    @Test
    void newEnvironment_sharedAcrossEvaluateAndExecute() {
        MiniJs js = new MiniJs();
        Environment env = js.newEnvironment(null);
        js.execute("var total = 0;", env);
        js.execute("while (total < 5) total += 2;", env);
        assertEquals(6.0, js.evaluate("total", env).asNumber(), 1e-9);
        assertTrue(js.evaluate("this", env).isUndefined());
    }

    @Test
    void nullSource_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MiniJs().run(null));
    }

    @Test
    void emptyProgram_yieldsUndefined() {
        ProgramResult r = run("");
        assertEquals(Completion.EMPTY, r.completion());
        assertTrue(r.value().isUndefined());
    }
}
