package com.minijs.script;

import java.io.PrintStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.minijs.debug.Debug;
import com.minijs.protocol.util.ValueJson;
import com.minijs.script.parser.Completion;
import com.minijs.script.parser.Environment;
import com.minijs.script.parser.Interpreter;
import com.minijs.script.parser.JsException;
import com.minijs.script.parser.NativeFunction;
import com.minijs.script.parser.Parser;
import com.minijs.script.parser.Statement.Block;
import com.minijs.script.parser.Statement.Stmt;
import com.minijs.script.parser.Value;

/**
 * Engine facade: configuration, host bindings and program execution.
 *
 * <pre>
 * MiniJs js = new MiniJs();
 * js.registerGlobalJson("config", "{\"limit\": 3}");
 * ProgramResult r = js.run("var n = config.limit * 2; n;");
 * r.value();   // 6.0
 * </pre>
 *
 * Script errors are {@link JsException}s. They are logged through the {@link Debug} hub and
 * rethrown to the host unchanged.
 */
public class MiniJs {
    private static final String TAG = "minijs.engine";

    private final Map<String, Value> globals = new LinkedHashMap<>();
    private int maxCallDepth = Interpreter.DEFAULT_MAX_DEPTH;
    private boolean strictAssignment = false;
    private int maxDisplayLength = Value.DEFAULT_MAX_DISPLAY_LENGTH;
    private PrintStream output = System.out;

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be positive, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** When on, assigning a name no scope declares is a ReferenceError instead of creating a global. */
    public void setStrictAssignment(boolean strict) { this.strictAssignment = strict; }

    public boolean isStrictAssignment() { return strictAssignment; }

    public void setMaxDisplayLength(int length) {
        if (length < 0) throw new IllegalArgumentException("maxDisplayLength must not be negative, got " + length);
        this.maxDisplayLength = length;
    }

    public int getMaxDisplayLength() { return maxDisplayLength; }

    /** Sink for {@code console.log}. */
    public void setOutput(PrintStream out) { this.output = (out == null) ? System.out : out; }

    public void registerGlobal(String name, Value value) {
        globals.put(requireName(name), value == null ? Value.undefined() : value);
    }

    public void registerFunction(String name, NativeFunction fn) {
        if (fn == null) throw new IllegalArgumentException("function must not be null");
        globals.put(requireName(name), Value.nativeFunction(fn));
    }

    /** Registers host data given as JSON text. */
    public void registerGlobalJson(String name, String json) {
        globals.put(requireName(name), ValueJson.parse(json));
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("name must not be empty");
        return name;
    }

    // -------------------------
    // Execution
    // -------------------------

    /**
     * A root environment holding {@code console} (unless the host registered its own), the
     * registered globals, then {@code bindings}, and {@code this} bound to undefined.
     */
    public Environment newEnvironment(Map<String, Value> bindings) {
        Environment env = new Environment();
        if (!globals.containsKey("console")) {
            env.declare("console", Console.create(output, maxDisplayLength));
        }
        for (Map.Entry<String, Value> e : globals.entrySet()) env.declare(e.getKey(), e.getValue());
        if (bindings != null) {
            for (Map.Entry<String, Value> e : bindings.entrySet()) env.declare(e.getKey(), e.getValue());
        }
        if (!env.hasOwn("this")) env.declare("this", Value.undefined());
        return env;
    }

    public ProgramResult run(String source) {
        return run(source, null);
    }

    public ProgramResult run(String source, Map<String, Value> initialBindings) {
        requireSource(source);
        Environment env = newEnvironment(initialBindings);

        Set<String> hostNames = new HashSet<>();
        hostNames.add("this");
        if (!globals.containsKey("console")) hostNames.add("console");
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            if (e.getValue().isCallable()) hostNames.add(e.getKey());
        }

        Debug.get().d(TAG, "run: " + source.length() + " chars");
        try {
            Block program = new Parser(source).parseProgram();
            Completion c = newInterpreter(env).executeProgram(program);
            Debug.get().d(TAG, "run complete: " + c);
            return new ProgramResult(c, env, Collections.unmodifiableSet(hostNames));
        } catch (JsException e) {
            Debug.get().e(TAG, "run failed: " + e, e);
            throw e;
        }
    }

    /** Evaluates one expression in {@code env} and returns its value. */
    public Value evaluate(String expression, Environment env) {
        requireSource(expression);
        try {
            return newInterpreter(env).evaluate(new Parser(expression).parseExpression());
        } catch (JsException e) {
            Debug.get().e(TAG, "evaluate failed: " + e, e);
            throw e;
        }
    }

    /** Executes one statement in {@code env}; its {@code var} names are declared there first. */
    public Completion execute(String statement, Environment env) {
        requireSource(statement);
        try {
            Stmt stmt = new Parser(statement).parseStatement();
            return newInterpreter(env).executeProgram(stmt);
        } catch (JsException e) {
            Debug.get().e(TAG, "execute failed: " + e, e);
            throw e;
        }
    }

    private Interpreter newInterpreter(Environment env) {
        if (env == null) throw new IllegalArgumentException("environment must not be null");
        return new Interpreter(env, maxCallDepth, strictAssignment);
    }

    private static void requireSource(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
    }
}
