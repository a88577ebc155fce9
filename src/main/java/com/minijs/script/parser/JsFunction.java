package com.minijs.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A script function: parameter names, the shared body and the environment it was
 * defined in.
 */
public class JsFunction {
    final List<String> params;
    final Statement.Block body;
    final Environment closure;
    final Set<String> declaredVars;

    JsFunction(List<String> params, Statement.Block body, Environment closure) {
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
        this.closure = closure;
        this.declaredVars = body.declaredVars();
    }

    /**
     * @param thisValue bound as {@code this} in the call scope; null leaves {@code this}
     *                  to resolve through the closure
     */
    Value call(Interpreter interpreter, Value thisValue, List<Value> args) {
        Map<String, Value> own = new LinkedHashMap<>();
        for (String name : declaredVars) own.put(name, Value.undefined());
        own.put("arguments", Value.newArray(args));
        for (String p : params) own.put(p, Value.undefined());
        for (int i = 0; i < params.size() && i < args.size(); i++) {
            own.put(params.get(i), args.get(i));
        }
        if (thisValue != null) own.put("this", thisValue);

        Environment previous = interpreter.env;

        // The call scope is a child of the defining scope, not of the caller.
        interpreter.env = closure.childScope(own);
        try {
            Completion c = body.accept(interpreter);
            if (c.type == Completion.Type.RETURN && c.value != null) return c.value;
            return Value.undefined();
        } finally {
            interpreter.env = previous;
        }
    }

    @Override
    public String toString() {
        return "function (" + String.join(", ", params) + ") {...}";
    }
}
