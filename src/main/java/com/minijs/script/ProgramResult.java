package com.minijs.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.minijs.protocol.util.ValueJson;
import com.minijs.script.parser.Completion;
import com.minijs.script.parser.Environment;
import com.minijs.script.parser.Value;

/** Last completion of a program run plus the top-level environment it left behind. */
public class ProgramResult {
    private final Completion completion;
    private final Environment env;
    private final Set<String> hostNames;

    ProgramResult(Completion completion, Environment env, Set<String> hostNames) {
        this.completion = completion;
        this.env = env;
        this.hostNames = hostNames;
    }

    public Completion completion() { return completion; }

    /** Completion value; undefined when the program produced none. */
    public Value value() {
        return completion.value == null ? Value.undefined() : completion.value;
    }

    public Environment environment() { return env; }

    public Map<String, Value> env() { return env.snapshot(); }

    public Value get(String name) { return env.get(name); }

    /** Script-visible globals, without the engine-installed host objects. */
    public Map<String, Value> globals() {
        Map<String, Value> out = new LinkedHashMap<>(env.snapshot());
        out.keySet().removeAll(hostNames);
        return Collections.unmodifiableMap(out);
    }

    public ObjectNode globalsJson() {
        return ValueJson.toJsonObject(globals());
    }
}
