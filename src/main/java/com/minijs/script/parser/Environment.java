package com.minijs.script.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope record. Lookups walk the parent chain; parents are shared, so a
 * closure and its defining code see each other's mutations.
 */
public class Environment {
    public final Environment parent;

    private final Map<String, Value> bindings = new LinkedHashMap<>();

    public Environment() {
        this(null, null);
    }

    public Environment(Map<String, Value> initial) {
        this(null, initial);
    }

    public Environment(Environment parent, Map<String, Value> initial) {
        this.parent = parent;
        if (initial != null) bindings.putAll(initial);
    }

    public Environment childScope(Map<String, Value> initial) {
        return new Environment(this, initial);
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    public boolean isRoot() {
        return parent == null;
    }

    // -------------------------
    // Bindings
    // -------------------------

    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.bindings.get(name);
            if (v != null) return v;
        }
        throw new ReferenceError(name + " is not defined");
    }

    /** Writes the nearest declaring scope, or creates the binding in the root scope. */
    public void set(String name, Value value) {
        Environment target = resolve(name);
        if (target == null) target = root();
        target.bindings.put(name, value == null ? Value.undefined() : value);
    }

    public void declare(String name, Value value) {
        bindings.put(name, value == null ? Value.undefined() : value);
    }

    public boolean exists(String name) {
        return resolve(name) != null;
    }

    public boolean hasOwn(String name) {
        return bindings.containsKey(name);
    }

    /** Nearest environment declaring {@code name}, or null. */
    public Environment resolve(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.bindings.containsKey(name)) return e;
        }
        return null;
    }

    public Value getThis() {
        return get("this");
    }

    /** Copy of this scope's own bindings. */
    public Map<String, Value> snapshot() {
        return new LinkedHashMap<>(bindings);
    }

    @Override
    public String toString() {
        return "Environment" + bindings.keySet() + (parent == null ? "" : " -> " + parent);
    }
}
