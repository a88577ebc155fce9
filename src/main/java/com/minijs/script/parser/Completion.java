package com.minijs.script.parser;

import java.util.Objects;

/**
 * Outcome of executing a statement. Break, continue and return travel as completions
 * instead of host exceptions; loops and function calls consume them.
 */
public final class Completion {
    public enum Type { NORMAL, BREAK, CONTINUE, RETURN }

    /** Normal completion with no value. */
    public static final Completion EMPTY = new Completion(Type.NORMAL, null);

    public final Type type;
    /** Null means empty, which is not the same as undefined. */
    public final Value value;
    /** Label target; labels are not supported so this is always null. */
    public final String target = null;

    public Completion(Type type, Value value) {
        this.type = type;
        this.value = value;
    }

    public static Completion normal(Value value) {
        return value == null ? EMPTY : new Completion(Type.NORMAL, value);
    }

    public static Completion ofBreak(Value value) { return new Completion(Type.BREAK, value); }
    public static Completion ofContinue(Value value) { return new Completion(Type.CONTINUE, value); }
    public static Completion ofReturn(Value value) { return new Completion(Type.RETURN, value); }

    public boolean isAbrupt() {
        return type != Type.NORMAL;
    }

    public boolean isEmpty() {
        return value == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Completion)) return false;
        Completion other = (Completion) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return "Completion(" + type + ", " + (value == null ? "empty" : value.toDisplayString()) + ")";
    }
}
