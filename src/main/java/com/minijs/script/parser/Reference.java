package com.minijs.script.parser;

/**
 * A resolved name: either a binding in an environment, a property of a value, or
 * unresolvable. Not a value itself; {@link #getValue()} dereferences it.
 */
public final class Reference implements Operand {
    private final String name;
    private final Environment env;
    private final Value base;

    private Reference(String name, Environment env, Value base) {
        this.name = name;
        this.env = env;
        this.base = base;
    }

    public static Reference binding(String name, Environment env) {
        return new Reference(name, env, null);
    }

    public static Reference property(Value base, String key) {
        return new Reference(key, null, base);
    }

    public static Reference unresolvable(String name) {
        return new Reference(name, null, null);
    }

    public Value getBase() { return base; }

    public boolean isProperty() { return base != null; }

    public Value getValue() {
        if (env != null) return env.get(name);
        if (base == null) throw new ReferenceError(name + " is not defined");
        return readProperty(base, name);
    }

    /**
     * @param strictAssignment when true, assigning an undeclared name raises ReferenceError
     *                         instead of creating a global
     */
    public void putValue(Value value, boolean strictAssignment) {
        if (env != null) {
            if (strictAssignment && !env.exists(name)) {
                throw new ReferenceError(name + " is not defined");
            }
            env.set(name, value);
            return;
        }
        if (base == null) throw new ReferenceError(name + " is not defined");
        writeProperty(base, name, value);
    }

    private static Value readProperty(Value base, String key) {
        switch (base.type) {
            case ARRAY:
                if ("length".equals(key)) return Value.number(base.asArray().length());
                return base.asArray().get(key);
            case OBJECT:
                return base.asObject().get(key);
            case STRING: {
                String s = base.asString();
                if ("length".equals(key)) return Value.number(s.length());
                long idx = JsArray.indexOf(key);
                if (idx >= 0 && idx < s.length()) return Value.string(String.valueOf(s.charAt((int) idx)));
                return Value.undefined();
            }
            default:
                return Value.undefined();
        }
    }

    private static void writeProperty(Value base, String key, Value value) {
        if (!base.isAggregate()) {
            throw new TypeError("Cannot set property '" + key + "' of " + base.toDisplayString());
        }
        if (base.type == Value.Type.ARRAY && "length".equals(key)) {
            throw new TypeError("Cannot assign to derived length of array");
        }
        base.asObject().put(key, value);
    }

    @Override
    public String toString() {
        if (base != null) return "Reference(" + base.type + "." + name + ")";
        return "Reference(" + name + (env == null ? ", unresolvable)" : ")");
    }
}
