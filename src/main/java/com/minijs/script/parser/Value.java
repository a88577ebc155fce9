package com.minijs.script.parser;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

public class Value implements Operand {
    public enum Type { UNDEFINED, NULL, NUMBER, BOOL, STRING, OBJECT, ARRAY, FUNCTION, NATIVE_FUNCTION }

    /** Default cap on rendered aggregates; display only. */
    public static final int DEFAULT_MAX_DISPLAY_LENGTH = 10_000;

    /** Longest string an aggregate may convert to. */
    public static final int MAX_STRING_LENGTH = 1 << 24;

    private static final Value UNDEFINED = new Value(Type.UNDEFINED, null);
    private static final Value NULL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value undefined() { return UNDEFINED; }
    public static Value nil() { return NULL; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value object(JsObject o) { return new Value(Type.OBJECT, o); }
    public static Value array(JsArray a) { return new Value(Type.ARRAY, a); }
    public static Value function(JsFunction f) { return new Value(Type.FUNCTION, f); }
    public static Value nativeFunction(NativeFunction f) { return new Value(Type.NATIVE_FUNCTION, f); }

    public static Value newObject() { return object(new JsObject()); }
    public static Value newArray(List<Value> elements) { return array(new JsArray(elements)); }

    public Type getType() { return type; }

    public boolean isUndefined() { return type == Type.UNDEFINED; }

    public boolean isCallable() {
        return type == Type.FUNCTION || type == Type.NATIVE_FUNCTION;
    }

    /** Objects and arrays: values with a property map. */
    public boolean isAggregate() {
        return type == Type.OBJECT || type == Type.ARRAY;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Works for both objects and arrays, since arrays are objects with index keys. */
    public JsObject asObject() {
        if (!isAggregate()) throw new IllegalStateException("Expected object, got " + type);
        return (JsObject) value;
    }

    public JsArray asArray() {
        if (type != Type.ARRAY) throw new IllegalStateException("Expected array, got " + type);
        return (JsArray) value;
    }

    public JsFunction asFunction() {
        if (type != Type.FUNCTION) throw new IllegalStateException("Expected function, got " + type);
        return (JsFunction) value;
    }

    public NativeFunction asNativeFunction() {
        if (type != Type.NATIVE_FUNCTION) throw new IllegalStateException("Expected native function, got " + type);
        return (NativeFunction) value;
    }

    // -------------------------
    // Conversions (ECMA-262 section 9)
    // -------------------------

    public double toNumber() {
        switch (type) {
            case NUMBER: return asNumber();
            case BOOL: return asBool() ? 1.0 : 0.0;
            case NULL: return 0.0;
            case STRING: return stringToNumber(asString());
            default: return Double.NaN;
        }
    }

    public boolean toBoolean() {
        switch (type) {
            case UNDEFINED:
            case NULL:
                return false;
            case BOOL: return asBool();
            case NUMBER: {
                double d = asNumber();
                return !Double.isNaN(d) && d != 0.0;
            }
            case STRING: return !asString().isEmpty();
            default: return true;
        }
    }

    public int toInt32() {
        return toInt32(toNumber());
    }

    public static int toInt32(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return 0;
        double t = (d < 0) ? Math.ceil(d) : Math.floor(d);
        return (int) (long) (t % 4294967296.0);
    }

    /** Canonical key used by object and array property maps. */
    public String toPropertyKey() {
        if (type == Type.STRING) return asString();
        if (type == Type.NUMBER) return numberToKey(asNumber());
        return toJsString();
    }

    static String numberToKey(double d) {
        if (d == 0.0) return "0";
        if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e21) {
            return Long.toString((long) d);
        }
        return formatNumber(d);
    }

    static String formatNumber(double d) {
        return Double.toString(d);
    }

    private static double stringToNumber(String s) {
        String t = s.trim();
        if (t.isEmpty()) return 0.0;
        switch (t) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (t.length() > 2 && t.charAt(0) == '0' && (t.charAt(1) == 'x' || t.charAt(1) == 'X')) {
            try {
                return Long.parseLong(t.substring(2), 16);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        if (!DECIMAL.matcher(t).matches()) return Double.NaN;
        return Double.parseDouble(t);
    }

    // -------------------------
    // Display
    // -------------------------

    /**
     * String conversion used by concatenation and property keys. Never truncated: an
     * aggregate whose rendering would exceed {@link #MAX_STRING_LENGTH} raises a RangeError.
     */
    public String toJsString() {
        if (type == Type.STRING) return asString();
        Renderer r = new Renderer(MAX_STRING_LENGTH);
        r.append(this, false);
        if (r.full()) throw new RangeError("Invalid string length");
        return r.finish();
    }

    /** Rendering used by console output, capped at {@link #DEFAULT_MAX_DISPLAY_LENGTH}. */
    public String toDisplayString() {
        return toDisplayString(DEFAULT_MAX_DISPLAY_LENGTH);
    }

    public String toDisplayString(int maxLength) {
        if (type == Type.STRING) return asString();
        Renderer r = new Renderer(maxLength);
        r.append(this, false);
        return r.finish();
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /** Renders aggregates with a length cap; cyclic structures print as [Circular]. */
    private static final class Renderer {
        private final StringBuilder sb = new StringBuilder();
        private final int maxLength;
        private final Set<JsObject> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean truncated;

        Renderer(int maxLength) {
            this.maxLength = Math.max(0, maxLength);
        }

        String finish() {
            if (truncated || sb.length() > maxLength) {
                sb.setLength(Math.min(sb.length(), maxLength));
                sb.append("...");
            }
            return sb.toString();
        }

        private boolean full() {
            if (sb.length() > maxLength) truncated = true;
            return truncated;
        }

        void append(Value v, boolean nested) {
            if (full()) return;
            switch (v.type) {
                case UNDEFINED: sb.append("undefined"); break;
                case NULL: sb.append("null"); break;
                case BOOL: sb.append(v.asBool()); break;
                case NUMBER: sb.append(formatNumber(v.asNumber())); break;
                case STRING:
                    if (nested) sb.append('"').append(v.asString()).append('"');
                    else sb.append(v.asString());
                    break;
                case FUNCTION: sb.append(v.asFunction()); break;
                case NATIVE_FUNCTION: sb.append("function () { [native code] }"); break;
                case ARRAY: appendArray(v.asArray()); break;
                case OBJECT: appendObject(v.asObject()); break;
                default: sb.append('<').append(v.type).append('>');
            }
        }

        private void appendArray(JsArray a) {
            if (!seen.add(a)) {
                sb.append("[Circular]");
                return;
            }
            sb.append('[');
            int len = a.length();
            for (int i = 0; i < len; i++) {
                if (full()) return;
                if (i > 0) sb.append(", ");
                append(a.get(i), true);
            }
            sb.append(']');
            seen.remove(a);
        }

        private void appendObject(JsObject o) {
            if (!seen.add(o)) {
                sb.append("[Circular]");
                return;
            }
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Value> e : o.items().entrySet()) {
                if (full()) return;
                if (!first) sb.append(", ");
                first = false;
                sb.append(e.getKey()).append(": ");
                append(e.getValue(), true);
            }
            sb.append('}');
            seen.remove(o);
        }
    }
}
