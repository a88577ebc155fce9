package com.minijs.script.parser;

import java.util.List;

/**
 * An object whose element keys are canonical non-negative integer strings.
 * Length is one past the highest index key; since keys are never removed it is
 * tracked as elements are written.
 */
public class JsArray extends JsObject {

    private int length;
    private int indexCount;

    public JsArray() {
    }

    public JsArray(List<Value> elements) {
        if (elements == null) return;
        for (int i = 0; i < elements.size(); i++) {
            put(Integer.toString(i), elements.get(i));
        }
    }

    @Override
    public void put(String key, Value value) {
        long idx = indexOf(key);
        if (idx >= 0 && !items.containsKey(key)) {
            indexCount++;
            if (idx >= length) length = (int) (idx + 1);
        }
        super.put(key, value);
    }

    public int length() {
        return length;
    }

    /** True when every index below length is present and there are no other keys. */
    public boolean isDense() {
        return indexCount == length && indexCount == size();
    }

    public Value get(int index) {
        return get(Integer.toString(index));
    }

    public void set(int index, Value value) {
        put(Integer.toString(index), value);
    }

    public void push(Value value) {
        set(length, value);
    }

    /** @return the index a key denotes, or -1 when it is not a canonical array index */
    static long indexOf(String key) {
        int n = key.length();
        if (n == 0 || n > 10) return -1;
        if (n > 1 && key.charAt(0) == '0') return -1;
        for (int i = 0; i < n; i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') return -1;
        }
        long idx = Long.parseLong(key);
        return idx < Integer.MAX_VALUE ? idx : -1;
    }

    @Override
    public String toString() {
        return Value.array(this).toDisplayString();
    }
}
