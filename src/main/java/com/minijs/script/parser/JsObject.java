package com.minijs.script.parser;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable string-keyed property map. Keys keep insertion order.
 */
public class JsObject {
    protected final Map<String, Value> items = new LinkedHashMap<>();

    public JsObject() {
    }

    public JsObject(Map<String, Value> initial) {
        if (initial != null) items.putAll(initial);
    }

    /** Missing keys read as undefined. */
    public Value get(String key) {
        Value v = items.get(key);
        return v == null ? Value.undefined() : v;
    }

    public boolean has(String key) {
        return items.containsKey(key);
    }

    public void put(String key, Value value) {
        items.put(key, value == null ? Value.undefined() : value);
    }

    public Map<String, Value> items() {
        return Collections.unmodifiableMap(items);
    }

    public int size() {
        return items.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return sameItems((JsObject) o, new IdentityHashMap<JsObject, Set<JsObject>>());
    }

    /**
     * Structural comparison. A pair already under comparison counts as equal, so
     * cyclic graphs terminate.
     */
    private boolean sameItems(JsObject other, Map<JsObject, Set<JsObject>> comparing) {
        Set<JsObject> partners = comparing.get(this);
        if (partners == null) {
            partners = Collections.newSetFromMap(new IdentityHashMap<JsObject, Boolean>());
            comparing.put(this, partners);
        }
        if (!partners.add(other)) return true;
        if (items.size() != other.items.size()) return false;

        for (Map.Entry<String, Value> e : items.entrySet()) {
            Value mine = e.getValue();
            Value theirs = other.items.get(e.getKey());
            if (theirs == null) return false;
            if (mine.isAggregate() && theirs.isAggregate()) {
                JsObject a = mine.asObject();
                JsObject b = theirs.asObject();
                if (a == b) continue;
                if (mine.type != theirs.type || a.getClass() != b.getClass()) return false;
                if (!a.sameItems(b, comparing)) return false;
            } else if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    /** Nested aggregates contribute only their type, which keeps hashing finite on cycles. */
    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, Value> e : items.entrySet()) {
            Value v = e.getValue();
            int vh = v.isAggregate() ? v.type.hashCode() : v.hashCode();
            h += e.getKey().hashCode() ^ vh;
        }
        return h;
    }

    @Override
    public String toString() {
        return Value.object(this).toDisplayString();
    }
}
