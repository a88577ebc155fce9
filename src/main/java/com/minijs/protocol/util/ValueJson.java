package com.minijs.protocol.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.minijs.script.parser.JsArray;
import com.minijs.script.parser.JsObject;
import com.minijs.script.parser.Value;

/**
 * Converts between script values and Jackson trees.
 *
 * Functions, undefined and non-finite numbers have no JSON form: they are left out of
 * objects and written as null inside arrays. A reference back to an enclosing object or
 * array is treated the same way. Arrays with holes or extra keys are written as objects
 * of their present keys.
 */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ValueJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    /** @return the JSON form, or null when the value has none */
    public static JsonNode toJson(Value v) {
        return toJson(v, Collections.newSetFromMap(new IdentityHashMap<JsObject, Boolean>()));
    }

    public static ObjectNode toJsonObject(Map<String, Value> bindings) {
        return toJsonObject(bindings, Collections.newSetFromMap(new IdentityHashMap<JsObject, Boolean>()));
    }

    private static JsonNode toJson(Value v, Set<JsObject> path) {
        if (v == null) return null;
        switch (v.getType()) {
            case NULL: return om.nullNode();
            case BOOL: return om.getNodeFactory().booleanNode(v.asBool());
            case STRING: return om.getNodeFactory().textNode(v.asString());
            case NUMBER: {
                double d = v.asNumber();
                if (Double.isNaN(d) || Double.isInfinite(d)) return null;
                return om.getNodeFactory().numberNode(d);
            }
            case ARRAY:
            case OBJECT: {
                JsObject o = v.asObject();
                if (!path.add(o)) return null;
                try {
                    if (v.getType() == Value.Type.ARRAY && v.asArray().isDense()) {
                        return toJsonArray(v.asArray(), path);
                    }
                    return toJsonObject(o.items(), path);
                } finally {
                    path.remove(o);
                }
            }
            default:
                return null;
        }
    }

    private static ArrayNode toJsonArray(JsArray a, Set<JsObject> path) {
        ArrayNode arr = om.createArrayNode();
        int len = a.length();
        for (int i = 0; i < len; i++) {
            JsonNode n = toJson(a.get(i), path);
            arr.add(n == null ? om.nullNode() : n);
        }
        return arr;
    }

    private static ObjectNode toJsonObject(Map<String, Value> bindings, Set<JsObject> path) {
        ObjectNode obj = om.createObjectNode();
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            JsonNode n = toJson(e.getValue(), path);
            if (n != null) obj.set(e.getKey(), n);
        }
        return obj;
    }

    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.nil();
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isNumber()) return Value.number(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.array(new JsArray(items));
        }
        if (node.isObject()) {
            JsObject obj = new JsObject();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                obj.put(e.getKey(), fromJson(e.getValue()));
            }
            return Value.object(obj);
        }
        throw new IllegalArgumentException("ValueJson: unsupported JSON node " + node.getNodeType());
    }

    public static Value parse(String json) {
        if (json == null) throw new IllegalArgumentException("ValueJson: json must not be null");
        try {
            return fromJson(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("ValueJson: malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** @return JSON text, or "null" for values without a JSON form */
    public static String stringify(Value v) {
        JsonNode n = toJson(v);
        try {
            return om.writeValueAsString(n == null ? om.nullNode() : n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ValueJson: cannot write " + v.getType(), e);
        }
    }
}
