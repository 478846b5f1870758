package com.flowgraph.analyzer.graph;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.Collection;

/**
 * Builds attribute bags for {@link Graph} nodes and edges.
 */
public final class Attributes {

    private Attributes() {}

    /**
     * Builds a {@link JsonObject} from alternating keys and values. Null values are skipped;
     * strings, numbers, booleans, json elements and string collections are supported.
     */
    public static JsonObject of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Attributes.of expects key/value pairs");
        }
        JsonObject obj = new JsonObject();
        for (int i = 0; i < keyValues.length; i += 2) {
            put(obj, (String) keyValues[i], keyValues[i + 1]);
        }
        return obj;
    }

    public static void put(JsonObject obj, String key, Object value) {
        if (value == null) return;
        if (value instanceof JsonElement) {
            if (!(value instanceof JsonNull)) obj.add(key, (JsonElement) value);
        } else if (value instanceof String) {
            obj.addProperty(key, (String) value);
        } else if (value instanceof Number) {
            obj.addProperty(key, (Number) value);
        } else if (value instanceof Boolean) {
            obj.addProperty(key, (Boolean) value);
        } else if (value instanceof Collection<?>) {
            obj.add(key, stringArray((Collection<?>) value));
        } else {
            obj.addProperty(key, value.toString());
        }
    }

    public static JsonArray stringArray(Collection<?> values) {
        JsonArray array = new JsonArray();
        for (Object v : values) array.add(String.valueOf(v));
        return array;
    }

    /** String attribute or {@code fallback} when absent or not a primitive. */
    public static String string(JsonObject obj, String key, String fallback) {
        if (obj == null) return fallback;
        JsonElement e = obj.get(key);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : fallback;
    }
}
