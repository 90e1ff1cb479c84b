package com.monsterworkshop.core.common;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Lenient readers for the metadata bags carried by entities and catalogs.
 *
 * Stored data can be years old and hand-edited: every accessor returns a safe
 * default instead of throwing when a key is missing, null or of the wrong type.
 */
public final class JsonFields {

    private JsonFields() {}

    public static boolean has(JsonObject obj, String key) {
        return obj != null && obj.has(key) && !obj.get(key).isJsonNull();
    }

    /**
     * Loose truthiness: false for null, false, 0, "" and empty arrays/objects.
     */
    public static boolean isTruthy(JsonElement el) {
        if (el == null || el.isJsonNull()) return false;
        if (el.isJsonArray()) return el.getAsJsonArray().size() > 0;
        if (el.isJsonObject()) return el.getAsJsonObject().size() > 0;
        JsonPrimitive p = el.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean();
        if (p.isNumber()) return p.getAsDouble() != 0.0;
        return !p.getAsString().isEmpty();
    }

    public static boolean isTruthy(JsonObject obj, String key) {
        return obj != null && isTruthy(obj.get(key));
    }

    /**
     * String value, or null when missing/empty. Numbers and booleans are stringified.
     */
    public static String getString(JsonObject obj, String key) {
        if (!has(obj, key)) return null;
        JsonElement el = obj.get(key);
        if (!el.isJsonPrimitive()) return null;
        String s = el.getAsString();
        return s.isEmpty() ? null : s;
    }

    public static String getString(JsonObject obj, String key, String defaultValue) {
        String s = getString(obj, key);
        return s != null ? s : defaultValue;
    }

    public static int getInt(JsonObject obj, String key, int defaultValue) {
        if (!has(obj, key)) return defaultValue;
        return asInt(obj.get(key), defaultValue);
    }

    public static long getLong(JsonObject obj, String key, long defaultValue) {
        if (!has(obj, key)) return defaultValue;
        JsonElement el = obj.get(key);
        if (!el.isJsonPrimitive()) return defaultValue;
        JsonPrimitive p = el.getAsJsonPrimitive();
        try {
            if (p.isNumber()) return (long) p.getAsDouble();
            if (p.isString()) return Long.parseLong(p.getAsString().trim());
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
        return defaultValue;
    }

    public static double getDouble(JsonObject obj, String key, double defaultValue) {
        if (!has(obj, key)) return defaultValue;
        return asDouble(obj.get(key), defaultValue);
    }

    /**
     * Number or null: lets callers tell "absent/garbage" apart from zero.
     */
    public static Double getDoubleOrNull(JsonObject obj, String key) {
        if (!has(obj, key)) return null;
        double v = asDouble(obj.get(key), Double.NaN);
        return Double.isNaN(v) ? null : v;
    }

    public static Integer getIntOrNull(JsonObject obj, String key) {
        if (!has(obj, key)) return null;
        JsonElement el = obj.get(key);
        int sentinel = Integer.MIN_VALUE;
        int v = asInt(el, sentinel);
        return v == sentinel ? null : v;
    }

    public static int asInt(JsonElement el, int defaultValue) {
        if (el == null || !el.isJsonPrimitive()) return defaultValue;
        JsonPrimitive p = el.getAsJsonPrimitive();
        try {
            if (p.isNumber()) return (int) p.getAsDouble();
            if (p.isString()) return Integer.parseInt(p.getAsString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
        return defaultValue;
    }

    public static double asDouble(JsonElement el, double defaultValue) {
        if (el == null || !el.isJsonPrimitive()) return defaultValue;
        JsonPrimitive p = el.getAsJsonPrimitive();
        try {
            if (p.isNumber()) return p.getAsDouble();
            if (p.isString()) return Double.parseDouble(p.getAsString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
        return defaultValue;
    }

    public static JsonObject getObject(JsonObject obj, String key) {
        if (!has(obj, key)) return null;
        JsonElement el = obj.get(key);
        return el.isJsonObject() ? el.getAsJsonObject() : null;
    }

    /**
     * Returns the nested object, creating (or replacing garbage with) an empty one.
     */
    public static JsonObject getOrCreateObject(JsonObject obj, String key) {
        JsonObject existing = getObject(obj, key);
        if (existing != null) return existing;
        JsonObject created = new JsonObject();
        obj.add(key, created);
        return created;
    }

    public static JsonArray getArray(JsonObject obj, String key) {
        if (!has(obj, key)) return null;
        JsonElement el = obj.get(key);
        return el.isJsonArray() ? el.getAsJsonArray() : null;
    }

    public static List<String> getStringList(JsonObject obj, String key) {
        return toStringList(getArray(obj, key));
    }

    public static List<String> toStringList(JsonArray arr) {
        List<String> out = new ArrayList<>();
        if (arr == null) return out;
        for (JsonElement el : arr) {
            if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) continue;
            String s = el.getAsString();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    public static JsonArray toJsonArray(List<String> values) {
        JsonArray arr = new JsonArray();
        if (values != null) values.forEach(arr::add);
        return arr;
    }

    public static UUID parseUuid(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static UUID getUuid(JsonObject obj, String key) {
        return parseUuid(getString(obj, key));
    }

    public static void putUuid(JsonObject obj, String key, UUID value) {
        if (value == null) obj.add(key, JsonNull.INSTANCE);
        else obj.addProperty(key, value.toString());
    }

    /**
     * Trim, lower-case, spaces to underscores: the canonical key for skills and good types.
     */
    public static String normalizeKey(String value) {
        if (value == null) return "";
        return value.trim().toLowerCase().replace(" ", "_");
    }
}
