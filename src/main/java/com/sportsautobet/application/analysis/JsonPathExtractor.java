package com.sportsautobet.application.analysis;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-safe lookups into provider JSON of unknown shape.
 *
 * A path is a sequence of String keys (object fields) and Integer indices (array positions).
 * Any step that is missing, hits the wrong node type, is out of bounds or lands on a JSON null
 * resolves to the caller's default. Nothing here throws.
 */
public class JsonPathExtractor {

    /**
     * Node at the path, or null when the path does not resolve.
     */
    public static JsonNode find(JsonNode root, Object... path) {
        JsonNode current = root;
        if (path == null) {
            return present(current) ? current : null;
        }
        for (Object step : path) {
            if (!present(current)) {
                return null;
            }
            if (step instanceof String) {
                current = current.isObject() ? current.get((String) step) : null;
            } else if (step instanceof Integer) {
                int index = (Integer) step;
                current = current.isArray() && index >= 0 && index < current.size()
                    ? current.get(index)
                    : null;
            } else {
                return null;
            }
        }
        return present(current) ? current : null;
    }

    /**
     * Scalar at the path as text. Objects and arrays are not scalars and yield the default.
     */
    public static String text(JsonNode root, String defaultValue, Object... path) {
        JsonNode found = find(root, path);
        if (found == null || !found.isValueNode()) {
            return defaultValue;
        }
        return found.asText();
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isMissingNode() && !node.isNull();
    }
}
