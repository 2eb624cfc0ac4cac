package com.assistants.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Readers for tool parameters in the JSON input, plus schema helpers.
 */
public final class ToolParamUtils {

    private ToolParamUtils() {
    }

    // --- String param ---

    /**
     * @return trimmed string value, or null when absent, not a string or blank
     */
    public static String readStringParam(JsonNode params, String key) {
        if (params == null || !params.has(key))
            return null;
        JsonNode node = params.get(key);
        if (!node.isTextual())
            return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    // --- Number param ---

    /**
     * Read a number; numeric strings are accepted too.
     *
     * @return the value, or null when absent or not numeric
     */
    public static Double readNumberParam(JsonNode params, String key) {
        if (params == null || !params.has(key))
            return null;
        JsonNode node = params.get(key);
        if (node.isNumber())
            return node.asDouble();
        if (node.isTextual()) {
            String trimmed = node.asText().trim();
            if (!trimmed.isEmpty()) {
                try {
                    return Double.parseDouble(trimmed);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    // --- Schema ---

    static ObjectNode addString(ObjectNode properties, String key, String description) {
        ObjectNode p = properties.putObject(key);
        p.put("type", "string");
        p.put("description", description);
        return p;
    }

    static ObjectNode addNumber(ObjectNode properties, String key, String description) {
        ObjectNode p = properties.putObject(key);
        p.put("type", "number");
        p.put("description", description);
        return p;
    }

    static void addEnum(ObjectNode property, String... values) {
        var array = property.putArray("enum");
        for (String v : values)
            array.add(v);
    }
}
