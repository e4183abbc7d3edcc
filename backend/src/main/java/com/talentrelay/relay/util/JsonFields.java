package com.talentrelay.relay.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Null-tolerant readers for upstream JSON payloads.
 */
public final class JsonFields {
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    private JsonFields() {
    }

    /**
     * First non-blank textual value among the named fields, or empty string.
     */
    public static String text(JsonNode node, String... fieldNames) {
        if (node == null || !node.isObject()) {
            return "";
        }
        for (String fieldName : fieldNames) {
            JsonNode value = node.get(fieldName);
            if (value != null && (value.isTextual() || value.isNumber())) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    /**
     * Reads {@code node.<objectField>.id}, e.g. {@code job.id} on an application.
     */
    public static String nestedId(JsonNode node, String objectField, String flatField) {
        if (node == null || !node.isObject()) {
            return "";
        }
        String nested = text(node.path(objectField), "id");
        if (!nested.isEmpty()) {
            return nested;
        }
        return text(node, flatField);
    }

    public static long epochMillis(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        String trimmed = value.trim();
        if (NUMERIC.matcher(trimmed).matches()) {
            double numeric = Double.parseDouble(trimmed);
            return numeric > 1e12 ? (long) numeric : (long) (numeric * 1000);
        }
        try {
            return Instant.parse(trimmed).toEpochMilli();
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }
}
