package com.talentrelay.relay.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Produces log-safe copies of request and response bodies.
 */
public final class LogRedactor {
    public static final String REDACTED = "[REDACTED]";
    public static final String TRUNCATED = "[Truncated]";
    private static final Pattern SECRET_KEY = Pattern.compile("token|api[_-]?key|authorization|secret|password", Pattern.CASE_INSENSITIVE);
    private static final int MAX_DEPTH = 4;
    private static final int MAX_STRING_LENGTH = 2000;
    private static final int MAX_ARRAY_ITEMS = 40;
    private static final int MAX_SUMMARY_KEYS = 20;
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private LogRedactor() {
    }

    public static JsonNode redact(JsonNode value) {
        return redact(value, 0);
    }

    /**
     * Short shape description of an upstream result: array count and first id, or object keys and id.
     */
    public static String summarize(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "type=null";
        }
        if (value.isArray()) {
            JsonNode first = value.size() > 0 ? value.get(0) : null;
            String firstId = first != null && first.isObject() ? first.path("id").asText("") : "";
            return "type=array count=" + value.size() + " first_id=" + firstId;
        }
        if (value.isObject()) {
            StringBuilder keys = new StringBuilder();
            Iterator<String> names = value.fieldNames();
            int count = 0;
            while (names.hasNext() && count < MAX_SUMMARY_KEYS) {
                if (count > 0) {
                    keys.append(',');
                }
                keys.append(names.next());
                count++;
            }
            return "type=object keys=" + keys + " id=" + value.path("id").asText("");
        }
        return "type=" + value.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private static JsonNode redact(JsonNode value, int depth) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return value;
        }
        if (depth > MAX_DEPTH) {
            return NODES.textNode(TRUNCATED);
        }
        if (value.isTextual()) {
            String text = value.asText();
            if (text.length() > MAX_STRING_LENGTH) {
                return NODES.textNode(text.substring(0, MAX_STRING_LENGTH) + "...[truncated]");
            }
            return value;
        }
        if (value.isArray()) {
            ArrayNode out = NODES.arrayNode();
            int limit = Math.min(value.size(), MAX_ARRAY_ITEMS);
            for (int i = 0; i < limit; i++) {
                out.add(redact(value.get(i), depth + 1));
            }
            return out;
        }
        if (value.isObject()) {
            ObjectNode out = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (SECRET_KEY.matcher(field.getKey()).find()) {
                    out.put(field.getKey(), REDACTED);
                } else {
                    out.set(field.getKey(), redact(field.getValue(), depth + 1));
                }
            }
            return out;
        }
        return value;
    }
}
