package io.poolscope.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Masks audited field values whose path names a secret. Agent environment maps routinely carry
 * tokens and passwords, so nested object keys are checked as path segments too.
 */
public final class SensitiveDataMasker {
    private static final TextNode MASK = TextNode.valueOf("***");
    private static final List<String> SENSITIVE_HINTS = List.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode maskedField(String fieldPath, JsonNode value) {
        if (value == null) {
            return null;
        }
        if (isSensitivePath(fieldPath)) {
            return MASK;
        }
        return maskNested(value);
    }

    public static boolean isSensitivePath(String fieldPath) {
        if (fieldPath == null || fieldPath.isBlank()) {
            return false;
        }
        for (String segment : fieldPath.split("\\.")) {
            if (isSensitiveSegment(segment)) {
                return true;
            }
        }
        return false;
    }

    private static JsonNode maskNested(JsonNode value) {
        if (value.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                out.set(entry.getKey(), isSensitiveSegment(entry.getKey()) ? MASK : maskNested(entry.getValue()));
            }
            return out;
        }
        if (value.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            value.forEach(element -> out.add(maskNested(element)));
            return out;
        }
        return value;
    }

    private static boolean isSensitiveSegment(String segment) {
        String key = segment.toLowerCase(Locale.ROOT);
        return SENSITIVE_HINTS.stream().anyMatch(key::contains);
    }
}
