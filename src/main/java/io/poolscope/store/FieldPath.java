package io.poolscope.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.poolscope.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public final class FieldPath {
    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static String of(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new ValidationException("field name must not be blank");
        }
        return ScopeDocument.VALUE_FIELD + "." + fieldName.trim().toLowerCase(Locale.ROOT);
    }

    public static FieldPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("field path must not be blank");
        }
        String[] parts = path.split("\\.", -1);
        if (parts.length < 2 || !ScopeDocument.VALUE_FIELD.equals(parts[0])) {
            throw new ValidationException("field path must start with '" + ScopeDocument.VALUE_FIELD + ".': " + path);
        }
        List<String> segments = new ArrayList<>(parts.length - 1);
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                throw new ValidationException("field path has an empty segment: " + path);
            }
            segments.add(parts[i]);
        }
        return new FieldPath(segments);
    }

    public List<String> segments() {
        return segments;
    }

    public JsonNode read(ObjectNode root) {
        JsonNode current = root;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    public boolean isVacant(ObjectNode root) {
        JsonNode value = read(root);
        return value == null || (value.isTextual() && value.asText().isEmpty());
    }

    public void write(ObjectNode root, JsonNode value) {
        ObjectNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            JsonNode child = parent.get(segment);
            if (child == null || child.isNull()) {
                parent = parent.putObject(segment);
            } else if (child.isObject()) {
                parent = (ObjectNode) child;
            } else {
                throw new ValidationException("cannot create field '" + segments.get(i + 1)
                        + "' inside non-object element '" + segment + "'");
            }
        }
        parent.set(segments.get(segments.size() - 1), value);
    }

    public void remove(ObjectNode root) {
        JsonNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            parent = parent.get(segments.get(i));
            if (parent == null || !parent.isObject()) {
                return;
            }
        }
        ((ObjectNode) parent).remove(segments.get(segments.size() - 1));
    }

    @Override
    public String toString() {
        return ScopeDocument.VALUE_FIELD + "." + String.join(".", segments);
    }
}
