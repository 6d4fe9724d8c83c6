package io.poolscope.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record ScopeDocument(String id, ObjectNode value) {
    public static final String BASE_SCOPE = "";
    public static final String VALUE_FIELD = "value";

    public ScopeDocument {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
    }

    public boolean isBase() {
        return BASE_SCOPE.equals(id);
    }
}
