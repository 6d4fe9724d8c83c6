package io.poolscope.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.poolscope.error.ScopedConfigException;
import io.poolscope.error.ValidationException;
import io.poolscope.util.Jsons;

import java.util.Objects;

public final class JacksonRecordCodec<T> implements RecordCodec<T> {
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JacksonRecordCodec(Class<T> type) {
        this(type, Jsons.storageMapper());
    }

    public JacksonRecordCodec(Class<T> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public ObjectNode encode(T value) {
        JsonNode node;
        try {
            node = mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Failed to encode " + type.getName() + ": " + e.getMessage());
        }
        if (node == null || !node.isObject()) {
            throw new ValidationException("a record type is required as value, got " + (node == null ? "null" : node.getNodeType()));
        }
        return (ObjectNode) node;
    }

    @Override
    public T decode(ObjectNode document) {
        try {
            return mapper.treeToValue(document, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ScopedConfigException("Failed to decode stored value as " + type.getName(), e);
        }
    }

    @Override
    public JsonNode encodeValue(Object value) {
        return mapper.valueToTree(value);
    }
}
