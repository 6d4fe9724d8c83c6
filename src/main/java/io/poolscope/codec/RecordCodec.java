package io.poolscope.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public interface RecordCodec<T> {
    ObjectNode encode(T value);

    T decode(ObjectNode document);

    JsonNode encodeValue(Object value);

    default T copy(T value) {
        return decode(encode(value));
    }
}
