package io.poolscope.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Handle on one collection of scope entries.
 *
 * <p>Field paths name a value inside an entry: the {@value ScopeDocument#VALUE_FIELD} container
 * segment followed by lower-case, dot-separated field names, e.g. {@code value.limits.cpu}.
 * Returned documents are copies; mutating them does not affect the store.
 */
public interface ScopeCollection extends AutoCloseable {
    String name();

    Optional<ScopeDocument> findById(String id);

    UpsertOutcome upsertById(String id, ObjectNode value);

    /**
     * Sets the field only when it is absent or the empty string, creating the entry when it does
     * not exist. Check and write happen as one atomic store operation.
     */
    ConditionalOutcome conditionalUpsert(String id, String fieldPath, JsonNode value);

    List<ScopeDocument> find(ScopeFilter filter);

    List<String> listIds();

    void updateFieldById(String id, String fieldPath, JsonNode value);

    // Both throw NotFoundException for a missing entry; a missing field is not an error.
    void unsetFieldById(String id, String fieldPath);

    void removeById(String id);

    @Override
    void close();
}
