package io.poolscope.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.poolscope.error.NotFoundException;
import io.poolscope.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local scope store. Every single-entry operation runs inside one
 * {@link ConcurrentSkipListMap#compute} call, which makes the conditional upsert atomic.
 */
public final class InMemoryScopeStore implements ScopeStore {
    private final ConcurrentMap<String, ConcurrentSkipListMap<String, ObjectNode>> collections = new ConcurrentHashMap<>();

    @Override
    public ScopeCollection collection(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collection name must not be blank");
        }
        return new Handle(name, collections.computeIfAbsent(name, k -> new ConcurrentSkipListMap<>()));
    }

    private static final class Handle implements ScopeCollection {
        private final String name;
        private final ConcurrentSkipListMap<String, ObjectNode> entries;

        private Handle(String name, ConcurrentSkipListMap<String, ObjectNode> entries) {
            this.name = name;
            this.entries = entries;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<ScopeDocument> findById(String id) {
            ObjectNode value = entries.get(id);
            return value == null ? Optional.empty() : Optional.of(new ScopeDocument(id, value.deepCopy()));
        }

        @Override
        public UpsertOutcome upsertById(String id, ObjectNode value) {
            ObjectNode copy = value.deepCopy();
            ObjectNode previous = entries.put(id, copy);
            return previous == null ? UpsertOutcome.CREATED : UpsertOutcome.UPDATED;
        }

        @Override
        public ConditionalOutcome conditionalUpsert(String id, String fieldPath, JsonNode value) {
            FieldPath path = FieldPath.parse(fieldPath);
            AtomicBoolean applied = new AtomicBoolean(false);
            entries.compute(id, (key, current) -> {
                if (current != null && !path.isVacant(current)) {
                    return current;
                }
                ObjectNode next = current == null ? Jsons.storageMapper().createObjectNode() : current.deepCopy();
                path.write(next, value == null ? null : value.deepCopy());
                applied.set(true);
                return next;
            });
            return applied.get() ? ConditionalOutcome.APPLIED : ConditionalOutcome.NOT_APPLIED;
        }

        @Override
        public List<ScopeDocument> find(ScopeFilter filter) {
            List<ScopeDocument> out = new ArrayList<>();
            entries.forEach((id, value) -> {
                if (filter.matches(id)) {
                    out.add(new ScopeDocument(id, value.deepCopy()));
                }
            });
            return out;
        }

        @Override
        public List<String> listIds() {
            return new ArrayList<>(entries.keySet());
        }

        @Override
        public void updateFieldById(String id, String fieldPath, JsonNode value) {
            FieldPath path = FieldPath.parse(fieldPath);
            entries.compute(id, (key, current) -> {
                ObjectNode next = current == null ? Jsons.storageMapper().createObjectNode() : current.deepCopy();
                path.write(next, value == null ? null : value.deepCopy());
                return next;
            });
        }

        @Override
        public void unsetFieldById(String id, String fieldPath) {
            FieldPath path = FieldPath.parse(fieldPath);
            ObjectNode updated = entries.computeIfPresent(id, (key, current) -> {
                ObjectNode next = current.deepCopy();
                path.remove(next);
                return next;
            });
            if (updated == null) {
                throw new NotFoundException(name, id);
            }
        }

        @Override
        public void removeById(String id) {
            if (entries.remove(id) == null) {
                throw new NotFoundException(name, id);
            }
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
