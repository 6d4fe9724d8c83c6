package io.poolscope.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.poolscope.config.PoolScopeConfig;
import io.poolscope.error.NotFoundException;
import io.poolscope.error.ValidationException;
import io.poolscope.observability.ScopeAuditLog;
import io.poolscope.observability.ScopeAuditLog.AuditEvent;
import io.poolscope.store.ConditionalOutcome;
import io.poolscope.store.FieldPath;
import io.poolscope.store.ScopeCollection;
import io.poolscope.store.ScopeDocument;
import io.poolscope.store.ScopeFilter;
import io.poolscope.store.ScopeStore;
import io.poolscope.store.UpsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class RawScopedConfig {
    private static final Logger LOG = LoggerFactory.getLogger(RawScopedConfig.class);

    private final ScopeStore store;
    private final String collection;
    private final ScopeAuditLog auditLog;

    public RawScopedConfig(ScopeStore store, String namespace, ScopeAuditLog auditLog) {
        this.store = Objects.requireNonNull(store, "store");
        this.collection = PoolScopeConfig.collectionName(namespace);
        this.auditLog = auditLog;
    }

    public RawScopedConfig(ScopeStore store, String namespace) {
        this(store, namespace, null);
    }

    public String collection() {
        return collection;
    }

    public Optional<ScopeDocument> find(String scope) {
        try (ScopeCollection coll = store.collection(collection)) {
            return coll.findById(normalize(scope));
        }
    }

    public List<ScopeDocument> findAll(ScopeFilter filter) {
        try (ScopeCollection coll = store.collection(collection)) {
            return coll.find(filter);
        }
    }

    public List<String> scopes() {
        try (ScopeCollection coll = store.collection(collection)) {
            return coll.listIds();
        }
    }

    public UpsertOutcome save(String scope, ObjectNode value) {
        String id = normalize(scope);
        UpsertOutcome outcome;
        try (ScopeCollection coll = store.collection(collection)) {
            outcome = coll.upsertById(id, value);
        }
        LOG.debug("Saved scope '{}' in {}: {}", id, collection, outcome);
        audit(AuditEvent.of(collection, "save", id, outcome.name()));
        return outcome;
    }

    public void setField(String scope, String fieldName, JsonNode value) {
        String id = normalize(scope);
        String path = FieldPath.of(fieldName);
        JsonNode encoded = value == null ? NullNode.getInstance() : value;
        try (ScopeCollection coll = store.collection(collection)) {
            coll.updateFieldById(id, path, encoded);
        }
        audit(AuditEvent.ofField(collection, "set_field", id, path, "UPDATED", encoded));
    }

    public boolean setFieldAtomic(String scope, String fieldName, JsonNode value) {
        String id = normalize(scope);
        String path = FieldPath.of(fieldName);
        JsonNode encoded = value == null ? NullNode.getInstance() : value;
        ConditionalOutcome outcome;
        try (ScopeCollection coll = store.collection(collection)) {
            outcome = coll.conditionalUpsert(id, path, encoded);
        }
        LOG.debug("Conditional set of {} on scope '{}' in {}: {}", path, id, collection, outcome);
        audit(AuditEvent.ofField(collection, "set_field_atomic", id, path, outcome.name(), encoded));
        return outcome == ConditionalOutcome.APPLIED;
    }

    public void removeField(String scope, String fieldName) {
        String id = normalize(scope);
        String path = FieldPath.of(fieldName);
        try (ScopeCollection coll = store.collection(collection)) {
            coll.unsetFieldById(id, path);
            audit(AuditEvent.ofField(collection, "remove_field", id, path, "UPDATED", null));
        } catch (NotFoundException e) {
            LOG.debug("Scope '{}' not found in {} while removing {}", id, collection, path);
        }
    }

    public void remove(String scope) {
        String id = normalize(scope);
        try (ScopeCollection coll = store.collection(collection)) {
            coll.removeById(id);
        }
        audit(AuditEvent.of(collection, "remove", id, "REMOVED"));
    }

    private void audit(AuditEvent event) {
        if (auditLog != null) {
            auditLog.log(event);
        }
    }

    static String normalize(String scope) {
        if (scope == null) {
            throw new ValidationException("scope must not be null, use \"\" for the base scope");
        }
        return scope;
    }
}
