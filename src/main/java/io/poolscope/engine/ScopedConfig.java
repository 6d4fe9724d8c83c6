package io.poolscope.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.poolscope.codec.JacksonRecordCodec;
import io.poolscope.codec.RecordCodec;
import io.poolscope.config.EngineOptions;
import io.poolscope.error.ValidationException;
import io.poolscope.merge.EmptinessPolicy;
import io.poolscope.merge.MergeMode;
import io.poolscope.merge.RecordSchema;
import io.poolscope.merge.StructuralMerger;
import io.poolscope.observability.ScopeAuditLog;
import io.poolscope.store.ScopeDocument;
import io.poolscope.store.ScopeFilter;
import io.poolscope.store.ScopeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pool-scoped configuration of record type {@code T}.
 *
 * <p>The entry stored under scope {@code ""} is the base every pool inherits from. Loading a pool
 * merges its entry over a copy of the base, field by field, and fills the inheritance companions
 * declared in the {@link RecordSchema}. Missing entries load as the zero value of {@code T}.
 *
 * <p>Writes are last-writer-wins. {@link #saveMerge} is a read-modify-write without any guard and
 * may lose updates when called concurrently on the same scope; {@link #setFieldAtomic} is the only
 * operation with a compare-and-set guarantee.
 */
public final class ScopedConfig<T> {
    private static final Logger LOG = LoggerFactory.getLogger(ScopedConfig.class);

    private final RawScopedConfig raw;
    private final RecordSchema<T> schema;
    private final RecordCodec<T> codec;
    private final EngineOptions options;
    private final StructuralMerger merger;

    public ScopedConfig(RawScopedConfig raw, RecordSchema<T> schema, RecordCodec<T> codec, EngineOptions options) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.options = options == null ? EngineOptions.defaults() : options;
        this.merger = new StructuralMerger(
                EmptinessPolicy.of(this.options.allowEmpty()),
                MergeMode.of(this.options.shallowMerge())
        );
    }

    public static <T> ScopedConfig<T> find(ScopeStore store, String namespace, RecordSchema<T> schema) {
        return find(store, namespace, schema, EngineOptions.defaults());
    }

    public static <T> ScopedConfig<T> find(ScopeStore store, String namespace, RecordSchema<T> schema, EngineOptions options) {
        return new ScopedConfig<>(new RawScopedConfig(store, namespace), schema, new JacksonRecordCodec<>(schema.type()), options);
    }

    public static <T> ScopedConfig<T> find(
            ScopeStore store,
            String namespace,
            RecordSchema<T> schema,
            EngineOptions options,
            ScopeAuditLog auditLog
    ) {
        return new ScopedConfig<>(new RawScopedConfig(store, namespace, auditLog), schema, new JacksonRecordCodec<>(schema.type()), options);
    }

    public RawScopedConfig raw() {
        return raw;
    }

    public EngineOptions options() {
        return options;
    }

    public String collection() {
        return raw.collection();
    }

    public void save(String scope, T value) {
        requireRecord(value, "value");
        raw.save(scope, codec.encode(value));
    }

    public void saveBase(T value) {
        save(ScopeDocument.BASE_SCOPE, value);
    }

    public void saveMerge(String scope, T value) {
        requireRecord(value, "value");
        T current = loadEntry(scope);
        merger.merge(schema, current, value, false);
        raw.save(scope, codec.encode(current));
    }

    public T load(String scope) {
        return loadWithBase(scope, null);
    }

    public T loadBase() {
        return load(ScopeDocument.BASE_SCOPE);
    }

    public T loadWithBase(String scope, T base) {
        String id = RawScopedConfig.normalize(scope);
        T resolvedBase;
        if (base == null) {
            resolvedBase = loadEntry(ScopeDocument.BASE_SCOPE);
        } else {
            requireRecord(base, "base");
            resolvedBase = codec.copy(base);
        }
        if (id.isEmpty()) {
            return resolvedBase;
        }
        T pool = loadEntry(id);
        merger.merge(schema, resolvedBase, pool, true);
        return resolvedBase;
    }

    public Map<String, T> loadPools(List<String> filterScopes) {
        Optional<ScopeDocument> baseDoc = raw.find(ScopeDocument.BASE_SCOPE);
        Map<String, T> out = new LinkedHashMap<>();
        out.put(ScopeDocument.BASE_SCOPE, decodeOrZero(baseDoc));
        ScopeFilter filter = filterScopes == null || filterScopes.isEmpty()
                ? ScopeFilter.excludingBase()
                : ScopeFilter.ids(filterScopes);
        for (ScopeDocument poolDoc : raw.findAll(filter)) {
            if (poolDoc.isBase()) {
                continue;
            }
            T merged = decodeOrZero(baseDoc);
            merger.merge(schema, merged, codec.decode(poolDoc.value()), true);
            out.put(poolDoc.id(), merged);
        }
        return out;
    }

    public Map<String, T> loadAll() {
        return loadPools(null);
    }

    public List<String> scopes() {
        return raw.scopes();
    }

    public void setField(String scope, String fieldName, Object value) {
        raw.setField(scope, fieldName, codec.encodeValue(value));
    }

    public boolean setFieldAtomic(String scope, String fieldName, Object value) {
        return raw.setFieldAtomic(scope, fieldName, codec.encodeValue(value));
    }

    public void removeField(String scope, String fieldName) {
        raw.removeField(scope, fieldName);
    }

    public void remove(String scope) {
        raw.remove(scope);
    }

    private T loadEntry(String scope) {
        Optional<ScopeDocument> doc = raw.find(scope);
        if (doc.isEmpty()) {
            LOG.debug("No entry for scope '{}' in {}, using zero value", scope, raw.collection());
        }
        return decodeOrZero(doc);
    }

    private T decodeOrZero(Optional<ScopeDocument> doc) {
        return doc.map(d -> decode(d.value())).orElseGet(schema::newInstance);
    }

    private T decode(ObjectNode value) {
        T decoded = codec.decode(value);
        return decoded == null ? schema.newInstance() : decoded;
    }

    private void requireRecord(Object value, String what) {
        if (!schema.isInstance(value)) {
            throw new ValidationException("a " + schema.type().getName() + " record is required as " + what
                    + ", got " + (value == null ? "null" : value.getClass().getName()));
        }
    }
}
