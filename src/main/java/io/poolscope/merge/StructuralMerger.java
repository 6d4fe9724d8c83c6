package io.poolscope.merge;

import io.poolscope.error.MergeException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Merges an override record into a base record of the same schema, in place.
 *
 * <p>In deep mode every field is merged recursively: leaves are replaced when the override is
 * non-empty, maps are merged key by key with empty override values acting as tombstones, and
 * nested records recurse. In shallow mode each top-level field is replaced as a unit when the
 * override's copy is non-empty.
 *
 * <p>A merge is not transactional: when an assignment fails the fields already merged stay in
 * the base record and a {@link MergeException} is thrown.
 */
public final class StructuralMerger {
    private final EmptinessPolicy emptiness;
    private final MergeMode mode;

    public StructuralMerger(EmptinessPolicy emptiness, MergeMode mode) {
        this.emptiness = Objects.requireNonNull(emptiness, "emptiness");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public EmptinessPolicy emptiness() {
        return emptiness;
    }

    public MergeMode mode() {
        return mode;
    }

    public <T> boolean merge(RecordSchema<T> schema, T base, T override, boolean trackInheritance) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(override, "override");
        return mergeRecord(schema, base, override, trackInheritance, "");
    }

    private <T> boolean mergeRecord(RecordSchema<T> schema, T base, T override, boolean trackInheritance, String path) {
        boolean merged = false;
        for (FieldDescriptor<T> field : schema.fields()) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();
            if (mode == MergeMode.SHALLOW) {
                Object overrideValue = field.get(override);
                if (!emptiness.isEmpty(overrideValue, field.kind() == FieldKind.RECORD ? field.nestedSchema() : null)) {
                    assign(field, base, overrideValue, fieldPath);
                    merged = true;
                }
                continue;
            }
            boolean fieldMerged = switch (field.kind()) {
                case LEAF -> mergeLeaf(field, base, override, fieldPath);
                case MAP -> mergeMap(field, base, override, fieldPath);
                case RECORD -> mergeNested(field, base, override, trackInheritance, fieldPath);
            };
            if (trackInheritance) {
                field.markInherited(base, !fieldMerged);
            }
            if (fieldMerged) {
                merged = true;
            }
        }
        return merged;
    }

    private <T> boolean mergeLeaf(FieldDescriptor<T> field, T base, T override, String path) {
        Object overrideValue = field.get(override);
        if (emptiness.isEmpty(overrideValue)) {
            return false;
        }
        assign(field, base, overrideValue, path);
        return true;
    }

    private <T> boolean mergeMap(FieldDescriptor<T> field, T base, T override, String path) {
        Map<?, ?> overrideMap = (Map<?, ?>) field.get(override);
        if (overrideMap == null || overrideMap.isEmpty()) {
            return false;
        }
        Map<?, ?> baseMap = (Map<?, ?>) field.get(base);
        Map<Object, Object> result = baseMap == null ? null : new LinkedHashMap<>(baseMap);
        boolean merged = false;
        for (Map.Entry<?, ?> entry : overrideMap.entrySet()) {
            Object value = entry.getValue();
            if (!emptiness.isEmpty(value, field.nestedSchema())) {
                if (!field.valueType().isInstance(value)) {
                    throw new MergeException(path + "[" + entry.getKey() + "]",
                            "value of type " + value.getClass().getName()
                                    + " is not assignable to " + field.valueType().getName());
                }
                if (result == null) {
                    result = new LinkedHashMap<>();
                }
                result.put(entry.getKey(), value);
                merged = true;
            } else if (result != null) {
                result.remove(entry.getKey());
            }
        }
        if (result != null) {
            assignRaw(field, base, result, path);
        }
        return merged;
    }

    private <T> boolean mergeNested(FieldDescriptor<T> field, T base, T override, boolean trackInheritance, String path) {
        Object overrideValue = field.get(override);
        RecordSchema<?> nested = field.nestedSchema();
        if (emptiness.isEmpty(overrideValue, nested)) {
            Object baseValue = field.get(base);
            if (trackInheritance && baseValue != null) {
                markAllInherited(nested, baseValue);
            }
            return false;
        }
        if (!nested.isInstance(overrideValue)) {
            throw new MergeException(path, "value of type " + overrideValue.getClass().getName()
                    + " is not assignable to " + nested.type().getName());
        }
        Object baseValue = field.get(base);
        if (baseValue == null) {
            baseValue = nested.newInstance();
            assign(field, base, baseValue, path);
        }
        return mergeNestedRecord(nested, baseValue, overrideValue, trackInheritance, path);
    }

    private <V> boolean mergeNestedRecord(RecordSchema<V> schema, Object base, Object override, boolean trackInheritance, String path) {
        return mergeRecord(schema, schema.cast(base), schema.cast(override), trackInheritance, path);
    }

    // Every companion of a nested record kept whole from the base reports inherited.
    private <V> void markAllInherited(RecordSchema<V> schema, Object record) {
        V target = schema.cast(record);
        for (FieldDescriptor<V> field : schema.fields()) {
            field.markInherited(target, true);
            if (field.kind() == FieldKind.RECORD) {
                Object nestedValue = field.get(target);
                if (nestedValue != null) {
                    markAllInherited(field.nestedSchema(), nestedValue);
                }
            }
        }
    }

    private <T> void assign(FieldDescriptor<T> field, T target, Object value, String path) {
        if (!field.accepts(value)) {
            throw new MergeException(path, "value of type " + value.getClass().getName()
                    + " is not assignable to field of kind " + field.kind() + " (" + field.valueType().getName() + ")");
        }
        assignRaw(field, target, value, path);
    }

    private <T> void assignRaw(FieldDescriptor<T> field, T target, Object value, String path) {
        if (!field.assignable()) {
            throw new MergeException(path, "field is not assignable");
        }
        try {
            field.set(target, value);
        } catch (RuntimeException e) {
            throw new MergeException(path, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }
}
