package io.poolscope.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declared field layout of a configuration record type. The merge algorithm walks these
 * descriptors instead of introspecting the class, and inheritance companions are linked
 * explicitly through {@link Builder#inheritance(String, BiConsumer)}.
 *
 * <pre>{@code
 * RecordSchema<PoolSettings> schema = RecordSchema.builder(PoolSettings.class, PoolSettings::new)
 *         .leaf("image", String.class, PoolSettings::getImage, PoolSettings::setImage)
 *         .inheritance("image", PoolSettings::setImageInherited)
 *         .map("env", String.class, PoolSettings::getEnv, PoolSettings::setEnv)
 *         .build();
 * }</pre>
 */
public final class RecordSchema<T> {
    private final Class<T> type;
    private final Supplier<T> factory;
    private final List<FieldDescriptor<T>> fields;

    private RecordSchema(Class<T> type, Supplier<T> factory, List<FieldDescriptor<T>> fields) {
        this.type = type;
        this.factory = factory;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static <T> Builder<T> builder(Class<T> type, Supplier<T> factory) {
        return new Builder<>(type, factory);
    }

    public Class<T> type() {
        return type;
    }

    public List<FieldDescriptor<T>> fields() {
        return fields;
    }

    public T newInstance() {
        T value = factory.get();
        if (value == null) {
            throw new IllegalStateException("Record factory for " + type.getName() + " returned null");
        }
        return value;
    }

    public boolean isInstance(Object value) {
        return value != null && type == value.getClass();
    }

    T cast(Object value) {
        return type.cast(value);
    }

    public static final class Builder<T> {
        private final Class<T> type;
        private final Supplier<T> factory;
        private final Map<String, FieldDescriptor<T>> fields = new LinkedHashMap<>();

        private Builder(Class<T> type, Supplier<T> factory) {
            this.type = Objects.requireNonNull(type, "type");
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public <V> Builder<T> leaf(String name, Class<? super V> valueType, Function<T, V> getter, BiConsumer<T, V> setter) {
            return add(name, FieldKind.LEAF, valueType, getter, setter, null);
        }

        public <V> Builder<T> readOnlyLeaf(String name, Class<? super V> valueType, Function<T, V> getter) {
            return add(name, FieldKind.LEAF, valueType, getter, null, null);
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        public <V> Builder<T> map(
                String name,
                Class<? super V> valueType,
                Function<T, Map<String, V>> getter,
                BiConsumer<T, Map<String, V>> setter
        ) {
            return add(name, FieldKind.MAP, valueType, (Function) getter, (BiConsumer) setter, null);
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        public <V> Builder<T> mapOfRecords(
                String name,
                RecordSchema<V> valueSchema,
                Function<T, Map<String, V>> getter,
                BiConsumer<T, Map<String, V>> setter
        ) {
            return add(name, FieldKind.MAP, valueSchema.type(), (Function) getter, (BiConsumer) setter, valueSchema);
        }

        public <V> Builder<T> record(
                String name,
                RecordSchema<V> nestedSchema,
                Function<T, V> getter,
                BiConsumer<T, V> setter
        ) {
            return add(name, FieldKind.RECORD, nestedSchema.type(), getter, setter, nestedSchema);
        }

        public Builder<T> inheritance(String fieldName, BiConsumer<T, Boolean> companion) {
            Objects.requireNonNull(companion, "companion");
            String key = key(fieldName);
            FieldDescriptor<T> field = fields.get(key);
            if (field == null) {
                throw new IllegalArgumentException("Unknown field for inheritance link: " + fieldName);
            }
            if (field.tracksInheritance()) {
                throw new IllegalArgumentException("Field already has an inheritance companion: " + fieldName);
            }
            fields.put(key, field.withInheritance(companion));
            return this;
        }

        public RecordSchema<T> build() {
            return new RecordSchema<>(type, factory, new ArrayList<>(fields.values()));
        }

        @SuppressWarnings("unchecked")
        private <V> Builder<T> add(
                String name,
                FieldKind kind,
                Class<?> valueType,
                Function<T, V> getter,
                BiConsumer<T, V> setter,
                RecordSchema<?> nestedSchema
        ) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name must not be blank");
            }
            String key = key(name);
            if (fields.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate field (names are case-insensitive): " + name);
            }
            fields.put(key, new FieldDescriptor<>(
                    name.trim(),
                    kind,
                    boxed(valueType),
                    (Function<T, Object>) getter,
                    (BiConsumer<T, Object>) setter,
                    nestedSchema,
                    null
            ));
            return this;
        }

        private static Class<?> boxed(Class<?> type) {
            if (!type.isPrimitive()) {
                return type;
            }
            if (type == int.class) return Integer.class;
            if (type == long.class) return Long.class;
            if (type == boolean.class) return Boolean.class;
            if (type == double.class) return Double.class;
            if (type == float.class) return Float.class;
            if (type == short.class) return Short.class;
            if (type == byte.class) return Byte.class;
            if (type == char.class) return Character.class;
            throw new IllegalArgumentException("Unsupported field type: " + type);
        }

        private static String key(String name) {
            return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        }
    }
}
