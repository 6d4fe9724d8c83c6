package io.poolscope.merge;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

public final class FieldDescriptor<T> {
    private final String name;
    private final FieldKind kind;
    private final Class<?> valueType;
    private final Function<T, Object> getter;
    private final BiConsumer<T, Object> setter;
    private final RecordSchema<?> nestedSchema;
    private final BiConsumer<T, Boolean> inheritedSetter;

    FieldDescriptor(
            String name,
            FieldKind kind,
            Class<?> valueType,
            Function<T, Object> getter,
            BiConsumer<T, Object> setter,
            RecordSchema<?> nestedSchema,
            BiConsumer<T, Boolean> inheritedSetter
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.getter = Objects.requireNonNull(getter, "getter");
        this.setter = setter;
        this.nestedSchema = nestedSchema;
        this.inheritedSetter = inheritedSetter;
    }

    public String name() {
        return name;
    }

    public FieldKind kind() {
        return kind;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public RecordSchema<?> nestedSchema() {
        return nestedSchema;
    }

    public boolean assignable() {
        return setter != null;
    }

    public boolean tracksInheritance() {
        return inheritedSetter != null;
    }

    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return kind == FieldKind.MAP ? value instanceof Map : valueType.isInstance(value);
    }

    public Object get(T record) {
        return getter.apply(record);
    }

    void set(T record, Object value) {
        setter.accept(record, value);
    }

    void markInherited(T record, boolean inherited) {
        if (inheritedSetter != null) {
            inheritedSetter.accept(record, inherited);
        }
    }

    FieldDescriptor<T> withInheritance(BiConsumer<T, Boolean> companion) {
        return new FieldDescriptor<>(name, kind, valueType, getter, setter, nestedSchema, companion);
    }

    @Override
    public String toString() {
        return "FieldDescriptor{" + name + ", " + kind + ", " + valueType.getSimpleName() + "}";
    }
}
