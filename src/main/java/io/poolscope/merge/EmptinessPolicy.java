package io.poolscope.merge;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Optional;

public final class EmptinessPolicy {
    private static final EmptinessPolicy STRICT = new EmptinessPolicy(false);
    private static final EmptinessPolicy ALLOW_EMPTY = new EmptinessPolicy(true);

    private final boolean allowEmpty;

    private EmptinessPolicy(boolean allowEmpty) {
        this.allowEmpty = allowEmpty;
    }

    public static EmptinessPolicy of(boolean allowEmpty) {
        return allowEmpty ? ALLOW_EMPTY : STRICT;
    }

    public boolean allowEmpty() {
        return allowEmpty;
    }

    public boolean isEmpty(Object value) {
        return isEmpty(value, null);
    }

    public boolean isEmpty(Object value, RecordSchema<?> schema) {
        if (value == null) {
            return true;
        }
        if (allowEmpty) {
            return false;
        }
        if (schema != null && schema.isInstance(value)) {
            return isZeroRecord(schema, value);
        }
        // maps, enums and time values are empty only when null
        return isZeroValue(value);
    }

    static boolean isZeroValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (value instanceof Boolean b) {
            return !b;
        }
        if (value instanceof Character c) {
            return c == '\0';
        }
        if (value instanceof BigDecimal d) {
            return d.signum() == 0;
        }
        if (value instanceof BigInteger i) {
            return i.signum() == 0;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0d;
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Optional<?> o) {
            return o.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    private static <T> boolean isZeroRecord(RecordSchema<T> schema, Object value) {
        T record = schema.cast(value);
        for (FieldDescriptor<T> field : schema.fields()) {
            Object fieldValue = field.get(record);
            boolean zero = switch (field.kind()) {
                case LEAF -> isZeroValue(fieldValue);
                case MAP -> fieldValue == null;
                case RECORD -> fieldValue == null || isZeroRecord(field.nestedSchema(), fieldValue);
            };
            if (!zero) {
                return false;
            }
        }
        return true;
    }
}
