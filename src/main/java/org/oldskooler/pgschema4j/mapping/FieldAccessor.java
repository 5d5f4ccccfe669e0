package org.oldskooler.pgschema4j.mapping;

import org.oldskooler.pgschema4j.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/** Reads and writes one mapped field of a record instance. */
public interface FieldAccessor {

    Object get(Object record);

    void set(Object record, Object value);

    @SuppressWarnings("unchecked")
    static <T, V> FieldAccessor of(Function<T, V> getter, BiConsumer<T, V> setter) {
        Objects.requireNonNull(getter, "getter");
        return new FieldAccessor() {
            @Override
            public Object get(Object record) {
                return getter.apply((T) record);
            }

            @Override
            public void set(Object record, Object value) {
                if (setter == null) {
                    throw new UnsupportedOperationException("field is read-only");
                }
                setter.accept((T) record, (V) value);
            }
        };
    }

    static FieldAccessor reflective(Field field) {
        field.setAccessible(true);
        return new FieldAccessor() {
            @Override
            public Object get(Object record) {
                return ReflectionUtils.getField(record, field);
            }

            @Override
            public void set(Object record, Object value) {
                ReflectionUtils.setField(record, field, value);
            }
        };
    }

    /**
     * Accessor for a field of an embedded value. Reading through a null parent gives null;
     * writing through a null parent creates it with {@code parentFactory} first.
     */
    static FieldAccessor nested(FieldAccessor parent, FieldAccessor child, Supplier<?> parentFactory) {
        return new FieldAccessor() {
            @Override
            public Object get(Object record) {
                Object owner = parent.get(record);
                return owner == null ? null : child.get(owner);
            }

            @Override
            public void set(Object record, Object value) {
                Object owner = parent.get(record);
                if (owner == null) {
                    owner = parentFactory.get();
                    parent.set(record, owner);
                }
                child.set(owner, value);
            }
        };
    }
}
