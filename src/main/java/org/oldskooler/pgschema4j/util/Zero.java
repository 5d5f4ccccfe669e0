package org.oldskooler.pgschema4j.util;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class Zero {
    private static final UUID NIL_UUID = new UUID(0L, 0L);

    private Zero() {}

    /**
     * Reports whether a field value counts as unset: null, empty text, numeric zero,
     * false, empty arrays, collections, maps and optionals, the nil UUID, or a
     * {@link Zeroer} that says so. Arbitrary precision numbers are never zero.
     */
    public static boolean isZero(Object v) {
        if (v == null) return true;
        if (v instanceof Zeroer) return ((Zeroer) v).isZero();
        if (v instanceof CharSequence) return ((CharSequence) v).length() == 0;
        if (v instanceof Boolean) return !((Boolean) v);
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue() == 0L;
        }
        if (v instanceof Double || v instanceof Float) return ((Number) v).doubleValue() == 0.0d;
        if (v instanceof Character) return ((Character) v) == '\0';
        if (v instanceof UUID) return NIL_UUID.equals(v);
        if (v instanceof Collection) return ((Collection<?>) v).isEmpty();
        if (v instanceof Map) return ((Map<?, ?>) v).isEmpty();
        if (v instanceof Optional) return !((Optional<?>) v).isPresent();
        if (v.getClass().isArray()) return Array.getLength(v) == 0;
        return false;
    }
}
