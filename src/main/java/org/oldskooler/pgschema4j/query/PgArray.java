package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.mapping.DataType;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parameter bound as a SQL array, e.g. the key list of {@code = ANY($1)}.
 */
public final class PgArray {
    public final DataType elementType;
    public final List<Object> values;

    public PgArray(DataType elementType, List<Object> values) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.values = Collections.unmodifiableList(values);
    }

    /** The element type name accepted by {@code Connection.createArrayOf}. */
    public String jdbcTypeName() {
        switch (elementType) {
            case INTEGER:
            case SERIAL:
                return "int4";
            case BIG_INT:
            case BIG_SERIAL:
                return "int8";
            case SMALL_INT:
            case SMALL_SERIAL:
                return "int2";
            default:
                return elementType.toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PgArray)) return false;
        PgArray that = (PgArray) o;
        return elementType == that.elementType && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, values);
    }

    @Override
    public String toString() {
        return jdbcTypeName() + values;
    }
}
