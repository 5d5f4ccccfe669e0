package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.mapping.Column;

/** A column and the parameter value bound for it. */
public final class Argument {
    public final Column column;
    public final Object value;

    public Argument(Column column, Object value) {
        this.column = column;
        this.value = value;
    }

    @Override
    public String toString() {
        return column.getName() + "=" + value;
    }
}
