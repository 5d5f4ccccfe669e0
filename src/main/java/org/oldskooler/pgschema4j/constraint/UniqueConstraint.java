package org.oldskooler.pgschema4j.constraint;

import java.util.Collections;
import java.util.List;

/** Columns of a {@code UNIQUE (a, b)} constraint, in definition order. */
public final class UniqueConstraint {
    public final List<String> columns;

    public UniqueConstraint(List<String> columns) {
        this.columns = Collections.unmodifiableList(columns);
    }
}
