package org.oldskooler.pgschema4j.scan;

import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Table;

import java.util.Collections;
import java.util.List;

/**
 * The destination and {@link DecodeStrategy} of every column of one result shape,
 * built by {@link RowScanner#plan(Table, List)} and reused for all its rows.
 */
public final class ScanPlan {
    public final Table table;
    public final List<Binding> bindings;

    ScanPlan(Table table, List<Binding> bindings) {
        this.table = table;
        this.bindings = Collections.unmodifiableList(bindings);
    }

    /** One result column. {@code column} is null for columns without a destination. */
    public static final class Binding {
        public final int index;
        public final String resultColumn;
        public final Column column;
        public final DecodeStrategy strategy;

        Binding(int index, String resultColumn, Column column, DecodeStrategy strategy) {
            this.index = index;
            this.resultColumn = resultColumn;
            this.column = column;
            this.strategy = strategy;
        }
    }

    public DecodeStrategy strategyOf(String resultColumn) {
        for (Binding b : bindings) {
            if (b.resultColumn.equalsIgnoreCase(resultColumn)) return b.strategy;
        }
        throw new IllegalArgumentException("no result column " + resultColumn);
    }
}
