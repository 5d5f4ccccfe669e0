package org.oldskooler.pgschema4j.mapping;

/**
 * Registration hook applied to a freshly built table. Returning false drops the table.
 */
@FunctionalInterface
public interface TableFilter {

    boolean filter(Table table);

    /** Registers the table as a read-only view. */
    TableFilter VIEW = t -> {
        t.setType(TableType.VIEW);
        return true;
    };

    /** Registers the table as a read-only materialized view. */
    TableFilter MATERIALIZED_VIEW = t -> {
        t.setType(TableType.MATERIALIZED_VIEW);
        return true;
    };

    /**
     * Registers a row shape for custom queries; it takes no part in DDL or writes.
     */
    TableFilter PRESENTER = t -> {
        t.setType(TableType.PRESENTER);
        return true;
    };
}
