package org.oldskooler.pgschema4j.mapping;

public enum TableType {
    BASE,
    VIEW,
    MATERIALIZED_VIEW,
    /** A row shape backed by an arbitrary SELECT, used for scanning only. */
    PRESENTER;

    public boolean isReadOnly() {
        return this != BASE;
    }

    /** Maps {@code information_schema.tables.table_type} values. */
    public static TableType parse(String s) {
        if (s == null) return BASE;
        switch (s.trim().toUpperCase()) {
            case "VIEW":
                return VIEW;
            case "MATERIALIZED VIEW":
                return MATERIALIZED_VIEW;
            default:
                return BASE;
        }
    }
}
