package org.oldskooler.pgschema4j.exceptions;

/**
 * Raised when a registered table does not match the live catalog.
 * Carries both tag renderings when the failure is a column mismatch.
 */
public class ReconciliationException extends PgSchemaException {
    private final String tableName;
    private final String columnName;
    private final String liveTag;
    private final String codeTag;

    public ReconciliationException(String message) {
        this(message, null, null, null, null);
    }

    public ReconciliationException(String message, String tableName, String columnName, String liveTag, String codeTag) {
        super(message);
        this.tableName = tableName;
        this.columnName = columnName;
        this.liveTag = liveTag;
        this.codeTag = codeTag;
    }

    public String getTableName() {
        return tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    /** @return the tag rendered from the catalog, or null */
    public String getLiveTag() {
        return liveTag;
    }

    /** @return the tag rendered from the registered record, or null */
    public String getCodeTag() {
        return codeTag;
    }
}
