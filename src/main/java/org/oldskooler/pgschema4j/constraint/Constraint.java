package org.oldskooler.pgschema4j.constraint;

import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.IndexType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One constraint row read from the catalog, merged into the {@link Column} it names
 * and then discarded. The payload matching {@link #getType()} is null when the
 * definition text could not be decoded.
 */
public class Constraint {
    private static final Logger log = LoggerFactory.getLogger(Constraint.class);

    private String tableName = "";
    private String columnName = "";
    private String constraintName = "";
    private ConstraintType type = ConstraintType.NONE;
    private IndexType indexType = IndexType.NONE;

    private UniqueConstraint unique;
    private CheckConstraint check;
    private ForeignKeyConstraint foreignKey;

    public Constraint() {
    }

    public Constraint(String tableName, String columnName, String constraintName, ConstraintType type,
                      IndexType indexType) {
        this.tableName = tableName;
        this.columnName = columnName == null ? "" : columnName;
        this.constraintName = constraintName;
        this.type = type;
        this.indexType = indexType == null ? IndexType.NONE : indexType;
    }

    /**
     * Decodes the kind specific payload from {@code pg_get_constraintdef} or
     * {@code indexdef} text. Index definitions also supply the column name and method.
     */
    public void build(String definition) {
        switch (type) {
            case UNIQUE:
                unique = ConstraintParsers.parseUnique(definition);
                break;
            case CHECK:
                check = ConstraintParsers.parseCheck(definition);
                if (check == null) warn(definition);
                break;
            case FOREIGN_KEY:
                foreignKey = ConstraintParsers.parseForeignKey(definition);
                if (foreignKey == null) warn(definition);
                break;
            case INDEX: {
                ConstraintParsers.SimpleIndex idx = ConstraintParsers.parseSimpleIndex(definition);
                if (idx == null) {
                    warn(definition);
                    break;
                }
                columnName = idx.columnName;
                indexType = idx.type;
                break;
            }
            default:
                break;
        }
    }

    private void warn(String definition) {
        log.warn("{}: {} constraint {}: cannot parse definition: {}", tableName, type, constraintName, definition);
    }

    /** Copies what this constraint says about its column onto {@code column}. */
    public void applyTo(Column column) {
        if (column.getIndex() == IndexType.NONE) {
            column.setIndex(indexType);
        }

        switch (type) {
            case PRIMARY_KEY:
                column.setPrimaryKey(true);
                break;
            case UNIQUE:
                if (unique == null || unique.columns.isEmpty()
                        || (unique.columns.size() == 1 && unique.columns.get(0).equals(columnName))) {
                    column.setUnique(true);
                } else {
                    column.setUniqueIndex(constraintName);
                }
                break;
            case CHECK:
                if (check != null) column.setCheckConstraint(check.expression);
                break;
            case FOREIGN_KEY:
                if (foreignKey != null) {
                    column.setReferenceTableName(foreignKey.referenceTableName);
                    column.setReferenceColumnName(foreignKey.referenceColumnName);
                    column.setReferenceOnDelete(foreignKey.onDelete.isEmpty() ? "NO ACTION" : foreignKey.onDelete);
                    column.setDeferrableReference(foreignKey.deferrable);
                }
                break;
            case INDEX:
                column.setIndex(indexType);
                break;
            default:
                break;
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case PRIMARY_KEY:
                return "PRIMARY KEY (" + columnName + ")";
            case UNIQUE:
                if (unique == null || unique.columns.isEmpty()) return "UNIQUE (" + columnName + ")";
                return "UNIQUE (" + String.join(", ", unique.columns) + ")";
            case CHECK:
                return "CHECK (" + (check == null ? "" : check.expression) + ")";
            case FOREIGN_KEY:
                if (foreignKey == null) return "FOREIGN KEY (" + columnName + ")";
                return "FOREIGN KEY (" + columnName + ") REFERENCES " + foreignKey.referenceTableName
                        + " (" + foreignKey.referenceColumnName + ")";
            case INDEX:
                return "INDEX (" + columnName + ")";
            default:
                return "";
        }
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    public void setColumnName(String columnName) {
        this.columnName = columnName;
    }

    public String getConstraintName() {
        return constraintName;
    }

    public void setConstraintName(String constraintName) {
        this.constraintName = constraintName;
    }

    public ConstraintType getType() {
        return type;
    }

    public void setType(ConstraintType type) {
        this.type = type;
    }

    public IndexType getIndexType() {
        return indexType;
    }

    public void setIndexType(IndexType indexType) {
        this.indexType = indexType;
    }

    public UniqueConstraint getUnique() {
        return unique;
    }

    public CheckConstraint getCheck() {
        return check;
    }

    public ForeignKeyConstraint getForeignKey() {
        return foreignKey;
    }
}
