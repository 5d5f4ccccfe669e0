package org.oldskooler.pgschema4j.constraint;

import java.util.Objects;

/**
 * A single column foreign key, either declared through a {@code ref} annotation or read
 * back from {@code pg_get_constraintdef}. Actions are upper case, empty when not given.
 */
public final class ForeignKeyConstraint {
    public final String columnName;
    public final String referenceTableName;
    public final String referenceColumnName;
    public final String onDelete;
    public final String onUpdate;
    public final boolean deferrable;

    public ForeignKeyConstraint(String columnName, String referenceTableName, String referenceColumnName,
                                String onDelete, String onUpdate, boolean deferrable) {
        this.columnName = columnName;
        this.referenceTableName = referenceTableName;
        this.referenceColumnName = referenceColumnName;
        this.onDelete = onDelete == null ? "" : onDelete;
        this.onUpdate = onUpdate == null ? "" : onUpdate;
        this.deferrable = deferrable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForeignKeyConstraint)) return false;
        ForeignKeyConstraint that = (ForeignKeyConstraint) o;
        return deferrable == that.deferrable
                && Objects.equals(columnName, that.columnName)
                && Objects.equals(referenceTableName, that.referenceTableName)
                && Objects.equals(referenceColumnName, that.referenceColumnName)
                && onDelete.equals(that.onDelete)
                && onUpdate.equals(that.onUpdate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, referenceTableName, referenceColumnName, onDelete, onUpdate, deferrable);
    }

    @Override
    public String toString() {
        return "FOREIGN KEY (" + columnName + ") REFERENCES " + referenceTableName + " (" + referenceColumnName + ")"
                + (onDelete.isEmpty() ? "" : " ON DELETE " + onDelete)
                + (onUpdate.isEmpty() ? "" : " ON UPDATE " + onUpdate)
                + (deferrable ? " DEFERRABLE" : "");
    }
}
