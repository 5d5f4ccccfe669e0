package org.oldskooler.pgschema4j.mapping;

import org.oldskooler.pgschema4j.SchemaOptions;
import org.oldskooler.pgschema4j.exceptions.AnnotationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link RecordDescriptor} into a {@link Table}.
 */
public final class TableBuilder {
    private TableBuilder() {}

    /**
     * Builds the table model of a record type.
     *
     * @param tableName the table name
     * @param descriptor the mapped fields of the record type
     * @param options naming and search path settings
     * @return the table, columns in field order with 1-based ordinal positions
     * @throws AnnotationException if a field annotation is invalid, the record maps no
     *                             columns, or more than one column declares {@code conflict}
     */
    public static Table build(String tableName, RecordDescriptor<?> descriptor, SchemaOptions options) {
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(options, "options");

        if (descriptor.fields.isEmpty()) {
            throw new AnnotationException(tableName + ": no columns found, missing @Pg annotations on "
                    + descriptor.type.getName());
        }

        List<Column> columns = new ArrayList<>(descriptor.fields.size());
        String conflictColumn = null;
        int position = 0;
        for (FieldDescriptor field : descriptor.fields) {
            Column c;
            try {
                c = ColumnTagParser.parse(tableName, field, options.getColumnNaming());
            } catch (AnnotationException e) {
                throw new AnnotationException(tableName + "." + field + ": " + e.getMessage(), e);
            }

            if (!c.getConflict().isEmpty()) {
                if (conflictColumn != null) {
                    throw new AnnotationException(tableName + ": conflict is already set by column "
                            + conflictColumn + ", found again on " + c.getName());
                }
                conflictColumn = c.getName();
            }

            c.setOrdinalPosition(++position);
            columns.add(c);
        }

        Table t = new Table(options.getSearchPath(), tableName);
        t.setDescriptor(descriptor);
        t.addColumns(columns);
        return t;
    }
}
