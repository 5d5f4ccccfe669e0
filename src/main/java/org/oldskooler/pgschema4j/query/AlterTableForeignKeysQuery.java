package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.constraint.ForeignKeyConstraint;
import org.oldskooler.pgschema4j.mapping.Table;

import java.util.ArrayList;
import java.util.List;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;

/**
 * Drops and re-adds the foreign keys of a table. Run after every table of the schema
 * exists.
 */
public final class AlterTableForeignKeysQuery {
    private AlterTableForeignKeysQuery() {}

    /** Two statements per foreign key, drop then add; none for read-only tables. */
    public static List<String> build(Table table) {
        List<String> out = new ArrayList<>();
        if (table.isReadOnly()) return out;

        String name = qualified(table);
        for (ForeignKeyConstraint fk : table.foreignKeys()) {
            String constraintName = table.getName() + "_" + fk.columnName + "_fkey";
            out.add("ALTER TABLE " + name + " DROP CONSTRAINT IF EXISTS " + constraintName + ";");

            StringBuilder b = new StringBuilder("ALTER TABLE ").append(name)
                    .append(" ADD CONSTRAINT ").append(constraintName)
                    .append(" FOREIGN KEY (").append(quote(fk.columnName)).append(')')
                    .append(" REFERENCES ").append(qualified(table.getSearchPath(), fk.referenceTableName))
                    .append(" (").append(quote(fk.referenceColumnName)).append(')')
                    .append(" ON DELETE ").append(fk.onDelete);
            if (fk.deferrable) b.append(" DEFERRABLE");
            out.add(b.append(';').toString());
        }
        return out;
    }
}
