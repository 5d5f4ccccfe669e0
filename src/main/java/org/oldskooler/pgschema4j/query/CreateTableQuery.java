package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;
import static org.oldskooler.pgschema4j.query.Identifiers.quoteAll;

/**
 * {@code CREATE TABLE IF NOT EXISTS} for a base table, followed by its
 * {@code CREATE INDEX IF NOT EXISTS} statements. Foreign keys are left to
 * {@link AlterTableForeignKeysQuery} so tables can be created in any order.
 */
public final class CreateTableQuery {
    private CreateTableQuery() {}

    /**
     * @return the statements, or an empty string for views and presenters
     */
    public static String build(Table table) {
        if (table.isReadOnly()) return "";

        List<String> defs = new ArrayList<>();
        for (Column c : table.listColumnsWithoutPresenter()) {
            StringBuilder d = new StringBuilder(quote(c.getName())).append(' ').append(c.getType());
            if (!c.getTypeArgument().isEmpty()) d.append('(').append(c.getTypeArgument()).append(')');
            if (c.isIdentity()) d.append(" GENERATED ALWAYS AS IDENTITY");
            if (!c.isIdentity() && !c.getDefaultValue().isEmpty()) d.append(" DEFAULT ").append(c.getDefaultValue());
            if (!c.isNullable()) d.append(" NOT NULL");
            if (c.isUnique()) d.append(" UNIQUE");
            if (!c.getCheckConstraint().isEmpty()) d.append(" CHECK (").append(c.getCheckConstraint()).append(')');
            defs.add(d.toString());
        }

        table.primaryKey().ifPresent(pk -> defs.add("PRIMARY KEY (" + quote(pk.getName()) + ")"));

        // Unique index groups become table constraints, which cannot carry a WHERE clause.
        for (Map.Entry<String, List<String>> e : table.uniqueIndexes().entrySet()) {
            defs.add("CONSTRAINT " + e.getKey() + " UNIQUE (" + quoteAll(e.getValue()) + ")");
        }

        StringBuilder b = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
                .append(qualified(table))
                .append(" (")
                .append(String.join(", ", defs))
                .append(");");

        for (Table.Index idx : table.indexes()) {
            b.append("CREATE INDEX IF NOT EXISTS ").append(idx.name)
                    .append(" ON ").append(qualified(table))
                    .append(" USING ").append(idx.type)
                    .append(" (").append(quote(idx.columnName)).append(");");
        }
        return b.toString();
    }
}
