package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;
import static org.oldskooler.pgschema4j.query.Identifiers.quoteAll;

/**
 * Copies a row into a new one with {@code INSERT ... SELECT}. The primary key, generated
 * and auto generated columns are left to the database; a column referencing the table's
 * own primary key falls back to the source row's key when it is null, so a copy of a
 * root row becomes its child.
 */
public final class DuplicateQuery {
    private DuplicateQuery() {}

    public static SqlQuery build(Table table, Object id, boolean returningId) {
        Column pk = table.primaryKey().orElseThrow(
                () -> new QueryBuildException(table + ": duplicate: no primary key"));
        if (id == null) {
            throw new QueryBuildException(table + ": duplicate: primary key value is null");
        }

        List<String> names = new ArrayList<>();
        List<String> selects = new ArrayList<>();
        for (Column c : table.getColumns()) {
            if (c.isPrimaryKey() || c.isPresenter() || c.isAutoGenerated() || c.isGenerated()) continue;

            names.add(c.getName());
            if (c.getReferenceTableName().equals(table.getName()) && c.getReferenceColumnName().equals(pk.getName())) {
                selects.add("COALESCE(" + quote(c.getName()) + ", " + quote(pk.getName()) + ")");
            } else {
                selects.add(quote(c.getName()));
            }
        }
        if (names.isEmpty()) {
            throw new QueryBuildException(table + ": duplicate: no columns to copy");
        }

        StringBuilder b = new StringBuilder("INSERT INTO ").append(qualified(table))
                .append(" (").append(quoteAll(names)).append(')')
                .append(" SELECT ").append(String.join(", ", selects))
                .append(" FROM ").append(qualified(table))
                .append(" WHERE ").append(quote(pk.getName())).append(" = $1");
        if (returningId) b.append(" RETURNING ").append(quote(pk.getName()));
        b.append(';');
        return new SqlQuery(b.toString(), Collections.singletonList(id));
    }
}
