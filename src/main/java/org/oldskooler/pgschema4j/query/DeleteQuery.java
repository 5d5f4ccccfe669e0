package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;

/**
 * Deletes any number of records in one statement, {@code WHERE "pk" = ANY($1)}.
 */
public final class DeleteQuery {
    private DeleteQuery() {}

    public static SqlQuery build(Table table, Collection<?> records) {
        Column pk = table.primaryKey().orElseThrow(
                () -> new QueryBuildException(table + ": delete: no primary key"));
        if (records.isEmpty()) {
            throw new QueryBuildException(table + ": delete: no records");
        }

        List<Object> ids = new ArrayList<>(records.size());
        for (Object record : records) {
            Arguments.checkRecord(table, record);
            Object id = Arguments.read(pk, record);
            if (id == null) {
                throw new QueryBuildException(table + ": delete: primary key " + pk.getName() + " is null");
            }
            ids.add(id);
        }

        String sql = "DELETE FROM " + qualified(table) + " WHERE " + quote(pk.getName()) + " = ANY($1);";
        return new SqlQuery(sql, Collections.singletonList(new PgArray(pk.getType(), ids)));
    }
}
