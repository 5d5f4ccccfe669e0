package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;

/**
 * UPDATE of one row by primary key.
 * <p>
 * A full update sets every non-zero field except the primary key and generated columns,
 * so resetting a field to its zero value needs the column named explicitly. Named
 * columns are set whatever their value; naming the primary key makes it updatable and
 * the WHERE clause reuses its placeholder.
 */
public final class UpdateQuery {
    private static final Logger log = LoggerFactory.getLogger(UpdateQuery.class);

    private UpdateQuery() {}

    /**
     * @param onlyColumns the columns to set, none for a full update
     * @throws QueryBuildException if the table has no primary key, the record's key is
     *                             null, a named column is unknown, or nothing is left to set
     */
    public static SqlQuery build(Table table, Object record, String... onlyColumns) {
        Column pk = table.primaryKey().orElseThrow(
                () -> new QueryBuildException(table + ": update: no primary key"));

        Arguments.checkRecord(table, record);
        Object id = Arguments.read(pk, record);
        if (id == null) {
            throw new QueryBuildException(table + ": update: primary key " + pk.getName() + " is null");
        }

        List<Argument> args;
        if (onlyColumns.length > 0) {
            List<String> wanted = new ArrayList<>(onlyColumns.length);
            for (String name : onlyColumns) {
                Column c = table.getColumnByName(name);
                if (c == null || c.isPresenter()) {
                    throw new QueryBuildException(table + ": update: unknown column " + name);
                }
                wanted.add(c.getName());
            }
            args = Arguments.extract(table, record, c -> wanted.contains(c.getName()), false);
        } else {
            args = Arguments.extract(table, record,
                    c -> !c.isPrimaryKey() && !c.isGenerated() && !c.isIdentity(), true);
        }

        if (args.isEmpty()) {
            throw new QueryBuildException(table + ": no arguments found for update, maybe missing @Pg annotations");
        }

        List<String> sets = new ArrayList<>(args.size());
        int pkIndex = 0;
        int i = 0;
        for (Argument a : args) {
            i++;
            if (a.column == pk) pkIndex = i;
            sets.add(quote(a.column.getName()) + " = " + Arguments.placeholder(table, a.column, i));
        }

        List<Object> values = Arguments.values(args);
        if (pkIndex == 0) {
            values.add(Arguments.toParameter(table, pk, id));
            pkIndex = values.size();
        }

        String sql = "UPDATE " + qualified(table) + " SET " + String.join(", ", sets)
                + " WHERE " + quote(pk.getName()) + " = $" + pkIndex + ";";
        log.debug("update: {}", sql);
        return new SqlQuery(sql, values);
    }
}
