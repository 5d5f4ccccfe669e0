package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.Table;

import java.util.ArrayList;
import java.util.List;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;

/**
 * {@code SELECT EXISTS(...)} matching every non-zero field of a probe record.
 * Password columns hashed by the database compare through {@code crypt($n, "password")}.
 */
public final class ExistsQuery {
    private ExistsQuery() {}

    public static SqlQuery build(Table table, Object probe) {
        List<Argument> args = Arguments.extract(table, probe, c -> true, true);
        if (args.isEmpty()) {
            throw new QueryBuildException(table + ": no arguments found for exists, maybe missing @Pg annotations");
        }

        List<String> where = new ArrayList<>(args.size());
        int i = 0;
        for (Argument a : args) {
            String name = quote(a.column.getName());
            String p = "$" + (++i);
            if (a.column.isPassword() && !Arguments.canEncrypt(table)) {
                p = "crypt(" + p + ", " + name + ")";
            }
            where.add(name + " = " + p);
        }

        String sql = "SELECT EXISTS(SELECT 1 FROM " + qualified(table) + " WHERE " + String.join(" AND ", where) + ");";
        return new SqlQuery(sql, Arguments.values(args));
    }
}
