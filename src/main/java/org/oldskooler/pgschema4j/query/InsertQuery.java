package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.util.Zero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;
import static org.oldskooler.pgschema4j.query.Identifiers.quoteAll;

/**
 * INSERT and UPSERT statements.
 * <p>
 * The ON CONFLICT clause is chosen in this order:
 * <ol>
 *   <li>a forced target ({@link InsertOptions#getOnConflict()}) names a unique index group
 *   or a unique column; the other inserted columns are updated from {@code EXCLUDED};</li>
 *   <li>a {@code conflict} action declared on the table is used as written, against the
 *   inserted unique columns;</li>
 *   <li>an upsert targets the inserted columns of the first unique index group, else the
 *   inserted unique columns, and updates the rest.</li>
 * </ol>
 * Without a target no ON CONFLICT clause is written and a duplicate fails the insert.
 */
public final class InsertQuery {
    private static final Logger log = LoggerFactory.getLogger(InsertQuery.class);

    private static final String DO_NOTHING = "DO NOTHING";

    private InsertQuery() {}

    public static SqlQuery build(Table table, Object record) {
        return build(table, record, InsertOptions.defaults());
    }

    /**
     * @throws QueryBuildException if there is nothing to insert, the returned key is
     *                             requested from a table without primary key, or a forced
     *                             conflict target is unknown
     */
    public static SqlQuery build(Table table, Object record, InsertOptions options) {
        String returningColumn = null;
        if (options.isReturningId()) {
            Column pk = table.primaryKey().orElseThrow(
                    () -> new QueryBuildException(table + ": insert: no primary key to return"));
            returningColumn = pk.getName();
        }

        List<Argument> args;
        if (options.isFull()) {
            Arguments.checkRecord(table, record);
            args = new ArrayList<>();
            for (Column c : table.getColumns()) {
                if (c.isPresenter()) continue;
                Object raw = Arguments.read(c, record);
                if (Zero.isZero(raw) && (c.isGenerated() || c.isAutoGenerated() || !c.getDefaultValue().isEmpty())) {
                    continue;
                }
                args.add(new Argument(c, Arguments.toParameter(table, c, raw)));
            }
        } else {
            args = Arguments.extract(table, record, c -> true, true);
        }

        if (args.isEmpty()) {
            throw new QueryBuildException(table + ": no columns to insert, maybe missing @Pg annotations");
        }

        String sql = buildSql(table, args, returningColumn, options);
        log.debug("insert: {}", sql);
        return new SqlQuery(sql, Arguments.values(args));
    }

    static String buildSql(Table table, List<Argument> args, String returningColumn, InsertOptions options) {
        List<String> columnNames = new ArrayList<>(args.size());
        List<String> params = new ArrayList<>(args.size());
        int i = 0;
        for (Argument a : args) {
            columnNames.add(a.column.getName());
            params.add(Arguments.placeholder(table, a.column, ++i));
        }

        List<String> target = new ArrayList<>();
        String action = "";
        Optional<String> tableConflict = table.onConflict();

        if (!options.getOnConflict().isEmpty()) {
            target = forcedTarget(table, options.getOnConflict());
            action = doUpdateSet(columnNames, target);
        } else if (tableConflict.isPresent()) {
            for (Argument a : args) {
                if (a.column.isUnique()) target.add(a.column.getName());
            }
            action = tableConflict.get();
        } else if (options.isUpsert()) {
            target = upsertTarget(args);
            action = doUpdateSet(columnNames, target);
        }

        StringBuilder b = new StringBuilder("INSERT INTO ")
                .append(qualified(table))
                .append(" (").append(quoteAll(columnNames)).append(')')
                .append(" VALUES (").append(String.join(", ", params)).append(')');

        boolean returning = returningColumn != null;
        if (!target.isEmpty()) {
            b.append(" ON CONFLICT (").append(quoteAll(target)).append(") ").append(action);
            // A skipped row returns nothing, so RETURNING only goes with DO UPDATE.
            returning = returning && action.toUpperCase(Locale.ROOT).contains("DO UPDATE");
        }
        if (returning) {
            b.append(" RETURNING ").append(quote(returningColumn));
        }
        return b.append(';').toString();
    }

    private static List<String> forcedTarget(Table table, String name) {
        Map<String, List<String>> groups = table.uniqueIndexes();
        List<String> group = groups.get(name);
        if (group != null) return new ArrayList<>(group);

        Column c = table.getColumnByName(name);
        if (c != null && (c.isUnique() || !c.getUniqueIndex().isEmpty() || c.isPrimaryKey())) {
            List<String> out = new ArrayList<>();
            out.add(c.getName());
            return out;
        }
        throw new QueryBuildException(table + ": can't find unique index with name: " + name);
    }

    private static List<String> upsertTarget(List<Argument> args) {
        List<String> out = new ArrayList<>();
        String group = null;
        for (Argument a : args) {
            String g = a.column.getUniqueIndex();
            if (g.isEmpty()) continue;
            if (group == null) group = g;
            if (g.equals(group)) out.add(a.column.getName());
        }
        if (!out.isEmpty()) return out;

        for (Argument a : args) {
            if (a.column.isUnique()) out.add(a.column.getName());
        }
        return out;
    }

    private static String doUpdateSet(List<String> columnNames, List<String> target) {
        List<String> sets = new ArrayList<>();
        for (String name : columnNames) {
            if (target.contains(name)) continue;
            sets.add(quote(name) + " = EXCLUDED." + quote(name));
        }
        if (sets.isEmpty()) return DO_NOTHING;
        return "DO UPDATE SET " + String.join(", ", sets);
    }
}
