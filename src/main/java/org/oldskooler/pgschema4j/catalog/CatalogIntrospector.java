package org.oldskooler.pgschema4j.catalog;

import org.oldskooler.pgschema4j.SchemaOptions;
import org.oldskooler.pgschema4j.constraint.Constraint;
import org.oldskooler.pgschema4j.constraint.ConstraintType;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.mapping.IndexType;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.mapping.TableFilter;
import org.oldskooler.pgschema4j.mapping.TableType;
import org.oldskooler.pgschema4j.operations.QueryExecutor;
import org.oldskooler.pgschema4j.query.PgArray;
import org.oldskooler.pgschema4j.util.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.*;

/**
 * Reads tables, columns, constraints, unique indexes and triggers of the configured
 * search path from the system catalogs and assembles them into {@link Table} models.
 */
public class CatalogIntrospector {
    private static final Logger log = LoggerFactory.getLogger(CatalogIntrospector.class);

    static final String COLUMNS_QUERY = "SELECT\n"
            + "    c.table_name,\n"
            + "    obj_description(p.attrelid::regclass) AS table_description,\n"
            + "    t.table_type,\n"
            + "    c.column_name,\n"
            + "    c.ordinal_position,\n"
            + "    col_description(p.attrelid::regclass, p.attnum) AS column_description,\n"
            + "    c.column_default,\n"
            + "    pg_catalog.format_type(p.atttypid, p.atttypmod) AS data_type,\n"
            + "    CASE WHEN c.is_nullable = 'YES' THEN true ELSE false END AS is_nullable,\n"
            + "    CASE WHEN c.is_identity = 'YES' THEN true ELSE false END AS is_identity,\n"
            + "    CASE WHEN c.is_generated = 'ALWAYS' THEN true ELSE false END AS is_generated\n"
            + "FROM information_schema.columns c\n"
            + "    JOIN information_schema.tables t ON t.table_catalog = c.table_catalog"
            + " AND t.table_schema = c.table_schema AND t.table_name = c.table_name\n"
            + "    JOIN pg_catalog.pg_attribute p ON p.attrelid = (quote_ident(c.table_schema) || '.' || quote_ident(c.table_name))::regclass"
            + " AND p.attname = c.column_name\n"
            + "WHERE c.table_catalog = current_database()\n"
            + "    AND c.table_schema = $1\n"
            + "    AND (CARDINALITY($2::varchar[]) = 0 OR c.table_name = ANY($2::varchar[]))\n"
            + "ORDER BY c.table_name, c.ordinal_position;";

    static final String CONSTRAINTS_QUERY = "SELECT\n"
            + "    cl.relname AS table_name,\n"
            + "    a.attname AS column_name,\n"
            + "    con.conname AS constraint_name,\n"
            + "    con.contype::text AS constraint_type,\n"
            + "    pg_get_constraintdef(con.oid) AS constraint_definition,\n"
            + "    COALESCE(am.amname, '') AS index_type\n"
            + "FROM pg_catalog.pg_class cl\n"
            + "    JOIN pg_catalog.pg_namespace n ON n.oid = cl.relnamespace\n"
            + "    JOIN pg_catalog.pg_attribute a ON a.attrelid = cl.oid\n"
            + "    JOIN pg_catalog.pg_constraint con ON con.conrelid = cl.oid AND a.attnum = ANY (con.conkey)\n"
            + "    LEFT JOIN pg_catalog.pg_index idx ON idx.indrelid = cl.oid AND idx.indexrelid = con.conindid\n"
            + "    LEFT JOIN pg_catalog.pg_class i ON i.oid = idx.indexrelid\n"
            + "    LEFT JOIN pg_catalog.pg_am am ON am.oid = i.relam\n"
            + "WHERE n.nspname = $1\n"
            + "    AND (CARDINALITY($2::varchar[]) = 0 OR cl.relname = ANY($2::varchar[]))\n"
            + "UNION ALL\n"
            + "SELECT\n"
            + "    tablename AS table_name,\n"
            + "    '' AS column_name,\n"
            + "    indexname AS constraint_name,\n"
            + "    'i' AS constraint_type,\n"
            + "    indexdef AS constraint_definition,\n"
            + "    '' AS index_type\n"
            + "FROM pg_indexes\n"
            + "WHERE schemaname = $1\n"
            + "    AND (CARDINALITY($2::varchar[]) = 0 OR tablename = ANY($2::varchar[]))\n"
            + "    AND indexdef NOT LIKE '%UNIQUE%'\n"
            + "ORDER BY table_name, column_name;";

    static final String UNIQUE_INDEXES_QUERY = "SELECT\n"
            + "    t.relname AS table_name,\n"
            + "    i.relname AS index_name,\n"
            + "    array_agg(a.attname ORDER BY a.attnum) AS index_columns\n"
            + "FROM pg_index p\n"
            + "    JOIN pg_class t ON t.oid = p.indrelid\n"
            + "    JOIN pg_class i ON i.oid = p.indexrelid\n"
            + "    JOIN pg_namespace n ON n.oid = t.relnamespace\n"
            + "    JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = ANY(p.indkey)\n"
            + "WHERE n.nspname = $1\n"
            + "    AND (CARDINALITY($2::varchar[]) = 0 OR t.relname = ANY($2::varchar[]))\n"
            + "    AND p.indisunique\n"
            + "    AND NOT p.indisprimary\n"
            + "    AND NOT EXISTS (SELECT 1 FROM pg_constraint c WHERE c.conindid = p.indexrelid)\n"
            + "GROUP BY n.nspname, t.relname, i.relname;";

    static final String TRIGGERS_QUERY = "SELECT\n"
            + "    event_object_catalog,\n"
            + "    event_object_schema,\n"
            + "    trigger_name,\n"
            + "    event_manipulation,\n"
            + "    event_object_table,\n"
            + "    action_statement,\n"
            + "    action_orientation,\n"
            + "    action_timing\n"
            + "FROM information_schema.triggers\n"
            + "WHERE event_object_schema = $1\n"
            + "    AND (CARDINALITY($2::varchar[]) = 0 OR event_object_table = ANY($2::varchar[]))\n"
            + "ORDER BY event_object_table;";

    private final QueryExecutor executor;
    private final SchemaOptions options;

    public CatalogIntrospector(QueryExecutor executor, SchemaOptions options) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.options = Objects.requireNonNull(options, "options");
    }

    private List<Object> args(String... tableNames) {
        List<Object> names = new ArrayList<>(Arrays.asList(tableNames));
        return Arrays.asList(options.getSearchPath(), new PgArray(DataType.CHARACTER_VARYING, names));
    }

    /**
     * Lists the columns of the given tables, or of every table and view, as reported by
     * {@code information_schema.columns}.
     */
    public List<ColumnBasicInfo> listColumnsInformationSchema(String... tableNames) throws SQLException {
        List<ColumnBasicInfo> out = new ArrayList<>();
        for (Map<String, Object> row : executor.queryForMaps(COLUMNS_QUERY, args(tableNames))) {
            DataType.Parsed type = DataType.parse(str(row.get("data_type")));
            out.add(new ColumnBasicInfo(
                    str(row.get("table_name")),
                    withPeriod(str(row.get("table_description"))),
                    TableType.parse(str(row.get("table_type"))),
                    str(row.get("column_name")),
                    ((Number) row.get("ordinal_position")).intValue(),
                    withPeriod(str(row.get("column_description"))),
                    str(row.get("column_default")),
                    type.type,
                    type.argument,
                    bool(row.get("is_nullable")),
                    bool(row.get("is_identity")),
                    bool(row.get("is_generated"))));
        }
        return out;
    }

    /**
     * Lists primary key, unique, check and foreign key constraints per column, plus every
     * plain index as an {@link ConstraintType#INDEX} pseudo constraint.
     */
    public List<Constraint> listConstraints(String... tableNames) throws SQLException {
        List<Constraint> out = new ArrayList<>();
        for (Map<String, Object> row : executor.queryForMaps(CONSTRAINTS_QUERY, args(tableNames))) {
            Constraint c = new Constraint(
                    str(row.get("table_name")),
                    str(row.get("column_name")),
                    str(row.get("constraint_name")),
                    ConstraintType.parse(str(row.get("constraint_type"))),
                    IndexType.parse(str(row.get("index_type"))));
            c.build(str(row.get("constraint_definition")));
            out.add(c);
        }
        return out;
    }

    /** Lists unique indexes that are neither primary keys nor backing a constraint. */
    public List<UniqueIndex> listUniqueIndexes(String... tableNames) throws SQLException {
        List<UniqueIndex> out = new ArrayList<>();
        for (Map<String, Object> row : executor.queryForMaps(UNIQUE_INDEXES_QUERY, args(tableNames))) {
            List<String> columns = new ArrayList<>();
            Object v = row.get("index_columns");
            if (v instanceof Collection) {
                for (Object o : (Collection<?>) v) columns.add(String.valueOf(o));
            }
            out.add(new UniqueIndex(str(row.get("table_name")), str(row.get("index_name")), columns));
        }
        return out;
    }

    public List<Trigger> listTriggers(String... tableNames) throws SQLException {
        List<Trigger> out = new ArrayList<>();
        for (Map<String, Object> row : executor.queryForMaps(TRIGGERS_QUERY, args(tableNames))) {
            out.add(new Trigger(
                    str(row.get("event_object_catalog")),
                    str(row.get("event_object_schema")),
                    str(row.get("trigger_name")),
                    str(row.get("event_manipulation")),
                    str(row.get("event_object_table")),
                    str(row.get("action_statement")),
                    str(row.get("action_orientation")),
                    str(row.get("action_timing"))));
        }
        return out;
    }

    /**
     * Columns with their constraints merged in. A column that is a primary key, unique or
     * part of a unique index carries no index type, as the database creates that index.
     */
    public List<Column> listColumns(String... tableNames) throws SQLException {
        List<ColumnBasicInfo> infos = listColumnsInformationSchema(tableNames);
        List<Constraint> constraints = listConstraints(tableNames);
        List<UniqueIndex> uniqueIndexes = listUniqueIndexes(tableNames);

        List<Column> out = new ArrayList<>(infos.size());
        for (ColumnBasicInfo info : infos) {
            Column column = new Column();
            info.buildColumn(column);

            for (Constraint c : constraints) {
                if (c.getTableName().equals(column.getTableName()) && c.getColumnName().equals(column.getName())) {
                    c.applyTo(column);
                }
            }

            uniqueIndexLoop:
            for (UniqueIndex idx : uniqueIndexes) {
                if (!idx.tableName.equals(column.getTableName())) continue;
                for (String name : idx.columns) {
                    if (name.equals(column.getName())) {
                        column.setUnique(false);
                        column.setUniqueIndex(idx.indexName);
                        break uniqueIndexLoop;
                    }
                }
            }

            if (column.isPrimaryKey() || column.isUnique() || !column.getUniqueIndex().isEmpty()) {
                column.setIndex(IndexType.NONE);
            }
            out.add(column);
        }
        return out;
    }

    public List<Table> listTables(String... tableNames) throws SQLException {
        return listTables(Arrays.asList(tableNames), null);
    }

    /**
     * Live tables in parent first order: base tables without an underscore in their name,
     * then the other base tables, then views. Table name order is kept within each group.
     *
     * @param filter may adjust each table or drop it by returning false; may be null
     */
    public List<Table> listTables(List<String> tableNames, TableFilter filter) throws SQLException {
        Map<String, Table> byName = new LinkedHashMap<>();
        for (Column c : listColumns(tableNames.toArray(new String[0]))) {
            Table t = byName.get(c.getTableName());
            if (t == null) {
                t = new Table(options.getSearchPath(), c.getTableName());
                t.setType(c.getTableType());
                t.setDescription(c.getTableDescription());
                t.setRegisteredPosition(byName.size());
                byName.put(c.getTableName(), t);
            }
            t.addColumns(c);
        }

        List<Table> out = new ArrayList<>(byName.size());
        for (Table t : byName.values()) {
            if (filter != null && !filter.filter(t)) continue;
            out.add(t);
        }

        out.sort(Comparator.comparingInt(CatalogIntrospector::orderRank));
        log.debug("listed {} tables in {}", out.size(), options.getSearchPath());
        return out;
    }

    private static int orderRank(Table t) {
        if (t.isReadOnly()) return 2;
        return t.getName().contains("_") ? 1 : 0;
    }

    private static String withPeriod(String s) {
        if (s.isEmpty() || s.endsWith(".")) return s;
        return s + ".";
    }

    private static String str(Object v) {
        return v == null ? "" : v.toString();
    }

    private static boolean bool(Object v) {
        if (v instanceof Boolean) return (Boolean) v;
        return v != null && ValueConverter.parseBoolean(v.toString());
    }
}
