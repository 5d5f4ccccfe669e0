package org.oldskooler.pgschema4j.operations;

import org.oldskooler.pgschema4j.query.SqlQuery;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * The database as seen by the catalog introspector and the DDL operations.
 * SQL uses {@code $n} placeholders; arguments may include
 * {@link org.oldskooler.pgschema4j.query.PgArray} and
 * {@link org.oldskooler.pgschema4j.query.JsonParameter}.
 */
public interface QueryExecutor {

    /** Runs a query and returns every row as an ordered column label to value map. */
    List<Map<String, Object>> queryForMaps(String sql, List<Object> args) throws SQLException;

    /** Runs a query; the caller closes the returned rows. */
    Rows query(String sql, List<Object> args) throws SQLException;

    /**
     * Runs a statement, or several separated by semicolons when there are no arguments.
     *
     * @return the update count of the first statement, 0 when it has none
     */
    int execute(String sql, List<Object> args) throws SQLException;

    default Rows query(SqlQuery q) throws SQLException {
        return query(q.sql, q.args);
    }

    default int execute(SqlQuery q) throws SQLException {
        return execute(q.sql, q.args);
    }
}
