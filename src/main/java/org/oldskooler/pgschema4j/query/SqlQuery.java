package org.oldskooler.pgschema4j.query;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with {@code $n} placeholders and the values bound to them, in order.
 */
public final class SqlQuery {
    public final String sql;
    public final List<Object> args;

    public SqlQuery(String sql, List<Object> args) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.args = Collections.unmodifiableList(args);
    }

    public SqlQuery(String sql) {
        this(sql, Collections.emptyList());
    }

    @Override
    public String toString() {
        return sql + " " + args;
    }
}
