package org.oldskooler.pgschema4j.operations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryExecutor} over a single JDBC connection owned by the caller.
 */
public class JdbcQueryExecutor implements QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final Connection conn;

    public JdbcQueryExecutor(Connection conn) {
        this.conn = Objects.requireNonNull(conn, "conn");
    }

    public Connection conn() {
        return conn;
    }

    @Override
    public List<Map<String, Object>> queryForMaps(String sql, List<Object> args) throws SQLException {
        JdbcParamBinder.Rewritten q = JdbcParamBinder.rewrite(sql, args);
        log.debug("query: {}", q.sql);
        try (PreparedStatement ps = conn.prepareStatement(q.sql)) {
            JdbcParamBinder.bindParams(ps, q.params);
            try (ResultSet rs = ps.executeQuery()) {
                return RowMapper.toMapList(rs);
            }
        }
    }

    @Override
    public Rows query(String sql, List<Object> args) throws SQLException {
        JdbcParamBinder.Rewritten q = JdbcParamBinder.rewrite(sql, args);
        log.debug("query: {}", q.sql);
        PreparedStatement ps = conn.prepareStatement(q.sql);
        try {
            JdbcParamBinder.bindParams(ps, q.params);
            return new ResultSetRows(ps, ps.executeQuery());
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    @Override
    public int execute(String sql, List<Object> args) throws SQLException {
        log.debug("execute: {}", sql);
        if (args.isEmpty()) {
            try (Statement st = conn.createStatement()) {
                st.execute(sql);
                return Math.max(st.getUpdateCount(), 0);
            }
        }

        JdbcParamBinder.Rewritten q = JdbcParamBinder.rewrite(sql, args);
        try (PreparedStatement ps = conn.prepareStatement(q.sql)) {
            JdbcParamBinder.bindParams(ps, q.params);
            ps.execute();
            return Math.max(ps.getUpdateCount(), 0);
        }
    }
}
