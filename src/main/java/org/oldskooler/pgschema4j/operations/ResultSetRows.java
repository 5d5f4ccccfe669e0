package org.oldskooler.pgschema4j.operations;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/** {@link Rows} over a JDBC result; closing it closes the statement too. */
public class ResultSetRows implements Rows {
    private final Statement statement;
    private final ResultSet rs;
    private List<String> columnNames;

    public ResultSetRows(Statement statement, ResultSet rs) {
        this.statement = statement;
        this.rs = rs;
    }

    @Override
    public List<String> columnNames() throws SQLException {
        if (columnNames == null) {
            columnNames = RowMapper.columnNames(rs);
        }
        return columnNames;
    }

    @Override
    public boolean next() throws SQLException {
        return rs.next();
    }

    @Override
    public List<Object> values() throws SQLException {
        return RowMapper.values(rs, columnNames().size());
    }

    @Override
    public void close() throws SQLException {
        try {
            rs.close();
        } finally {
            if (statement != null) statement.close();
        }
    }
}
