package org.oldskooler.pgschema4j.operations;

import java.sql.SQLException;
import java.util.List;

/**
 * Forward-only access to a result. Values are normalised: SQL arrays arrive as
 * {@code List}, json and other driver objects as their text.
 */
public interface Rows extends AutoCloseable {

    /** Result column labels, in select order. */
    List<String> columnNames() throws SQLException;

    boolean next() throws SQLException;

    /** Values of the current row, one per column. */
    List<Object> values() throws SQLException;

    @Override
    void close() throws SQLException;
}
