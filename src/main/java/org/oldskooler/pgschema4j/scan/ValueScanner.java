package org.oldskooler.pgschema4j.scan;

/**
 * Implemented by field types that decode their own column value. The scanner reuses
 * the instance already held by the field, or creates one through its no-arg constructor.
 */
public interface ValueScanner {

    /**
     * @param source the JDBC value of the column, null for SQL NULL
     */
    void scan(Object source);
}
