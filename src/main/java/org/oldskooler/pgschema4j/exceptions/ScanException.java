package org.oldskooler.pgschema4j.exceptions;

/** Raised when a result row cannot be converted into its destination record. */
public class ScanException extends PgSchemaException {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
