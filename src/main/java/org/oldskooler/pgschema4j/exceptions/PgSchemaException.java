package org.oldskooler.pgschema4j.exceptions;

/**
 * Root of the unchecked exceptions raised by the table model, the query builders,
 * the reconciler and the row scanner.
 */
public class PgSchemaException extends RuntimeException {

    public PgSchemaException(String message) {
        super(message);
    }

    public PgSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
