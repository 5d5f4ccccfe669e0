package org.oldskooler.pgschema4j.exceptions;

/** Raised when SQL cannot be synthesized for a table and value. */
public class QueryBuildException extends PgSchemaException {

    public QueryBuildException(String message) {
        super(message);
    }
}
