package org.oldskooler.pgschema4j.exceptions;

/**
 * Raised while turning a record's field annotations into a table model.
 * Always fatal to the registration that triggered it.
 */
public class AnnotationException extends PgSchemaException {

    public AnnotationException(String message) {
        super(message);
    }

    public AnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
