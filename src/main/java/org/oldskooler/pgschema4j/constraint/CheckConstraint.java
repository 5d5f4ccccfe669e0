package org.oldskooler.pgschema4j.constraint;

/** The boolean expression of a {@code CHECK} constraint without its outer parentheses. */
public final class CheckConstraint {
    public final String expression;

    public CheckConstraint(String expression) {
        this.expression = expression;
    }
}
