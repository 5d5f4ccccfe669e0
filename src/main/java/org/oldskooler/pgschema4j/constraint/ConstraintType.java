package org.oldskooler.pgschema4j.constraint;

/**
 * Kinds of constraint reported by the catalog. {@link #INDEX} stands for a plain,
 * non-unique index, which the catalog lists separately from constraints.
 */
public enum ConstraintType {
    NONE("", ""),
    PRIMARY_KEY("p", "PRIMARY KEY"),
    UNIQUE("u", "UNIQUE"),
    FOREIGN_KEY("f", "FOREIGN KEY"),
    CHECK("c", "CHECK"),
    INDEX("i", "INDEX");

    private final String code;
    private final String text;

    ConstraintType(String code, String text) {
        this.code = code;
        this.text = text;
    }

    /** @return the {@code pg_constraint.contype} letter */
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * Accepts the catalog letter ({@code p}, {@code u}, {@code c}, {@code f}, {@code i})
     * or the SQL keyword, e.g. {@code FOREIGN KEY}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ConstraintType parse(String s) {
        if (s != null) {
            String v = s.trim();
            for (ConstraintType t : values()) {
                if (t == NONE) continue;
                if (t.code.equals(v) || t.text.equalsIgnoreCase(v)) return t;
            }
        }
        throw new IllegalArgumentException("constraint type: unknown value of: " + s);
    }
}
