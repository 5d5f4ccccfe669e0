package org.oldskooler.pgschema4j.mapping;

import java.util.Locale;

/** Index access methods, {@link #NONE} meaning the column carries no index. */
public enum IndexType {
    NONE(""),
    BTREE("btree"),
    HASH("hash"),
    GIST("gist"),
    SPGIST("spgist"),
    GIN("gin"),
    BRIN("brin");

    private final String method;

    IndexType(String method) {
        this.method = method;
    }

    @Override
    public String toString() {
        return method;
    }

    /** Unknown or empty names give {@link #NONE}. */
    public static IndexType parse(String s) {
        if (s == null) return NONE;
        String m = s.trim().toLowerCase(Locale.ROOT);
        if (m.isEmpty()) return NONE;
        for (IndexType t : values()) {
            if (t != NONE && t.method.equals(m)) return t;
        }
        return NONE;
    }
}
