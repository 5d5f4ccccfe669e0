package org.oldskooler.pgschema4j.constraint;

import org.oldskooler.pgschema4j.mapping.IndexType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decoders for the definition text the catalog returns through
 * {@code pg_get_constraintdef} and {@code pg_indexes.indexdef}.
 * Text of an unexpected shape gives null (or an empty result), never an exception.
 */
public final class ConstraintParsers {
    private static final Pattern SIMPLE_INDEX =
            Pattern.compile("CREATE INDEX (\\w+) ON \\w+\\.(\\w+) USING (\\w+) \\((\\w+)\\)");
    private static final Pattern UNIQUE_INDEX =
            Pattern.compile("CREATE UNIQUE INDEX (\\w+) ON (\\w+)\\.(\\w+) USING (\\w+) \\((.*)\\)");
    private static final Pattern CHECK =
            Pattern.compile("^CHECK\\s*\\(\\s*\\(?\\s*(.*?\\S)\\s*\\)?\\s*\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOREIGN_KEY =
            Pattern.compile("^FOREIGN KEY\\s*\\((\\w+)\\)\\s*REFERENCES\\s*(\\w+)\\s*\\((\\w+)\\)(.*)$",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern ON_DELETE =
            Pattern.compile("ON DELETE\\s+(CASCADE|RESTRICT|NO ACTION|SET NULL|SET DEFAULT)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ON_UPDATE =
            Pattern.compile("ON UPDATE\\s+(CASCADE|RESTRICT|NO ACTION|SET NULL|SET DEFAULT)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFERRABLE =
            Pattern.compile("(?<!NOT\\s)\\bDEFERRABLE\\b", Pattern.CASE_INSENSITIVE);

    private ConstraintParsers() {}

    /** A plain single column index: {@code CREATE INDEX name ON schema.table USING method (column)}. */
    public static final class SimpleIndex {
        public final String indexName;
        public final String tableName;
        public final String columnName;
        public final IndexType type;

        SimpleIndex(String indexName, String tableName, String columnName, IndexType type) {
            this.indexName = indexName;
            this.tableName = tableName;
            this.columnName = columnName;
            this.type = type;
        }
    }

    /**
     * @return the index, or null for multi column, expression or partial index text
     */
    public static SimpleIndex parseSimpleIndex(String definition) {
        if (definition == null) return null;
        Matcher m = SIMPLE_INDEX.matcher(definition);
        if (!m.find()) return null;
        return new SimpleIndex(m.group(1), m.group(2), m.group(4), IndexType.parse(m.group(3)));
    }

    /** {@code UNIQUE (title, source_url)} gives [title, source_url]. */
    public static UniqueConstraint parseUnique(String definition) {
        if (definition == null) return null;
        String s = definition.trim();
        if (s.startsWith("UNIQUE (")) s = s.substring("UNIQUE (".length());
        if (s.endsWith(")")) s = s.substring(0, s.length() - 1);
        if (s.isEmpty()) return new UniqueConstraint(Collections.emptyList());
        return new UniqueConstraint(new ArrayList<>(Arrays.asList(s.split(", "))));
    }

    /**
     * Columns of a {@code CREATE UNIQUE INDEX ... USING method (a, b)} definition,
     * empty when the text does not match.
     */
    public static List<String> parseUniqueIndexColumns(String definition) {
        if (definition == null) return Collections.emptyList();
        Matcher m = UNIQUE_INDEX.matcher(definition);
        if (!m.find()) return Collections.emptyList();
        return new ArrayList<>(Arrays.asList(m.group(5).split(", ")));
    }

    /** {@code CHECK ((price > 0))} gives {@code price > 0}. */
    public static CheckConstraint parseCheck(String definition) {
        if (definition == null) return null;
        Matcher m = CHECK.matcher(definition.trim());
        if (!m.matches()) return null;
        return new CheckConstraint(m.group(1));
    }

    /**
     * {@code FOREIGN KEY (col) REFERENCES tbl (ref) ON DELETE SET NULL ON UPDATE CASCADE DEFERRABLE}.
     * Missing actions stay empty; actions are upper cased, names keep their case.
     */
    public static ForeignKeyConstraint parseForeignKey(String definition) {
        if (definition == null) return null;
        Matcher m = FOREIGN_KEY.matcher(definition.trim());
        if (!m.matches()) return null;

        String rest = m.group(4);
        String onDelete = "";
        String onUpdate = "";

        Matcher d = ON_DELETE.matcher(rest);
        if (d.find()) onDelete = upper(d.group(1));
        Matcher u = ON_UPDATE.matcher(rest);
        if (u.find()) onUpdate = upper(u.group(1));
        boolean deferrable = DEFERRABLE.matcher(rest).find();

        return new ForeignKeyConstraint(m.group(1), m.group(2), m.group(3), onDelete, onUpdate, deferrable);
    }

    private static String upper(String s) {
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
