package org.oldskooler.pgschema4j.mapping;

import org.oldskooler.pgschema4j.exceptions.AnnotationException;
import org.oldskooler.pgschema4j.scan.ValueScanner;
import org.oldskooler.pgschema4j.util.ValueConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the annotation grammar of a single field into a {@link Column}.
 * <pre>
 * name=, type=TYPE[(ARG)], primary|pk, identity, default=EXPR, unique, conflict=ACTION,
 * username, password, nullable|null[=bool], ref=[TABLE](COLUMN [ACTION] [deferrable]),
 * index[=METHOD], unique_index[=NAME], check=EXPR, auto, presenter, unscannable, bare rename
 * </pre>
 * Options are separated by commas outside parentheses and single quotes.
 */
public final class ColumnTagParser {
    private static final Pattern REFERENCE = Pattern.compile(
            "^(\\w+)\\((\\w+)\\s*(no action|cascade|restrict|set null|set default)?\\s*(\\w*)?\\)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_WORD = Pattern.compile("^\\w+$");

    static final String DEFAULT_ON_DELETE = "CASCADE";
    static final String NULL_LITERAL = "null";
    static final String VARCHAR_CAST = "::character varying";

    private ColumnTagParser() {}

    /** One {@code key[=value]} option. */
    public static final class Option {
        public final String key;
        public final String value;
        public final boolean bare;

        Option(String key, String value, boolean bare) {
            this.key = key;
            this.value = value;
            this.bare = bare;
        }
    }

    /** Parsed value of a {@code ref} option. */
    public static final class Reference {
        public final String tableName;
        public final String columnName;
        public final String onDelete;
        public final boolean deferrable;

        Reference(String tableName, String columnName, String onDelete, boolean deferrable) {
            this.tableName = tableName;
            this.columnName = columnName;
            this.onDelete = onDelete;
            this.deferrable = deferrable;
        }
    }

    public static List<Option> tokenize(String tag) {
        List<Option> out = new ArrayList<>();
        if (tag == null) return out;

        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i <= tag.length(); i++) {
            boolean end = i == tag.length();
            char c = end ? ',' : tag.charAt(i);
            if (!end && c == '\'') {
                quoted = !quoted;
            } else if (!end && !quoted && c == '(') {
                depth++;
            } else if (!end && !quoted && c == ')' && depth > 0) {
                depth--;
            } else if (end || (!quoted && depth == 0 && c == ',')) {
                String token = tag.substring(start, i).trim();
                start = i + 1;
                if (token.isEmpty()) continue;

                int eq = token.indexOf('=');
                if (eq == -1) {
                    out.add(new Option(token.toLowerCase(Locale.ROOT), "", true));
                } else {
                    out.add(new Option(token.substring(0, eq).trim().toLowerCase(Locale.ROOT),
                            token.substring(eq + 1).trim(), false));
                }
            }
        }
        return out;
    }

    /** True if {@code tag} holds the boolean option {@code key} set to true. */
    public static boolean isEnabled(String tag, String key) {
        for (Option o : tokenize(tag)) {
            if (!o.key.equals(key)) continue;
            if (o.bare) return true;
            String v = o.value.toLowerCase(Locale.ROOT);
            return v.equals("true") || v.equals("t") || v.equals("1") || v.equals("yes");
        }
        return false;
    }

    public static Column parse(String tableName, FieldDescriptor field, Function<String, String> columnNaming) {
        Column c = parse(tableName, field.name, field.type, field.tag, columnNaming);
        c.setField(field);
        c.setScanner(ValueScanner.class.isAssignableFrom(field.type));
        return c;
    }

    /**
     * @param javaType the field type, used when the annotation names no type; may be null
     */
    public static Column parse(String tableName, String fieldName, Class<?> javaType, String tag,
                               Function<String, String> columnNaming) {
        Column c = new Column();
        c.setTableName(tableName);
        c.setName(columnNaming.apply(fieldName));

        for (Option o : tokenize(tag)) {
            apply(tableName, fieldName, c, o);
        }

        if (c.isUnique() && !c.getUniqueIndex().isEmpty()) {
            throw new AnnotationException(fieldName + ": unique and unique_index cannot be used together");
        }

        if (c.isPassword() && !c.getType().isValid()) {
            c.setType(DataType.TEXT);
        }
        if (!c.getType().isValid()) {
            c.setType(DataType.fromJavaType(javaType));
        }
        if (!c.getType().isValid()) {
            throw new AnnotationException(fieldName + ": invalid data type"
                    + (javaType == null ? "" : " for " + javaType.getName()));
        }

        if (c.isPrimaryKey() && !c.isNullable() && c.getType() == DataType.UUID
                && c.getDefaultValue().isEmpty() && c.getReferenceColumnName().isEmpty()) {
            c.setDefaultValue(Column.GEN_RANDOM_UUID);
        }

        // Postgres reports varchar defaults with a cast, keep them comparable.
        String d = c.getDefaultValue();
        if (c.getType() == DataType.CHARACTER_VARYING && !d.isEmpty() && !d.equalsIgnoreCase(NULL_LITERAL)
                && !d.toLowerCase(Locale.ROOT).endsWith(VARCHAR_CAST)) {
            c.setDefaultValue(d + VARCHAR_CAST);
        }

        if (c.getType() == DataType.TS_VECTOR) {
            c.setUnscannable(true);
        }
        return c;
    }

    private static void apply(String tableName, String fieldName, Column c, Option o) {
        String value = o.value;
        switch (o.key) {
            case "name":
                c.setName(value);
                break;
            case "type":
                parseType(fieldName, c, value);
                break;
            case "primary":
            case "pk":
                c.setPrimaryKey(bool(fieldName, o));
                break;
            case "identity":
                c.setIdentity(bool(fieldName, o));
                if (c.isIdentity()) c.setAutoGenerated(true);
                break;
            case "default":
                c.setDefaultValue(o.bare ? "true" : value);
                if (NULL_LITERAL.equalsIgnoreCase(c.getDefaultValue())) c.setNullable(true);
                break;
            case "unique":
                c.setUnique(bool(fieldName, o));
                break;
            case "conflict":
                c.setConflict(value);
                break;
            case "username":
                c.setUsername(bool(fieldName, o));
                break;
            case "password":
                c.setPassword(bool(fieldName, o));
                break;
            case "nullable":
            case "null":
                if (bool(fieldName, o)) {
                    c.setNullable(true);
                    c.setDefaultValue(NULL_LITERAL);
                } else {
                    c.setNullable(false);
                    if (NULL_LITERAL.equalsIgnoreCase(c.getDefaultValue())) c.setDefaultValue("");
                }
                break;
            case "ref":
            case "reference":
            case "references": {
                Reference ref = parseReference(tableName, value);
                c.setReferenceTableName(ref.tableName);
                c.setReferenceColumnName(ref.columnName);
                c.setReferenceOnDelete(ref.onDelete);
                c.setDeferrableReference(ref.deferrable);
                break;
            }
            case "index": {
                String method = o.bare ? IndexType.BTREE.toString() : value;
                IndexType t = IndexType.parse(method);
                if (t == IndexType.NONE) {
                    throw new AnnotationException(fieldName + ": invalid index type: " + method);
                }
                c.setIndex(t);
                break;
            }
            case "unique_index":
                c.setUniqueIndex(value.isEmpty() ? tableName + "_unique_idx" : value);
                break;
            case "check":
                c.setCheckConstraint(value);
                break;
            case "auto":
                c.setAutoGenerated(bool(fieldName, o));
                break;
            case "presenter":
                c.setPresenter(bool(fieldName, o));
                break;
            case "unscannable":
                c.setUnscannable(bool(fieldName, o));
                break;
            default:
                if (o.bare && BARE_WORD.matcher(o.key).matches()) {
                    c.setName(o.key);
                    break;
                }
                throw new AnnotationException(fieldName + ": unrecognized option: " + o.key);
        }
    }

    private static void parseType(String fieldName, Column c, String value) {
        DataType.Parsed parsed = DataType.parse(value);
        if (!parsed.type.isValid()) {
            if (value.indexOf('(') != -1 && !value.trim().endsWith(")")) {
                throw new AnnotationException(fieldName + ": missing right parenthesis in type: " + value);
            }
            throw new AnnotationException(fieldName + ": invalid data type: " + value);
        }
        c.setType(parsed.type);
        c.setTypeArgument(parsed.argument);
    }

    /**
     * Parses {@code table(column [action] [deferrable])}. A value without a table,
     * {@code column} or {@code (column ...)}, references {@code selfTable}.
     */
    public static Reference parseReference(String selfTable, String value) {
        String v = value.trim();
        if (v.startsWith("(")) {
            v = selfTable + v;
        } else if (v.indexOf('(') == -1) {
            v = selfTable + "(" + v + ")";
        }

        Matcher m = REFERENCE.matcher(v);
        if (!m.matches()) {
            throw new AnnotationException("invalid reference tag: " + value);
        }

        String onDelete = m.group(3) == null ? DEFAULT_ON_DELETE : m.group(3).toUpperCase(Locale.ROOT);
        String rest = m.group(4) == null ? "" : m.group(4);
        boolean deferrable = false;
        if (!rest.isEmpty()) {
            if (!rest.equalsIgnoreCase("deferrable")) {
                throw new AnnotationException("invalid reference tag: " + value + ": unexpected " + rest);
            }
            deferrable = true;
        }
        if (deferrable && onDelete.equals("RESTRICT")) {
            throw new AnnotationException("invalid reference tag: " + value + ": deferrable cannot be used with restrict");
        }
        return new Reference(m.group(1), m.group(2), onDelete, deferrable);
    }

    private static boolean bool(String fieldName, Option o) {
        if (o.bare) return true;
        try {
            return ValueConverter.parseBoolean(o.value);
        } catch (IllegalArgumentException e) {
            throw new AnnotationException(fieldName + ": " + o.key + ": " + e.getMessage(), e);
        }
    }
}
