package org.oldskooler.pgschema4j.operations;

import org.oldskooler.pgschema4j.query.JsonParameter;
import org.oldskooler.pgschema4j.query.PgArray;
import org.postgresql.util.PGInterval;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code $n} style queries to JDBC statements.
 */
public final class JdbcParamBinder {
    private JdbcParamBinder() {}

    /** SQL with {@code ?} markers and the parameters in marker order. */
    public static final class Rewritten {
        public final String sql;
        public final List<Object> params;

        Rewritten(String sql, List<Object> params) {
            this.sql = sql;
            this.params = params;
        }
    }

    /**
     * Replaces {@code $n} placeholders with {@code ?}, repeating the argument of a
     * placeholder used more than once. Quoted strings, quoted identifiers, dollar quoted
     * bodies and comments are copied unchanged; a literal {@code ?} operator is escaped
     * as {@code ??}.
     *
     * @throws IllegalArgumentException if a placeholder has no argument
     */
    public static Rewritten rewrite(String sql, List<Object> args) {
        StringBuilder out = new StringBuilder(sql.length());
        List<Object> params = new ArrayList<>(args.size());

        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);

            if (c == '\'' || c == '"') {
                int end = sql.indexOf(c, i + 1);
                while (end != -1 && end + 1 < n && sql.charAt(end + 1) == c) {
                    end = sql.indexOf(c, end + 2);
                }
                end = end == -1 ? n : end + 1;
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end == -1 ? n : end;
                out.append(sql, i, end);
                i = end;
            } else if (c == '$' && i + 1 < n && Character.isDigit(sql.charAt(i + 1))) {
                int j = i + 1;
                while (j < n && Character.isDigit(sql.charAt(j))) j++;
                int index = Integer.parseInt(sql.substring(i + 1, j));
                if (index < 1 || index > args.size()) {
                    throw new IllegalArgumentException("placeholder $" + index + " has no argument, got "
                            + args.size() + " arguments");
                }
                out.append('?');
                params.add(args.get(index - 1));
                i = j;
            } else if (c == '$') {
                int tagEnd = dollarTagEnd(sql, i);
                if (tagEnd == -1) {
                    out.append(c);
                    i++;
                    continue;
                }
                String tag = sql.substring(i, tagEnd + 1);
                int close = sql.indexOf(tag, tagEnd + 1);
                int end = close == -1 ? n : close + tag.length();
                out.append(sql, i, end);
                i = end;
            } else if (c == '?') {
                out.append("??");
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return new Rewritten(out.toString(), params);
    }

    /** Index of the closing {@code $} of a {@code $tag$} opener at {@code start}, or -1. */
    private static int dollarTagEnd(String sql, int start) {
        int j = start + 1;
        while (j < sql.length()) {
            char c = sql.charAt(j);
            if (c == '$') return j;
            boolean valid = j == start + 1 ? (Character.isLetter(c) || c == '_') : (Character.isLetterOrDigit(c) || c == '_');
            if (!valid) return -1;
            j++;
        }
        return -1;
    }

    public static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object v = params.get(i);
            if (v instanceof LocalDate) {
                LocalDate ld = (LocalDate) v;
                ps.setDate(i + 1, Date.valueOf(ld));
            } else if (v instanceof LocalDateTime) {
                LocalDateTime ldt = (LocalDateTime) v;
                ps.setTimestamp(i + 1, Timestamp.valueOf(ldt));
            } else if (v instanceof Instant) {
                Instant inst = (Instant) v;
                ps.setTimestamp(i + 1, Timestamp.from(inst));
            } else if (v instanceof PgArray) {
                PgArray arr = (PgArray) v;
                Array sqlArray = ps.getConnection().createArrayOf(arr.jdbcTypeName(), arr.values.toArray());
                ps.setArray(i + 1, sqlArray);
            } else if (v instanceof JsonParameter) {
                JsonParameter json = (JsonParameter) v;
                PGobject obj = new PGobject();
                obj.setType(json.typeName());
                obj.setValue(json.json);
                ps.setObject(i + 1, obj);
            } else if (v instanceof Duration) {
                ps.setObject(i + 1, toInterval((Duration) v));
            } else if (v instanceof Character) {
                ps.setString(i + 1, v.toString());
            } else {
                ps.setObject(i + 1, v);
            }
        }
    }

    static PGInterval toInterval(Duration d) {
        long seconds = d.getSeconds();
        double fraction = d.getNano() / 1_000_000_000d;
        int days = (int) (seconds / 86_400);
        seconds -= days * 86_400L;
        int hours = (int) (seconds / 3_600);
        seconds -= hours * 3_600L;
        int minutes = (int) (seconds / 60);
        seconds -= minutes * 60L;
        return new PGInterval(0, 0, days, hours, minutes, seconds + fraction);
    }
}
