package org.oldskooler.pgschema4j.operations;

import org.postgresql.util.PGInterval;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.*;

public final class RowMapper {
    private RowMapper() {}

    public static List<Map<String, Object>> toMapList(ResultSet rs) throws SQLException {
        List<Map<String, Object>> out = new ArrayList<>();
        ResultSetMetaData md = rs.getMetaData();
        final int cols = md.getColumnCount();

        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(cols);
            for (int i = 1; i <= cols; i++) {
                String label = md.getColumnLabel(i); // respects SQL aliases
                row.put(label, normalize(rs.getObject(i)));
            }
            out.add(row);
        }
        return out;
    }

    public static List<String> columnNames(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        List<String> out = new ArrayList<>(md.getColumnCount());
        for (int i = 1; i <= md.getColumnCount(); i++) {
            out.add(md.getColumnLabel(i));
        }
        return out;
    }

    public static List<Object> values(ResultSet rs, int columnCount) throws SQLException {
        List<Object> out = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            out.add(normalize(rs.getObject(i)));
        }
        return out;
    }

    /**
     * SQL arrays become lists, json and other driver objects their text, intervals
     * without months or years a {@link Duration}.
     */
    public static Object normalize(Object v) throws SQLException {
        if (v instanceof Array) {
            Array arr = (Array) v;
            try {
                return toList(arr.getArray());
            } finally {
                arr.free();
            }
        }
        if (v instanceof PGInterval) {
            PGInterval iv = (PGInterval) v;
            if (iv.getYears() != 0 || iv.getMonths() != 0) return iv.getValue();
            return Duration.ofDays(iv.getDays())
                    .plusHours(iv.getHours())
                    .plusMinutes(iv.getMinutes())
                    .plusNanos(Math.round(iv.getSeconds() * 1_000_000_000d));
        }
        if (v instanceof PGobject) {
            return ((PGobject) v).getValue();
        }
        return v;
    }

    private static Object toList(Object array) {
        if (!(array instanceof Object[])) return array;
        Object[] items = (Object[]) array;
        List<Object> out = new ArrayList<>(items.length);
        for (Object item : items) {
            out.add(item instanceof Object[] ? toList(item) : item);
        }
        return out;
    }
}
