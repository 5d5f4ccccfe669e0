package org.oldskooler.pgschema4j.query;

import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.mapping.PasswordHandler;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.serialization.JsonColumnCodec;
import org.oldskooler.pgschema4j.util.Zero;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Reads column values out of a record and turns them into bindable parameters.
 */
public final class Arguments {
    private Arguments() {}

    /**
     * Collects the arguments of every non-presenter column accepted by {@code filter}.
     *
     * @param skipZero drop columns whose field holds its zero value, see {@link Zero}
     */
    public static List<Argument> extract(Table table, Object record, Predicate<Column> filter, boolean skipZero) {
        checkRecord(table, record);

        List<Argument> out = new ArrayList<>();
        for (Column c : table.getColumns()) {
            if (c.isPresenter() || !filter.test(c)) continue;

            Object raw = read(c, record);
            if (skipZero && Zero.isZero(raw)) continue;
            out.add(new Argument(c, toParameter(table, c, raw)));
        }
        return out;
    }

    public static List<Object> values(List<Argument> args) {
        List<Object> out = new ArrayList<>(args.size());
        for (Argument a : args) out.add(a.value);
        return out;
    }

    static void checkRecord(Table table, Object record) {
        Objects.requireNonNull(record, "record");
        if (table.getDescriptor() != null && !table.getDescriptor().type.isInstance(record)) {
            throw new IllegalArgumentException(table + ": expected a " + table.getDescriptor().type.getName()
                    + " but got " + record.getClass().getName());
        }
    }

    /** The raw field value of {@code c} in {@code record}. */
    public static Object read(Column c, Object record) {
        if (c.getField() == null) {
            throw new QueryBuildException(c.getTableName() + "." + c.getName() + ": column is not bound to a record field");
        }
        return c.getField().accessor.get(record);
    }

    /**
     * Converts a field value for binding: optionals are unwrapped, enums bind their name,
     * json columns bind a {@link JsonParameter}, array columns a {@link PgArray}, and
     * password columns are encrypted when the table has an encrypt hook.
     */
    public static Object toParameter(Table table, Column c, Object raw) {
        Object v = raw;
        if (v instanceof Optional) v = ((Optional<?>) v).orElse(null);
        if (v == null) return null;

        if (c.isPassword() && v instanceof String) {
            PasswordHandler handler = table.getPasswordHandler();
            if (handler != null && handler.canEncrypt()) {
                return handler.encrypt(table.getName(), (String) v);
            }
            return v;
        }

        DataType type = c.getType();
        if (type.isJson()) {
            return new JsonParameter(JsonColumnCodec.getDefault().toJson(v), type == DataType.JSONB);
        }
        if (type.isArray()) {
            List<Object> elements = toList(v);
            if (elements != null) return new PgArray(type.elementType(), elements);
        }
        if (v instanceof Enum) return ((Enum<?>) v).name();
        return v;
    }

    private static List<Object> toList(Object v) {
        if (v instanceof Collection) return new ArrayList<>((Collection<?>) v);
        if (!v.getClass().isArray()) return null;

        int n = Array.getLength(v);
        List<Object> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(Array.get(v, i));
        return out;
    }

    /** A {@code $n} placeholder, wrapped in {@code crypt} for passwords the database hashes. */
    static String placeholder(Table table, Column c, int index) {
        String p = "$" + index;
        if (c.isPassword() && !canEncrypt(table)) {
            return "crypt(" + p + ", gen_salt('bf'))";
        }
        return p;
    }

    static boolean canEncrypt(Table table) {
        return table.getPasswordHandler() != null && table.getPasswordHandler().canEncrypt();
    }
}
