package org.oldskooler.pgschema4j.scan;

import org.oldskooler.pgschema4j.exceptions.ScanException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.mapping.FieldDescriptor;
import org.oldskooler.pgschema4j.mapping.PasswordHandler;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.operations.Rows;
import org.oldskooler.pgschema4j.serialization.JsonColumnCodec;
import org.oldskooler.pgschema4j.util.ReflectionUtils;
import org.oldskooler.pgschema4j.util.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes result rows into records of a registered table. Result columns are matched to
 * table columns by case-insensitive name.
 */
public final class RowScanner {
    private static final Logger log = LoggerFactory.getLogger(RowScanner.class);

    private RowScanner() {}

    /**
     * Resolves the destination and decode strategy of each result column.
     *
     * @throws ScanException if the table is strict and a result column has no destination
     */
    public static ScanPlan plan(Table table, List<String> columnNames) {
        List<ScanPlan.Binding> bindings = new ArrayList<>(columnNames.size());
        for (int i = 0; i < columnNames.size(); i++) {
            String name = columnNames.get(i);
            Column c = table.getColumnByName(name);
            if (c == null) {
                if (table.isStrict()) {
                    throw new ScanException(table + ": result column " + name + " has no destination field");
                }
                bindings.add(new ScanPlan.Binding(i, name, null, DecodeStrategy.NO_OP));
                continue;
            }
            bindings.add(new ScanPlan.Binding(i, name, c, strategyOf(table, c)));
        }

        if (log.isDebugEnabled()) {
            List<String> parts = new ArrayList<>(bindings.size());
            for (ScanPlan.Binding b : bindings) parts.add(b.resultColumn + ":" + b.strategy);
            log.debug("{}: scan plan {}", table, parts);
        }
        return new ScanPlan(table, bindings);
    }

    static DecodeStrategy strategyOf(Table table, Column c) {
        if (c.isUnscannable() || c.getField() == null) return DecodeStrategy.NO_OP;

        PasswordHandler handler = table.getPasswordHandler();
        if (c.isPassword() && handler != null && handler.canDecrypt()) return DecodeStrategy.PASSWORD;

        DataType t = c.getType();
        if (c.isNullable() && (t == DataType.UUID || t == DataType.TEXT || t == DataType.CHARACTER_VARYING)) {
            return DecodeStrategy.NULLABLE;
        }
        return DecodeStrategy.DEFAULT;
    }

    /** Reads every remaining row into a new record. Does not close {@code rows}. */
    public static <T> List<T> scanAll(Table table, Rows rows) throws SQLException {
        ScanPlan plan = plan(table, rows.columnNames());
        List<T> out = new ArrayList<>();
        while (rows.next()) {
            out.add(scan(plan, rows.values()));
        }
        return out;
    }

    /** Creates a record of the table's type from one row. */
    @SuppressWarnings("unchecked")
    public static <T> T scan(ScanPlan plan, List<Object> values) {
        if (plan.table.getDescriptor() == null) {
            throw new ScanException(plan.table + ": table has no record type to scan into");
        }
        T record = (T) plan.table.getDescriptor().newInstance();
        scanInto(plan, record, values);
        return record;
    }

    /** Writes one row into an existing record. */
    public static void scanInto(ScanPlan plan, Object record, List<Object> values) {
        if (values.size() != plan.bindings.size()) {
            throw new ScanException(plan.table + ": expected " + plan.bindings.size() + " values, got " + values.size());
        }

        for (ScanPlan.Binding b : plan.bindings) {
            Object src = values.get(b.index);
            switch (b.strategy) {
                case NO_OP:
                    break;
                case NULLABLE:
                    // Optional fields still become Optional.empty() on NULL.
                    if (src != null || b.column.getField().type == Optional.class) decode(b.column, record, src);
                    break;
                case PASSWORD:
                    decrypt(plan.table, b.column, record, src);
                    break;
                case DEFAULT:
                default:
                    decode(b.column, record, src);
                    break;
            }
        }
    }

    private static void decrypt(Table table, Column c, Object record, Object src) {
        if (src == null) return;

        String stored;
        if (src instanceof String) {
            stored = (String) src;
        } else if (src instanceof byte[]) {
            stored = new String((byte[]) src, StandardCharsets.UTF_8);
        } else {
            throw new ScanException(table.getName() + ": password: unknown type of: " + src.getClass().getName());
        }

        String plain = table.getPasswordHandler().decrypt(table.getName(), stored);
        if (plain == null || plain.isEmpty()) return; // verify-only hook
        c.getField().accessor.set(record, plain);
    }

    private static void decode(Column c, Object record, Object src) {
        FieldDescriptor f = c.getField();

        if (c.isScanner()) {
            Object current = f.accessor.get(record);
            if (current == null) {
                current = ReflectionUtils.newInstance(ReflectionUtils.noArgConstructor(f.type));
            }
            ((ValueScanner) current).scan(src);
            f.accessor.set(record, current);
            return;
        }

        if (f.type == Optional.class) {
            Type inner = optionalElementType(f.genericType);
            f.accessor.set(record, src == null ? Optional.empty() : Optional.ofNullable(convert(c, src, inner)));
            return;
        }

        if (src == null) {
            if (f.type.isPrimitive()) {
                throw new ScanException(c.getTableName() + "." + c.getName()
                        + ": cannot assign NULL to primitive field " + f);
            }
            f.accessor.set(record, null);
            return;
        }

        f.accessor.set(record, convert(c, src, f.genericType));
    }

    private static Object convert(Column c, Object src, Type target) {
        Class<?> raw = rawClass(target);
        try {
            if (c.getType().isJson() && raw != String.class && src instanceof String) {
                return JsonColumnCodec.getDefault().fromJson((String) src, target);
            }
            return ValueConverter.convert(src, raw);
        } catch (RuntimeException e) {
            throw new ScanException(c.getTableName() + "." + c.getName() + ": cannot convert "
                    + src.getClass().getName() + " to " + target.getTypeName(), e);
        }
    }

    private static Type optionalElementType(Type t) {
        if (t instanceof ParameterizedType) {
            return ((ParameterizedType) t).getActualTypeArguments()[0];
        }
        return Object.class;
    }

    private static Class<?> rawClass(Type t) {
        if (t instanceof Class) return (Class<?>) t;
        if (t instanceof ParameterizedType) return (Class<?>) ((ParameterizedType) t).getRawType();
        return Object.class;
    }
}
