package org.oldskooler.pgschema4j.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/** Coerces values read from JDBC into the declared type of a record field. */
public final class ValueConverter {
    private static final DateTimeFormatter SQL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValueConverter() {}

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object convert(Object val, Class<?> targetType) {
        if (val == null) return null;
        if (targetType.isInstance(val)) return val;

        if (targetType == Long.class || targetType == long.class) return toNumber(val).longValue();
        if (targetType == Integer.class || targetType == int.class) return toNumber(val).intValue();
        if (targetType == Double.class || targetType == double.class) return toNumber(val).doubleValue();
        if (targetType == Float.class || targetType == float.class) return toNumber(val).floatValue();
        if (targetType == Short.class || targetType == short.class) return toNumber(val).shortValue();
        if (targetType == Byte.class || targetType == byte.class) {
            if (val instanceof Boolean) {
                return (byte) (((Boolean) val) ? 1 : 0);
            }
            return toNumber(val).byteValue();
        }
        if (targetType == BigDecimal.class) return new BigDecimal(String.valueOf(val));
        if (targetType == BigInteger.class) return new BigInteger(String.valueOf(val));

        if (targetType == Boolean.class || targetType == boolean.class) {
            if (val instanceof Number) return ((Number) val).intValue() != 0;
            if (val instanceof String) return parseBoolean((String) val);
        }
        if (targetType == String.class) return String.valueOf(val);
        if (targetType == UUID.class) return UUID.fromString(String.valueOf(val));
        if (targetType.isEnum()) return Enum.valueOf((Class<? extends Enum>) targetType, String.valueOf(val));

        if (targetType == LocalDate.class) {
            if (val instanceof Date) return ((Date) val).toLocalDate();
            if (val instanceof Timestamp) return ((Timestamp) val).toLocalDateTime().toLocalDate();
            if (val instanceof String) {
                String s = (String) val;
                try {
                    return LocalDate.parse(s);
                } catch (DateTimeException e) {
                    return LocalDate.parse(s, SQL_DATE_TIME);
                }
            }
        }

        if (targetType == LocalDateTime.class) {
            if (val instanceof Timestamp) return ((Timestamp) val).toLocalDateTime();
            if (val instanceof OffsetDateTime) return ((OffsetDateTime) val).toLocalDateTime();
            if (val instanceof String) {
                String s = (String) val;
                try {
                    return LocalDateTime.parse(s);
                } catch (DateTimeException e) {
                    return LocalDateTime.parse(s, SQL_DATE_TIME);
                }
            }
        }

        if (targetType == LocalTime.class) {
            if (val instanceof Time) return ((Time) val).toLocalTime();
            if (val instanceof String) return LocalTime.parse((String) val);
        }

        if (targetType == OffsetDateTime.class) {
            if (val instanceof Timestamp) {
                return OffsetDateTime.ofInstant(((Timestamp) val).toInstant(), ZoneId.systemDefault());
            }
            if (val instanceof String) return OffsetDateTime.parse((String) val);
        }

        if (targetType == Instant.class) {
            if (val instanceof Timestamp) return ((Timestamp) val).toInstant();
            if (val instanceof OffsetDateTime) return ((OffsetDateTime) val).toInstant();
        }

        if (targetType == java.util.Date.class && val instanceof Timestamp) {
            return new java.util.Date(((Timestamp) val).getTime());
        }

        if (List.class.isAssignableFrom(targetType) && val.getClass().isArray() && !val.getClass().getComponentType().isPrimitive()) {
            return new ArrayList<>(Arrays.asList((Object[]) val));
        }
        if (targetType.isArray() && val instanceof List) {
            List<?> list = (List<?>) val;
            Class<?> component = targetType.getComponentType();
            Object out = java.lang.reflect.Array.newInstance(component, list.size());
            for (int i = 0; i < list.size(); i++) {
                java.lang.reflect.Array.set(out, i, convert(list.get(i), component));
            }
            return out;
        }

        return val;
    }

    private static Number toNumber(Object val) {
        if (val instanceof Number) return (Number) val;
        if (val instanceof String) return new BigDecimal(((String) val).trim());
        throw new IllegalArgumentException("Cannot convert " + val.getClass().getName() + " to a number");
    }

    /** Accepts the literals understood by annotation booleans and catalog flags. */
    public static boolean parseBoolean(String s) {
        switch (s.trim().toLowerCase()) {
            case "1":
            case "t":
            case "true":
            case "y":
            case "yes":
                return true;
            case "0":
            case "f":
            case "false":
            case "n":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException("invalid boolean value: " + s);
        }
    }
}
