package org.oldskooler.pgschema4j.mapping;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PostgreSQL column types known to the table model.
 * The first alias of each constant is its canonical name, used when rendering DDL and tags.
 */
public enum DataType {
    INVALID(Object.class),
    BIG_INT(Long.class, "bigint", "int8"),
    BIG_INT_ARRAY(Long[].class, "bigint[]", "int8[]"),
    BIG_SERIAL(Long.class, "bigserial", "serial8"),
    BIT(String.class, "bit"),
    BIT_VARYING(String.class, "varbit", "bit varying"),
    BOOLEAN(Boolean.class, "boolean", "bool"),
    BOX(String.class, "box"),
    BYTEA(byte[].class, "bytea"),
    CHARACTER(String.class, "character", "char"),
    CHARACTER_ARRAY(String[].class, "character[]", "char[]"),
    CHARACTER_VARYING(String.class, "varchar", "character varying"),
    CHARACTER_VARYING_ARRAY(String[].class, "varchar[]", "character varying[]"),
    CIDR(String.class, "cidr"),
    CIRCLE(String.class, "circle"),
    DATE(LocalDate.class, "date"),
    DOUBLE_PRECISION(Double.class, "float8", "double precision"),
    INET(String.class, "inet"),
    INTEGER(Integer.class, "int", "int4", "integer"),
    INTEGER_ARRAY(Integer[].class, "int[]", "int4[]", "integer[]"),
    INTEGER_DOUBLE_ARRAY(Integer[][].class, "int[][]", "int4[][]", "integer[][]"),
    ARRAY(Object[].class, "array"),
    INTERVAL(Duration.class, "interval"),
    JSON(String.class, "json"),
    JSONB(String.class, "jsonb"),
    LINE(String.class, "line"),
    LSEG(String.class, "lseg"),
    MAC_ADDR(String.class, "macaddr"),
    MAC_ADDR8(String.class, "macaddr8"),
    MONEY(String.class, "money"),
    NUMERIC(BigDecimal.class, "numeric", "decimal"),
    PATH(String.class, "path"),
    PG_LSN(String.class, "pg_lsn"),
    POINT(String.class, "point"),
    POLYGON(String.class, "polygon"),
    REAL(Float.class, "real", "float4"),
    SMALL_INT(Short.class, "smallint", "int2"),
    SMALL_SERIAL(Short.class, "smallserial", "serial2"),
    SERIAL(Integer.class, "serial", "serial4"),
    TEXT(String.class, "text"),
    TEXT_ARRAY(String[].class, "text[]"),
    TEXT_DOUBLE_ARRAY(String[][].class, "text[][]"),
    TIME(LocalTime.class, "time", "time without time zone", "time(6) without time zone"),
    TIME_TZ(OffsetTime.class, "timetz", "time with time zone", "time(6) with time zone"),
    TIMESTAMP(LocalDateTime.class, "timestamp", "timestamp without time zone", "timestamp(6) without time zone"),
    TIMESTAMP_TZ(OffsetDateTime.class, "timestamptz", "timestamp with time zone", "timestamp(6) with time zone"),
    TS_QUERY(String.class, "tsquery"),
    TS_VECTOR(String.class, "tsvector"),
    TXID_SNAPSHOT(String.class, "txid_snapshot"),
    UUID(java.util.UUID.class, "uuid"),
    UUID_ARRAY(java.util.UUID[].class, "uuid[]"),
    XML(String.class, "xml"),
    INT4_RANGE(String.class, "int4range"),
    INT4_MULTI_RANGE(String.class, "int4multirange"),
    INT8_RANGE(String.class, "int8range"),
    INT8_MULTI_RANGE(String.class, "int8multirange"),
    NUM_RANGE(String.class, "numrange"),
    NUM_MULTI_RANGE(String.class, "nummultirange"),
    TS_RANGE(String.class, "tsrange"),
    TS_MULTI_RANGE(String.class, "tsmultirange"),
    TSTZ_RANGE(String.class, "tstzrange"),
    TSTZ_MULTI_RANGE(String.class, "tstzmultirange"),
    DATE_RANGE(String.class, "daterange"),
    DATE_MULTI_RANGE(String.class, "datemultirange"),
    CITEXT(String.class, "citext"),
    HSTORE(Map.class, "hstore");

    private final Class<?> javaType;
    private final List<String> aliases;

    DataType(Class<?> javaType, String... aliases) {
        this.javaType = javaType;
        this.aliases = Collections.unmodifiableList(Arrays.asList(aliases));
    }

    /** @return every textual name the catalog or an annotation may use for this type */
    public List<String> aliases() {
        return aliases;
    }

    /** @return the default Java representation of a value of this type */
    public Class<?> javaType() {
        return javaType;
    }

    public boolean isValid() {
        return this != INVALID;
    }

    public boolean isArray() {
        switch (this) {
            case BIG_INT_ARRAY:
            case INTEGER_ARRAY:
            case INTEGER_DOUBLE_ARRAY:
            case CHARACTER_ARRAY:
            case CHARACTER_VARYING_ARRAY:
            case TEXT_ARRAY:
            case TEXT_DOUBLE_ARRAY:
            case UUID_ARRAY:
                return true;
            default:
                return false;
        }
    }

    /** The type of one element of an array type; the type itself otherwise. */
    public DataType elementType() {
        switch (this) {
            case BIG_INT_ARRAY:
                return BIG_INT;
            case INTEGER_ARRAY:
            case INTEGER_DOUBLE_ARRAY:
                return INTEGER;
            case CHARACTER_ARRAY:
                return CHARACTER;
            case CHARACTER_VARYING_ARRAY:
                return CHARACTER_VARYING;
            case TEXT_ARRAY:
            case TEXT_DOUBLE_ARRAY:
                return TEXT;
            case UUID_ARRAY:
                return UUID;
            default:
                return this;
        }
    }

    public boolean isTime() {
        return this == TIME || this == TIME_TZ || this == TIMESTAMP || this == TIMESTAMP_TZ;
    }

    public boolean isJson() {
        return this == JSON || this == JSONB;
    }

    /** Case-insensitive match against any alias. */
    public boolean is(String name) {
        if (name == null) return false;
        String s = name.trim().toLowerCase(Locale.ROOT);
        return aliases.contains(s);
    }

    @Override
    public String toString() {
        return aliases.isEmpty() ? "" : aliases.get(0);
    }

    /**
     * Parses a type name as written in an annotation or returned by {@code format_type},
     * e.g. {@code character varying(255)} gives {@link #CHARACTER_VARYING} and {@code 255}.
     * A parenthesised part is treated as the argument only when it closes the text,
     * so {@code timestamp(6) without time zone} resolves through its alias.
     */
    public static Parsed parse(String text) {
        if (text == null) return new Parsed(INVALID, "");

        String s = text.trim().toLowerCase(Locale.ROOT);
        String argument = "";
        if (s.endsWith(")")) {
            int open = s.indexOf('(');
            if (open != -1) {
                argument = s.substring(open + 1, s.length() - 1).trim();
                s = s.substring(0, open).trim();
            }
        }

        for (DataType t : values()) {
            if (t.aliases.contains(s)) {
                return new Parsed(t, argument);
            }
        }
        return new Parsed(INVALID, "");
    }

    /** Default column type for a field of the given Java type, or {@link #INVALID}. */
    public static DataType fromJavaType(Class<?> type) {
        if (type == null) return INVALID;
        if (type == String.class || type.isEnum()) return TEXT;
        if (type == byte[].class) return BYTEA;
        if (type == Integer.class || type == int.class) return INTEGER;
        if (type == Long.class || type == long.class) return BIG_INT;
        if (type == Short.class || type == short.class || type == Byte.class || type == byte.class) return SMALL_INT;
        if (type == Double.class || type == double.class) return DOUBLE_PRECISION;
        if (type == Float.class || type == float.class) return REAL;
        if (type == BigDecimal.class) return NUMERIC;
        if (type == Boolean.class || type == boolean.class) return BOOLEAN;
        if (type == Character.class || type == char.class) return CHARACTER;
        if (type == java.util.UUID.class) return UUID;
        if (type == LocalDate.class) return DATE;
        if (type == LocalTime.class) return TIME;
        if (type == OffsetTime.class) return TIME_TZ;
        if (type == LocalDateTime.class || type == Instant.class
                || type == java.util.Date.class || type == java.sql.Timestamp.class) return TIMESTAMP;
        if (type == OffsetDateTime.class) return TIMESTAMP_TZ;
        if (type == Duration.class) return INTERVAL;
        if (type == String[].class || Collection.class.isAssignableFrom(type)) return CHARACTER_VARYING_ARRAY;
        if (type == Integer[].class || type == int[].class) return INTEGER_ARRAY;
        if (type == Long[].class || type == long[].class) return BIG_INT_ARRAY;
        if (type == java.util.UUID[].class) return UUID_ARRAY;
        if (Map.class.isAssignableFrom(type)) return JSONB;
        return INVALID;
    }

    /** A parsed type name and its optional argument. */
    public static final class Parsed {
        public final DataType type;
        public final String argument;

        Parsed(DataType type, String argument) {
            this.type = type;
            this.argument = argument;
        }
    }
}
