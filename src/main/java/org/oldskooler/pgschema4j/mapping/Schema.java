package org.oldskooler.pgschema4j.mapping;

import org.oldskooler.pgschema4j.SchemaOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Registry of the tables of one database, keyed by record type and kept in
 * registration order. Filled once at start-up, read-only afterwards.
 */
public class Schema {
    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    private final SchemaOptions options;
    private final Map<Class<?>, Table> byType = new LinkedHashMap<>();
    private PasswordHandler passwordHandler;

    public Schema() {
        this(new SchemaOptions());
    }

    public Schema(SchemaOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public SchemaOptions getOptions() {
        return options;
    }

    /**
     * Registers an annotated record type.
     *
     * @param tableName the table name
     * @param type the record class, its fields carry {@code @Pg}
     * @param filters applied in order; a filter returning false skips registration
     * @return this schema
     */
    public <T> Schema register(String tableName, Class<T> type, TableFilter... filters) {
        return register(tableName, RecordDescriptor.of(type), filters);
    }

    public <T> Schema register(String tableName, RecordDescriptor<T> descriptor, TableFilter... filters) {
        add(tableName, descriptor, false, filters);
        return this;
    }

    /**
     * Registers a strict table: reading a result column it has no field for fails,
     * and reconciliation also rejects live columns missing from the record.
     */
    public <T> Schema mustRegister(String tableName, Class<T> type, TableFilter... filters) {
        return mustRegister(tableName, RecordDescriptor.of(type), filters);
    }

    public <T> Schema mustRegister(String tableName, RecordDescriptor<T> descriptor, TableFilter... filters) {
        add(tableName, descriptor, true, filters);
        return this;
    }

    private void add(String tableName, RecordDescriptor<?> descriptor, boolean strict, TableFilter... filters) {
        Table t = TableBuilder.build(tableName, descriptor, options);
        t.setStrict(strict);
        t.setPasswordHandler(passwordHandler);

        for (TableFilter f : filters) {
            if (!f.filter(t)) {
                log.debug("table {} skipped by filter", tableName);
                return;
            }
        }

        Table previous = byType.get(descriptor.type);
        if (previous != null) {
            // Re-registration replaces the table in place.
            t.setRegisteredPosition(previous.getRegisteredPosition());
            log.debug("table {} for {} replaces {}", t, descriptor.type.getName(), previous);
        } else {
            t.setRegisteredPosition(byType.size() + 1);
        }
        byType.put(descriptor.type, t);
        log.debug("registered {} table {} for {} with {} columns", t.getType(), t, descriptor.type.getName(),
                t.getColumns().size());
    }

    /**
     * Sets the password hooks of every registered and every later registered table.
     */
    public void setPasswordHandler(PasswordHandler passwordHandler) {
        this.passwordHandler = passwordHandler;
        for (Table t : byType.values()) {
            t.setPasswordHandler(passwordHandler);
        }
    }

    public PasswordHandler getPasswordHandler() {
        return passwordHandler;
    }

    /**
     * @throws IllegalArgumentException if the type was never registered
     */
    public Table get(Class<?> type) {
        Table t = byType.get(type);
        if (t == null) {
            throw new IllegalArgumentException("table for type " + type.getName() + " is not registered");
        }
        return t;
    }

    public Optional<Table> getByTableName(String tableName) {
        for (Table t : byType.values()) {
            if (t.getName().equals(tableName)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** The most recently registered table. */
    public Optional<Table> last() {
        Table last = null;
        for (Table t : byType.values()) last = t;
        return Optional.ofNullable(last);
    }

    /**
     * Registered tables in registration order.
     *
     * @param types restricts the result to these table types; none means all
     */
    public List<Table> tables(TableType... types) {
        Set<TableType> allowed = types.length == 0
                ? EnumSet.allOf(TableType.class) : EnumSet.copyOf(Arrays.asList(types));

        List<Table> out = new ArrayList<>();
        for (Table t : byType.values()) {
            if (allowed.contains(t.getType())) out.add(t);
        }
        out.sort(Comparator.comparingInt(Table::getRegisteredPosition));
        return out;
    }

    public List<String> tableNames(TableType... types) {
        List<String> out = new ArrayList<>();
        for (Table t : tables(types)) out.add(t.getName());
        return out;
    }

    public boolean hasColumnType(DataType... dataTypes) {
        List<DataType> wanted = Arrays.asList(dataTypes);
        for (Table t : byType.values()) {
            for (Column c : t.getColumns()) {
                if (wanted.contains(c.getType())) return true;
            }
        }
        return false;
    }

    public boolean hasPassword() {
        for (Table t : byType.values()) {
            if (t.passwordColumn().isPresent()) return true;
        }
        return false;
    }
}
