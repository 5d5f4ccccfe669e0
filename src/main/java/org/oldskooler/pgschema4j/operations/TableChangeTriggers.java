package org.oldskooler.pgschema4j.operations;

import org.oldskooler.pgschema4j.SchemaOptions;
import org.oldskooler.pgschema4j.mapping.Schema;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.mapping.TableType;
import org.oldskooler.pgschema4j.query.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Installs the function and the per-table triggers that publish row changes on the
 * notify channel as {@link TableNotification} payloads. Each is installed at most once
 * per instance; safe for concurrent use.
 */
public class TableChangeTriggers {
    private static final Logger log = LoggerFactory.getLogger(TableChangeTriggers.class);

    private final QueryExecutor executor;
    private final SchemaOptions options;

    private final AtomicBoolean functionInstalled = new AtomicBoolean();
    private final Object functionLock = new Object();

    private final ReadWriteLock tablesLock = new ReentrantReadWriteLock();
    private final Set<String> installedTables = new HashSet<>();

    public TableChangeTriggers(QueryExecutor executor, SchemaOptions options) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.options = Objects.requireNonNull(options, "options");
    }

    public String functionSql() {
        return "CREATE OR REPLACE FUNCTION " + options.getNotifyFunction() + "() RETURNS trigger AS $$\n"
                + "DECLARE\n"
                + "    payload text;\n"
                + "    channel text := '" + options.getNotifyChannel() + "';\n"
                + "BEGIN\n"
                + "    SELECT json_build_object('table', TG_TABLE_NAME, 'change', TG_OP, 'old', OLD, 'new', NEW)::text INTO payload;\n"
                + "    PERFORM pg_notify(channel, payload);\n"
                + "    IF (TG_OP = 'DELETE') THEN\n"
                + "        RETURN OLD;\n"
                + "    ELSE\n"
                + "        RETURN NEW;\n"
                + "    END IF;\n"
                + "END;\n"
                + "$$ LANGUAGE plpgsql;";
    }

    public String triggerName(Table table) {
        return table.getName() + "_" + options.getNotifyFunction();
    }

    public String triggerSql(Table table) {
        return "CREATE OR REPLACE TRIGGER " + triggerName(table)
                + " AFTER INSERT OR UPDATE OR DELETE ON " + Identifiers.qualified(table)
                + " FOR EACH ROW EXECUTE FUNCTION " + options.getNotifyFunction() + "();";
    }

    /**
     * Makes sure the notify function exists and the table has its trigger.
     *
     * @throws IllegalArgumentException for views and presenters
     */
    public void install(Table table) throws SQLException {
        if (table.getType() != TableType.BASE) {
            throw new IllegalArgumentException("change notifications need a base table: " + table);
        }
        installFunction();

        String key = table.toString();
        tablesLock.readLock().lock();
        try {
            if (installedTables.contains(key)) return;
        } finally {
            tablesLock.readLock().unlock();
        }

        tablesLock.writeLock().lock();
        try {
            if (installedTables.contains(key)) return;
            executor.execute(triggerSql(table), Collections.emptyList());
            installedTables.add(key);
            log.info("installed change trigger {} on {}", triggerName(table), table);
        } finally {
            tablesLock.writeLock().unlock();
        }
    }

    /** Installs triggers on every registered base table. */
    public void installAll(Schema schema) throws SQLException {
        for (Table t : schema.tables(TableType.BASE)) {
            install(t);
        }
    }

    public boolean isInstalled(Table table) {
        tablesLock.readLock().lock();
        try {
            return installedTables.contains(table.toString());
        } finally {
            tablesLock.readLock().unlock();
        }
    }

    private void installFunction() throws SQLException {
        if (functionInstalled.get()) return;
        synchronized (functionLock) {
            if (functionInstalled.get()) return;
            executor.execute(functionSql(), Collections.emptyList());
            functionInstalled.set(true);
            log.info("installed change notify function {} on channel {}", options.getNotifyFunction(),
                    options.getNotifyChannel());
        }
    }
}
