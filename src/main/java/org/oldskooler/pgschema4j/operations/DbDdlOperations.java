package org.oldskooler.pgschema4j.operations;

import org.oldskooler.pgschema4j.catalog.CatalogIntrospector;
import org.oldskooler.pgschema4j.catalog.Trigger;
import org.oldskooler.pgschema4j.exceptions.PgSchemaException;
import org.oldskooler.pgschema4j.mapping.Schema;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.query.CreateTableQuery;
import org.oldskooler.pgschema4j.reconcile.SchemaReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.oldskooler.pgschema4j.query.Identifiers.quote;

/**
 * Handles DDL (Data Definition Language) operations for a registered schema:
 * creating, dropping and checking it against the live database.
 */
public class DbDdlOperations {
    private static final Logger log = LoggerFactory.getLogger(DbDdlOperations.class);

    private final Schema schema;
    private final QueryExecutor executor;
    private final CatalogIntrospector introspector;

    public DbDdlOperations(Schema schema, QueryExecutor executor) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.introspector = new CatalogIntrospector(executor, schema.getOptions());
    }

    public CatalogIntrospector introspector() {
        return introspector;
    }

    public <T> String createTableSql(Class<T> type) {
        return CreateTableQuery.build(schema.get(type));
    }

    /**
     * Renders the whole schema; reads the live triggers so existing timestamp triggers
     * are not created twice.
     */
    public String createSchemaDumpSql() throws SQLException {
        List<Trigger> triggers = introspector.listTriggers();
        return SchemaDump.build(schema, triggers);
    }

    /**
     * Creates the namespace, extensions, tables, foreign keys and triggers in one round
     * trip, which the server runs as a single implicit transaction.
     */
    public void createSchema() {
        String sql = null;
        try {
            sql = createSchemaDumpSql();
            executor.execute(sql, Collections.emptyList());
        } catch (SQLException e) {
            throw new PgSchemaException("create schema failed:\n" + (sql == null ? "" : sql), e);
        }
        log.info("created schema {} with {} tables", schema.getOptions().getSearchPath(),
                schema.tables().size());
    }

    public void deleteSchema() {
        String sql = "DROP SCHEMA IF EXISTS " + quote(schema.getOptions().getSearchPath()) + " CASCADE;";
        try {
            executor.execute(sql, Collections.emptyList());
        } catch (SQLException e) {
            throw new PgSchemaException("delete schema failed", e);
        }
        log.info("dropped schema {}", schema.getOptions().getSearchPath());
    }

    /**
     * @throws org.oldskooler.pgschema4j.exceptions.ReconciliationException on the first mismatch
     */
    public void checkSchema() {
        try {
            new SchemaReconciler(introspector).check(schema);
        } catch (SQLException e) {
            throw new PgSchemaException("check schema failed", e);
        }
    }

    public int createTable(Class<?> type) {
        Table t = schema.get(type);
        String sql = CreateTableQuery.build(t);
        if (sql.isEmpty()) return 0;
        try {
            return executor.execute(sql, Collections.emptyList());
        } catch (SQLException e) {
            throw new PgSchemaException("create table " + t + " failed", e);
        }
    }
}
