package org.oldskooler.pgschema4j.operations;

import org.oldskooler.pgschema4j.SchemaOptions;
import org.oldskooler.pgschema4j.catalog.Trigger;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.mapping.Schema;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.mapping.TableType;
import org.oldskooler.pgschema4j.query.AlterTableForeignKeysQuery;
import org.oldskooler.pgschema4j.query.CreateTableQuery;

import java.util.List;

import static org.oldskooler.pgschema4j.query.Identifiers.qualified;
import static org.oldskooler.pgschema4j.query.Identifiers.quote;

/**
 * Renders the statements that create a registered schema, one per line:
 * the namespace, the extensions the column types need, every base table, every
 * foreign key, then the {@code updated_at} maintenance function and triggers.
 */
public final class SchemaDump {
    private SchemaDump() {}

    /**
     * @param existingTriggers triggers already live in the search path; tables that have
     *                         the timestamp trigger are skipped
     */
    public static String build(Schema schema, List<Trigger> existingTriggers) {
        SchemaOptions options = schema.getOptions();
        StringBuilder b = new StringBuilder();

        line(b, "CREATE SCHEMA IF NOT EXISTS " + quote(options.getSearchPath()) + ";");

        if (schema.hasColumnType(DataType.UUID) || schema.hasPassword()) {
            line(b, "CREATE EXTENSION IF NOT EXISTS pgcrypto;");
        }
        if (schema.hasColumnType(DataType.CITEXT)) {
            line(b, "CREATE EXTENSION IF NOT EXISTS citext;");
        }
        if (schema.hasColumnType(DataType.HSTORE)) {
            line(b, "CREATE EXTENSION IF NOT EXISTS hstore;");
        }

        List<Table> tables = schema.tables(TableType.BASE);
        for (Table t : tables) {
            line(b, CreateTableQuery.build(t));
        }
        // after all tables, so references resolve whatever the registration order
        for (Table t : tables) {
            for (String q : AlterTableForeignKeysQuery.build(t)) line(b, q);
        }

        timestampTriggers(b, options, tables, existingTriggers);
        return b.toString();
    }

    private static void timestampTriggers(StringBuilder b, SchemaOptions options, List<Table> tables,
                                          List<Trigger> existing) {
        String triggerName = options.getSetTimestampTriggerName();
        String columnName = options.getUpdatedAtColumnName();
        if (triggerName.isEmpty() || columnName.isEmpty()) return;

        boolean functionCreated = false;
        for (Table t : tables) {
            if (hasTrigger(existing, triggerName, t.getName())) continue;

            Column c = t.getColumnByName(columnName);
            if (c == null || !isTimestamp(c.getType())) continue;

            String function = quote(t.getSearchPath()) + ".trigger_" + triggerName + "()";
            if (!functionCreated) {
                line(b, "CREATE OR REPLACE FUNCTION " + function + " RETURNS TRIGGER AS $$ BEGIN NEW."
                        + quote(c.getName()) + " = NOW(); RETURN NEW; END; $$ LANGUAGE plpgsql;");
                functionCreated = true;
            }
            line(b, "CREATE TRIGGER " + triggerName + " BEFORE UPDATE ON " + qualified(t)
                    + " FOR EACH ROW EXECUTE PROCEDURE " + function + ";");
        }
    }

    private static boolean hasTrigger(List<Trigger> triggers, String name, String tableName) {
        for (Trigger tr : triggers) {
            if (tr.name.equals(name) && tr.tableName.equals(tableName)) return true;
        }
        return false;
    }

    private static boolean isTimestamp(DataType type) {
        return type == DataType.TIMESTAMP || type == DataType.TIMESTAMP_TZ;
    }

    private static void line(StringBuilder b, String statement) {
        if (statement.isEmpty()) return;
        b.append(statement).append('\n');
    }
}
