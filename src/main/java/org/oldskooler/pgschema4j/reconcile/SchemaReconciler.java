package org.oldskooler.pgschema4j.reconcile;

import org.oldskooler.pgschema4j.catalog.CatalogIntrospector;
import org.oldskooler.pgschema4j.exceptions.ReconciliationException;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.Schema;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.mapping.TableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Compares registered tables with the live catalog. Columns are matched by name and
 * compared through their non-strict tag rendering, lower cased; descriptions are copied
 * to whichever side lacks one and never compared.
 */
public class SchemaReconciler {
    private static final Logger log = LoggerFactory.getLogger(SchemaReconciler.class);

    private static final TableType[] DATABASE_TABLE_TYPES = {
            TableType.BASE, TableType.VIEW, TableType.MATERIALIZED_VIEW
    };

    private final CatalogIntrospector introspector;

    public SchemaReconciler(CatalogIntrospector introspector) {
        this.introspector = Objects.requireNonNull(introspector, "introspector");
    }

    /**
     * @throws ReconciliationException on the first mismatch
     */
    public void check(Schema schema) throws SQLException {
        List<String> tableNames = schema.tableNames(DATABASE_TABLE_TYPES);
        if (tableNames.isEmpty()) return;

        List<Table> live = introspector.listTables(tableNames, null);
        if (live.size() != tableNames.size()) {
            throw new ReconciliationException("expected " + tableNames.size() + " tables, got " + live.size());
        }

        for (Table liveTable : live) {
            Table code = schema.getByTableName(liveTable.getName())
                    .orElseThrow(() -> new ReconciliationException("table " + liveTable.getName() + " is not registered",
                            liveTable.getName(), null, null, null));
            checkTable(liveTable, code);
        }
        log.info("schema {} matches {} registered tables", schema.getOptions().getSearchPath(), live.size());
    }

    private void checkTable(Table live, Table code) {
        String tableName = code.getName();
        if (code.getDescription().isEmpty()) code.setDescription(live.getDescription());
        else if (live.getDescription().isEmpty()) live.setDescription(code.getDescription());

        for (Column codeColumn : code.listColumnsWithoutPresenter()) {
            Column liveColumn = live.getColumnByName(codeColumn.getName());
            if (liveColumn == null) {
                throw new ReconciliationException("column " + codeColumn.getName() + " in table " + tableName
                        + " not found in database", tableName, codeColumn.getName(), null, codeColumn.tagString(false));
            }

            String liveTag = liveColumn.tagString(false).toLowerCase(Locale.ROOT);
            String codeTag = codeColumn.tagString(false).toLowerCase(Locale.ROOT);
            if (!liveTag.equals(codeTag)) {
                throw new ReconciliationException("column " + codeColumn.getName() + " in table " + tableName
                        + " has wrong field tag: db:\n" + liveTag + "\nvs code:\n" + codeTag,
                        tableName, codeColumn.getName(), liveTag, codeTag);
            }

            if (codeColumn.getDescription().isEmpty()) codeColumn.setDescription(liveColumn.getDescription());
            else if (liveColumn.getDescription().isEmpty()) liveColumn.setDescription(codeColumn.getDescription());
        }

        if (!code.isStrict()) return;
        for (Column liveColumn : live.getColumns()) {
            if (!code.columnExists(liveColumn.getName())) {
                throw new ReconciliationException("column " + liveColumn.getName() + " in table " + tableName
                        + " not found in schema", tableName, liveColumn.getName(), liveColumn.tagString(false), null);
            }
        }
    }
}
