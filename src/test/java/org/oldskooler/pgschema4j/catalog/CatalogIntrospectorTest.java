package org.oldskooler.pgschema4j.catalog;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.oldskooler.pgschema4j.SchemaOptions;
import org.oldskooler.pgschema4j.constraint.Constraint;
import org.oldskooler.pgschema4j.constraint.ConstraintType;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.mapping.IndexType;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.mapping.TableType;
import org.oldskooler.pgschema4j.operations.QueryExecutor;
import org.oldskooler.pgschema4j.query.PgArray;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class CatalogIntrospectorTest {

    private final QueryExecutor executor = mock(QueryExecutor.class);
    private final CatalogIntrospector introspector = new CatalogIntrospector(executor, new SchemaOptions());

    @Test
    void passesSearchPathAndTableNames() throws SQLException {
        new CatalogRows().stub(executor);
        introspector.listTriggers("customers", "orders");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Object>> args = ArgumentCaptor.forClass(List.class);
        verify(executor).queryForMaps(contains("information_schema.triggers"), args.capture());
        assertEquals("public", args.getValue().get(0));
        assertEquals(new PgArray(DataType.CHARACTER_VARYING, Arrays.<Object>asList("customers", "orders")),
                args.getValue().get(1));
    }

    @Test
    void readsColumnInformation() throws SQLException {
        CatalogRows rows = CatalogRows.customers().describe("customers", "email", "Customers table", "Login email.");
        rows.stub(executor);

        List<ColumnBasicInfo> infos = introspector.listColumnsInformationSchema("customers");
        assertEquals(6, infos.size());

        ColumnBasicInfo email = infos.get(4);
        assertEquals("email", email.name);
        assertEquals(5, email.ordinalPosition);
        assertEquals(DataType.CHARACTER_VARYING, email.dataType);
        assertEquals("255", email.dataTypeArgument);
        assertEquals("Customers table.", email.tableDescription);
        assertEquals("Login email.", email.description);
        assertEquals(TableType.BASE, email.tableType);
        assertFalse(email.nullable);
    }

    @Test
    void readsConstraintsLeniently() throws SQLException {
        new CatalogRows()
                .constraint("orders", "customer_id", "orders_customer_id_fkey", "f",
                        "FOREIGN KEY (customer_id) REFERENCES customers(id) ON DELETE CASCADE", "")
                .constraint("orders", "", "orders_status_idx", "i",
                        "CREATE INDEX orders_status_idx ON public.orders USING btree (status)", "")
                .constraint("orders", "total", "orders_total_check", "c", "not a check", "")
                .stub(executor);

        List<Constraint> constraints = introspector.listConstraints("orders");
        assertEquals(3, constraints.size());
        assertEquals("customers", constraints.get(0).getForeignKey().referenceTableName);
        assertEquals(ConstraintType.INDEX, constraints.get(1).getType());
        assertEquals("status", constraints.get(1).getColumnName());
        assertNull(constraints.get(2).getCheck());
    }

    @Test
    void readsUniqueIndexesAndTriggers() throws SQLException {
        CatalogRows.customers().trigger("customers", "set_timestamp").stub(executor);

        List<UniqueIndex> indexes = introspector.listUniqueIndexes();
        assertEquals(1, indexes.size());
        assertEquals(Arrays.asList("cognito_user_id", "email"), indexes.get(0).columns);

        List<Trigger> triggers = introspector.listTriggers();
        assertEquals("set_timestamp", triggers.get(0).name);
        assertEquals("customers", triggers.get(0).tableName);
        assertEquals("BEFORE", triggers.get(0).actionTiming);
    }

    @Test
    void mergesConstraintsIntoColumns() throws SQLException {
        CatalogRows.customers()
                .column("orders", "BASE TABLE", "id", "bigint", null, false)
                .column("orders", "BASE TABLE", "customer_id", "uuid", null, false)
                .column("orders", "BASE TABLE", "status", "text", null, true)
                .constraint("orders", "id", "orders_pkey", "p", "PRIMARY KEY (id)", "btree")
                .constraint("orders", "customer_id", "orders_customer_id_fkey", "f",
                        "FOREIGN KEY (customer_id) REFERENCES customers(id)", "")
                .constraint("orders", "", "orders_status_idx", "i",
                        "CREATE INDEX orders_status_idx ON public.orders USING hash (status)", "")
                .stub(executor);

        List<Column> columns = introspector.listColumns();
        Column id = find(columns, "customers", "id");
        assertTrue(id.isPrimaryKey());
        assertEquals(IndexType.NONE, id.getIndex());

        Column sub = find(columns, "customers", "cognito_user_id");
        assertEquals("customer_unique_idx", sub.getUniqueIndex());
        assertFalse(sub.isUnique());

        Column customerId = find(columns, "orders", "customer_id");
        assertEquals("customers", customerId.getReferenceTableName());
        assertEquals("NO ACTION", customerId.getReferenceOnDelete());

        Column status = find(columns, "orders", "status");
        assertEquals(IndexType.HASH, status.getIndex());
        assertTrue(status.isNullable());
    }

    @Test
    void ordersTablesParentsFirst() throws SQLException {
        new CatalogRows()
                .column("customer_orders", "BASE TABLE", "id", "integer", null, false)
                .column("active_customers", "VIEW", "id", "uuid", null, true)
                .column("customers", "BASE TABLE", "id", "uuid", null, false)
                .column("products", "BASE TABLE", "id", "integer", null, false)
                .stub(executor);

        List<Table> tables = introspector.listTables();
        assertEquals(Arrays.asList("customers", "products", "customer_orders", "active_customers"), names(tables));
        assertTrue(tables.get(3).isReadOnly());
        assertSame(tables.get(0), tables.get(0).getColumns().get(0).getTable());
    }

    @Test
    void filterCanDropTables() throws SQLException {
        new CatalogRows()
                .column("customers", "BASE TABLE", "id", "uuid", null, false)
                .column("products", "BASE TABLE", "id", "integer", null, false)
                .stub(executor);

        List<Table> tables = introspector.listTables(Collections.<String>emptyList(), t -> !t.getName().equals("products"));
        assertEquals(Collections.singletonList("customers"), names(tables));
    }

    private static Column find(List<Column> columns, String table, String name) {
        for (Column c : columns) {
            if (c.getTableName().equals(table) && c.getName().equals(name)) return c;
        }
        throw new AssertionError("no column " + table + "." + name);
    }

    private static List<String> names(List<Table> tables) {
        String[] out = new String[tables.size()];
        for (int i = 0; i < out.length; i++) out[i] = tables.get(i).getName();
        return Arrays.asList(out);
    }
}
