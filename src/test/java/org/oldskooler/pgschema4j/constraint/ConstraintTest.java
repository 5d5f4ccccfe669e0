package org.oldskooler.pgschema4j.constraint;

import org.junit.jupiter.api.Test;
import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.IndexType;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintTest {

    private static Column column(String name) {
        Column c = new Column();
        c.setTableName("orders");
        c.setName(name);
        return c;
    }

    @Test
    void parsesTypeCodes() {
        assertEquals(ConstraintType.PRIMARY_KEY, ConstraintType.parse("p"));
        assertEquals(ConstraintType.FOREIGN_KEY, ConstraintType.parse("FOREIGN KEY"));
        assertEquals(ConstraintType.INDEX, ConstraintType.parse("i"));
        assertThrows(IllegalArgumentException.class, () -> ConstraintType.parse("x"));
    }

    @Test
    void primaryKeyAndCheck() {
        Column c = column("id");
        new Constraint("orders", "id", "orders_pkey", ConstraintType.PRIMARY_KEY, IndexType.BTREE).applyTo(c);
        assertTrue(c.isPrimaryKey());
        assertEquals(IndexType.BTREE, c.getIndex());

        Column total = column("total");
        Constraint check = new Constraint("orders", "total", "orders_total_check", ConstraintType.CHECK, IndexType.NONE);
        check.build("CHECK ((total >= 0))");
        check.applyTo(total);
        assertEquals("total >= 0", total.getCheckConstraint());
    }

    @Test
    void singleColumnUniqueVersusGroup() {
        Column email = column("email");
        Constraint single = new Constraint("orders", "email", "orders_email_key", ConstraintType.UNIQUE, IndexType.BTREE);
        single.build("UNIQUE (email)");
        single.applyTo(email);
        assertTrue(email.isUnique());

        Column code = column("code");
        Constraint group = new Constraint("orders", "code", "orders_code_region_key", ConstraintType.UNIQUE, IndexType.BTREE);
        group.build("UNIQUE (code, region)");
        group.applyTo(code);
        assertFalse(code.isUnique());
        assertEquals("orders_code_region_key", code.getUniqueIndex());
    }

    @Test
    void foreignKeyWithoutActionReadsNoAction() {
        Column c = column("customer_id");
        Constraint fk = new Constraint("orders", "customer_id", "orders_customer_id_fkey", ConstraintType.FOREIGN_KEY, IndexType.NONE);
        fk.build("FOREIGN KEY (customer_id) REFERENCES customers(id) DEFERRABLE");
        fk.applyTo(c);

        assertEquals("customers", c.getReferenceTableName());
        assertEquals("id", c.getReferenceColumnName());
        assertEquals("NO ACTION", c.getReferenceOnDelete());
        assertTrue(c.isDeferrableReference());
    }

    @Test
    void indexDefinitionSuppliesColumn() {
        Constraint idx = new Constraint("orders", "", "orders_status_idx", ConstraintType.INDEX, IndexType.NONE);
        idx.build("CREATE INDEX orders_status_idx ON public.orders USING hash (status)");
        assertEquals("status", idx.getColumnName());
        assertEquals(IndexType.HASH, idx.getIndexType());

        Column status = column("status");
        idx.applyTo(status);
        assertEquals(IndexType.HASH, status.getIndex());
    }

    @Test
    void unparseableDefinitionIsLenient() {
        Constraint fk = new Constraint("orders", "x", "weird", ConstraintType.FOREIGN_KEY, IndexType.NONE);
        fk.build("FOREIGN KEY (a, b) REFERENCES t (x, y)");
        assertNull(fk.getForeignKey());

        Column c = column("x");
        fk.applyTo(c);
        assertFalse(c.isReference());
    }
}
