package org.oldskooler.pgschema4j.constraint;

import org.junit.jupiter.api.Test;
import org.oldskooler.pgschema4j.mapping.IndexType;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintParsersTest {

    @Test
    void foreignKeys() {
        Object[][] cases = {
                // definition, column, table, ref column, on delete, on update, deferrable
                {"FOREIGN KEY (customer_id) REFERENCES customers (id)", "customer_id", "customers", "id", "", "", false},
                {"FOREIGN KEY (customer_id) REFERENCES customers(id) ON DELETE CASCADE", "customer_id", "customers", "id", "CASCADE", "", false},
                {"FOREIGN KEY (col) REFERENCES tbl (ref) ON DELETE SET NULL ON UPDATE CASCADE DEFERRABLE", "col", "tbl", "ref", "SET NULL", "CASCADE", true},
                {"FOREIGN KEY (col) REFERENCES tbl (ref) ON UPDATE NO ACTION ON DELETE RESTRICT", "col", "tbl", "ref", "RESTRICT", "NO ACTION", false},
                {"FOREIGN KEY (col) REFERENCES tbl (ref) ON DELETE SET DEFAULT NOT DEFERRABLE", "col", "tbl", "ref", "SET DEFAULT", "", false},
                {"foreign key (col) references tbl (ref) on delete cascade deferrable initially deferred", "col", "tbl", "ref", "CASCADE", "", true},
        };

        for (Object[] c : cases) {
            ForeignKeyConstraint fk = ConstraintParsers.parseForeignKey((String) c[0]);
            assertNotNull(fk, (String) c[0]);
            assertEquals(c[1], fk.columnName, (String) c[0]);
            assertEquals(c[2], fk.referenceTableName, (String) c[0]);
            assertEquals(c[3], fk.referenceColumnName, (String) c[0]);
            assertEquals(c[4], fk.onDelete, (String) c[0]);
            assertEquals(c[5], fk.onUpdate, (String) c[0]);
            assertEquals(c[6], fk.deferrable, (String) c[0]);
        }
    }

    @Test
    void malformedForeignKeyGivesNull() {
        assertNull(ConstraintParsers.parseForeignKey("FOREIGN KEY (a, b) REFERENCES t (x, y)"));
        assertNull(ConstraintParsers.parseForeignKey("REFERENCES t (x)"));
        assertNull(ConstraintParsers.parseForeignKey(null));
    }

    @Test
    void checks() {
        assertEquals("price > 0", ConstraintParsers.parseCheck("CHECK ((price > 0))").expression);
        assertEquals("price > 0", ConstraintParsers.parseCheck("CHECK (price > 0)").expression);
        assertEquals("(a > 0) AND (b > 0)", ConstraintParsers.parseCheck("CHECK (((a > 0) AND (b > 0)))").expression);
        assertNull(ConstraintParsers.parseCheck("price > 0"));
    }

    @Test
    void unique() {
        assertEquals(Arrays.asList("title", "source_url"),
                ConstraintParsers.parseUnique("UNIQUE (title, source_url)").columns);
        assertEquals(Collections.singletonList("email"), ConstraintParsers.parseUnique("UNIQUE (email)").columns);
    }

    @Test
    void simpleIndex() {
        ConstraintParsers.SimpleIndex idx = ConstraintParsers.parseSimpleIndex(
                "CREATE INDEX customers_name_idx ON public.customers USING gin (name)");
        assertNotNull(idx);
        assertEquals("customers_name_idx", idx.indexName);
        assertEquals("customers", idx.tableName);
        assertEquals("name", idx.columnName);
        assertEquals(IndexType.GIN, idx.type);

        assertNull(ConstraintParsers.parseSimpleIndex(
                "CREATE INDEX multi_idx ON public.customers USING btree (a, b)"));
    }

    @Test
    void uniqueIndexColumns() {
        assertEquals(Arrays.asList("cognito_user_id", "email"), ConstraintParsers.parseUniqueIndexColumns(
                "CREATE UNIQUE INDEX customer_unique_idx ON public.customers USING btree (cognito_user_id, email)"));
        assertTrue(ConstraintParsers.parseUniqueIndexColumns("CREATE INDEX x ON public.t USING btree (a)").isEmpty());
    }
}
