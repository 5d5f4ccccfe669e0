package org.oldskooler.pgschema4j.query;

import org.junit.jupiter.api.Test;
import org.oldskooler.pgschema4j.SchemaOptions;
import org.oldskooler.pgschema4j.exceptions.QueryBuildException;
import org.oldskooler.pgschema4j.mapping.RecordDescriptor;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.mapping.TableBuilder;
import org.oldskooler.pgschema4j.models.Account;
import org.oldskooler.pgschema4j.models.Customer;

import java.util.Arrays;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UpdateQueryTest {
    private static final UUID ID = UUID.fromString("3f0d6c1e-2a4b-4c5d-8e9f-0a1b2c3d4e5f");

    private final Table customers = TableBuilder.build("customers", RecordDescriptor.of(Customer.class), new SchemaOptions());

    @Test
    void fullUpdateSkipsZeroValuesAndPrimaryKey() {
        Customer c = new Customer(ID, null, null, "sub", "", "Alice");

        SqlQuery q = UpdateQuery.build(customers, c);
        assertEquals("UPDATE \"public\".\"customers\" SET \"cognito_user_id\" = $1, \"name\" = $2 WHERE \"id\" = $3;", q.sql);
        assertEquals(Arrays.asList("sub", "Alice", ID), q.args);
    }

    @Test
    void namedColumnsAreSetEvenWhenZero() {
        Customer c = new Customer(ID, null, null, "sub", "", "Alice");

        SqlQuery q = UpdateQuery.build(customers, c, "EMAIL");
        assertEquals("UPDATE \"public\".\"customers\" SET \"email\" = $1 WHERE \"id\" = $2;", q.sql);
        assertEquals(Arrays.asList("", ID), q.args);
    }

    @Test
    void namedPrimaryKeyReusesPlaceholder() {
        Customer c = new Customer(ID, null, null, "sub", "", "Alice");

        SqlQuery q = UpdateQuery.build(customers, c, "name", "id");
        assertEquals("UPDATE \"public\".\"customers\" SET \"id\" = $1, \"name\" = $2 WHERE \"id\" = $1;", q.sql);
        assertEquals(Arrays.asList(ID, "Alice"), q.args);
    }

    @Test
    void passwordUpdateHashes() {
        Table accounts = TableBuilder.build("accounts", RecordDescriptor.of(Account.class), new SchemaOptions());

        SqlQuery q = UpdateQuery.build(accounts, new Account(7, "bob", "new", null), "password");
        assertEquals("UPDATE \"public\".\"accounts\" SET \"password\" = crypt($1, gen_salt('bf')) WHERE \"id\" = $2;", q.sql);
        assertEquals(Arrays.asList("new", 7), q.args);
    }

    @Test
    void errors() {
        Customer noId = new Customer(null, null, null, "sub", "", "Alice");
        QueryBuildException nullKey = assertThrows(QueryBuildException.class, () -> UpdateQuery.build(customers, noId));
        assertTrue(nullKey.getMessage().contains("primary key id is null"));

        Customer c = new Customer(ID, null, null, "sub", "", "Alice");
        QueryBuildException unknown = assertThrows(QueryBuildException.class, () -> UpdateQuery.build(customers, c, "nickname"));
        assertTrue(unknown.getMessage().contains("update: unknown column nickname"));

        Customer onlyId = new Customer(ID, null, null, null, null, null);
        assertThrows(QueryBuildException.class, () -> UpdateQuery.build(customers, onlyId));
    }
}
