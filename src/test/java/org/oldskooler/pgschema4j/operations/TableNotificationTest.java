package org.oldskooler.pgschema4j.operations;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNotificationTest {

    @Data
    @NoArgsConstructor
    public static class CustomerRow {
        private String id;
        private String cognitoUserId;
        private String email;
    }

    @Test
    void parsesInsert() {
        TableNotification n = TableNotification.parse("{\"table\":\"customers\",\"change\":\"INSERT\",\"old\":null,"
                + "\"new\":{\"id\":\"c1\",\"cognito_user_id\":\"sub\",\"email\":\"a@b.c\"}}");

        assertEquals("customers", n.getTable());
        assertEquals(TableNotification.Change.INSERT, n.getChange());
        assertNull(n.decodeOld(CustomerRow.class));

        CustomerRow row = n.decodeNew(CustomerRow.class);
        assertEquals("c1", row.getId());
        assertEquals("sub", row.getCognitoUserId());
        assertEquals("a@b.c", row.getEmail());
    }

    @Test
    void parsesDelete() {
        TableNotification n = TableNotification.parse("{\"table\":\"customers\",\"change\":\"DELETE\","
                + "\"old\":{\"id\":\"c1\"},\"new\":null}");

        assertEquals(TableNotification.Change.DELETE, n.getChange());
        assertEquals("c1", n.decodeOld(CustomerRow.class).getId());
        assertNull(n.decodeNew(CustomerRow.class));
    }

    @Test
    void rejectsOtherPayloads() {
        assertThrows(IllegalArgumentException.class, () -> TableNotification.parse("{\"foo\":1}"));
        assertThrows(IllegalArgumentException.class, () -> TableNotification.parse("not json {"));
    }
}
