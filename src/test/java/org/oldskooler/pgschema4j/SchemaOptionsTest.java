package org.oldskooler.pgschema4j;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SchemaOptionsTest {

    @Test
    void defaults() {
        SchemaOptions options = new SchemaOptions();
        assertEquals("public", options.getSearchPath());
        assertEquals("updated_at", options.getUpdatedAtColumnName());
        assertEquals("set_timestamp", options.getSetTimestampTriggerName());
        assertEquals("table_change_notifications", options.getNotifyChannel());
        assertEquals("table_change_notify", options.getNotifyFunction());
        assertEquals("user_id", options.getColumnNaming().apply("userId"));
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty("pgschema4j.search-path", "app");
        props.setProperty("pgschema4j.set-timestamp-trigger", "");
        props.setProperty("pgschema4j.notify-channel", "changes");

        SchemaOptions options = SchemaOptions.fromProperties(props);
        assertEquals("app", options.getSearchPath());
        assertEquals("", options.getSetTimestampTriggerName());
        assertEquals("changes", options.getNotifyChannel());
        assertEquals("updated_at", options.getUpdatedAtColumnName());
        assertEquals("table_change_notify", options.getNotifyFunction());
    }

    @Test
    void toBuilderKeepsSettings() {
        SchemaOptions options = SchemaOptions.builder().searchPath("app").notifyFunction("fn").build();
        SchemaOptions copy = options.toBuilder().notifyChannel("ch").build();
        assertEquals("app", copy.getSearchPath());
        assertEquals("fn", copy.getNotifyFunction());
        assertEquals("ch", copy.getNotifyChannel());
    }
}
