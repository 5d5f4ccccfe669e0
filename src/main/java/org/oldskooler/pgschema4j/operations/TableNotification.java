package org.oldskooler.pgschema4j.operations;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Payload sent on the notify channel by the table change trigger function:
 * {@code {"table": ..., "change": "INSERT", "old": {...}, "new": {...}}}.
 * Row objects are keyed by column name.
 */
public class TableNotification {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final Gson ROW_GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    public enum Change {
        INSERT,
        UPDATE,
        DELETE
    }

    private String table;
    private Change change;
    private JsonElement old;
    @SerializedName("new")
    private JsonElement newValue;

    /**
     * Parses a notification payload.
     *
     * @throws IllegalArgumentException if the payload is not a notification object
     */
    public static TableNotification parse(String payload) {
        TableNotification n;
        try {
            n = GSON.fromJson(payload, TableNotification.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid table notification: " + payload, e);
        }
        if (n == null || n.table == null || n.change == null) {
            throw new IllegalArgumentException("invalid table notification: " + payload);
        }
        return n;
    }

    public String getTable() {
        return table;
    }

    public Change getChange() {
        return change;
    }

    /** @return the row before the change, JSON null on INSERT */
    public JsonElement getOld() {
        return old;
    }

    /** @return the row after the change, JSON null on DELETE */
    public JsonElement getNew() {
        return newValue;
    }

    /**
     * Decodes the new row into a record whose snake case column names derive from its
     * field names. Returns null when there is no new row.
     */
    public <T> T decodeNew(Class<T> type) {
        return decode(newValue, type);
    }

    public <T> T decodeOld(Class<T> type) {
        return decode(old, type);
    }

    private static <T> T decode(JsonElement row, Class<T> type) {
        if (row == null || row.isJsonNull()) return null;
        return ROW_GSON.fromJson(row, type);
    }

    @Override
    public String toString() {
        return change + " " + table;
    }
}
