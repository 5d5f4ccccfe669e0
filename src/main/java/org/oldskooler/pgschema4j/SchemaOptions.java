package org.oldskooler.pgschema4j;

import org.oldskooler.pgschema4j.util.Names;

import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Settings shared by table building, SQL generation and catalog introspection.
 * Immutable; pass the same instance to every component of one database.
 */
public class SchemaOptions {
    public static final String PREFIX = "pgschema4j.";

    private final String searchPath;
    private final Function<String, String> columnNaming;
    private final String updatedAtColumnName;
    private final String setTimestampTriggerName;
    private final String notifyChannel;
    private final String notifyFunction;

    /**
     * Creates options with default settings:
     * search path "public", snake case column names, "updated_at" maintained by the
     * "set_timestamp" trigger.
     */
    public SchemaOptions() {
        this(builder());
    }

    private SchemaOptions(Builder b) {
        this.searchPath = b.searchPath;
        this.columnNaming = b.columnNaming;
        this.updatedAtColumnName = b.updatedAtColumnName;
        this.setTimestampTriggerName = b.setTimestampTriggerName;
        this.notifyChannel = b.notifyChannel;
        this.notifyFunction = b.notifyFunction;
    }

    /**
     * Reads {@code pgschema4j.*} keys, falling back to the defaults for missing ones.
     *
     * @param props e.g. loaded from an application properties file
     * @return the options
     */
    public static SchemaOptions fromProperties(Properties props) {
        Builder b = builder();
        b.searchPath(props.getProperty(PREFIX + "search-path", b.searchPath));
        b.updatedAtColumnName(props.getProperty(PREFIX + "updated-at-column", b.updatedAtColumnName));
        b.setTimestampTriggerName(props.getProperty(PREFIX + "set-timestamp-trigger", b.setTimestampTriggerName));
        b.notifyChannel(props.getProperty(PREFIX + "notify-channel", b.notifyChannel));
        b.notifyFunction(props.getProperty(PREFIX + "notify-function", b.notifyFunction));
        return b.build();
    }

    /**
     * Gets the schema (namespace) tables are created in and read from.
     *
     * @return the search path
     */
    public String getSearchPath() {
        return searchPath;
    }

    /**
     * Gets the function turning a field name into a default column name.
     *
     * @return the naming function
     */
    public Function<String, String> getColumnNaming() {
        return columnNaming;
    }

    /**
     * Gets the column kept current by the timestamp trigger, empty to disable.
     *
     * @return the column name
     */
    public String getUpdatedAtColumnName() {
        return updatedAtColumnName;
    }

    /**
     * Gets the name of the timestamp trigger, empty to disable.
     *
     * @return the trigger name
     */
    public String getSetTimestampTriggerName() {
        return setTimestampTriggerName;
    }

    public String getNotifyChannel() {
        return notifyChannel;
    }

    public String getNotifyFunction() {
        return notifyFunction;
    }

    public Builder toBuilder() {
        return new Builder()
                .searchPath(searchPath)
                .columnNaming(columnNaming)
                .updatedAtColumnName(updatedAtColumnName)
                .setTimestampTriggerName(setTimestampTriggerName)
                .notifyChannel(notifyChannel)
                .notifyFunction(notifyFunction);
    }

    /**
     * Creates a builder for constructing SchemaOptions.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SchemaOptions.
     */
    public static class Builder {
        private String searchPath = "public";
        private Function<String, String> columnNaming = Names::snakeCase;
        private String updatedAtColumnName = "updated_at";
        private String setTimestampTriggerName = "set_timestamp";
        private String notifyChannel = "table_change_notifications";
        private String notifyFunction = "table_change_notify";

        public Builder searchPath(String searchPath) {
            this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
            return this;
        }

        public Builder columnNaming(Function<String, String> columnNaming) {
            this.columnNaming = Objects.requireNonNull(columnNaming, "columnNaming");
            return this;
        }

        public Builder updatedAtColumnName(String updatedAtColumnName) {
            this.updatedAtColumnName = updatedAtColumnName == null ? "" : updatedAtColumnName;
            return this;
        }

        public Builder setTimestampTriggerName(String setTimestampTriggerName) {
            this.setTimestampTriggerName = setTimestampTriggerName == null ? "" : setTimestampTriggerName;
            return this;
        }

        public Builder notifyChannel(String notifyChannel) {
            this.notifyChannel = Objects.requireNonNull(notifyChannel, "notifyChannel");
            return this;
        }

        public Builder notifyFunction(String notifyFunction) {
            this.notifyFunction = Objects.requireNonNull(notifyFunction, "notifyFunction");
            return this;
        }

        /**
         * Builds the SchemaOptions.
         *
         * @return a new SchemaOptions instance
         */
        public SchemaOptions build() {
            return new SchemaOptions(this);
        }
    }
}
