package org.oldskooler.pgschema4j.query;

/**
 * Options of a single INSERT statement.
 */
public class InsertOptions {
    private final boolean returningId;
    private final String onConflict;
    private final boolean upsert;
    private final boolean full;

    private InsertOptions(Builder b) {
        this.returningId = b.returningId;
        this.onConflict = b.onConflict;
        this.upsert = b.upsert;
        this.full = b.full;
    }

    /** A plain insert of the non-zero fields. */
    public static InsertOptions defaults() {
        return builder().build();
    }

    /**
     * Whether to append {@code RETURNING "pk"}. Ignored when the conflict action is
     * {@code DO NOTHING}, which returns no row for skipped inserts.
     */
    public boolean isReturningId() {
        return returningId;
    }

    /**
     * Gets the forced conflict target: a unique index group name or a unique column name.
     *
     * @return the target, empty when not forced
     */
    public String getOnConflict() {
        return onConflict;
    }

    /**
     * Whether to update the existing row when a unique column or unique index group
     * conflicts.
     */
    public boolean isUpsert() {
        return upsert;
    }

    /**
     * Whether to insert zero values too. Generated, auto generated and defaulted columns
     * holding zero values are still left to the database.
     */
    public boolean isFull() {
        return full;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for InsertOptions.
     */
    public static class Builder {
        private boolean returningId;
        private String onConflict = "";
        private boolean upsert;
        private boolean full;

        public Builder returningId(boolean returningId) {
            this.returningId = returningId;
            return this;
        }

        public Builder onConflict(String onConflict) {
            this.onConflict = onConflict == null ? "" : onConflict;
            return this;
        }

        public Builder upsert(boolean upsert) {
            this.upsert = upsert;
            return this;
        }

        public Builder full(boolean full) {
            this.full = full;
            return this;
        }

        public InsertOptions build() {
            return new InsertOptions(this);
        }
    }
}
