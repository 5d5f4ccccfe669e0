package org.oldskooler.pgschema4j.catalog;

import java.util.Collections;
import java.util.List;

/** A unique index that no constraint owns, e.g. created with {@code CREATE UNIQUE INDEX}. */
public final class UniqueIndex {
    public final String tableName;
    public final String indexName;
    public final List<String> columns;

    public UniqueIndex(String tableName, String indexName, List<String> columns) {
        this.tableName = tableName;
        this.indexName = indexName;
        this.columns = Collections.unmodifiableList(columns);
    }

    @Override
    public String toString() {
        return tableName + "." + indexName + columns;
    }
}
