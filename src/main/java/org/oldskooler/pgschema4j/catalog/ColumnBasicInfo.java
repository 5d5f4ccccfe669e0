package org.oldskooler.pgschema4j.catalog;

import org.oldskooler.pgschema4j.mapping.Column;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.mapping.TableType;

/**
 * One column as listed by {@code information_schema.columns}, before constraints are
 * merged in.
 */
public final class ColumnBasicInfo {
    public final String tableName;
    public final String tableDescription;
    public final TableType tableType;
    public final String name;
    public final int ordinalPosition;
    public final String description;
    public final String defaultValue;
    public final DataType dataType;
    public final String dataTypeArgument;
    public final boolean nullable;
    public final boolean identity;
    public final boolean generated;

    public ColumnBasicInfo(String tableName, String tableDescription, TableType tableType, String name,
                           int ordinalPosition, String description, String defaultValue, DataType dataType,
                           String dataTypeArgument, boolean nullable, boolean identity, boolean generated) {
        this.tableName = tableName;
        this.tableDescription = tableDescription == null ? "" : tableDescription;
        this.tableType = tableType;
        this.name = name;
        this.ordinalPosition = ordinalPosition;
        this.description = description == null ? "" : description;
        this.defaultValue = defaultValue == null ? "" : defaultValue;
        this.dataType = dataType;
        this.dataTypeArgument = dataTypeArgument == null ? "" : dataTypeArgument;
        this.nullable = nullable;
        this.identity = identity;
        this.generated = generated;
    }

    /** Fills the basic attributes of {@code c}; constraints are applied separately. */
    public void buildColumn(Column c) {
        c.setTableName(tableName);
        c.setTableDescription(tableDescription);
        c.setTableType(tableType);
        c.setName(name);
        c.setOrdinalPosition(ordinalPosition);
        c.setDescription(description);
        c.setType(dataType);
        c.setTypeArgument(dataTypeArgument);
        c.setNullable(nullable);
        c.setIdentity(identity);
        c.setAutoGenerated(identity || generated);
        c.setDefaultValue(defaultValue);
    }
}
