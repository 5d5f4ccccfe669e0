package org.oldskooler.pgschema4j.mapping;

import java.util.Locale;

/**
 * One field to column binding. Columns built from annotations reference their
 * {@link FieldDescriptor}; columns built from the catalog carry the table name,
 * description and type instead.
 */
public class Column {
    public static final String GEN_RANDOM_UUID = "gen_random_uuid()";
    public static final String UUID_GENERATE_V4 = "uuid_generate_v4()";

    private Table table;
    private String tableName = "";
    private String tableDescription = "";
    private TableType tableType = TableType.BASE;

    private String name = "";
    private DataType type = DataType.INVALID;
    private String typeArgument = "";
    private String description = "";
    private int ordinalPosition;
    private FieldDescriptor field;

    private boolean primaryKey;
    private boolean identity;
    private String defaultValue = "";
    private String checkConstraint = "";
    private boolean unique;
    private String uniqueIndex = "";
    private String conflict = "";
    private boolean username;
    private boolean password;
    private boolean nullable;

    private String referenceTableName = "";
    private String referenceColumnName = "";
    private String referenceOnDelete = "";
    private boolean deferrableReference;

    private IndexType index = IndexType.NONE;
    private boolean presenter;
    private boolean autoGenerated;
    private boolean unscannable;
    private boolean scanner;

    public boolean isGeneratedTimestamp() {
        if (!type.isTime()) return false;
        String d = defaultValue.toLowerCase(Locale.ROOT);
        return d.equals("clock_timestamp()") || d.equals("now()");
    }

    public boolean isGeneratedPrimaryUUID() {
        return primaryKey && !nullable && type == DataType.UUID
                && (GEN_RANDOM_UUID.equals(defaultValue) || UUID_GENERATE_V4.equals(defaultValue));
    }

    public boolean isGenerated() {
        return isGeneratedPrimaryUUID() || isGeneratedTimestamp();
    }

    public boolean isReference() {
        return !referenceTableName.isEmpty() && !referenceColumnName.isEmpty();
    }

    private boolean isReadOnlyTable() {
        return (table != null && table.getType().isReadOnly()) || tableType.isReadOnly();
    }

    /**
     * Renders the column back into annotation form. The non-strict form drops the type
     * argument, credential and scanning flags and cast suffixes on defaults, which is
     * what the catalog can be compared on. Columns of read-only tables render name and
     * type only.
     */
    public String tagString(boolean strict) {
        StringBuilder b = new StringBuilder();
        b.append("name=").append(name);
        if (type.isValid()) b.append(",type=").append(type);
        if (isReadOnlyTable()) {
            return b.toString();
        }

        if (strict && !typeArgument.isEmpty()) b.append('(').append(typeArgument).append(')');
        if (primaryKey) b.append(",primary");
        if (identity) b.append(",identity");

        if (nullable) {
            b.append(",nullable");
        } else {
            String d = defaultValue;
            if (!strict) {
                // '{}'::integer[] and ''::character varying compare as '{}' and ''.
                for (String alias : type.aliases()) {
                    String suffix = "::" + alias;
                    if (d.endsWith(suffix)) d = d.substring(0, d.length() - suffix.length());
                }
            }
            if (!d.isEmpty()) b.append(",default=").append(d);
        }

        if (unique) b.append(",unique");
        if (!conflict.isEmpty()) b.append(",conflict=").append(conflict);
        if (strict) {
            if (username) b.append(",username");
            if (password) b.append(",password");
        }

        if (!referenceTableName.isEmpty()) {
            b.append(",ref=").append(referenceTableName);
            if (!referenceColumnName.isEmpty()) {
                b.append('(').append(referenceColumnName);
                if (!referenceOnDelete.isEmpty()) b.append(' ').append(referenceOnDelete);
                if (deferrableReference) b.append(" deferrable");
                b.append(')');
            }
        }

        if (index != IndexType.NONE) b.append(",index=").append(index);
        if (!uniqueIndex.isEmpty()) b.append(",unique_index=").append(uniqueIndex);
        if (!checkConstraint.isEmpty()) b.append(",check=").append(checkConstraint);
        if (strict) {
            if (autoGenerated) b.append(",auto");
            if (presenter) b.append(",presenter");
            if (unscannable) b.append(",unscannable");
        }
        return b.toString();
    }

    @Override
    public String toString() {
        return tagString(true);
    }

    public Table getTable() {
        return table;
    }

    /** Also copies the table's name, description and type. */
    public void setTable(Table table) {
        this.table = table;
        if (table != null) {
            this.tableName = table.getName();
            this.tableDescription = table.getDescription();
            this.tableType = table.getType();
        }
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = nn(tableName);
    }

    public String getTableDescription() {
        return tableDescription;
    }

    public void setTableDescription(String tableDescription) {
        this.tableDescription = nn(tableDescription);
    }

    public TableType getTableType() {
        return tableType;
    }

    public void setTableType(TableType tableType) {
        this.tableType = tableType == null ? TableType.BASE : tableType;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = nn(name);
    }

    public DataType getType() {
        return type;
    }

    public void setType(DataType type) {
        this.type = type == null ? DataType.INVALID : type;
    }

    public String getTypeArgument() {
        return typeArgument;
    }

    public void setTypeArgument(String typeArgument) {
        this.typeArgument = nn(typeArgument);
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = nn(description);
    }

    public int getOrdinalPosition() {
        return ordinalPosition;
    }

    public void setOrdinalPosition(int ordinalPosition) {
        this.ordinalPosition = ordinalPosition;
    }

    /** @return the bound record field, or null for catalog columns */
    public FieldDescriptor getField() {
        return field;
    }

    public void setField(FieldDescriptor field) {
        this.field = field;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public void setPrimaryKey(boolean primaryKey) {
        this.primaryKey = primaryKey;
    }

    public boolean isIdentity() {
        return identity;
    }

    public void setIdentity(boolean identity) {
        this.identity = identity;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = nn(defaultValue);
    }

    public String getCheckConstraint() {
        return checkConstraint;
    }

    public void setCheckConstraint(String checkConstraint) {
        this.checkConstraint = nn(checkConstraint);
    }

    public boolean isUnique() {
        return unique;
    }

    public void setUnique(boolean unique) {
        this.unique = unique;
    }

    public String getUniqueIndex() {
        return uniqueIndex;
    }

    public void setUniqueIndex(String uniqueIndex) {
        this.uniqueIndex = nn(uniqueIndex);
    }

    public String getConflict() {
        return conflict;
    }

    public void setConflict(String conflict) {
        this.conflict = nn(conflict);
    }

    public boolean isUsername() {
        return username;
    }

    public void setUsername(boolean username) {
        this.username = username;
    }

    public boolean isPassword() {
        return password;
    }

    public void setPassword(boolean password) {
        this.password = password;
    }

    public boolean isNullable() {
        return nullable;
    }

    public void setNullable(boolean nullable) {
        this.nullable = nullable;
    }

    public String getReferenceTableName() {
        return referenceTableName;
    }

    public void setReferenceTableName(String referenceTableName) {
        this.referenceTableName = nn(referenceTableName);
    }

    public String getReferenceColumnName() {
        return referenceColumnName;
    }

    public void setReferenceColumnName(String referenceColumnName) {
        this.referenceColumnName = nn(referenceColumnName);
    }

    public String getReferenceOnDelete() {
        return referenceOnDelete;
    }

    public void setReferenceOnDelete(String referenceOnDelete) {
        this.referenceOnDelete = nn(referenceOnDelete);
    }

    public boolean isDeferrableReference() {
        return deferrableReference;
    }

    public void setDeferrableReference(boolean deferrableReference) {
        this.deferrableReference = deferrableReference;
    }

    public IndexType getIndex() {
        return index;
    }

    public void setIndex(IndexType index) {
        this.index = index == null ? IndexType.NONE : index;
    }

    public boolean isPresenter() {
        return presenter;
    }

    public void setPresenter(boolean presenter) {
        this.presenter = presenter;
    }

    public boolean isAutoGenerated() {
        return autoGenerated;
    }

    public void setAutoGenerated(boolean autoGenerated) {
        this.autoGenerated = autoGenerated;
    }

    public boolean isUnscannable() {
        return unscannable;
    }

    public void setUnscannable(boolean unscannable) {
        this.unscannable = unscannable;
    }

    /** True when the bound field type decodes its own values, see {@code ValueScanner}. */
    public boolean isScanner() {
        return scanner;
    }

    public void setScanner(boolean scanner) {
        this.scanner = scanner;
    }

    private static String nn(String s) {
        return s == null ? "" : s;
    }
}
