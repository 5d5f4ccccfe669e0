package org.oldskooler.pgschema4j.mapping;

import org.oldskooler.pgschema4j.constraint.ForeignKeyConstraint;

import java.util.*;
import java.util.function.Predicate;

/**
 * A table, view or presenter and its ordered columns. Built once at registration or
 * introspection; the column list changes only through explicit filtering.
 */
public class Table {
    private int registeredPosition;
    private TableType type = TableType.BASE;
    private RecordDescriptor<?> descriptor;
    private String searchPath = "public";
    private String name = "";
    private String description = "";
    private boolean strict;
    private PasswordHandler passwordHandler;
    private final List<Column> columns = new ArrayList<>();

    public Table() {
    }

    public Table(String searchPath, String name) {
        this.searchPath = Objects.requireNonNull(searchPath, "searchPath");
        this.name = Objects.requireNonNull(name, "name");
    }

    public boolean isReadOnly() {
        return type.isReadOnly();
    }

    /** Appends the columns and points them back to this table. */
    public void addColumns(Column... cols) {
        for (Column c : cols) {
            c.setTable(this);
            columns.add(c);
        }
    }

    public void addColumns(Collection<Column> cols) {
        addColumns(cols.toArray(new Column[0]));
    }

    public void removeColumns(String... names) {
        Set<String> drop = new HashSet<>();
        for (String n : names) drop.add(n.toLowerCase(Locale.ROOT));
        columns.removeIf(c -> drop.contains(c.getName().toLowerCase(Locale.ROOT)));
    }

    /** Keeps only the columns accepted by {@code filter}. */
    public void filterColumns(Predicate<Column> filter) {
        columns.removeIf(filter.negate());
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<Column> listColumnsWithoutPresenter() {
        List<Column> out = new ArrayList<>(columns.size());
        for (Column c : columns) {
            if (!c.isPresenter()) out.add(c);
        }
        return out;
    }

    public List<String> listColumnNames() {
        return listColumnNamesExcept();
    }

    public List<String> listColumnNamesExcept(String... except) {
        Set<String> skip = new HashSet<>(Arrays.asList(except));
        List<String> out = new ArrayList<>(columns.size());
        for (Column c : columns) {
            if (!skip.contains(c.getName())) out.add(c.getName());
        }
        return out;
    }

    /** Case-insensitive lookup, null when absent. */
    public Column getColumnByName(String columnName) {
        for (Column c : columns) {
            if (c.getName().equalsIgnoreCase(columnName)) return c;
        }
        return null;
    }

    public boolean columnExists(String columnName) {
        return getColumnByName(columnName) != null;
    }

    public Optional<Column> primaryKey() {
        for (Column c : columns) {
            if (c.isPrimaryKey()) return Optional.of(c);
        }
        return Optional.empty();
    }

    public Optional<Column> usernameColumn() {
        for (Column c : columns) {
            if (c.isUsername()) return Optional.of(c);
        }
        return Optional.empty();
    }

    public Optional<Column> passwordColumn() {
        for (Column c : columns) {
            if (c.isPassword()) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** The first declared {@code conflict} action of the table. */
    public Optional<String> onConflict() {
        for (Column c : columns) {
            if (!c.getConflict().isEmpty()) return Optional.of(c.getConflict());
        }
        return Optional.empty();
    }

    /** Unique index groups in declaration order, each with its columns in declaration order. */
    public Map<String, List<String>> uniqueIndexes() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Column c : columns) {
            if (c.getUniqueIndex().isEmpty()) continue;
            out.computeIfAbsent(c.getUniqueIndex(), k -> new ArrayList<>()).add(c.getName());
        }
        return out;
    }

    public List<Index> indexes() {
        List<Index> out = new ArrayList<>();
        for (Column c : columns) {
            if (c.getIndex() == IndexType.NONE) continue;

            String indexName;
            if (c.isReference()) {
                indexName = name + "_" + c.getName() + "_fkey";
            } else if (c.isPrimaryKey()) {
                indexName = name + "_pkey";
            } else {
                indexName = name + "_" + c.getName() + "_idx";
            }
            out.add(new Index(indexName, name, c.getName(), c.getIndex()));
        }
        return out;
    }

    public List<ForeignKeyConstraint> foreignKeys() {
        List<ForeignKeyConstraint> out = new ArrayList<>();
        for (Column c : columns) {
            if (!c.isReference()) continue;
            out.add(new ForeignKeyConstraint(c.getName(), c.getReferenceTableName(), c.getReferenceColumnName(),
                    c.getReferenceOnDelete(), "", c.isDeferrableReference()));
        }
        return out;
    }

    public List<String> foreignKeyColumnNames() {
        List<String> out = new ArrayList<>();
        for (Column c : columns) {
            if (c.isReference()) out.add(c.getName());
        }
        return out;
    }

    /** Marks the table strict: result columns without a destination fail scanning. */
    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    public int getRegisteredPosition() {
        return registeredPosition;
    }

    public void setRegisteredPosition(int registeredPosition) {
        this.registeredPosition = registeredPosition;
    }

    public TableType getType() {
        return type;
    }

    public void setType(TableType type) {
        this.type = type == null ? TableType.BASE : type;
        for (Column c : columns) c.setTableType(this.type);
    }

    /** @return the record type descriptor, or null for introspected tables */
    public RecordDescriptor<?> getDescriptor() {
        return descriptor;
    }

    public void setDescriptor(RecordDescriptor<?> descriptor) {
        this.descriptor = descriptor;
    }

    public String getSearchPath() {
        return searchPath;
    }

    public void setSearchPath(String searchPath) {
        this.searchPath = searchPath;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
        for (Column c : columns) c.setTableDescription(this.description);
    }

    public PasswordHandler getPasswordHandler() {
        return passwordHandler;
    }

    public void setPasswordHandler(PasswordHandler passwordHandler) {
        this.passwordHandler = passwordHandler;
    }

    @Override
    public String toString() {
        return searchPath + "." + name;
    }

    /** A non-unique index declared through a column's {@code index} option. */
    public static final class Index {
        public final String name;
        public final String tableName;
        public final String columnName;
        public final IndexType type;

        public Index(String name, String tableName, String columnName, IndexType type) {
            this.name = name;
            this.tableName = tableName;
            this.columnName = columnName;
            this.type = type;
        }
    }
}
