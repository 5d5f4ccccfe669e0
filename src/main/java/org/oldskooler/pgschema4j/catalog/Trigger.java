package org.oldskooler.pgschema4j.catalog;

/** One row of {@code information_schema.triggers}. */
public final class Trigger {
    public final String catalog;
    public final String searchPath;
    public final String name;
    /** INSERT, UPDATE or DELETE */
    public final String manipulation;
    public final String tableName;
    public final String actionStatement;
    /** ROW or STATEMENT */
    public final String actionOrientation;
    /** BEFORE or AFTER */
    public final String actionTiming;

    public Trigger(String catalog, String searchPath, String name, String manipulation, String tableName,
                   String actionStatement, String actionOrientation, String actionTiming) {
        this.catalog = catalog;
        this.searchPath = searchPath;
        this.name = name;
        this.manipulation = manipulation;
        this.tableName = tableName;
        this.actionStatement = actionStatement;
        this.actionOrientation = actionOrientation;
        this.actionTiming = actionTiming;
    }

    @Override
    public String toString() {
        return name + " " + actionTiming + " " + manipulation + " ON " + tableName;
    }
}
