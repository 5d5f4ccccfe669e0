package org.oldskooler.pgschema4j.scan;

/** How a result column is written into its record field. */
public enum DecodeStrategy {
    /** Convert the value to the field type; NULL clears the field. */
    DEFAULT,
    /** Like DEFAULT, except NULL leaves the field as it is. */
    NULLABLE,
    /** Run the stored value through the table's decrypt hook; only non-empty plain text is assigned. */
    PASSWORD,
    /** Read and discard. */
    NO_OP
}
