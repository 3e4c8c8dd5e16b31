package com.ovsdb.modelgen.codegen.exception;

/**
 * A column name normalizes to an empty identifier or to one already taken
 * by another column of the same table.
 */
public class FieldNameException extends ModelGenException {

    private static final long serialVersionUID = 1L;

    private final String tableName;
    private final String columnName;

    public FieldNameException(String tableName, String columnName, String message) {
        super("Column " + tableName + "." + columnName + ": " + message);
        this.tableName = tableName;
        this.columnName = columnName;
    }

    public String getTableName() {
        return tableName;
    }

    public String getColumnName() {
        return columnName;
    }
}
