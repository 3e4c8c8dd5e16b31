package com.ovsdb.modelgen.codegen.exception;

/**
 * A table name normalizes to a class name that another generated class
 * already uses.
 */
public class TableNameException extends ModelGenException {

    private static final long serialVersionUID = 1L;

    private final String tableName;
    private final String className;

    public TableNameException(String tableName, String className, String message) {
        super("Table " + tableName + ": class name " + className + " " + message);
        this.tableName = tableName;
        this.className = className;
    }

    public String getTableName() {
        return tableName;
    }

    public String getClassName() {
        return className;
    }
}
