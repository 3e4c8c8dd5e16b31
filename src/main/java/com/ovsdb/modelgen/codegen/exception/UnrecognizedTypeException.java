package com.ovsdb.modelgen.codegen.exception;

/**
 * A column declares a wire type with no Java mapping.
 */
public class UnrecognizedTypeException extends ModelGenException {

    private static final long serialVersionUID = 1L;

    private final String tableName;
    private final String columnName;
    private final String typeToken;

    public UnrecognizedTypeException(String tableName, String columnName, String typeToken) {
        super("Unrecognized type '" + typeToken + "' for column " + tableName + "." + columnName);
        this.tableName = tableName;
        this.columnName = columnName;
        this.typeToken = typeToken;
    }

    public String getTableName() {
        return tableName;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getTypeToken() {
        return typeToken;
    }
}
