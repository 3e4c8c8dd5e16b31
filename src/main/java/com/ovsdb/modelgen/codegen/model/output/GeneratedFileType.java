package com.ovsdb.modelgen.codegen.model.output;

/**
 * Kinds of generated source files.
 */
public enum GeneratedFileType {
    /**
     * Model class of a single table.
     */
    TABLE_MODEL,

    /**
     * Index of every model class of a database.
     */
    DATABASE_MODEL
}
