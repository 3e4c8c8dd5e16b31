package com.ovsdb.modelgen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Schema of a table, keyed by column name. Column iteration order carries
 * no meaning.
 */
@Value
@Builder
public class TableSchema {

    @Singular
    Map<String, ColumnSchema> columns;
}
