package com.ovsdb.modelgen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Parsed OVSDB database schema. Supplied by the caller and never modified
 * by the generators.
 */
@Value
@Builder(toBuilder = true)
public class DatabaseSchema {

    @NonNull
    String name;

    String version;

    @Singular
    Map<String, TableSchema> tables;

    public Optional<TableSchema> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }
}
