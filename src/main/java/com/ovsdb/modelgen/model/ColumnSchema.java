package com.ovsdb.modelgen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Schema of a single column.
 */
@Value
@Builder
public class ColumnSchema {

    @NonNull
    ColumnType type;

    public static ColumnSchema of(ColumnType type) {
        return ColumnSchema.builder().type(type).build();
    }

    public static ColumnSchema of(AtomicType type) {
        return of(ColumnType.atomic(type));
    }
}
