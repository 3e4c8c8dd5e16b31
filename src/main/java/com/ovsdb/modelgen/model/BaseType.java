package com.ovsdb.modelgen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Key or value element of a column type.
 */
@Value
@Builder(toBuilder = true)
public class BaseType {

    /**
     * Wire type name, e.g. "integer" or "uuid".
     */
    @NonNull
    String type;

    /**
     * Referenced table for "uuid" elements, null otherwise.
     */
    String refTable;

    /**
     * Allowed values when the element is enum-constrained.
     */
    @Singular
    List<String> enumValues;

    public static BaseType of(String type) {
        return BaseType.builder().type(type).build();
    }

    public static BaseType of(AtomicType type) {
        return of(type.getWireName());
    }

    public boolean isEnum() {
        return !enumValues.isEmpty();
    }
}
