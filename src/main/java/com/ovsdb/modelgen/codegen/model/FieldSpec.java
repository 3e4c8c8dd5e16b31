package com.ovsdb.modelgen.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single field of a generated model class, as exposed to templates.
 *
 * Pure structure only (no validation / mapping logic).
 */
@Value
@Builder(toBuilder = true)
public class FieldSpec {

    /**
     * Name of the identity column every OVSDB row carries.
     */
    public static final String IDENTITY_COLUMN = "_uuid";

    /**
     * Field name of the identity column.
     */
    public static final String IDENTITY_FIELD = "UUID";

    /**
     * Exported Java field name, e.g. "ExternalIDs".
     */
    @NonNull
    String name;

    /**
     * Java type expression, e.g. "Map<String, String>".
     */
    @NonNull
    String type;

    /**
     * Original column name, reproduced verbatim in the column annotation.
     */
    @NonNull
    String tag;

    public static FieldSpec identity() {
        return FieldSpec.builder()
                .name(IDENTITY_FIELD)
                .type("String")
                .tag(IDENTITY_COLUMN)
                .build();
    }
}
