package com.ovsdb.modelgen.model;

import java.util.Optional;

/**
 * OVSDB atomic column types as they appear on the wire.
 */
public enum AtomicType {
    /**
     * 64-bit signed integer.
     */
    INTEGER("integer"),

    /**
     * IEEE-754 double precision floating point.
     */
    REAL("real"),

    BOOLEAN("boolean"),

    STRING("string"),

    /**
     * Row identifier, optionally a reference into another table.
     */
    UUID("uuid");

    private final String wireName;

    AtomicType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<AtomicType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (AtomicType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
