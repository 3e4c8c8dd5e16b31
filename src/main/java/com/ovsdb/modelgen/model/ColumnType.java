package com.ovsdb.modelgen.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Type of a column: either a bare atomic type name or a complex
 * key/value/min/max descriptor.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ColumnType {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    /**
     * Wire name of an atomic column, null for complex columns.
     */
    String atomic;

    BaseType key;

    /**
     * Present only for map columns.
     */
    BaseType value;

    int min;

    int max;

    public static ColumnType atomic(String wireName) {
        return new ColumnType(wireName, null, null, 1, 1);
    }

    public static ColumnType atomic(AtomicType type) {
        return atomic(type.getWireName());
    }

    public static ColumnType complex(BaseType key, BaseType value, int min, int max) {
        if (key == null) {
            throw new IllegalArgumentException("Complex column type requires a key type");
        }
        if (min < 0 || max < 1 || min > max) {
            throw new IllegalArgumentException("Invalid bounds min=" + min + ", max=" + max);
        }
        return new ColumnType(null, key, value, min, max);
    }

    public static ColumnType optional(BaseType key) {
        return complex(key, null, 0, 1);
    }

    public static ColumnType set(BaseType key, int min, int max) {
        return complex(key, null, min, max);
    }

    public static ColumnType map(BaseType key, BaseType value, int min, int max) {
        if (value == null) {
            throw new IllegalArgumentException("Map column type requires a value type");
        }
        return complex(key, value, min, max);
    }

    public boolean isAtomic() {
        return atomic != null;
    }

    public boolean isMap() {
        return !isAtomic() && value != null;
    }

    public boolean isOptional() {
        return !isAtomic() && value == null && min == 0 && max == 1;
    }

    public boolean isSet() {
        return !isAtomic() && value == null && max > 1;
    }

    /**
     * A complex type holding exactly one key, e.g. an enum-constrained string.
     */
    public boolean isScalar() {
        return !isAtomic() && value == null && min == 1 && max == 1;
    }

    /**
     * Type name used in error messages.
     */
    public String describe() {
        if (isAtomic()) {
            return atomic;
        }
        String bound = max == UNLIMITED ? "unlimited" : String.valueOf(max);
        if (isMap()) {
            return "map<" + key.getType() + ", " + value.getType() + ">[" + min + ".." + bound + "]";
        }
        return key.getType() + "[" + min + ".." + bound + "]";
    }
}
