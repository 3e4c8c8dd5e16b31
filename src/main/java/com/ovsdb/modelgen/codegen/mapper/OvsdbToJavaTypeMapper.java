package com.ovsdb.modelgen.codegen.mapper;

import com.ovsdb.modelgen.codegen.exception.UnrecognizedTypeException;
import com.ovsdb.modelgen.codegen.model.JavaType;
import com.ovsdb.modelgen.model.AtomicType;
import com.ovsdb.modelgen.model.ColumnSchema;
import com.ovsdb.modelgen.model.ColumnType;

import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Maps OVSDB column types to Java types.
 *
 * <pre>
 *   integer -> long
 *   real    -> double
 *   boolean -> boolean
 *   string  -> String
 *   uuid    -> String   (opaque row handle)
 * </pre>
 *
 * Optional columns become {@code Optional<T>}, sets {@code Set<T>} and maps
 * {@code Map<K, V>}, with primitives boxed.
 */
@UtilityClass
public class OvsdbToJavaTypeMapper {

    private final String OPTIONAL = "java.util.Optional";
    private final String SET = "java.util.Set";
    private final String MAP = "java.util.Map";

    /**
     * Java type name for an atomic wire type, or "" if the name is unknown.
     */
    public String atomicType(String wireTypeName) {
        return atomicJavaType(wireTypeName)
                .map(JavaType::toSource)
                .orElse("");
    }

    /**
     * Java type expression for a column.
     *
     * @throws UnrecognizedTypeException if any element type has no mapping
     */
    public String fieldType(String tableName, String columnName, ColumnSchema column) {
        return javaType(tableName, columnName, column).toSource();
    }

    /**
     * Structured Java type for a column.
     *
     * @throws UnrecognizedTypeException if any element type has no mapping
     */
    public JavaType javaType(String tableName, String columnName, ColumnSchema column) {
        ColumnType type = column.getType();
        if (type.isAtomic()) {
            return require(tableName, columnName, type.getAtomic());
        }

        JavaType key = require(tableName, columnName, type.getKey().getType());
        if (type.isMap()) {
            JavaType value = require(tableName, columnName, type.getValue().getType());
            return JavaType.generic(MAP, key, value);
        }
        if (type.isOptional()) {
            return JavaType.generic(OPTIONAL, key);
        }
        if (type.isSet()) {
            return JavaType.generic(SET, key);
        }
        if (type.isScalar()) {
            return key;
        }
        // ColumnType rejects every other bound combination
        throw new UnrecognizedTypeException(tableName, columnName, type.describe());
    }

    private JavaType require(String tableName, String columnName, String wireTypeName) {
        return atomicJavaType(wireTypeName)
                .orElseThrow(() -> new UnrecognizedTypeException(tableName, columnName, wireTypeName));
    }

    private Optional<JavaType> atomicJavaType(String wireTypeName) {
        return AtomicType.fromWireName(wireTypeName).map(atomic -> switch (atomic) {
            case INTEGER -> JavaType.primitive("long", "Long");
            case REAL -> JavaType.primitive("double", "Double");
            case BOOLEAN -> JavaType.primitive("boolean", "Boolean");
            case STRING, UUID -> JavaType.reference("String");
        });
    }
}
