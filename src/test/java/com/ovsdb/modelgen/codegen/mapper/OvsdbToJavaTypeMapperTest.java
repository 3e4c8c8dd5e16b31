package com.ovsdb.modelgen.codegen.mapper;

import com.ovsdb.modelgen.codegen.exception.UnrecognizedTypeException;
import com.ovsdb.modelgen.codegen.model.JavaType;
import com.ovsdb.modelgen.model.AtomicType;
import com.ovsdb.modelgen.model.BaseType;
import com.ovsdb.modelgen.model.ColumnSchema;
import com.ovsdb.modelgen.model.ColumnType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OvsdbToJavaTypeMapper.
 */
class OvsdbToJavaTypeMapperTest {

    @ParameterizedTest
    @CsvSource({
        "integer, long",
        "real, double",
        "boolean, boolean",
        "string, String",
        "uuid, String"
    })
    void testAtomicType(String wireType, String expected) {
        assertThat(OvsdbToJavaTypeMapper.atomicType(wireType)).isEqualTo(expected);
    }

    @Test
    void testUnknownAtomicTypeYieldsEmptySentinel() {
        assertThat(OvsdbToJavaTypeMapper.atomicType("notAType")).isEmpty();
        assertThat(OvsdbToJavaTypeMapper.atomicType(null)).isEmpty();
    }

    @Test
    void testAtomicColumn() {
        ColumnSchema column = ColumnSchema.of(AtomicType.REAL);

        assertThat(OvsdbToJavaTypeMapper.fieldType("t", "c", column)).isEqualTo("double");
    }

    @Test
    void testOptionalColumnIsBoxed() {
        ColumnSchema column = ColumnSchema.of(ColumnType.optional(BaseType.of(AtomicType.INTEGER)));

        assertThat(OvsdbToJavaTypeMapper.fieldType("t", "c", column)).isEqualTo("Optional<Long>");
    }

    @Test
    void testOptionalReferenceIsStringHandle() {
        BaseType ref = BaseType.builder().type("uuid").refTable("Bridge").build();
        ColumnSchema column = ColumnSchema.of(ColumnType.optional(ref));

        assertThat(OvsdbToJavaTypeMapper.fieldType("t", "c", column)).isEqualTo("Optional<String>");
    }

    @Test
    void testSetColumn() {
        ColumnSchema column = ColumnSchema.of(
                ColumnType.set(BaseType.of(AtomicType.STRING), 0, ColumnType.UNLIMITED));

        JavaType type = OvsdbToJavaTypeMapper.javaType("t", "c", column);

        assertThat(type.toSource()).isEqualTo("Set<String>");
        assertThat(type.getRequiredImports()).containsExactly("java.util.Set");
    }

    @Test
    void testMapColumn() {
        ColumnSchema column = ColumnSchema.of(ColumnType.map(
                BaseType.of(AtomicType.STRING), BaseType.of(AtomicType.BOOLEAN), 0, ColumnType.UNLIMITED));

        assertThat(OvsdbToJavaTypeMapper.fieldType("t", "c", column)).isEqualTo("Map<String, Boolean>");
    }

    @Test
    void testEnumScalarColumnUsesKeyType() {
        BaseType key = BaseType.builder()
                .type("string")
                .enumValue("active")
                .enumValue("backup")
                .build();
        ColumnSchema column = ColumnSchema.of(ColumnType.complex(key, null, 1, 1));

        assertThat(key.isEnum()).isTrue();
        assertThat(OvsdbToJavaTypeMapper.fieldType("t", "c", column)).isEqualTo("String");
    }

    @Test
    void testUnknownAtomicColumnIsAnError() {
        ColumnSchema column = ColumnSchema.of(ColumnType.atomic("notAType"));

        assertThatThrownBy(() -> OvsdbToJavaTypeMapper.fieldType("Bridge", "weird", column))
                .isInstanceOfSatisfying(UnrecognizedTypeException.class, e -> {
                    assertThat(e.getTableName()).isEqualTo("Bridge");
                    assertThat(e.getColumnName()).isEqualTo("weird");
                    assertThat(e.getTypeToken()).isEqualTo("notAType");
                })
                .hasMessageContaining("Bridge.weird");
    }

    @Test
    void testUnknownMapValueIsAnError() {
        ColumnSchema column = ColumnSchema.of(ColumnType.map(
                BaseType.of(AtomicType.STRING), BaseType.of("decimal"), 0, ColumnType.UNLIMITED));

        assertThatThrownBy(() -> OvsdbToJavaTypeMapper.fieldType("Bridge", "options", column))
                .isInstanceOf(UnrecognizedTypeException.class)
                .hasMessageContaining("decimal");
    }
}
