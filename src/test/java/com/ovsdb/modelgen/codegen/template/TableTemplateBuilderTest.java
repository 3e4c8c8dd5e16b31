package com.ovsdb.modelgen.codegen.template;

import com.ovsdb.modelgen.SchemaFixtures;
import com.ovsdb.modelgen.codegen.GeneratorConfig;
import com.ovsdb.modelgen.codegen.exception.FieldNameException;
import com.ovsdb.modelgen.codegen.exception.UnrecognizedTypeException;
import com.ovsdb.modelgen.codegen.model.FieldSpec;
import com.ovsdb.modelgen.codegen.util.NameNormalizer;
import com.ovsdb.modelgen.model.AtomicType;
import com.ovsdb.modelgen.model.ColumnSchema;
import com.ovsdb.modelgen.model.ColumnType;
import com.ovsdb.modelgen.model.TableSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TableTemplateBuilder.
 */
class TableTemplateBuilderTest {

    private final TableTemplateBuilder builder = new TableTemplateBuilder(
            new TemplateEngine(), NameNormalizer.withDefaultAcronyms(), GeneratorConfig.defaults());

    @Test
    void testBaseContextKeys() {
        TemplateBinding binding = builder.build("test", "atomicTable", SchemaFixtures.atomicTable());
        TemplateContext context = binding.getContext();

        assertThat(context.getPackageName()).isEqualTo("test");
        assertThat(context.getTableName()).isEqualTo("atomicTable");
        assertThat(context.getStructName()).isEqualTo("AtomicTable");
        assertThat(context.get(TemplateContext.COLUMN_ANNOTATION)).isEqualTo("Column");
        assertThat(context.get(TemplateContext.IMPORTS)).asList()
                .containsExactly(GeneratorConfig.DEFAULT_COLUMN_ANNOTATION);
        assertThat(binding.getTemplate().getHookNames()).containsExactlyElementsOf(TableTemplateBuilder.HOOKS);
    }

    @Test
    void testIdentityFirstThenSortedByName() {
        TemplateContext context = builder.build("test", "test", SchemaFixtures.atomicTable()).getContext();

        assertThat(context.getFields())
                .extracting(FieldSpec::getName)
                .containsExactly("UUID", "Float", "Int", "Str");
        assertThat(context.getFields())
                .extracting(FieldSpec::getType)
                .containsExactly("String", "double", "long", "String");
        assertThat(context.getFields().get(0)).isEqualTo(FieldSpec.identity());
    }

    @Test
    void testExplicitIdentityColumnIsFolded() {
        TableSchema table = TableSchema.builder()
                .column("_uuid", ColumnSchema.of(AtomicType.UUID))
                .column("name", ColumnSchema.of(AtomicType.STRING))
                .build();

        TemplateContext context = builder.build("test", "Bridge", table).getContext();

        assertThat(context.getFields())
                .extracting(FieldSpec::getTag)
                .containsExactly("_uuid", "name");
    }

    @Test
    void testEmptyTableStillHasIdentity() {
        TemplateContext context = builder.build("test", "Empty", TableSchema.builder().build()).getContext();

        assertThat(context.getFields()).containsExactly(FieldSpec.identity());
    }

    @Test
    void testTagKeepsOriginalColumnName() {
        TableSchema table = TableSchema.builder()
                .column("Foo_Bar", ColumnSchema.of(AtomicType.STRING))
                .build();

        FieldSpec field = builder.build("test", "t", table).getContext().getFields().get(1);

        assertThat(field.getName()).isEqualTo("FooBar");
        assertThat(field.getTag()).isEqualTo("Foo_Bar");
    }

    @Test
    void testComplexColumnsAddImports() {
        TemplateContext context = builder.build("org.ovn.nb", "Logical_Router_Port",
                SchemaFixtures.logicalRouterPort()).getContext();

        assertThat(context.getStructName()).isEqualTo("LogicalRouterPort");
        assertThat(context.get(TemplateContext.IMPORTS)).asList().containsExactly(
                "java.util.Map",
                "java.util.Optional",
                "java.util.Set",
                GeneratorConfig.DEFAULT_COLUMN_ANNOTATION);
        assertThat(context.getFields())
                .extracting(FieldSpec::getName, FieldSpec::getType)
                .containsExactly(
                        tuple("UUID", "String"),
                        tuple("Enabled", "Optional<Boolean>"),
                        tuple("ExternalIDs", "Map<String, String>"),
                        tuple("GatewayChassis", "Set<String>"),
                        tuple("Ipv6Prefix", "Set<String>"),
                        tuple("Name", "String"),
                        tuple("Status", "String"));
    }

    @Test
    void testCollidingNormalizedNamesAreRejected() {
        TableSchema table = TableSchema.builder()
                .column("foo_bar", ColumnSchema.of(AtomicType.STRING))
                .column("foo-bar", ColumnSchema.of(AtomicType.INTEGER))
                .build();

        assertThatThrownBy(() -> builder.build("test", "t", table))
                .isInstanceOf(FieldNameException.class)
                .hasMessageContaining("FooBar");
    }

    @Test
    void testIdentityNameIsReserved() {
        TableSchema table = TableSchema.builder()
                .column("uuid", ColumnSchema.of(AtomicType.STRING))
                .build();

        assertThatThrownBy(() -> builder.build("test", "t", table))
                .isInstanceOfSatisfying(FieldNameException.class,
                        e -> assertThat(e.getColumnName()).isEqualTo("uuid"));
    }

    @Test
    void testSeparatorOnlyColumnIsRejected() {
        TableSchema table = TableSchema.builder()
                .column("__", ColumnSchema.of(AtomicType.STRING))
                .build();

        assertThatThrownBy(() -> builder.build("test", "t", table))
                .isInstanceOf(FieldNameException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void testUnrecognizedTypeNamesTableAndColumn() {
        TableSchema table = TableSchema.builder()
                .column("odd", ColumnSchema.of(ColumnType.atomic("notAType")))
                .build();

        assertThatThrownBy(() -> builder.build("test", "Bridge", table))
                .isInstanceOfSatisfying(UnrecognizedTypeException.class, e -> {
                    assertThat(e.getTableName()).isEqualTo("Bridge");
                    assertThat(e.getColumnName()).isEqualTo("odd");
                });
    }

    @Test
    void testEveryCallReturnsFreshInstances() {
        TemplateBinding first = builder.build("test", "test", SchemaFixtures.atomicTable());
        TemplateBinding second = builder.build("test", "test", SchemaFixtures.atomicTable());

        first.getTemplate().define(TableTemplateBuilder.EXTRA_FIELDS, "int extra;");
        first.getContext().put("Extra", "x");

        assertThat(second.getTemplate().getHook(TableTemplateBuilder.EXTRA_FIELDS)).isEmpty();
        assertThat(second.getContext().containsKey("Extra")).isFalse();
    }
}
