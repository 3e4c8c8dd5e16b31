package com.ovsdb.modelgen.codegen.template;

import com.ovsdb.modelgen.codegen.GeneratorConfig;
import com.ovsdb.modelgen.codegen.exception.FieldNameException;
import com.ovsdb.modelgen.codegen.mapper.OvsdbToJavaTypeMapper;
import com.ovsdb.modelgen.codegen.model.FieldSpec;
import com.ovsdb.modelgen.codegen.model.JavaType;
import com.ovsdb.modelgen.codegen.util.ImportManager;
import com.ovsdb.modelgen.codegen.util.NameNormalizer;
import com.ovsdb.modelgen.model.ColumnSchema;
import com.ovsdb.modelgen.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the template and data context for one table's model class.
 *
 * <p>Each call returns a fresh {@link ModelTemplate} and {@link TemplateContext};
 * nothing is shared between calls. The class skeleton ({@code table.ftl}) is:
 * header comment, package clause, imports, {@value #PRE_STRUCT} hook, class
 * declaration with one annotated public field per column, {@value #EXTRA_FIELDS}
 * hook, closing brace, {@value #POST_STRUCT} hook.
 *
 * <p>Fields are ordered identity first ({@code _uuid}), then by normalized name,
 * so output does not depend on the column order of the schema.
 */
public class TableTemplateBuilder {
    private static final Logger log = LoggerFactory.getLogger(TableTemplateBuilder.class);

    public static final String SKELETON = "table.ftl";

    /**
     * Top-level declarations between the imports and the class.
     */
    public static final String PRE_STRUCT = "preStructDefinitions";

    /**
     * Members appended after the generated fields.
     */
    public static final String EXTRA_FIELDS = "extraFields";

    /**
     * Top-level declarations after the class.
     */
    public static final String POST_STRUCT = "postStructDefinitions";

    public static final List<String> HOOKS = List.of(PRE_STRUCT, EXTRA_FIELDS, POST_STRUCT);

    private final TemplateEngine engine;
    private final NameNormalizer normalizer;
    private final GeneratorConfig config;

    public TableTemplateBuilder(TemplateEngine engine, NameNormalizer normalizer, GeneratorConfig config) {
        this.engine = engine;
        this.normalizer = normalizer;
        this.config = config;
    }

    /**
     * Builds the template and context for a table.
     *
     * @param packageName package of the generated class, may be empty
     * @param tableName   table name as declared in the schema
     * @param table       table schema
     * @throws com.ovsdb.modelgen.codegen.exception.UnrecognizedTypeException if a column type has no mapping
     * @throws FieldNameException if column names collide after normalization
     */
    public TemplateBinding build(String packageName, String tableName, TableSchema table) {
        String structName = normalizer.structName(tableName);
        if (structName.isEmpty()) {
            throw new IllegalArgumentException("Table name '" + tableName + "' yields an empty class name");
        }
        log.debug("Building template for table {} as {}", tableName, structName);

        ImportManager importManager = new ImportManager(packageName);
        importManager.addImport(config.getColumnAnnotation());
        List<FieldSpec> fields = buildFields(tableName, table, importManager);

        TemplateContext context = new TemplateContext()
                .put(TemplateContext.PACKAGE_NAME, packageName == null ? "" : packageName)
                .put(TemplateContext.TABLE_NAME, tableName)
                .put(TemplateContext.STRUCT_NAME, structName)
                .put(TemplateContext.FIELDS, fields)
                .put(TemplateContext.IMPORTS, importManager.getImports())
                .put(TemplateContext.COLUMN_ANNOTATION, ImportManager.simpleName(config.getColumnAnnotation()));

        ModelTemplate template = new ModelTemplate(engine, tableName, engine.loadSkeleton(SKELETON), HOOKS);
        return new TemplateBinding(template, context);
    }

    private List<FieldSpec> buildFields(String tableName, TableSchema table, ImportManager importManager) {
        Map<String, FieldSpec> byName = new TreeMap<>();
        Map<String, String> columnByName = new TreeMap<>();

        for (Map.Entry<String, ColumnSchema> column : new TreeMap<>(table.getColumns()).entrySet()) {
            String columnName = column.getKey();
            if (FieldSpec.IDENTITY_COLUMN.equals(columnName)) {
                continue;
            }

            String fieldName = normalizer.fieldName(columnName);
            if (fieldName.isEmpty()) {
                throw new FieldNameException(tableName, columnName, "name normalizes to an empty identifier");
            }
            if (FieldSpec.IDENTITY_FIELD.equals(fieldName)) {
                throw new FieldNameException(tableName, columnName,
                        "field name " + fieldName + " is reserved for " + FieldSpec.IDENTITY_COLUMN);
            }
            if (byName.containsKey(fieldName)) {
                throw new FieldNameException(tableName, columnName,
                        "field name " + fieldName + " already used by column " + columnByName.get(fieldName));
            }

            JavaType javaType = OvsdbToJavaTypeMapper.javaType(tableName, columnName, column.getValue());
            importManager.addImports(javaType.getRequiredImports());

            byName.put(fieldName, FieldSpec.builder()
                    .name(fieldName)
                    .type(javaType.toSource())
                    .tag(columnName)
                    .build());
            columnByName.put(fieldName, columnName);
            log.debug("    Field {} {} <- {}", javaType.toSource(), fieldName, columnName);
        }

        List<FieldSpec> fields = new ArrayList<>(byName.size() + 1);
        fields.add(FieldSpec.identity());
        fields.addAll(byName.values());
        return List.copyOf(fields);
    }
}
