package com.ovsdb.modelgen.codegen;

import com.ovsdb.modelgen.codegen.exception.ModelGenException;
import com.ovsdb.modelgen.codegen.exception.TableNameException;
import com.ovsdb.modelgen.codegen.model.output.GeneratedFile;
import com.ovsdb.modelgen.codegen.model.output.GeneratedFileType;
import com.ovsdb.modelgen.codegen.template.ModelTemplate;
import com.ovsdb.modelgen.codegen.template.TableTemplateBuilder;
import com.ovsdb.modelgen.codegen.template.TemplateBinding;
import com.ovsdb.modelgen.codegen.template.TemplateContext;
import com.ovsdb.modelgen.codegen.template.TemplateEngine;
import com.ovsdb.modelgen.codegen.util.FileWriteUtil;
import com.ovsdb.modelgen.codegen.util.NameNormalizer;
import com.ovsdb.modelgen.model.DatabaseSchema;
import com.ovsdb.modelgen.model.TableSchema;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generates the model classes of a whole database: one class per table plus
 * an index class mapping table names to model classes.
 *
 * Tables are processed in table-name order. Every file is rendered and
 * validated before the first one is written, so a failing table leaves the
 * output directory untouched.
 */
public class DatabaseModelGenerator {
    private static final Logger log = LoggerFactory.getLogger(DatabaseModelGenerator.class);

    public static final String SKELETON = "dbmodel.ftl";

    public static final String CLASS_NAME = "ClassName";
    public static final String DATABASE_NAME = "DatabaseName";
    public static final String DATABASE_VERSION = "DatabaseVersion";
    public static final String TABLES = "Tables";

    private final GeneratorConfig config;
    private final TemplateEngine engine;
    private final NameNormalizer normalizer;
    private final TableTemplateBuilder tableBuilder;
    private final Generator generator;

    public DatabaseModelGenerator(GeneratorConfig config) {
        this.config = config;
        this.engine = new TemplateEngine();
        this.normalizer = NameNormalizer.withDefaultAcronyms()
                .withAdditionalAcronyms(config.getAdditionalAcronyms());
        this.tableBuilder = new TableTemplateBuilder(engine, normalizer, config);
        this.generator = new Generator(engine, config.isDryRun());
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    public Generator getGenerator() {
        return generator;
    }

    /**
     * Fresh template and context for one table.
     */
    public TemplateBinding buildTableTemplate(String packageName, String tableName, TableSchema table) {
        return tableBuilder.build(packageName, tableName, table);
    }

    /**
     * Template and context of the database model index class.
     */
    public TemplateBinding buildDatabaseModelTemplate(String packageName, DatabaseSchema schema) {
        List<TableEntry> tables = new ArrayList<>();
        for (String tableName : new TreeMap<>(schema.getTables()).keySet()) {
            tables.add(new TableEntry(tableName, normalizer.structName(tableName)));
        }

        TemplateContext context = new TemplateContext()
                .put(TemplateContext.PACKAGE_NAME, packageName == null ? "" : packageName)
                .put(TemplateContext.STRUCT_NAME, config.getDatabaseModelClassName())
                .put(CLASS_NAME, config.getDatabaseModelClassName())
                .put(DATABASE_NAME, schema.getName())
                .put(DATABASE_VERSION, schema.getVersion() == null ? "" : schema.getVersion())
                .put(TABLES, List.copyOf(tables));

        ModelTemplate template = new ModelTemplate(engine, config.getDatabaseModelClassName(),
                engine.loadSkeleton(SKELETON), List.of());
        return new TemplateBinding(template, context);
    }

    /**
     * Renders and validates every table model plus the index.
     *
     * @throws ModelGenException on the first table that fails
     * @throws TableNameException if two tables, or a table and the index, share a class name
     */
    public List<GeneratedFile> formatAll(String packageName, DatabaseSchema schema, TableCustomizer customizer) {
        Path packageDir = FileWriteUtil.packageDirectory(Path.of(""), packageName);
        List<GeneratedFile> files = new ArrayList<>();
        Map<String, String> tableByClassName = new TreeMap<>();

        for (Map.Entry<String, TableSchema> table : new TreeMap<>(schema.getTables()).entrySet()) {
            String tableName = table.getKey();
            String className = normalizer.structName(tableName);
            if (className.equals(config.getDatabaseModelClassName())) {
                throw new TableNameException(tableName, className, "reserved for the database model index");
            }
            String previous = tableByClassName.putIfAbsent(className, tableName);
            if (previous != null) {
                throw new TableNameException(tableName, className, "already used by table " + previous);
            }
            log.info("Generating model for table {}", tableName);

            TemplateBinding binding = tableBuilder.build(packageName, tableName, table.getValue());
            customizer.customize(tableName, binding.getTemplate(), binding.getContext());
            byte[] content = generator.format(binding.getTemplate(), binding.getContext());

            files.add(GeneratedFile.builder()
                    .path(packageDir.resolve(normalizer.fileName(tableName)))
                    .contents(new String(content, StandardCharsets.UTF_8))
                    .type(GeneratedFileType.TABLE_MODEL)
                    .build());
        }

        TemplateBinding index = buildDatabaseModelTemplate(packageName, schema);
        byte[] content = generator.format(index.getTemplate(), index.getContext());
        files.add(GeneratedFile.builder()
                .path(packageDir.resolve(config.getDatabaseModelClassName() + ".java"))
                .contents(new String(content, StandardCharsets.UTF_8))
                .type(GeneratedFileType.DATABASE_MODEL)
                .build());
        return files;
    }

    public GeneratorResult generate(DatabaseSchema schema) {
        return generate(schema, TableCustomizer.NONE);
    }

    /**
     * Generates every model of the schema into the configured output directory.
     */
    public GeneratorResult generate(DatabaseSchema schema, TableCustomizer customizer) {
        if (config.getOutputDir() == null) {
            return GeneratorResult.failure("No output directory configured");
        }
        try {
            log.info("Generating models for database {} ({} tables)", schema.getName(), schema.getTables().size());
            List<GeneratedFile> files = formatAll(config.getPackageName(), schema, customizer);

            GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getPackageDir())
                    .databaseName(schema.getName())
                    .tablesGenerated(files.size() - 1);

            for (GeneratedFile file : files) {
                Path destination = config.getOutputDir().resolve(file.getPath());
                if (config.isDryRun()) {
                    log.info("Dry run, skipping write of {}:\n{}", destination, file.getContents());
                    continue;
                }
                FileWriteUtil.safeWrite(destination, file.getBytes());
                result.writtenFile(destination);
                log.debug("Wrote {}", destination);
            }

            log.info("Model generation complete for database {}", schema.getName());
            return result.build();

        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * Table name and model class name, as listed in the index.
     */
    @Value
    public static class TableEntry {
        String tableName;
        String structName;
    }
}
