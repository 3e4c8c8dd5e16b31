package com.ovsdb.modelgen.codegen;

import com.ovsdb.modelgen.codegen.util.FileWriteUtil;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for the model generators.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Annotation carrying the original column name on every generated field.
     * Owned by the client runtime that consumes the generated classes.
     */
    public static final String DEFAULT_COLUMN_ANNOTATION = "org.ovsdb.client.annotations.Column";

    public static final String DEFAULT_DATABASE_MODEL_CLASS = "DatabaseModel";

    /**
     * Java package of the generated classes.
     */
    private String packageName;

    /**
     * Source root the package directories are created under.
     */
    private Path outputDir;

    /**
     * Whether this is a dry run (sources are logged, no files written).
     */
    private boolean dryRun;

    /**
     * Fully qualified name of the column annotation.
     */
    @Builder.Default
    private String columnAnnotation = DEFAULT_COLUMN_ANNOTATION;

    /**
     * Simple name of the generated database model index class.
     */
    @Builder.Default
    private String databaseModelClassName = DEFAULT_DATABASE_MODEL_CLASS;

    /**
     * Acronyms applied on top of the bundled acronyms.txt set.
     */
    @Builder.Default
    private List<String> additionalAcronyms = List.of();

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }

    /**
     * Directory the generated package lives in.
     */
    public Path getPackageDir() {
        return FileWriteUtil.packageDirectory(outputDir, packageName);
    }
}
