package com.ovsdb.modelgen.codegen;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of generating the models of a whole database.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private String databaseName;
    private int tablesGenerated;

    @Singular
    private List<Path> writtenFiles;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
