package com.ovsdb.modelgen.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for file writes with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWrite(Path filePath, byte[] content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.write(filePath, content);
    }

    /**
     * Directory of a Java package below a source root.
     */
    public static Path packageDirectory(Path sourceRoot, String packageName) {
        if (packageName == null || packageName.isEmpty()) {
            return sourceRoot;
        }
        return sourceRoot.resolve(packageName.replace('.', '/'));
    }
}
