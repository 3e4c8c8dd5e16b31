package com.ovsdb.modelgen.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * A formatted and validated source file, not yet written.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    /**
     * Path relative to the output source root, e.g. "org/ovn/nb/Bridge.java".
     */
    @NonNull
    Path path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    public byte[] getBytes() {
        return contents.getBytes(StandardCharsets.UTF_8);
    }
}
