package com.ovsdb.modelgen.codegen.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts separator-delimited schema identifiers into exported Java
 * identifiers.
 *
 * <p>Input is split on {@code _} and {@code -}; empty tokens are dropped.
 * A token matching an entry of the acronym set (ignoring case) is emitted as
 * spelled in the set, any other token gets an upper-case first character.
 * Examples: {@code ip_port_mappings -> IPPortMappings},
 * {@code external_ids -> ExternalIDs}, {@code Foo_Bar -> FooBar}.
 *
 * <p>The default acronym set is read from the {@code acronyms.txt} class-path
 * resource.
 */
public class NameNormalizer {

    public static final String ACRONYMS_RESOURCE = "/acronyms.txt";

    private static final String SEPARATORS = "[-_]";
    private static final String JAVA_EXTENSION = ".java";

    // lower-case token -> emitted spelling
    private final Map<String, String> acronyms;

    private NameNormalizer(Collection<String> acronyms) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String acronym : acronyms) {
            String trimmed = acronym.trim();
            if (!trimmed.isEmpty()) {
                byKey.put(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        this.acronyms = Collections.unmodifiableMap(byKey);
    }

    /**
     * Normalizer using only the bundled acronym set.
     */
    public static NameNormalizer withDefaultAcronyms() {
        return new NameNormalizer(loadDefaultAcronyms());
    }

    public static NameNormalizer withAcronyms(Collection<String> acronyms) {
        return new NameNormalizer(acronyms);
    }

    /**
     * Returns a normalizer knowing the acronyms of this one plus the given ones.
     */
    public NameNormalizer withAdditionalAcronyms(Collection<String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(acronyms.values());
        merged.addAll(additional);
        return new NameNormalizer(merged);
    }

    /**
     * The acronym spellings this normalizer applies, in declaration order.
     */
    public Collection<String> getAcronyms() {
        return acronyms.values();
    }

    public String normalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        return Arrays.stream(name.split(SEPARATORS))
                .filter(token -> !token.isEmpty())
                .map(this::normalizeToken)
                .collect(Collectors.joining(""));
    }

    /**
     * Class name for a table.
     */
    public String structName(String tableName) {
        return normalize(tableName);
    }

    /**
     * Field name for a column.
     */
    public String fieldName(String columnName) {
        return normalize(columnName);
    }

    /**
     * Source file holding the class generated for a table.
     */
    public String fileName(String tableName) {
        return structName(tableName) + JAVA_EXTENSION;
    }

    private String normalizeToken(String token) {
        String acronym = acronyms.get(token.toLowerCase(Locale.ROOT));
        if (acronym != null) {
            return acronym;
        }
        return token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1);
    }

    private static List<String> loadDefaultAcronyms() {
        try (InputStream in = NameNormalizer.class.getResourceAsStream(ACRONYMS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing class-path resource " + ACRONYMS_RESOURCE);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return reader.lines()
                        .map(String::trim)
                        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                        .toList();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + ACRONYMS_RESOURCE, e);
        }
    }
}
