package com.ovsdb.modelgen.codegen.template;

import com.ovsdb.modelgen.codegen.model.FieldSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Data every section of a {@link ModelTemplate} renders against.
 *
 * <p>An order-preserving key/value map. The table builder fills the base keys
 * ({@link #PACKAGE_NAME}, {@link #TABLE_NAME}, {@link #STRUCT_NAME},
 * {@link #FIELDS}, {@link #IMPORTS}, {@link #COLUMN_ANNOTATION}); callers may
 * overwrite them or add keys of their own before rendering. Values are exposed
 * to templates through FreeMarker's object wrapper, so beans, lists and maps
 * can all be used.
 *
 * <p>Not thread-safe.
 */
public class TemplateContext {

    public static final String PACKAGE_NAME = "PackageName";
    public static final String TABLE_NAME = "TableName";
    public static final String STRUCT_NAME = "StructName";
    public static final String FIELDS = "Fields";
    public static final String IMPORTS = "Imports";
    public static final String COLUMN_ANNOTATION = "ColumnAnnotation";

    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Sets a value, replacing any previous one for the key.
     */
    public TemplateContext put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            throw new IllegalArgumentException("Null value for context key '" + key + "'");
        }
        values.put(key, value);
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public String getStructName() {
        return (String) values.get(STRUCT_NAME);
    }

    public String getTableName() {
        return (String) values.get(TABLE_NAME);
    }

    public String getPackageName() {
        return (String) values.get(PACKAGE_NAME);
    }

    @SuppressWarnings("unchecked")
    public List<FieldSpec> getFields() {
        Object fields = values.get(FIELDS);
        return fields == null ? List.of() : (List<FieldSpec>) fields;
    }

    /**
     * Copy of the current entries for a single render.
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
