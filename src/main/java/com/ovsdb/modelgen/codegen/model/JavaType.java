package com.ovsdb.modelgen.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Describes a Java type used in generated models.
 *
 * Pure structure only, the mapping from column types lives in
 * {@link com.ovsdb.modelgen.codegen.mapper.OvsdbToJavaTypeMapper}.
 */
@Value
@Builder(toBuilder = true)
public class JavaType {

    /**
     * Simple type name as written in source, e.g. "long", "String", "Map".
     */
    @NonNull
    String rawType;

    /**
     * Fully qualified name to import, null for primitives and java.lang types.
     */
    String importName;

    /**
     * Whether the type is a Java primitive.
     */
    boolean primitive;

    /**
     * Reference type used where a primitive cannot appear, e.g. "Long" for "long".
     */
    String boxedType;

    /**
     * Type arguments of a generic type, in declaration order.
     */
    @Singular
    List<JavaType> typeArguments;

    public static JavaType primitive(String name, String boxedType) {
        return JavaType.builder().rawType(name).primitive(true).boxedType(boxedType).build();
    }

    public static JavaType reference(String simpleName) {
        return JavaType.builder().rawType(simpleName).build();
    }

    public static JavaType generic(String qualifiedName, JavaType... arguments) {
        JavaTypeBuilder builder = JavaType.builder()
                .rawType(qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1))
                .importName(qualifiedName);
        for (JavaType argument : arguments) {
            builder.typeArgument(argument.boxed());
        }
        return builder.build();
    }

    /**
     * This type, or its wrapper class if primitive.
     */
    public JavaType boxed() {
        if (!primitive) {
            return this;
        }
        return JavaType.reference(boxedType);
    }

    /**
     * Imports needed by this type and its arguments.
     */
    public List<String> getRequiredImports() {
        List<String> result = new ArrayList<>();
        if (importName != null) {
            result.add(importName);
        }
        for (JavaType argument : typeArguments) {
            result.addAll(argument.getRequiredImports());
        }
        return result;
    }

    /**
     * Source form, e.g. {@code Map<String, Long>}.
     */
    public String toSource() {
        if (typeArguments.isEmpty()) {
            return rawType;
        }
        return typeArguments.stream()
                .map(JavaType::toSource)
                .collect(Collectors.joining(", ", rawType + "<", ">"));
    }
}
