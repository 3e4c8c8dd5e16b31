package com.ovsdb.modelgen.codegen.template;

import lombok.NonNull;
import lombok.Value;

/**
 * A template together with the context it renders against.
 */
@Value
public class TemplateBinding {

    @NonNull
    ModelTemplate template;

    @NonNull
    TemplateContext context;
}
