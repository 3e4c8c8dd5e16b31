package com.ovsdb.modelgen.codegen;

import com.ovsdb.modelgen.codegen.template.ModelTemplate;
import com.ovsdb.modelgen.codegen.template.TemplateContext;

/**
 * Callback applied to each table's template before it is rendered, e.g. to
 * define hooks or add context keys.
 */
@FunctionalInterface
public interface TableCustomizer {

    TableCustomizer NONE = (tableName, template, context) -> { };

    void customize(String tableName, ModelTemplate template, TemplateContext context);
}
