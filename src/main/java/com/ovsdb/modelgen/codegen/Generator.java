package com.ovsdb.modelgen.codegen;

import com.ovsdb.modelgen.codegen.exception.FormatException;
import com.ovsdb.modelgen.codegen.template.ModelTemplate;
import com.ovsdb.modelgen.codegen.template.TemplateContext;
import com.ovsdb.modelgen.codegen.template.TemplateEngine;
import com.ovsdb.modelgen.codegen.util.FileWriteUtil;
import com.ovsdb.modelgen.validation.JavaSourceFormatter;
import com.ovsdb.modelgen.validation.JavaSyntaxValidator;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a template against its context, normalizes the layout and checks
 * that the result parses as Java.
 *
 * Neither the template nor the context is modified, and rendering the same
 * unmodified pair always yields the same bytes. Nothing is written unless the
 * output passed validation.
 */
public class Generator {
    private static final Logger log = LoggerFactory.getLogger(Generator.class);

    private final TemplateEngine engine;
    private final boolean dryRun;
    private final JavaSourceFormatter formatter = new JavaSourceFormatter();
    private final JavaSyntaxValidator validator = new JavaSyntaxValidator();

    /**
     * @param dryRun log generated sources instead of writing them
     */
    public Generator(TemplateEngine engine, boolean dryRun) {
        this.engine = engine;
        this.dryRun = dryRun;
    }

    /**
     * Renders and validates.
     *
     * @return UTF-8 encoded source
     * @throws FormatException if rendering fails or the output is not valid Java
     */
    public byte[] format(ModelTemplate template, TemplateContext context) {
        String rendered = render(template, context);
        String formatted = formatter.format(rendered);

        List<String> errors = validator.validate(formatted, sourceName(template, context));
        if (!errors.isEmpty()) {
            log.warn("Rejected output of template {}: {}", template.getName(), errors);
            throw new FormatException(template.getName(), errors);
        }
        return formatted.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Formats and writes the result to {@code destination}, creating parent
     * directories. No file is touched if formatting fails.
     *
     * @throws FormatException if rendering fails or the output is not valid Java
     * @throws IOException if writing fails
     */
    public void generate(Path destination, ModelTemplate template, TemplateContext context) throws IOException {
        byte[] content = format(template, context);
        if (dryRun) {
            log.info("Dry run, skipping write of {}:\n{}", destination, new String(content, StandardCharsets.UTF_8));
            return;
        }
        FileWriteUtil.safeWrite(destination, content);
        log.info("Generated {}", destination);
    }

    private String render(ModelTemplate template, TemplateContext context) {
        try {
            Template parsed = engine.parse(template.getName(), template.compose());
            return engine.render(parsed, context.snapshot());
        } catch (TemplateException | IOException e) {
            throw new FormatException(template.getName(), String.valueOf(e.getMessage()), e);
        }
    }

    private static String sourceName(ModelTemplate template, TemplateContext context) {
        Object structName = context.get(TemplateContext.STRUCT_NAME);
        return (structName instanceof String name ? name : template.getName()) + ".java";
    }
}
