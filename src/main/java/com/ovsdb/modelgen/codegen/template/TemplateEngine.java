package com.ovsdb.modelgen.codegen.template;

import freemarker.cache.TemplateLoader;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Owns the FreeMarker configuration used to parse and render model templates.
 *
 * The configuration is set up once in the constructor and only read
 * afterwards, so one engine may be shared by concurrent generations.
 */
public class TemplateEngine {

    private static final String TEMPLATE_DIR = "/templates";

    private final Configuration freemarkerConfig;

    public TemplateEngine() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), TEMPLATE_DIR);
        cfg.setDefaultEncoding(StandardCharsets.UTF_8.name());
        // context values are interpolated into Java source: no grouping, true/false literals
        cfg.setLocale(Locale.ROOT);
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("c");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Reads the source text of a skeleton from the template directory.
     *
     * @throws IllegalStateException if the skeleton is not on the class path
     */
    public String loadSkeleton(String skeletonName) {
        TemplateLoader loader = freemarkerConfig.getTemplateLoader();
        try {
            Object source = loader.findTemplateSource(skeletonName);
            if (source == null) {
                throw new IllegalStateException("Template not found: " + TEMPLATE_DIR + "/" + skeletonName);
            }
            try (Reader reader = loader.getReader(source, freemarkerConfig.getDefaultEncoding())) {
                StringWriter text = new StringWriter();
                reader.transferTo(text);
                return text.toString();
            } finally {
                loader.closeTemplateSource(source);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read template " + skeletonName, e);
        }
    }

    /**
     * Parses template source.
     *
     * @throws freemarker.core.ParseException on syntax errors
     */
    public Template parse(String name, String source) throws IOException {
        return new Template(name, source, freemarkerConfig);
    }

    /**
     * Renders a parsed template against a data model.
     */
    public String render(Template template, Map<String, Object> dataModel) throws TemplateException, IOException {
        StringWriter out = new StringWriter();
        template.process(dataModel, out);
        return out.toString();
    }
}
