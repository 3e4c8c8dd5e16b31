package com.ovsdb.modelgen.codegen.template;

import com.ovsdb.modelgen.codegen.exception.HookParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A FreeMarker skeleton with a fixed set of named hooks.
 *
 * <p>The skeleton invokes each hook as a macro ({@code <@extraFields/>}).
 * Hooks default to an empty body; {@link #define} replaces a body. Bodies are
 * ordinary FreeMarker text and see the whole data model, including keys added
 * to the {@link TemplateContext} after the template was built.
 *
 * <p>Instances are mutable. Callers that redefine hooks while another thread
 * renders the same instance must synchronize themselves.
 */
public class ModelTemplate {
    private static final Logger log = LoggerFactory.getLogger(ModelTemplate.class);

    private final TemplateEngine engine;
    private final String name;
    private final String skeleton;
    private final Map<String, String> hooks = new LinkedHashMap<>();

    public ModelTemplate(TemplateEngine engine, String name, String skeleton, List<String> hookNames) {
        this.engine = engine;
        this.name = name;
        this.skeleton = skeleton;
        for (String hookName : hookNames) {
            hooks.put(hookName, "");
        }
    }

    public String getName() {
        return name;
    }

    public Set<String> getHookNames() {
        return Collections.unmodifiableSet(hooks.keySet());
    }

    /**
     * Current body of a hook.
     */
    public String getHook(String hookName) {
        requireHook(hookName);
        return hooks.get(hookName);
    }

    /**
     * Replaces the body of a hook. The body is parsed right away.
     *
     * @throws IllegalArgumentException if the template has no such hook
     * @throws HookParseException if the body is not valid template syntax
     */
    public ModelTemplate define(String hookName, String body) {
        requireHook(hookName);
        String definition = macroDefinition(hookName, body == null ? "" : body);
        try {
            engine.parse(name + "#" + hookName, definition);
        } catch (IOException e) {
            throw new HookParseException(hookName, e);
        }
        hooks.put(hookName, body == null ? "" : body);
        log.debug("Defined hook {} on template {}", hookName, name);
        return this;
    }

    /**
     * Skeleton followed by the current hook definitions, ready to parse.
     */
    public String compose() {
        StringBuilder sb = new StringBuilder(skeleton);
        if (!skeleton.endsWith("\n")) {
            sb.append('\n');
        }
        for (Map.Entry<String, String> hook : hooks.entrySet()) {
            sb.append(macroDefinition(hook.getKey(), hook.getValue()));
        }
        return sb.toString();
    }

    private void requireHook(String hookName) {
        if (!hooks.containsKey(hookName)) {
            throw new IllegalArgumentException("Template '" + name + "' has no hook '" + hookName
                    + "'; known hooks: " + hooks.keySet());
        }
    }

    // a non-empty body always ends its line, so skeleton text after the call starts on a new one
    private static String macroDefinition(String hookName, String body) {
        String text = body.isEmpty() || body.endsWith("\n") ? body : body + "\n";
        return "<#macro " + hookName + ">" + text + "</#macro>\n";
    }
}
