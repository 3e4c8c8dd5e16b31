package com.ovsdb.modelgen.codegen.exception;

import java.util.List;

/**
 * Rendering failed, or the rendered text is not a well-formed Java
 * compilation unit. Holds every diagnostic so callers can report them at once.
 */
public class FormatException extends ModelGenException {

    private static final long serialVersionUID = 1L;

    private final String templateName;
    private final List<String> diagnostics;

    public FormatException(String templateName, List<String> diagnostics) {
        super("Generated source for '" + templateName + "' is invalid:"
                + System.lineSeparator() + String.join(System.lineSeparator(), diagnostics));
        this.templateName = templateName;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public FormatException(String templateName, String message, Throwable cause) {
        super("Rendering '" + templateName + "' failed: " + message, cause);
        this.templateName = templateName;
        this.diagnostics = List.of(message);
    }

    public String getTemplateName() {
        return templateName;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
