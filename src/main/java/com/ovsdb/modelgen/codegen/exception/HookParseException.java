package com.ovsdb.modelgen.codegen.exception;

/**
 * Replacement text for a template hook is not valid template syntax.
 */
public class HookParseException extends ModelGenException {

    private static final long serialVersionUID = 1L;

    private final String hookName;

    public HookParseException(String hookName, Throwable cause) {
        super("Hook '" + hookName + "' failed to parse: " + cause.getMessage(), cause);
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }
}
