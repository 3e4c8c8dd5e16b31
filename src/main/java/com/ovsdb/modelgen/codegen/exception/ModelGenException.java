package com.ovsdb.modelgen.codegen.exception;

/**
 * Base class for every error raised while building or rendering a model.
 */
public abstract class ModelGenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ModelGenException(String message) {
        super(message);
    }

    protected ModelGenException(String message, Throwable cause) {
        super(message, cause);
    }
}
