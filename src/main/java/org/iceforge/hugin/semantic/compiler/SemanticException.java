package org.iceforge.hugin.semantic.compiler;

/**
 * Base of every failure raised while parsing or compiling a semantic query.
 * None of them are transient; callers should not retry.
 */
public abstract class SemanticException extends RuntimeException {

    protected SemanticException(String message) {
        super(message);
    }

    protected SemanticException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code reported to API clients, e.g. {@code METRIC_NOT_FOUND}.
     */
    public abstract String errorCode();
}
