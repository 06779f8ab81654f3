package org.iceforge.hugin.semantic.compiler;

import java.util.List;

/**
 * A layer or query document that cannot be parsed, or that is missing required fields.
 */
public class MalformedConfigurationException extends SemanticException {

    private final List<String> violations;

    public MalformedConfigurationException(String document, List<String> violations) {
        super("Malformed " + document + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public MalformedConfigurationException(String document, Throwable cause) {
        super("Malformed " + document + ": " + cause.getMessage(), cause);
        this.violations = List.of(String.valueOf(cause.getMessage()));
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String errorCode() {
        return "MALFORMED_CONFIGURATION";
    }
}
