package org.iceforge.hugin.semantic.compiler;

import java.util.Objects;

/**
 * Outcome of qualifying a bare field name: either a table-qualified expression or
 * the original text, untouched.
 */
public record FieldResolution(String field, String qualified) {

    public FieldResolution {
        Objects.requireNonNull(field);
    }

    public static FieldResolution qualified(String field, String qualified) {
        return new FieldResolution(field, Objects.requireNonNull(qualified));
    }

    public static FieldResolution unresolved(String field) {
        return new FieldResolution(field, null);
    }

    public boolean isQualified() {
        return qualified != null;
    }

    /**
     * The qualified expression, or the original field when nothing matched.
     */
    public String text() {
        return qualified != null ? qualified : field;
    }
}
