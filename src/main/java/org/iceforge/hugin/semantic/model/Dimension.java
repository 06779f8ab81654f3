package org.iceforge.hugin.semantic.model;

import jakarta.validation.constraints.NotBlank;

/**
 * A groupable column or expression bound to a source table.
 */
public record Dimension(@NotBlank String name,
                        @NotBlank String sql,
                        @NotBlank String table) {

    /**
     * Table-qualified expression, e.g. {@code orders.status}.
     */
    public String qualifiedSql() {
        return table + "." + sql;
    }
}
