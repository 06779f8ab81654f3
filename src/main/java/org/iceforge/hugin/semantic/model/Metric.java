package org.iceforge.hugin.semantic.model;

import jakarta.validation.constraints.NotBlank;

/**
 * An aggregation bound to a source table, e.g. {@code SUM(sale_price)} on {@code order_items}.
 */
public record Metric(@NotBlank String name,
                     @NotBlank String sql, // rendered as-is in SELECT, never re-aliased
                     @NotBlank String table) {
}
