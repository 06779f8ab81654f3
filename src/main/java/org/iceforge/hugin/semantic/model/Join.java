package org.iceforge.hugin.semantic.model;

import jakarta.validation.constraints.NotBlank;

/**
 * One-to-many relationship between two physical tables. Endpoints are table names,
 * {@code join} is the raw ON condition.
 */
public record Join(@NotBlank String one,
                   @NotBlank String many,
                   @NotBlank String join) {
}
