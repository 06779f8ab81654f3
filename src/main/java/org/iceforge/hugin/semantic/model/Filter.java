package org.iceforge.hugin.semantic.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A predicate on a metric or dimension. {@code value} is either a {@link String} or a {@link Number}.
 */
public record Filter(@NotBlank String field,
                     @NotBlank String operator,
                     @NotNull Object value) {

    @JsonIgnore
    @AssertTrue(message = "must be a string or a number")
    public boolean isValueScalar() {
        return value == null || value instanceof String || value instanceof Number;
    }
}
