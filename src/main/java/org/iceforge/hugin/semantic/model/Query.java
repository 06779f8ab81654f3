package org.iceforge.hugin.semantic.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A request against a {@link SemanticLayer}: metric names, optional dimension names and filters.
 */
public record Query(@NotNull List<@NotBlank String> metrics,
                    List<@NotBlank String> dimensions,
                    List<@Valid @NotNull Filter> filters) {

    public Query {
        metrics = metrics == null ? null : Collections.unmodifiableList(new ArrayList<>(metrics));
        dimensions = dimensions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dimensions));
        filters = filters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(filters));
    }

    public static Query of(List<String> metrics) {
        return new Query(metrics, null, null);
    }
}
