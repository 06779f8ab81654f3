package org.iceforge.hugin.semantic.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative schema: metrics, dimensions and joins mapped onto physical tables.
 * Absent {@code dimensions} / {@code joins} are normalized to empty lists.
 */
public record SemanticLayer(@NotNull List<@Valid @NotNull Metric> metrics,
                            List<@Valid @NotNull Dimension> dimensions,
                            List<@Valid @NotNull Join> joins) {

    public SemanticLayer {
        metrics = metrics == null ? null : Collections.unmodifiableList(new ArrayList<>(metrics));
        dimensions = dimensions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dimensions));
        joins = joins == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(joins));
    }

    public static SemanticLayer of(List<Metric> metrics) {
        return new SemanticLayer(metrics, null, null);
    }
}
