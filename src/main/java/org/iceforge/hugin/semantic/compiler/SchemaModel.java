package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Dimension;
import org.iceforge.hugin.semantic.model.Join;
import org.iceforge.hugin.semantic.model.Metric;
import org.iceforge.hugin.semantic.model.SemanticLayer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookup view over a {@link SemanticLayer}.
 * <p>
 * Lookups scan in declaration order and return the first match. Duplicate names are
 * not rejected; a later definition with the same name is simply never returned.
 */
public final class SchemaModel {

    private final List<Metric> metrics;
    private final List<Dimension> dimensions;
    private final List<Join> joins;

    public SchemaModel(SemanticLayer layer) {
        Objects.requireNonNull(layer);
        this.metrics = layer.metrics() == null ? List.of() : layer.metrics();
        this.dimensions = layer.dimensions();
        this.joins = layer.joins();
    }

    public Optional<Metric> lookupMetric(String name) {
        for (Metric m : metrics) {
            if (m.name().equals(name)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public Optional<Dimension> lookupDimension(String name) {
        for (Dimension d : dimensions) {
            if (d.name().equals(name)) return Optional.of(d);
        }
        return Optional.empty();
    }

    public boolean hasDimension(String name) {
        return lookupDimension(name).isPresent();
    }

    public List<Join> joins() {
        return joins;
    }
}
