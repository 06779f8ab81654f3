package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Dimension;
import org.iceforge.hugin.semantic.model.Metric;

import java.util.Optional;

/**
 * Rewrites a field name into {@code <table>.<sql>}. Dimensions win over metrics of the same name.
 */
public final class FieldResolver {

    public FieldResolution qualify(String field, SchemaModel schema) {
        Optional<Dimension> dimension = schema.lookupDimension(field);
        if (dimension.isPresent()) {
            return FieldResolution.qualified(field, dimension.get().qualifiedSql());
        }
        Optional<Metric> metric = schema.lookupMetric(field);
        if (metric.isPresent()) {
            Metric m = metric.get();
            return FieldResolution.qualified(field, m.table() + "." + m.sql());
        }
        // Already-qualified columns and literal expressions pass through as written.
        return FieldResolution.unresolved(field);
    }
}
