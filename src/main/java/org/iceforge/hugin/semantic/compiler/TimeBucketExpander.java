package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Dimension;

import java.util.Optional;

/**
 * Expands grain references such as {@code ordered_date__week} into
 * {@code DATE_TRUNC(<table>.<sql>, WEEK)} over the base dimension.
 * Only the weekly grain is recognized.
 */
public final class TimeBucketExpander {

    public static final String WEEK_SUFFIX = "__week";

    public boolean isGrainReference(String dimensionName) {
        return dimensionName.endsWith(WEEK_SUFFIX);
    }

    /**
     * Returns empty when the name carries no grain suffix or its base dimension is unknown.
     */
    public Optional<DimensionExpression> expand(String dimensionName, SchemaModel schema) {
        if (!isGrainReference(dimensionName)) {
            return Optional.empty();
        }
        String baseName = baseName(dimensionName);
        Optional<Dimension> base = schema.lookupDimension(baseName);
        return base.map(d -> new DimensionExpression(
                dimensionName,
                "DATE_TRUNC(" + d.qualifiedSql() + ", WEEK)",
                d.table()));
    }

    String baseName(String dimensionName) {
        return dimensionName.substring(0, dimensionName.length() - WEEK_SUFFIX.length());
    }
}
