package org.iceforge.hugin.semantic.compiler;

/**
 * What to do with a requested dimension the layer does not define.
 */
public enum UnresolvedDimensionPolicy {
    /**
     * Drop it from SELECT and GROUP BY and carry on. Reported in {@link CompiledQuery#omittedDimensions()}.
     */
    OMIT,
    /**
     * Fail the compile with {@link UnresolvedDimensionException}.
     */
    ERROR
}
