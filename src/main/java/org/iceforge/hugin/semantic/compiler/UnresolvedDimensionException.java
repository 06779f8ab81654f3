package org.iceforge.hugin.semantic.compiler;

/**
 * Raised under {@link UnresolvedDimensionPolicy#ERROR} when a requested dimension
 * (or the base of a grain dimension) is missing from the layer.
 */
public class UnresolvedDimensionException extends SemanticException {

    private final String dimension;

    public UnresolvedDimensionException(String dimension) {
        super("Dimension " + dimension + " not found in semantic layer");
        this.dimension = dimension;
    }

    public String getDimension() {
        return dimension;
    }

    @Override
    public String errorCode() {
        return "UNRESOLVED_DIMENSION";
    }
}
