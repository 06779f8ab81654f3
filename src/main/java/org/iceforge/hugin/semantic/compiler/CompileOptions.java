package org.iceforge.hugin.semantic.compiler;

import java.util.Objects;

public record CompileOptions(UnresolvedDimensionPolicy unresolvedDimensionPolicy, LiteralPolicy literalPolicy) {

    public CompileOptions {
        Objects.requireNonNull(unresolvedDimensionPolicy);
        Objects.requireNonNull(literalPolicy);
    }

    public static CompileOptions defaults() {
        return new CompileOptions(UnresolvedDimensionPolicy.OMIT, LiteralPolicy.TRUSTED);
    }

    public CompileOptions withUnresolvedDimensionPolicy(UnresolvedDimensionPolicy policy) {
        return new CompileOptions(policy, literalPolicy);
    }

    public CompileOptions withLiteralPolicy(LiteralPolicy policy) {
        return new CompileOptions(unresolvedDimensionPolicy, policy);
    }
}
