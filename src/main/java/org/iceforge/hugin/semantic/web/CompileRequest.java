package org.iceforge.hugin.semantic.web;

import jakarta.validation.constraints.NotNull;
import org.iceforge.hugin.semantic.model.Query;
import org.iceforge.hugin.semantic.model.SemanticLayer;

public class CompileRequest {

    /**
     * Layer to compile against. When absent the server's default layer is used.
     * Nested fields are checked by the service, not by request binding.
     */
    private SemanticLayer layer;

    @NotNull
    private Query query;

    public SemanticLayer getLayer() {
        return layer;
    }

    public void setLayer(SemanticLayer layer) {
        this.layer = layer;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }
}
