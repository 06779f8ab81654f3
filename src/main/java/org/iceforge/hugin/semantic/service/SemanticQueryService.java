package org.iceforge.hugin.semantic.service;

import org.iceforge.hugin.semantic.compiler.CompiledQuery;
import org.iceforge.hugin.semantic.compiler.QueryCompiler;
import org.iceforge.hugin.semantic.model.Query;
import org.iceforge.hugin.semantic.model.SemanticLayer;
import org.iceforge.hugin.semantic.web.CompileRequest;
import org.iceforge.hugin.semantic.web.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Service
public class SemanticQueryService {

    private static final Logger log = LoggerFactory.getLogger(SemanticQueryService.class);

    private final SemanticLayerLoader loader;
    private final SemanticLayerReader reader;
    private final QueryCompiler compiler;
    private final WarehouseClient warehouseClient;
    private final ResultPreviewFormatter formatter;

    public SemanticQueryService(SemanticLayerLoader loader,
                                SemanticLayerReader reader,
                                QueryCompiler compiler,
                                WarehouseClient warehouseClient,
                                ResultPreviewFormatter formatter) {
        this.loader = Objects.requireNonNull(loader);
        this.reader = Objects.requireNonNull(reader);
        this.compiler = Objects.requireNonNull(compiler);
        this.warehouseClient = Objects.requireNonNull(warehouseClient);
        this.formatter = Objects.requireNonNull(formatter);
    }

    public CompiledQuery compile(CompileRequest req) {
        SemanticLayer layer = req.getLayer() != null
                ? reader.validate(req.getLayer(), "semantic layer")
                : loader.load();
        Query query = reader.validate(req.getQuery(), "query");
        CompiledQuery cq = compiler.compile(layer, query);
        if (!cq.omittedDimensions().isEmpty()) {
            log.info("Compiled without unknown dimensions {}", cq.omittedDimensions());
        }
        return cq;
    }

    public Mono<QueryResponse> run(CompileRequest req) {
        CompiledQuery cq = compile(req);
        return warehouseClient.execute(cq.sql())
                .map(result -> new QueryResponse(cq.sql(), result.totalRows(), result.rows()));
    }

    public Mono<String> preview(CompileRequest req) {
        CompiledQuery cq = compile(req);
        return warehouseClient.execute(cq.sql())
                .map(formatter::format);
    }

    public void reloadLayer() {
        loader.reload();
    }
}
