package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Metric;
import org.iceforge.hugin.semantic.model.Query;
import org.iceforge.hugin.semantic.model.SemanticLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a {@link Query} against a {@link SemanticLayer} into SQL text.
 * <p>
 * Stateless and thread-safe: every call builds its own {@link SchemaModel} and {@link ClauseBuilder}.
 * Unknown metrics fail the compile. Unknown dimensions are handled per {@link UnresolvedDimensionPolicy}.
 */
public class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private final CompileOptions options;
    private final FieldResolver resolver = new FieldResolver();
    private final JoinPlanner joinPlanner = new JoinPlanner();
    private final TimeBucketExpander timeBuckets = new TimeBucketExpander();
    private final FilterRenderer filterRenderer;

    public QueryCompiler() {
        this(CompileOptions.defaults());
    }

    public QueryCompiler(CompileOptions options) {
        this.options = Objects.requireNonNull(options);
        this.filterRenderer = new FilterRenderer(options.literalPolicy(), resolver);
    }

    public CompileOptions getOptions() {
        return options;
    }

    public CompiledQuery compile(SemanticLayer layer, Query query) {
        Objects.requireNonNull(layer);
        Objects.requireNonNull(query);
        if (query.metrics() == null) {
            throw new MalformedConfigurationException("query", List.of("metrics: must not be null"));
        }

        SchemaModel schema = new SchemaModel(layer);
        ClauseBuilder clauses = new ClauseBuilder(filterRenderer);
        Set<String> tables = new LinkedHashSet<>();

        for (String name : query.metrics()) {
            Metric metric = schema.lookupMetric(name).orElseThrow(() -> new MetricNotFoundException(name));
            clauses.metric(metric);
            tables.add(metric.table());
        }

        List<String> omitted = new ArrayList<>();
        for (String name : query.dimensions()) {
            Optional<DimensionExpression> resolved = timeBuckets.isGrainReference(name)
                    ? timeBuckets.expand(name, schema)
                    : schema.lookupDimension(name).map(d -> DimensionExpression.of(name, d));
            if (resolved.isEmpty()) {
                if (options.unresolvedDimensionPolicy() == UnresolvedDimensionPolicy.ERROR) {
                    throw new UnresolvedDimensionException(name);
                }
                log.debug("Omitting dimension '{}': not defined in semantic layer", name);
                omitted.add(name);
                continue;
            }
            clauses.dimension(resolved.get());
            tables.add(resolved.get().table());
        }

        if (tables.isEmpty()) {
            throw new MalformedConfigurationException("query",
                    List.of("metrics: no requested metric or dimension resolves to a table"));
        }

        JoinPlan plan = joinPlanner.plan(tables, schema.joins());
        clauses.from(plan).filters(query.filters(), query.metrics(), schema);

        String sql = clauses.build();
        log.debug("Compiled query {} into:\n{}", query.metrics(), sql);
        return new CompiledQuery(sql, new ArrayList<>(tables), plan.anchor(), omitted);
    }
}
