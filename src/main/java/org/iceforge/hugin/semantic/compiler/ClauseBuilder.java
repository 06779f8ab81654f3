package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Filter;
import org.iceforge.hugin.semantic.model.Metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects resolved pieces of one query and renders them in fixed clause order:
 * SELECT, FROM/JOIN, WHERE, GROUP BY, HAVING. One instance per compile.
 */
public final class ClauseBuilder {

    private final FilterRenderer renderer;

    private final List<String> dimensionItems = new ArrayList<>();
    private final List<String> metricItems = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> where = new ArrayList<>();
    private final List<String> having = new ArrayList<>();
    private JoinPlan from;

    public ClauseBuilder(FilterRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer);
    }

    public ClauseBuilder dimension(DimensionExpression dimension) {
        dimensionItems.add(dimension.selectItem());
        groupBy.add(dimension.expression());
        return this;
    }

    public ClauseBuilder metric(Metric metric) {
        metricItems.add(metric.sql() + " AS " + metric.name());
        return this;
    }

    public ClauseBuilder from(JoinPlan plan) {
        this.from = Objects.requireNonNull(plan);
        return this;
    }

    /**
     * Routes each filter to HAVING when its field is one of the requested metric names,
     * to WHERE otherwise.
     */
    public ClauseBuilder filters(List<Filter> filters, List<String> requestedMetrics, SchemaModel schema) {
        for (Filter f : filters) {
            if (requestedMetrics.contains(f.field())) {
                having.add(renderer.renderHaving(f));
            } else {
                where.add(renderer.renderWhere(f, schema));
            }
        }
        return this;
    }

    public String build() {
        if (from == null) {
            throw new IllegalStateException("FROM clause was never set");
        }
        List<String> select = new ArrayList<>(dimensionItems);
        select.addAll(metricItems);

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", select)).append("\n");
        for (String line : from.lines()) {
            sql.append(line).append("\n");
        }
        if (!where.isEmpty()) {
            sql.append("WHERE ").append(String.join(" AND ", where)).append("\n");
        }
        if (!groupBy.isEmpty()) {
            sql.append("GROUP BY ").append(String.join(", ", groupBy)).append("\n");
        }
        if (!having.isEmpty()) {
            sql.append("HAVING ").append(String.join(" AND ", having)).append("\n");
        }
        return sql.toString().strip();
    }
}
