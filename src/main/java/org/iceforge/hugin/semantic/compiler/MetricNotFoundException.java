package org.iceforge.hugin.semantic.compiler;

public class MetricNotFoundException extends SemanticException {

    private final String metric;

    public MetricNotFoundException(String metric) {
        super("Metric " + metric + " not found in semantic layer");
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }

    @Override
    public String errorCode() {
        return "METRIC_NOT_FOUND";
    }
}
