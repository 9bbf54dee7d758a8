package com.qqsuccubus.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for console instance identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the API route, e.g. {@code /api/system_metric}.
     */
    public static final String ROUTE = "route";

    /**
     * Tag key for HTTP status code.
     */
    public static final String STATUS = "status";

    /**
     * Tag key for catalog metric name.
     */
    public static final String METRIC = "metric";

    /**
     * Tag key for fetch outcome (success/failure/skipped).
     */
    public static final String OUTCOME = "outcome";

}
