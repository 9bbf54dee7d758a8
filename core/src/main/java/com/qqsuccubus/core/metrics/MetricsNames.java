package com.qqsuccubus.core.metrics;

/**
 * Micrometer metric names used across the console.
 * <p>
 * <b>Naming convention:</b> {@code console.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: API requests served.
     * <p>
     * Tags: route, status
     * </p>
     */
    public static final String API_REQUESTS_TOTAL = "console.api.requests.total";

    /**
     * Timer: One metric fetch, raw query plus normalization.
     * <p>
     * Tags: metric, outcome
     * </p>
     */
    public static final String METRIC_FETCH_LATENCY = "console.metric.fetch.latency";

    /**
     * Counter: Resource limit updates sent to the control plane.
     * <p>
     * Tags: outcome
     * </p>
     */
    public static final String LIMITS_UPDATES_TOTAL = "console.limits.updates.total";
}
