package com.qqsuccubus.console.metrics;

import com.qqsuccubus.core.metrics.MetricsNames;
import com.qqsuccubus.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counts API requests per route and response status.
 */
public class ApiMetrics {

    private final MeterRegistry registry;

    public ApiMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(String route, int status) {
        Counter.builder(MetricsNames.API_REQUESTS_TOTAL)
            .tag(MetricsTags.ROUTE, route)
            .tag(MetricsTags.STATUS, Integer.toString(status))
            .description("API requests served")
            .register(registry)
            .increment();
    }
}
