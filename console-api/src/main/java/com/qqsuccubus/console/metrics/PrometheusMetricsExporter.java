package com.qqsuccubus.console.metrics;

import com.qqsuccubus.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the console's own metrics (API traffic, metric fetch latency, JVM) in the
 * Prometheus text format on {@code /metrics}.
 * <p>
 * The Prometheus registry joins reactor-netty's global composite registry, so Reactor Netty
 * server metrics and console meters land in the same scrape.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        log.info("Metrics exporter initialized for {} (global registry + Prometheus)", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
