package com.qqsuccubus.console.monitoring;

import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.core.error.TransportException;
import com.qqsuccubus.core.metrics.MetricsNames;
import com.qqsuccubus.core.metrics.MetricsTags;
import com.qqsuccubus.core.model.NormalizedTable;
import com.qqsuccubus.core.model.TimeWindow;
import com.qqsuccubus.core.normalize.MetricCatalog;
import com.qqsuccubus.core.normalize.MetricDescriptor;
import com.qqsuccubus.core.normalize.Normalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches Cloud Run metrics: resolves the catalog entry, issues the raw query and
 * normalizes the result.
 */
public class MetricService {
    private static final Logger log = LoggerFactory.getLogger(MetricService.class);

    private final IMetricQueryClient queryClient;
    private final Normalizer normalizer;
    private final ConsoleConfig config;
    private final MeterRegistry meterRegistry;

    public MetricService(IMetricQueryClient queryClient, Normalizer normalizer, ConsoleConfig config,
                         MeterRegistry meterRegistry) {
        this.queryClient = queryClient;
        this.normalizer = normalizer;
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Fetches one metric.
     * <p>
     * An empty window yields an empty table without querying the backend.
     * </p>
     *
     * @param metricName catalog name (any case)
     * @param window     resolved time window
     * @return Mono<NormalizedTable>; errors with UnknownMetricException, ConfigurationException
     * or TransportException
     */
    public Mono<NormalizedTable> fetchOne(String metricName, TimeWindow window) {
        return Mono.defer(() -> {
            MetricDescriptor descriptor = MetricCatalog.describe(metricName);
            if (window.isEmpty()) {
                log.debug("Empty window for {}, skipping query", descriptor.getName());
                record(Timer.start(meterRegistry), descriptor, "skipped");
                return Mono.just(NormalizedTable.empty());
            }

            String serviceName = config.requireServiceName();
            Timer.Sample timer = Timer.start(meterRegistry);
            return queryClient.queryRaw(descriptor.getQueryType(), descriptor.getGroupLabel(), serviceName,
                    window.getStart(), window.getEnd())
                .switchIfEmpty(Mono.error(new TransportException(
                    "Cloud Monitoring returned no result for " + descriptor.getName())))
                .map(raw -> normalizer.normalize(raw, descriptor))
                .doOnNext(table -> {
                    record(timer, descriptor, "success");
                    log.debug("Fetched {}: {} rows, columns {}", descriptor.getName(), table.rowCount(), table.getColumns());
                })
                .doOnError(err -> record(timer, descriptor, "failure"));
        });
    }

    /**
     * Fetches all six catalog metrics concurrently and waits for every one of them.
     * <p>
     * A failing metric never cancels the others: its entry carries an error message instead
     * of a table. The map always holds all six names, in catalog order.
     * </p>
     *
     * @param window resolved time window
     * @return Mono<Map<String, MetricResult>> map of metric name -> result
     */
    public Mono<Map<String, MetricResult>> fetchAll(TimeWindow window) {
        return Flux.fromIterable(MetricCatalog.names())
            .flatMapSequential(name -> fetchOne(name, window)
                .map(table -> MetricResult.success(name, table))
                .onErrorResume(err -> {
                    log.error("Failed to fetch metric {}: {}", name, err.getMessage());
                    return Mono.just(MetricResult.failure(name, errorMessage(name, err)));
                }))
            .<Map<String, MetricResult>>collect(LinkedHashMap::new, (results, result) ->
                results.put(result.getMetric(), result))
            .doOnNext(results -> log.info("Fetched all metrics: {} of {} succeeded",
                results.values().stream().filter(MetricResult::isSuccess).count(), results.size()));
    }

    /**
     * User-visible message for a failed metric fetch.
     */
    public static String errorMessage(String metricName, Throwable error) {
        return "An error occurred while getting the metric '" + metricName + "': " + error.getMessage();
    }

    private void record(Timer.Sample timer, MetricDescriptor descriptor, String outcome) {
        timer.stop(Timer.builder(MetricsNames.METRIC_FETCH_LATENCY)
            .tag(MetricsTags.METRIC, descriptor.getName())
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry));
    }
}
