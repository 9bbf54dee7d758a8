package com.qqsuccubus.core.normalize;

import com.qqsuccubus.core.error.UnknownMetricException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed table of the six Cloud Run metrics the console serves.
 * <p>
 * Lookup ignores case so {@code CPU_utilization} and {@code cpu_utilization} resolve to the
 * same entry. An unknown name is an error; there is no fallback descriptor.
 * </p>
 */
public final class MetricCatalog {

    public static final String REQUEST_COUNT = "request_count";
    public static final String REQUEST_LATENCIES = "request_latencies";
    public static final String INSTANCE_COUNT = "instance_count";
    public static final String CPU_UTILIZATION = "cpu_utilization";
    public static final String MEMORY_UTILIZATION = "memory_utilization";
    public static final String STARTUP_LATENCY = "startup_latency";

    private static final Map<String, MetricDescriptor> DESCRIPTORS = new LinkedHashMap<>();

    static {
        register(REQUEST_COUNT, "run.googleapis.com/request_count", "response_code", Reducer.SUM, false);
        register(REQUEST_LATENCIES, "run.googleapis.com/request_latencies", "response_code", Reducer.SUM, false);
        register(INSTANCE_COUNT, "run.googleapis.com/container/instance_count", "state", Reducer.MAX, false);
        register(CPU_UTILIZATION, "run.googleapis.com/container/cpu/utilizations", "service_name", Reducer.MAX, true);
        register(MEMORY_UTILIZATION, "run.googleapis.com/container/memory/utilizations", "service_name", Reducer.MAX, true);
        register(STARTUP_LATENCY, "run.googleapis.com/container/startup_latencies", "service_name", Reducer.MAX, false);
    }

    private MetricCatalog() {
    }

    private static void register(String name, String queryType, String groupLabel, Reducer reducer,
                                 boolean percentageScale) {
        DESCRIPTORS.put(name, MetricDescriptor.builder()
            .name(name)
            .queryType(queryType)
            .groupLabel(groupLabel)
            .reducer(reducer)
            .percentageScale(percentageScale)
            .build());
    }

    /**
     * @param name metric name, any case
     * @return the metric's descriptor
     * @throws UnknownMetricException if the name is not in the catalog
     */
    public static MetricDescriptor describe(String name) {
        if (name == null) {
            throw new UnknownMetricException("null");
        }
        MetricDescriptor descriptor = DESCRIPTORS.get(name.toLowerCase(Locale.ROOT));
        if (descriptor == null) {
            throw new UnknownMetricException(name);
        }
        return descriptor;
    }

    /**
     * @return the six metric names in catalog order
     */
    public static List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(DESCRIPTORS.keySet()));
    }
}
