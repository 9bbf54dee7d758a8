package com.qqsuccubus.core.normalize;

import com.qqsuccubus.core.error.UnknownMetricException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricCatalogTest {

    @Test
    void testCatalogHasExactlySixMetrics() {
        assertEquals(List.of(
            "request_count",
            "request_latencies",
            "instance_count",
            "cpu_utilization",
            "memory_utilization",
            "startup_latency"
        ), MetricCatalog.names());
    }

    @Test
    void testCounterMetrics_AreSummed() {
        MetricDescriptor requests = MetricCatalog.describe("request_count");
        assertEquals("run.googleapis.com/request_count", requests.getQueryType());
        assertEquals("response_code", requests.getGroupLabel());
        assertEquals(Reducer.SUM, requests.getReducer());
        assertFalse(requests.isPercentageScale());

        MetricDescriptor latencies = MetricCatalog.describe("request_latencies");
        assertEquals("run.googleapis.com/request_latencies", latencies.getQueryType());
        assertEquals("response_code", latencies.getGroupLabel());
        assertEquals(Reducer.SUM, latencies.getReducer());
        assertFalse(latencies.isPercentageScale());
    }

    @Test
    void testGaugeMetrics_TakeTheMaximum() {
        MetricDescriptor instances = MetricCatalog.describe("instance_count");
        assertEquals("run.googleapis.com/container/instance_count", instances.getQueryType());
        assertEquals("state", instances.getGroupLabel());
        assertEquals(Reducer.MAX, instances.getReducer());
        assertFalse(instances.isPercentageScale());

        MetricDescriptor startup = MetricCatalog.describe("startup_latency");
        assertEquals("run.googleapis.com/container/startup_latencies", startup.getQueryType());
        assertEquals("service_name", startup.getGroupLabel());
        assertEquals(Reducer.MAX, startup.getReducer());
        assertFalse(startup.isPercentageScale());
    }

    @Test
    void testUtilizationMetrics_AreScaledToPercent() {
        MetricDescriptor cpu = MetricCatalog.describe("cpu_utilization");
        assertEquals("run.googleapis.com/container/cpu/utilizations", cpu.getQueryType());
        assertEquals("service_name", cpu.getGroupLabel());
        assertEquals(Reducer.MAX, cpu.getReducer());
        assertTrue(cpu.isPercentageScale());

        MetricDescriptor memory = MetricCatalog.describe("memory_utilization");
        assertEquals("run.googleapis.com/container/memory/utilizations", memory.getQueryType());
        assertEquals("service_name", memory.getGroupLabel());
        assertEquals(Reducer.MAX, memory.getReducer());
        assertTrue(memory.isPercentageScale());
    }

    @Test
    void testLookupIgnoresCase() {
        assertSame(MetricCatalog.describe("cpu_utilization"), MetricCatalog.describe("CPU_utilization"));
    }

    @Test
    void testDescriptorsAreStable() {
        for (String name : MetricCatalog.names()) {
            assertEquals(MetricCatalog.describe(name), MetricCatalog.describe(name));
            assertEquals(name, MetricCatalog.describe(name).getName());
        }
    }

    @Test
    void testUnknownMetric_IsReported() {
        UnknownMetricException error = assertThrows(UnknownMetricException.class,
            () -> MetricCatalog.describe("disk_utilization"));
        assertEquals("disk_utilization", error.getMetricName());

        assertThrows(UnknownMetricException.class, () -> MetricCatalog.describe(null));
    }
}
