package com.qqsuccubus.console.monitoring;

import com.qqsuccubus.console.monitoring.CloudMonitoringQueryClient.DistributionValue;
import com.qqsuccubus.console.monitoring.CloudMonitoringQueryClient.ListTimeSeriesResponse;
import com.qqsuccubus.console.monitoring.CloudMonitoringQueryClient.Point;
import com.qqsuccubus.console.monitoring.CloudMonitoringQueryClient.TimeSeries;
import com.qqsuccubus.console.monitoring.CloudMonitoringQueryClient.TypedValue;
import com.qqsuccubus.core.model.RawMetricTable;
import com.qqsuccubus.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Wrapper for Cloud Monitoring time series with a pivot into a {@link RawMetricTable}.
 */
public class TimeSeriesResult {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesResult.class);

    private final List<TimeSeries> series;

    private TimeSeriesResult(List<TimeSeries> series) {
        this.series = series;
    }

    /**
     * Concatenates the series of all result pages.
     *
     * @param pages {@code timeSeries.list} pages in request order
     * @return TimeSeriesResult instance
     */
    public static TimeSeriesResult from(List<ListTimeSeriesResponse> pages) {
        List<TimeSeries> all = new ArrayList<>();
        for (ListTimeSeriesResponse page : pages) {
            if (page != null && page.getTimeSeries() != null) {
                all.addAll(page.getTimeSeries());
            }
        }
        return new TimeSeriesResult(all);
    }

    public static TimeSeriesResult empty() {
        return new TimeSeriesResult(Collections.emptyList());
    }

    /**
     * Pivots the series into a table: one column per series named by its {@code labelName}
     * value, one row per distinct point end time.
     * <p>
     * Metric labels take precedence over resource labels. A series without the label is
     * skipped. Several series may share a label; their columns stay separate here and are
     * reduced during normalization.
     * </p>
     *
     * @param labelName label naming each column (e.g. "response_code", "state", "service_name")
     * @return raw table with rows ascending by timestamp
     */
    public RawMetricTable toRawTable(String labelName) {
        List<String> labels = new ArrayList<>();
        List<TimeSeries> kept = new ArrayList<>();
        for (TimeSeries ts : series) {
            String label = labelOf(ts, labelName);
            if (label == null) {
                log.debug("Series missing label '{}': metric={}, resource={}", labelName, ts.getMetric(), ts.getResource());
                continue;
            }
            labels.add(label);
            kept.add(ts);
        }

        TreeMap<Instant, Sample[]> rows = new TreeMap<>();
        for (int column = 0; column < kept.size(); column++) {
            List<Point> points = kept.get(column).getPoints();
            if (points == null) {
                continue;
            }
            for (Point point : points) {
                if (point.getInterval() == null || point.getInterval().getEndTime() == null) {
                    continue;
                }
                Sample sample = toSample(point.getValue());
                if (sample == null) {
                    continue;
                }
                rows.computeIfAbsent(point.getInterval().getEndTime(), ts -> new Sample[kept.size()])[column] = sample;
            }
        }

        RawMetricTable.Builder builder = RawMetricTable.builder();
        labels.forEach(builder::column);
        for (Map.Entry<Instant, Sample[]> row : rows.entrySet()) {
            builder.row(row.getKey(), row.getValue());
        }
        return builder.build();
    }

    private static String labelOf(TimeSeries ts, String labelName) {
        if (ts.getMetric() != null && ts.getMetric().getLabels() != null
            && ts.getMetric().getLabels().containsKey(labelName)) {
            return ts.getMetric().getLabels().get(labelName);
        }
        if (ts.getResource() != null && ts.getResource().getLabels() != null) {
            return ts.getResource().getLabels().get(labelName);
        }
        return null;
    }

    private static Sample toSample(TypedValue value) {
        if (value == null) {
            return null;
        }
        if (value.getDoubleValue() != null) {
            return Sample.scalar(value.getDoubleValue());
        }
        if (value.getInt64Value() != null) {
            return Sample.scalar(value.getInt64Value());
        }
        if (value.getBoolValue() != null) {
            return Sample.scalar(value.getBoolValue() ? 1.0 : 0.0);
        }
        DistributionValue distribution = value.getDistributionValue();
        if (distribution != null) {
            long count = distribution.getCount() != null ? distribution.getCount() : 0L;
            double mean = distribution.getMean() != null ? distribution.getMean() : 0.0;
            double min = mean;
            double max = mean;
            if (distribution.getRange() != null) {
                min = distribution.getRange().getMin() != null ? distribution.getRange().getMin() : mean;
                max = distribution.getRange().getMax() != null ? distribution.getRange().getMax() : mean;
            }
            return Sample.distribution(count, mean, min, max);
        }
        log.debug("Skipping point with unsupported value type: {}", value);
        return null;
    }

    /**
     * Gets all series as a list.
     *
     * @return List of time series
     */
    public List<TimeSeries> getSeries() {
        return Collections.unmodifiableList(series);
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    public int size() {
        return series.size();
    }
}
