package com.qqsuccubus.core.normalize;

import lombok.Builder;
import lombok.Value;

/**
 * Static policy governing how one named metric is queried and reduced.
 */
@Value
@Builder
public class MetricDescriptor {
    /**
     * Public metric name, e.g. {@code request_count}.
     */
    String name;

    /**
     * Monitoring backend metric type, e.g. {@code run.googleapis.com/request_count}.
     */
    String queryType;

    /**
     * Series label whose value becomes the table column, e.g. {@code response_code}.
     */
    String groupLabel;

    Reducer reducer;

    /**
     * Values arrive as 0-1 fractions and are reported as percentages.
     */
    boolean percentageScale;
}
