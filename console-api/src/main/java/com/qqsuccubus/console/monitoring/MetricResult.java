package com.qqsuccubus.console.monitoring;

import com.qqsuccubus.core.model.NormalizedTable;
import lombok.Value;

/**
 * Outcome of one metric fetch inside an all-metrics request: a table or an error message.
 */
@Value
public class MetricResult {
    String metric;
    NormalizedTable table;
    String error;

    public static MetricResult success(String metric, NormalizedTable table) {
        return new MetricResult(metric, table, null);
    }

    public static MetricResult failure(String metric, String error) {
        return new MetricResult(metric, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the table's wire frame on success, otherwise the error message
     */
    public Object toWire() {
        return isSuccess() ? table.toFrame() : error;
    }
}
