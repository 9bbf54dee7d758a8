package com.qqsuccubus.core.error;

import lombok.Getter;

/**
 * Requested metric name is not one of the catalog entries.
 */
@Getter
public class UnknownMetricException extends ConsoleException {

    private final String metricName;

    public UnknownMetricException(String metricName) {
        super("Unknown metric '" + metricName + "'");
        this.metricName = metricName;
    }
}
