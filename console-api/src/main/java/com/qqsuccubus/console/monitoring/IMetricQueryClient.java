package com.qqsuccubus.console.monitoring;

import com.qqsuccubus.core.model.RawMetricTable;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Raw metric-query transport (Dependency Inversion Principle).
 * <p>
 * Implementations fetch one metric type for one service from the monitoring backend and
 * pivot the series into a {@link RawMetricTable}. Transport failures are signalled as
 * {@link com.qqsuccubus.core.error.TransportException}.
 * </p>
 */
public interface IMetricQueryClient {

    /**
     * @param queryType   backend metric type, e.g. {@code run.googleapis.com/request_count}
     * @param groupLabel  series label that names each column
     * @param serviceName Cloud Run service to select
     * @param start       interval start (inclusive)
     * @param end         interval end
     * @return raw table, possibly with zero rows
     */
    Mono<RawMetricTable> queryRaw(String queryType, String groupLabel, String serviceName, Instant start, Instant end);
}
