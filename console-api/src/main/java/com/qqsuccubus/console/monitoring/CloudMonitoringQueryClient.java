package com.qqsuccubus.console.monitoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.console.gcp.AccessTokenProvider;
import com.qqsuccubus.console.gcp.GoogleApiErrors;
import com.qqsuccubus.core.error.TransportException;
import com.qqsuccubus.core.model.RawMetricTable;
import com.qqsuccubus.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cloud Monitoring v3 REST client using reactor-netty HttpClient.
 * <p>
 * Lists raw (unaligned) time series of one metric type for one Cloud Run service and pivots
 * them into a {@link RawMetricTable}. Result pages are followed until
 * {@code nextPageToken} is empty.
 * </p>
 * <p>
 * Configuration:
 * - Production: https://monitoring.googleapis.com with application default credentials
 * - Tests: any base URL serving the same JSON
 * </p>
 */
public class CloudMonitoringQueryClient implements IMetricQueryClient {
    private static final Logger log = LoggerFactory.getLogger(CloudMonitoringQueryClient.class);

    private final HttpClient httpClient;
    private final ConsoleConfig config;
    private final AccessTokenProvider tokenProvider;

    public CloudMonitoringQueryClient(ConsoleConfig config, AccessTokenProvider tokenProvider) {
        this.config = config;
        this.tokenProvider = tokenProvider;
        this.httpClient = HttpClient.create()
            .baseUrl(config.getMonitoringUrl())
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(config.getQueryTimeout());

        log.info("CloudMonitoringQueryClient initialized with {}", config.getMonitoringUrl());
    }

    @Override
    public Mono<RawMetricTable> queryRaw(String queryType, String groupLabel, String serviceName,
                                         Instant start, Instant end) {
        return Mono.defer(() -> {
            String path = "/v3/projects/" + config.requireProjectId() + "/timeSeries"
                + "?filter=" + encode(filter(queryType, serviceName))
                + "&interval.startTime=" + encode(start.toString())
                + "&interval.endTime=" + encode(end.toString())
                + "&view=FULL";

            log.debug("Listing time series: type={}, service={}, [{}, {})", queryType, serviceName, start, end);

            return tokenProvider.accessToken()
                .flatMap(token -> fetchPage(path, token, null)
                    .expand(page -> hasNextPage(page)
                        ? fetchPage(path, token, page.getNextPageToken())
                        : Mono.empty())
                    .collectList())
                .map(pages -> {
                    TimeSeriesResult result = TimeSeriesResult.from(pages);
                    log.debug("Cloud Monitoring returned {} series for {}", result.size(), queryType);
                    return result.toRawTable(groupLabel);
                });
        });
    }

    static String filter(String queryType, String serviceName) {
        return "metric.type = \"" + queryType + "\" AND resource.labels.service_name = \"" + serviceName + "\"";
    }

    private Mono<ListTimeSeriesResponse> fetchPage(String path, String token, String pageToken) {
        String uri = pageToken == null ? path : path + "&pageToken=" + encode(pageToken);
        return httpClient
            .headers(h -> h.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token))
            .get()
            .uri(uri)
            .responseSingle((response, body) -> body.asString()
                .defaultIfEmpty("")
                .flatMap(text -> {
                    int status = response.status().code();
                    if (status != 200) {
                        log.error("Cloud Monitoring query failed: HTTP {} {}", status, text);
                        return Mono.error(new TransportException(
                            "Cloud Monitoring returned HTTP " + status + ": " + GoogleApiErrors.message(text)));
                    }
                    try {
                        return Mono.just(JsonUtils.readValue(text, ListTimeSeriesResponse.class));
                    } catch (IllegalArgumentException e) {
                        log.error("Failed to parse Cloud Monitoring response: {}", e.getMessage(), e);
                        return Mono.error(new TransportException("Malformed Cloud Monitoring response", e));
                    }
                }))
            .onErrorMap(err -> !(err instanceof TransportException), err -> {
                log.error("Failed to query Cloud Monitoring: {}", err.getMessage());
                return new TransportException("Cloud Monitoring request failed: " + err.getMessage(), err);
            });
    }

    private static boolean hasNextPage(ListTimeSeriesResponse page) {
        return page.getNextPageToken() != null && !page.getNextPageToken().isEmpty();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Data class for the {@code timeSeries.list} response.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListTimeSeriesResponse {
        private List<TimeSeries> timeSeries;
        private String nextPageToken;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeSeries {
        private LabelSet metric;
        private LabelSet resource;
        private String metricKind;
        private String valueType;
        private List<Point> points;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LabelSet {
        private String type;
        private Map<String, String> labels;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        private Interval interval;
        private TypedValue value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Interval {
        private Instant startTime;
        private Instant endTime;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TypedValue {
        private Double doubleValue;
        private Long int64Value;
        private Boolean boolValue;
        private DistributionValue distributionValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DistributionValue {
        private Long count;
        private Double mean;
        private Range range;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Range {
        private Double min;
        private Double max;
    }
}
