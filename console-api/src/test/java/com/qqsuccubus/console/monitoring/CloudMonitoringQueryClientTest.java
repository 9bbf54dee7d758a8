package com.qqsuccubus.console.monitoring;

import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.core.error.ConfigurationException;
import com.qqsuccubus.core.error.TransportException;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a local Reactor Netty server serving Cloud Monitoring JSON.
 */
class CloudMonitoringQueryClientTest {

    private static final Instant START = Instant.parse("2024-01-19T15:00:00Z");
    private static final Instant END = Instant.parse("2024-01-19T16:00:00Z");

    private static final List<String> authorizations = new CopyOnWriteArrayList<>();
    private static final List<QueryStringDecoder> queries = new CopyOnWriteArrayList<>();

    private static DisposableServer server;
    private static String fixture;

    @BeforeAll
    static void startServer() throws Exception {
        fixture = TimeSeriesResultTest.read("request_count.json");
        server = HttpServer.create()
            .port(0)
            .route(routes -> routes
                .get("/v3/projects/paged/timeSeries", (req, res) -> {
                    authorizations.add(req.requestHeaders().get("Authorization"));
                    QueryStringDecoder query = new QueryStringDecoder(req.uri());
                    queries.add(query);
                    // First page points to a second, identical page
                    String body = query.parameters().containsKey("pageToken")
                        ? fixture
                        : fixture.replace("\"unit\": \"1\"", "\"nextPageToken\": \"page-2\"");
                    return res.header("Content-Type", "application/json").sendString(Mono.just(body));
                })
                .get("/v3/projects/empty/timeSeries", (req, res) ->
                    res.header("Content-Type", "application/json").sendString(Mono.just("{}")))
                .get("/v3/projects/denied/timeSeries", (req, res) ->
                    res.status(HttpResponseStatus.FORBIDDEN)
                        .sendString(Mono.just("{\"error\":{\"code\":403,\"message\":\"Permission denied\",\"status\":\"PERMISSION_DENIED\"}}")))
                .get("/v3/projects/garbled/timeSeries", (req, res) ->
                    res.sendString(Mono.just("<html>not json</html>"))))
            .bindNow();
    }

    @AfterAll
    static void stopServer() {
        server.disposeNow();
    }

    @BeforeEach
    void reset() {
        authorizations.clear();
        queries.clear();
    }

    @Test
    void testFollowsPagesAndSendsBearerToken() {
        CloudMonitoringQueryClient client = client("paged");

        StepVerifier.create(client.queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END))
            .assertNext(raw -> {
                assertEquals(List.of("200", "200", "503", "200", "200", "503"), raw.getColumns());
                assertEquals(2, raw.rowCount());
            })
            .verifyComplete();

        assertEquals(2, queries.size());
        assertEquals(List.of("Bearer test-token", "Bearer test-token"), authorizations);
        assertEquals("page-2", queries.get(1).parameters().get("pageToken").get(0));
    }

    @Test
    void testQueryCarriesFilterAndInterval() {
        client("paged").queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END)
            .block(Duration.ofSeconds(10));

        QueryStringDecoder first = queries.get(0);
        assertEquals("metric.type = \"run.googleapis.com/request_count\" AND resource.labels.service_name = \"dvwa\"",
            first.parameters().get("filter").get(0));
        assertEquals("2024-01-19T15:00:00Z", first.parameters().get("interval.startTime").get(0));
        assertEquals("2024-01-19T16:00:00Z", first.parameters().get("interval.endTime").get(0));
        assertEquals("FULL", first.parameters().get("view").get(0));
    }

    @Test
    void testNoSeriesGivesEmptyTable() {
        StepVerifier.create(client("empty").queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END))
            .assertNext(raw -> assertTrue(raw.isEmpty()))
            .verifyComplete();
    }

    @Test
    void testHttpErrorBecomesTransportException() {
        StepVerifier.create(client("denied").queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END))
            .expectErrorMatches(err -> err instanceof TransportException
                && err.getMessage().equals("Cloud Monitoring returned HTTP 403: Permission denied"))
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testMalformedBodyBecomesTransportException() {
        StepVerifier.create(client("garbled").queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END))
            .expectError(TransportException.class)
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testTokenFailurePropagates() {
        CloudMonitoringQueryClient client = new CloudMonitoringQueryClient(config("paged"),
            () -> Mono.error(new TransportException("Could not obtain Google credentials: none")));

        StepVerifier.create(client.queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END))
            .expectError(TransportException.class)
            .verify(Duration.ofSeconds(10));
        assertTrue(queries.isEmpty());
    }

    @Test
    void testMissingProjectFailsWithoutRequest() {
        CloudMonitoringQueryClient client = new CloudMonitoringQueryClient(config(null), () -> Mono.just("test-token"));

        StepVerifier.create(client.queryRaw("run.googleapis.com/request_count", "response_code", "dvwa", START, END))
            .expectError(ConfigurationException.class)
            .verify(Duration.ofSeconds(10));
        assertTrue(queries.isEmpty());
    }

    @Test
    void testFilterQuotesTypeAndService() {
        assertEquals("metric.type = \"run.googleapis.com/container/instance_count\" AND resource.labels.service_name = \"api\"",
            CloudMonitoringQueryClient.filter("run.googleapis.com/container/instance_count", "api"));
    }

    private static CloudMonitoringQueryClient client(String project) {
        return new CloudMonitoringQueryClient(config(project), () -> Mono.just("test-token"));
    }

    private static ConsoleConfig config(String project) {
        return ConsoleConfig.builder()
            .projectId(project)
            .serviceName("dvwa")
            .monitoringUrl("http://localhost:" + server.port())
            .queryTimeout(Duration.ofSeconds(5))
            .build();
    }
}
