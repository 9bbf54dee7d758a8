package com.qqsuccubus.console.cloudrun;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.console.gcp.AccessTokenProvider;
import com.qqsuccubus.core.error.ConfigurationException;
import com.qqsuccubus.core.error.TransportException;
import com.qqsuccubus.core.error.ValidationException;
import com.qqsuccubus.core.model.ResourceLimits;
import com.qqsuccubus.core.util.JsonUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the service against a local Reactor Netty server serving Cloud Run Admin API JSON.
 */
class CloudRunLimitsServiceTest {

    private static final String LOCATION = "/v2/projects/my-project/locations/europe-west1";
    private static final String SERVICE_JSON = "{"
        + "\"name\":\"projects/my-project/locations/europe-west1/services/%s\","
        + "\"etag\":\"\\\"v1\\\"\","
        + "\"labels\":{\"team\":\"security\"},"
        + "\"template\":{"
        + "\"scaling\":{\"maxInstanceCount\":3},"
        + "\"containers\":[{\"image\":\"vulnerables/web-dvwa\","
        + "\"resources\":{\"limits\":{\"memory\":\"512Mi\",\"cpu\":\"1000m\"},\"cpuIdle\":true}}]}}";

    private static final List<String> authorizations = new CopyOnWriteArrayList<>();
    private static final Map<String, String> patches = new ConcurrentHashMap<>();
    private static final AtomicInteger operationPolls = new AtomicInteger();

    private static DisposableServer server;

    private AtomicInteger tokenRequests;
    private AccessTokenProvider tokens;
    private SimpleMeterRegistry meterRegistry;

    @BeforeAll
    static void startServer() {
        server = HttpServer.create()
            .port(0)
            .route(routes -> routes
                .route(req -> req.method().equals(HttpMethod.PATCH), (req, res) -> req.receive().aggregate().asString()
                    .flatMap(body -> {
                        String service = req.uri().substring(req.uri().lastIndexOf('/') + 1);
                        patches.put(service, body);
                        String operation;
                        if (service.equals("rejected")) {
                            operation = "{\"name\":\"projects/my-project/locations/europe-west1/operations/op-rejected\","
                                + "\"done\":true,\"error\":{\"code\":3,\"message\":\"Invalid memory limit\"}}";
                        } else {
                            operation = "{\"name\":\"projects/my-project/locations/europe-west1/operations/op-"
                                + service + "\",\"done\":false}";
                        }
                        return res.header("Content-Type", "application/json").sendString(Mono.just(operation)).then();
                    }))
                .get(LOCATION + "/services/denied", (req, res) ->
                    res.status(HttpResponseStatus.FORBIDDEN)
                        .sendString(Mono.just("{\"error\":{\"code\":403,\"message\":\"Permission denied\",\"status\":\"PERMISSION_DENIED\"}}")))
                .get(LOCATION + "/services/{service}", (req, res) -> {
                    authorizations.add(req.requestHeaders().get("Authorization"));
                    String body = String.format(SERVICE_JSON, req.param("service"));
                    return res.header("Content-Type", "application/json").sendString(Mono.just(body));
                })
                .get(LOCATION + "/operations/op-dvwa", (req, res) -> {
                    // Done on the second poll
                    boolean done = operationPolls.incrementAndGet() >= 2;
                    String body = "{\"name\":\"projects/my-project/locations/europe-west1/operations/op-dvwa\",\"done\":" + done
                        + (done ? ",\"response\":{\"name\":\"projects/my-project/locations/europe-west1/services/dvwa\"}}" : "}");
                    return res.header("Content-Type", "application/json").sendString(Mono.just(body));
                })
                .get(LOCATION + "/operations/op-stuck", (req, res) ->
                    res.header("Content-Type", "application/json")
                        .sendString(Mono.just("{\"name\":\"projects/my-project/locations/europe-west1/operations/op-stuck\",\"done\":false}"))))
            .bindNow();
    }

    @AfterAll
    static void stopServer() {
        server.disposeNow();
    }

    @BeforeEach
    void setUp() {
        authorizations.clear();
        patches.clear();
        operationPolls.set(0);
        tokenRequests = new AtomicInteger();
        tokens = () -> Mono.fromCallable(() -> "token-" + tokenRequests.incrementAndGet());
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    @DisplayName("Both limits absent is rejected before any control-plane call")
    void testSetLimitsRequiresAtLeastOneLimit() {
        CloudRunLimitsService service = service("dvwa");

        StepVerifier.create(service.setLimits(null, " "))
            .expectErrorMatches(err -> err instanceof ValidationException
                && err.getMessage().equals("You must provide at least one of 'memory_limit' or 'cpu_limit' parameters."))
            .verify();

        assertEquals(0, tokenRequests.get());
        assertTrue(patches.isEmpty());
    }

    @Test
    void testMissingServiceConfigurationFailsBeforeAnyCall() {
        CloudRunLimitsService service = new CloudRunLimitsService(
            config("dvwa").toBuilder().serviceRegion(null).build(), tokens, meterRegistry);

        StepVerifier.create(service.setLimits("512Mi", null))
            .expectError(ConfigurationException.class)
            .verify();
        StepVerifier.create(service.getLimits())
            .expectError(ConfigurationException.class)
            .verify();

        assertEquals(0, tokenRequests.get());
    }

    @Test
    @DisplayName("Update sends the full service with new limits and waits for the rollout")
    void testSetLimitsPatchesServiceAndWaitsForOperation() {
        CloudRunLimitsService service = service("dvwa");

        StepVerifier.create(service.setLimits("1Gi", null))
            .expectNext(true)
            .verifyComplete();

        JsonNode patched = JsonUtils.readTree(patches.get("dvwa"));
        JsonNode container = patched.path("template").path("containers").path(0);
        assertEquals("1Gi", container.path("resources").path("limits").path("memory").asText());
        assertEquals("1000m", container.path("resources").path("limits").path("cpu").asText());
        // Fields outside the limits are sent back as read
        assertEquals("vulnerables/web-dvwa", container.path("image").asText());
        assertTrue(container.path("resources").path("cpuIdle").asBoolean());
        assertEquals(3, patched.path("template").path("scaling").path("maxInstanceCount").asInt());
        assertEquals("security", patched.path("labels").path("team").asText());
        assertEquals("\"v1\"", patched.path("etag").asText());

        assertEquals(2, operationPolls.get());
        assertEquals(List.of("Bearer token-1"), authorizations);
        assertEquals(1.0, meterRegistry.get("console.limits.updates.total").tag("outcome", "success").counter().count());
    }

    @Test
    void testGetLimitsReadsFirstContainer() {
        StepVerifier.create(service("dvwa").getLimits())
            .expectNext(new ResourceLimits("512Mi", "1000m"))
            .verifyComplete();

        assertEquals(List.of("Bearer token-1"), authorizations);
    }

    @Test
    void testFailedOperationReportsFalse() {
        CloudRunLimitsService service = service("rejected");

        StepVerifier.create(service.setLimits("64Ti", "1000m"))
            .expectNext(false)
            .verifyComplete();

        assertEquals(1.0, meterRegistry.get("console.limits.updates.total").tag("outcome", "failure").counter().count());
    }

    @Test
    void testHttpErrorsBecomeTransportErrors() {
        CloudRunLimitsService service = service("denied");

        StepVerifier.create(service.setLimits("512Mi", null))
            .expectErrorMatches(err -> err instanceof TransportException
                && err.getMessage().contains("HTTP 403")
                && err.getMessage().contains("Permission denied"))
            .verify();
        StepVerifier.create(service.getLimits())
            .expectError(TransportException.class)
            .verify();

        assertTrue(patches.isEmpty());
        assertEquals(1.0, meterRegistry.get("console.limits.updates.total").tag("outcome", "failure").counter().count());
    }

    @Test
    void testCredentialFailuresBecomeTransportErrors() {
        CloudRunLimitsService service = new CloudRunLimitsService(config("dvwa"),
            () -> Mono.error(new IllegalStateException("no credentials")), meterRegistry);

        StepVerifier.create(service.setLimits("512Mi", "1000m"))
            .expectErrorMatches(err -> err instanceof TransportException
                && err.getMessage().contains("no credentials"))
            .verify();
        StepVerifier.create(service.getLimits())
            .expectError(TransportException.class)
            .verify();
    }

    @Test
    void testOperationThatNeverFinishesTimesOut() {
        CloudRunLimitsService service = new CloudRunLimitsService(
            config("stuck").toBuilder().limitsUpdateTimeout(Duration.ofMillis(300)).build(), tokens, meterRegistry);

        StepVerifier.create(service.setLimits("1Gi", null))
            .expectErrorMatches(err -> err instanceof TransportException
                && err.getMessage().startsWith("Timed out"))
            .verify(Duration.ofSeconds(5));

        assertEquals(1.0, meterRegistry.get("console.limits.updates.total").tag("outcome", "failure").counter().count());
    }

    @Test
    void testLimitsOfReportsNotSpecified() {
        JsonNode noContainers = JsonUtils.readTree("{\"template\":{}}");
        JsonNode noLimits = JsonUtils.readTree("{\"template\":{\"containers\":[{\"image\":\"dvwa\"}]}}");

        assertEquals(new ResourceLimits("Not specified", "Not specified"), CloudRunLimitsService.limitsOf(noContainers));
        assertEquals(new ResourceLimits("Not specified", "Not specified"), CloudRunLimitsService.limitsOf(noLimits));
    }

    @Test
    void testWithLimitsLeavesInputUntouched() {
        JsonNode current = JsonUtils.readTree(String.format(SERVICE_JSON, "dvwa"));

        JsonNode updated = CloudRunLimitsService.withLimits(current, null, "2");

        assertEquals(new ResourceLimits("512Mi", "2"), CloudRunLimitsService.limitsOf(updated));
        assertEquals(new ResourceLimits("512Mi", "1000m"), CloudRunLimitsService.limitsOf(current));
    }

    @Test
    void testWithLimitsAddsContainerWhenMissing() {
        JsonNode empty = JsonUtils.readTree("{\"name\":\"projects/p/locations/r/services/s\"}");

        JsonNode updated = CloudRunLimitsService.withLimits(empty, "1Gi", null);

        assertEquals(1, updated.path("template").path("containers").size());
        assertEquals(new ResourceLimits("1Gi", "Not specified"), CloudRunLimitsService.limitsOf(updated));
    }

    private CloudRunLimitsService service(String serviceName) {
        return new CloudRunLimitsService(config(serviceName), tokens, meterRegistry);
    }

    private static ConsoleConfig config(String serviceName) {
        return ConsoleConfig.builder()
            .projectId("my-project")
            .serviceRegion("europe-west1")
            .serviceName(serviceName)
            .runUrl("http://localhost:" + server.port())
            .queryTimeout(Duration.ofSeconds(5))
            .operationPollInterval(Duration.ofMillis(10))
            .limitsUpdateTimeout(Duration.ofSeconds(5))
            .build();
    }
}
