package com.qqsuccubus.console.cloudrun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.console.gcp.AccessTokenProvider;
import com.qqsuccubus.console.gcp.GoogleApiErrors;
import com.qqsuccubus.core.error.ConsoleException;
import com.qqsuccubus.core.error.TransportException;
import com.qqsuccubus.core.error.ValidationException;
import com.qqsuccubus.core.metrics.MetricsNames;
import com.qqsuccubus.core.metrics.MetricsTags;
import com.qqsuccubus.core.model.ResourceLimits;
import com.qqsuccubus.core.util.JsonUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

/**
 * Cloud Run Admin API v2 client for container resource limits, using reactor-netty HttpClient.
 * <p>
 * Only the first container of the service template is touched. An update reads the service,
 * replaces the given limit keys ({@code memory}, {@code cpu}) and sends the whole service back
 * with every other field as read. Cloud Run answers with a long-running operation, which is
 * polled until done; the update completes when the new revision has rolled out.
 * </p>
 * <p>
 * Configuration:
 * - Production: https://run.googleapis.com with application default credentials
 * - Tests: any base URL serving the same JSON
 * </p>
 */
public class CloudRunLimitsService implements IResourceLimitsService {
    private static final Logger log = LoggerFactory.getLogger(CloudRunLimitsService.class);

    static final String MEMORY = "memory";
    static final String CPU = "cpu";

    private final HttpClient httpClient;
    private final ConsoleConfig config;
    private final AccessTokenProvider tokenProvider;
    private final MeterRegistry meterRegistry;

    public CloudRunLimitsService(ConsoleConfig config, AccessTokenProvider tokenProvider, MeterRegistry meterRegistry) {
        this.config = config;
        this.tokenProvider = tokenProvider;
        this.meterRegistry = meterRegistry;
        this.httpClient = HttpClient.create()
            .baseUrl(config.getRunUrl())
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(config.getQueryTimeout());
    }

    @Override
    public Mono<ResourceLimits> getLimits() {
        return Mono.defer(() -> {
                String resourceName = config.requireServiceResourceName();
                return tokenProvider.accessToken()
                    .flatMap(token -> send(HttpMethod.GET, resourceName, token, null));
            })
            .map(CloudRunLimitsService::limitsOf)
            .onErrorMap(CloudRunLimitsService::isTransportFailure, err ->
                new TransportException("Failed to fetch resource limits: " + err.getMessage(), err));
    }

    @Override
    public Mono<Boolean> setLimits(String memory, String cpu) {
        if (isBlank(memory) && isBlank(cpu)) {
            return Mono.error(new ValidationException(
                "You must provide at least one of 'memory_limit' or 'cpu_limit' parameters."));
        }

        return Mono.defer(() -> {
                String resourceName = config.requireServiceResourceName();
                return tokenProvider.accessToken()
                    .flatMap(token -> send(HttpMethod.GET, resourceName, token, null)
                        .flatMap(current -> {
                            log.info("Updating limits of {}: memory={}, cpu={}", resourceName,
                                isBlank(memory) ? "(unchanged)" : memory, isBlank(cpu) ? "(unchanged)" : cpu);
                            return send(HttpMethod.PATCH, resourceName, token, withLimits(current, memory, cpu));
                        })
                        .flatMap(operation -> awaitOperation(operation, token)))
                    .map(operation -> completed(resourceName, operation))
                    .timeout(config.getLimitsUpdateTimeout(), Mono.error(new TransportException(
                        "Timed out after " + config.getLimitsUpdateTimeout() + " waiting for " + resourceName)));
            })
            .onErrorMap(CloudRunLimitsService::isTransportFailure, err ->
                new TransportException("Failed to update resource limits: " + err.getMessage(), err))
            .doOnNext(ok -> countUpdate(ok ? "success" : "failure"))
            .doOnError(err -> {
                log.error("Failed to update resource limits: {}", err.getMessage());
                countUpdate("failure");
            });
    }

    /**
     * Reads the limits of the template's first container.
     */
    static ResourceLimits limitsOf(JsonNode service) {
        JsonNode limits = service.path("template").path("containers").path(0).path("resources").path("limits");
        return new ResourceLimits(limitOrNotSpecified(limits, MEMORY), limitOrNotSpecified(limits, CPU));
    }

    /**
     * Copies {@code service} with the given limits set on its first container. Fields this
     * class does not know about are carried over unchanged.
     */
    static ObjectNode withLimits(JsonNode service, String memory, String cpu) {
        if (!service.isObject()) {
            throw new TransportException("Cloud Run returned a malformed service");
        }
        ObjectNode updated = ((ObjectNode) service).deepCopy();
        ObjectNode template = objectField(updated, "template");

        ArrayNode containers = template.get("containers") instanceof ArrayNode
            ? (ArrayNode) template.get("containers")
            : template.putArray("containers");
        if (containers.isEmpty() || !containers.get(0).isObject()) {
            containers.insertObject(0);
        }
        ObjectNode limits = objectField(objectField((ObjectNode) containers.get(0), "resources"), "limits");

        if (!isBlank(memory)) {
            limits.put(MEMORY, memory);
        }
        if (!isBlank(cpu)) {
            limits.put(CPU, cpu);
        }
        return updated;
    }

    private boolean completed(String resourceName, JsonNode operation) {
        JsonNode error = operation.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            log.error("Update of {} failed: {}", resourceName, error.path("message").asText(error.toString()));
            return false;
        }
        log.info("Service {} updated", operation.path("response").path("name").asText(resourceName));
        return true;
    }

    private Mono<JsonNode> awaitOperation(JsonNode operation, String token) {
        if (operation.path("done").asBoolean(false)) {
            return Mono.just(operation);
        }
        String name = operation.path("name").asText("");
        if (name.isEmpty()) {
            return Mono.error(new TransportException("Cloud Run returned an operation without a name"));
        }
        log.debug("Waiting for operation {}", name);
        return Mono.delay(config.getOperationPollInterval())
            .then(send(HttpMethod.GET, name, token, null))
            .flatMap(next -> awaitOperation(next, token));
    }

    private Mono<JsonNode> send(HttpMethod method, String resourceName, String token, JsonNode body) {
        HttpClient client = httpClient.headers(h -> h.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token));
        String uri = "/v2/" + resourceName;

        HttpClient.ResponseReceiver<?> receiver = body == null
            ? client.request(method).uri(uri)
            : client.headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
                .request(method)
                .uri(uri)
                .send(ByteBufFlux.fromString(Mono.just(JsonUtils.writeValueAsString(body))));

        return receiver
            .responseSingle((response, content) -> content.asString()
                .defaultIfEmpty("")
                .flatMap(text -> {
                    int status = response.status().code();
                    if (status != 200) {
                        log.error("Cloud Run {} {} failed: HTTP {} {}", method, uri, status, text);
                        return Mono.error(new TransportException(
                            "Cloud Run returned HTTP " + status + ": " + GoogleApiErrors.message(text)));
                    }
                    try {
                        return Mono.just(JsonUtils.readTree(text));
                    } catch (IllegalArgumentException e) {
                        log.error("Failed to parse Cloud Run response: {}", e.getMessage(), e);
                        return Mono.error(new TransportException("Malformed Cloud Run response", e));
                    }
                }))
            .onErrorMap(CloudRunLimitsService::isTransportFailure, err ->
                new TransportException("Cloud Run request failed: " + err.getMessage(), err));
    }

    private static ObjectNode objectField(ObjectNode parent, String field) {
        JsonNode node = parent.get(field);
        return node instanceof ObjectNode ? (ObjectNode) node : parent.putObject(field);
    }

    private static String limitOrNotSpecified(JsonNode limits, String key) {
        JsonNode value = limits.get(key);
        return value == null || value.isNull() ? ResourceLimits.NOT_SPECIFIED : value.asText();
    }

    private static boolean isTransportFailure(Throwable err) {
        return !(err instanceof ConsoleException);
    }

    private void countUpdate(String outcome) {
        meterRegistry.counter(MetricsNames.LIMITS_UPDATES_TOTAL, MetricsTags.OUTCOME, outcome).increment();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
