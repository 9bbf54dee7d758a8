package com.qqsuccubus.console.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.console.auth.AuthenticationException;
import com.qqsuccubus.console.auth.TokenService;
import com.qqsuccubus.console.auth.UserService;
import com.qqsuccubus.console.cloudrun.IResourceLimitsService;
import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.console.metrics.ApiMetrics;
import com.qqsuccubus.console.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.console.monitoring.MetricResult;
import com.qqsuccubus.console.monitoring.MetricService;
import com.qqsuccubus.core.error.TransportException;
import com.qqsuccubus.core.error.UnknownMetricException;
import com.qqsuccubus.core.error.ValidationException;
import com.qqsuccubus.core.model.TimeWindow;
import com.qqsuccubus.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP server for the console API.
 * <p>
 * Every {@code /api/*} route takes a JSON object body (an empty body counts as {@code {}}) and
 * answers JSON. All of them except login require a bearer token.
 * </p>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String BEARER = "Bearer ";
    private static final String APPLICATION_JSON = "application/json";

    private final ConsoleConfig config;
    private final UserService userService;
    private final TokenService tokenService;
    private final MetricService metricService;
    private final IResourceLimitsService limitsService;
    private final PrometheusMetricsExporter metricsExporter;
    private final ApiMetrics apiMetrics;
    private final Clock clock;

    private DisposableServer server;

    public HttpServer(
        ConsoleConfig config,
        UserService userService,
        TokenService tokenService,
        MetricService metricService,
        IResourceLimitsService limitsService,
        PrometheusMetricsExporter metricsExporter,
        ApiMetrics apiMetrics,
        Clock clock
    ) {
        this.config = config;
        this.userService = userService;
        this.tokenService = tokenService;
        this.metricService = metricService;
        this.limitsService = limitsService;
        this.metricsExporter = metricsExporter;
        this.apiMetrics = apiMetrics;
        this.clock = clock;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server; port 0 binds an ephemeral port
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/", (req, res) ->
                res.status(200).sendString(Mono.just("The server is running!"))
            )
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // CORS preflight
            .route(req -> HttpMethod.OPTIONS.equals(req.method()) && req.uri().startsWith("/api/"),
                (req, res) -> res.status(HttpResponseStatus.NO_CONTENT)
                    .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, config.getCorsOrigins())
                    .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
                    .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Authorization, Content-Type")
                    .header(HttpHeaderNames.ACCESS_CONTROL_MAX_AGE, "3600")
                    .send()
            )
            .post("/api/login", (req, res) ->
                handle(req, res, "/api/login", false, ApiRequests.Credentials.class, body ->
                    userService.login(body.getUsername(), body.getPassword())
                        .map(token -> ApiResponse.ok(Map.of("access_token", token))))
            )
            .post("/api/register_user", (req, res) ->
                handle(req, res, "/api/register_user", true, ApiRequests.Credentials.class, body ->
                    userService.register(body.getUsername(), body.getPassword())
                        .map(created -> created
                            ? new ApiResponse(HttpResponseStatus.CREATED, Map.of("message", "User created successfully"))
                            : new ApiResponse(HttpResponseStatus.CONFLICT, Map.of("error", "Username already exists"))))
            )
            .post("/api/revoke_user", (req, res) ->
                handle(req, res, "/api/revoke_user", true, ApiRequests.Credentials.class, body ->
                    userService.revoke(body.getUsername())
                        .map(revoked -> revoked
                            ? ApiResponse.ok(Map.of("message", "User revoked successfully"))
                            : new ApiResponse(HttpResponseStatus.NOT_FOUND, Map.of("error", "User not found"))))
            )
            .post("/api/list_users", (req, res) ->
                handle(req, res, "/api/list_users", true, ApiRequests.Credentials.class, body ->
                    userService.list().map(ApiResponse::ok))
            )
            .post("/api/system_metric", (req, res) ->
                handle(req, res, "/api/system_metric", true, ApiRequests.MetricQuery.class, this::systemMetric)
            )
            .post("/api/all_system_metric", (req, res) ->
                handle(req, res, "/api/all_system_metric", true, ApiRequests.MetricQuery.class, body ->
                    metricService.fetchAll(window(body))
                        .map(results -> {
                            Map<String, Object> wire = new LinkedHashMap<>();
                            for (Map.Entry<String, MetricResult> entry : results.entrySet()) {
                                wire.put(entry.getKey(), entry.getValue().toWire());
                            }
                            return ApiResponse.ok(wire);
                        }))
            )
            .post("/api/cloud_run_upscale", (req, res) ->
                handle(req, res, "/api/cloud_run_upscale", true, ApiRequests.Upscale.class, body ->
                    limitsService.setLimits(body.getMemoryLimit(), body.getCpuLimit())
                        .map(updated -> updated
                            ? ApiResponse.ok("Cloud Run service successfully upscaled.")
                            : new ApiResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                                "Cloud Run service could not be upscaled.")))
            )
            .post("/api/get_resources_limits", (req, res) ->
                handle(req, res, "/api/get_resources_limits", true, ApiRequests.Credentials.class, body ->
                    limitsService.getLimits().map(ApiResponse::ok))
            );
    }

    private Mono<ApiResponse> systemMetric(ApiRequests.MetricQuery body) {
        if (body.getMetric() == null || body.getMetric().isBlank()) {
            return Mono.error(new ValidationException("'metric' is required"));
        }
        return metricService.fetchOne(body.getMetric(), window(body))
            .map(table -> ApiResponse.ok(table.toFrame()))
            .onErrorResume(err -> !(err instanceof AuthenticationException), err ->
                Mono.just(errorResponse("/api/system_metric", err,
                    MetricService.errorMessage(body.getMetric(), err))));
    }

    private TimeWindow window(ApiRequests.MetricQuery body) {
        return TimeWindow.resolve(body.daysOrZero(), body.hoursOrZero(), body.minutesOrZero(), clock.instant());
    }

    /**
     * Runs one API call: authenticates, parses the body, invokes the action and writes the
     * JSON response. Failures are mapped to status codes by {@link #statusOf(Throwable)}.
     */
    private <T> Mono<Void> handle(HttpServerRequest req, HttpServerResponse res, String route,
                                  boolean authenticated, Class<T> bodyType,
                                  Function<T, Mono<ApiResponse>> action) {
        Mono<String> caller = authenticated ? authenticate(req) : Mono.just("anonymous");
        return caller
            .flatMap(user -> readBody(req, bodyType)
                .flatMap(body -> {
                    log.debug("{} called by {}", route, user);
                    return action.apply(body);
                }))
            .onErrorResume(err -> Mono.just(errorResponse(route, err, err.getMessage())))
            .flatMap(response -> send(res, route, response));
    }

    private Mono<String> authenticate(HttpServerRequest req) {
        return Mono.fromCallable(() -> {
            String header = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);
            if (header == null || !header.startsWith(BEARER)) {
                throw new AuthenticationException("Missing Authorization Header");
            }
            return tokenService.verify(header.substring(BEARER.length()).trim());
        });
    }

    private <T> Mono<T> readBody(HttpServerRequest req, Class<T> bodyType) {
        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .map(text -> {
                String json = text.isBlank() ? "{}" : text;
                try {
                    JsonNode tree = JsonUtils.readTree(json);
                    if (!tree.isObject()) {
                        throw new MalformedBodyException();
                    }
                    return JsonUtils.treeToValue(tree, bodyType);
                } catch (IllegalArgumentException e) {
                    log.debug("Rejected request body: {}", e.getMessage());
                    throw new MalformedBodyException();
                }
            });
    }

    private Mono<Void> send(HttpServerResponse res, String route, ApiResponse response) {
        apiMetrics.recordRequest(route, response.status().code());
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(response.body()))
            .flatMap(json -> res.status(response.status())
                .header(HttpHeaderNames.CONTENT_TYPE, APPLICATION_JSON)
                .header(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, config.getCorsOrigins())
                .sendString(Mono.just(json))
                .then())
            .onErrorResume(err -> {
                log.error("Failed to serialize response for {}", route, err);
                return res.status(HttpResponseStatus.INTERNAL_SERVER_ERROR)
                    .sendString(Mono.just("{\"error\":\"Serialization failed\"}")).then();
            });
    }

    private static ApiResponse errorResponse(String route, Throwable err, String message) {
        HttpResponseStatus status = statusOf(err);
        if (err instanceof MalformedBodyException) {
            return new ApiResponse(status, Map.of("msg", "Bad request"));
        }
        if (err instanceof AuthenticationException) {
            log.info("Rejected {}: {}", route, err.getMessage());
            return new ApiResponse(status, Map.of("msg", err.getMessage()));
        }
        if (status.code() >= 500) {
            log.error("{} failed: {}", route, message, err);
        } else {
            log.info("{} rejected: {}", route, message);
        }
        return new ApiResponse(status, Map.of("error", message != null ? message : err.getClass().getSimpleName()));
    }

    static HttpResponseStatus statusOf(Throwable err) {
        if (err instanceof MalformedBodyException
            || err instanceof ValidationException
            || err instanceof UnknownMetricException) {
            return HttpResponseStatus.BAD_REQUEST;
        }
        if (err instanceof AuthenticationException) {
            return HttpResponseStatus.UNAUTHORIZED;
        }
        if (err instanceof TransportException) {
            return HttpResponseStatus.BAD_GATEWAY;
        }
        // ConfigurationException and anything unexpected
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }

    private record ApiResponse(HttpResponseStatus status, Object body) {
        static ApiResponse ok(Object body) {
            return new ApiResponse(HttpResponseStatus.OK, body);
        }
    }

    /**
     * Request body is not a JSON object.
     */
    private static final class MalformedBodyException extends RuntimeException {
        private MalformedBodyException() {
            super("Bad request");
        }
    }
}
