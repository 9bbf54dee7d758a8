package com.qqsuccubus.console;

import com.qqsuccubus.console.auth.PasswordHasher;
import com.qqsuccubus.console.auth.TokenService;
import com.qqsuccubus.console.auth.UserService;
import com.qqsuccubus.console.cloudrun.CloudRunLimitsService;
import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.console.gcp.GoogleAccessTokenProvider;
import com.qqsuccubus.console.http.HttpServer;
import com.qqsuccubus.console.metrics.ApiMetrics;
import com.qqsuccubus.console.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.console.monitoring.CloudMonitoringQueryClient;
import com.qqsuccubus.console.monitoring.MetricService;
import com.qqsuccubus.console.redis.ICredentialStore;
import com.qqsuccubus.console.redis.RedisCredentialStore;
import com.qqsuccubus.core.normalize.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.time.Clock;
import java.time.Duration;

public class ConsoleApp {
    private static final Logger log = LoggerFactory.getLogger(ConsoleApp.class);

    public static void main(String[] args) {
        ConsoleConfig config = ConsoleConfig.fromEnv();

        log.info("Starting Cloud Run console");
        log.info("  Service: {} ({}, project {})", config.getServiceName(), config.getServiceRegion(), config.getProjectId());
        log.info("  Redis: {}", config.getRedactedRedisUrl());

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        ApiMetrics apiMetrics = new ApiMetrics(metricsExporter.getRegistry());

        // Authentication
        Clock clock = Clock.systemUTC();
        ICredentialStore credentialStore = new RedisCredentialStore(
            config.getRedisUrl(),
            new PasswordHasher(config.getPasswordHashIterations())
        );
        TokenService tokenService = new TokenService(config.requireJwtSecret(), config.getTokenTtl(), clock);
        UserService userService = new UserService(credentialStore, tokenService, config.getAdminUsername());
        userService.ensureAdmin(config.getAdminPassword()).block(Duration.ofSeconds(30));

        // Metrics and Cloud Run control plane
        MetricService metricService = new MetricService(
            new CloudMonitoringQueryClient(config,
                new GoogleAccessTokenProvider(GoogleAccessTokenProvider.MONITORING_READ_SCOPE)),
            new Normalizer(),
            config,
            metricsExporter.getRegistry()
        );
        CloudRunLimitsService limitsService = new CloudRunLimitsService(
            config,
            new GoogleAccessTokenProvider(GoogleAccessTokenProvider.CLOUD_PLATFORM_SCOPE),
            metricsExporter.getRegistry()
        );

        // Start HTTP server
        HttpServer httpServer = new HttpServer(
            config,
            userService,
            tokenService,
            metricService,
            limitsService,
            metricsExporter,
            apiMetrics,
            clock
        );

        DisposableServer disposableServer = httpServer.start();

        log.info("Cloud Run console is ready");

        handleShutDown(httpServer, credentialStore);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(HttpServer httpServer, ICredentialStore credentialStore) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            httpServer.stop();

            credentialStore.close();

            log.info("Shutdown complete");
        }));
    }
}
