package com.qqsuccubus.console.config;

import com.qqsuccubus.core.error.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Configuration for the console API, loaded from environment variables.
 * <p>
 * Cloud identifiers (project, region, service) have no defaults: a metric query or a
 * resource-limit update against a guessed service is never acceptable.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ConsoleConfig {

    String nodeId;
    int httpPort;
    String redisUrl;

    // Authentication
    String jwtSecret;
    Duration tokenTtl;
    int passwordHashIterations;
    String adminUsername;
    String adminPassword;  // bootstrap only; null skips admin creation

    // Cloud Run target
    String projectId;
    String serviceRegion;
    String serviceName;

    // Cloud Run Admin API
    String runUrl;
    Duration operationPollInterval;
    Duration limitsUpdateTimeout;

    // Cloud Monitoring
    String monitoringUrl;
    Duration queryTimeout;

    String corsOrigins;

    public static ConsoleConfig fromEnv() {
        return ConsoleConfig.builder()
            .nodeId(getEnv("NODE_ID", "console-1"))
            .httpPort(Integer.parseInt(getEnv("PORT", getEnv("HTTP_PORT", "5001"))))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .jwtSecret(getEnv("JWT_SECRET_KEY", null))
            .tokenTtl(Duration.ofMinutes(Integer.parseInt(getEnv("JWT_TTL_MIN", "15"))))
            .passwordHashIterations(Integer.parseInt(getEnv("PASSWORD_HASH_ITERATIONS", "600000")))
            .adminUsername(getEnv("ADMIN_USERNAME", "admin"))
            .adminPassword(getEnv("ADMIN_PASSWORD", null))
            .projectId(getEnv("PROJECT_ID", null))
            .serviceRegion(getEnv("SERVICE_REGION", null))
            .serviceName(getEnv("SERVICE_NAME", null))
            .runUrl(getEnv("RUN_URL", "https://run.googleapis.com"))
            .operationPollInterval(Duration.ofMillis(Long.parseLong(getEnv("OPERATION_POLL_MS", "2000"))))
            .limitsUpdateTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("LIMITS_UPDATE_TIMEOUT_SEC", "300"))))
            .monitoringUrl(getEnv("MONITORING_URL", "https://monitoring.googleapis.com"))
            .queryTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("QUERY_TIMEOUT_SEC", "30"))))
            .corsOrigins(getEnv("CORS_ORIGINS", "*"))
            .build();
    }

    /**
     * @return the JWT signing secret
     * @throws ConfigurationException if the secret is missing or shorter than 256 bits
     */
    public String requireJwtSecret() {
        if (isBlank(jwtSecret)) {
            throw new ConfigurationException("JWT_SECRET_KEY is not set");
        }
        if (jwtSecret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new ConfigurationException("JWT_SECRET_KEY must be at least 32 bytes");
        }
        return jwtSecret;
    }

    /**
     * @return fully qualified Cloud Run service name
     * @throws ConfigurationException if project, region or service is missing
     */
    public String requireServiceResourceName() {
        return String.format("projects/%s/locations/%s/services/%s",
            require(projectId, "PROJECT_ID"),
            require(serviceRegion, "SERVICE_REGION"),
            require(serviceName, "SERVICE_NAME"));
    }

    /**
     * @throws ConfigurationException if the project is missing
     */
    public String requireProjectId() {
        return require(projectId, "PROJECT_ID");
    }

    /**
     * @throws ConfigurationException if the service name is missing
     */
    public String requireServiceName() {
        return require(serviceName, "SERVICE_NAME");
    }

    /**
     * @return {@link #redisUrl} with any user-info (password) masked, for logging
     */
    public String getRedactedRedisUrl() {
        return redactUserInfo(redisUrl);
    }

    /**
     * Masks the user-info part of a URL: {@code redis://:secret@host:6379} becomes
     * {@code redis://***@host:6379}.
     */
    public static String redactUserInfo(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceFirst("^([a-zA-Z][a-zA-Z0-9+.-]*://)[^/]*@", "$1***@");
    }

    private static String require(String value, String variable) {
        if (isBlank(value)) {
            throw new ConfigurationException(variable + " is not set");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
