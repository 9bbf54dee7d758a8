package com.qqsuccubus.console.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Request bodies accepted by the console API.
 */
public final class ApiRequests {
    private ApiRequests() {
    }

    /**
     * Body of login, register and revoke requests.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Credentials {
        private String username;
        private String password;
    }

    /**
     * Body of metric requests. Absent spans count as zero.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetricQuery {
        private String metric;
        private Integer days;
        private Integer hours;
        private Integer minutes;

        int daysOrZero() {
            return days != null ? days : 0;
        }

        int hoursOrZero() {
            return hours != null ? hours : 0;
        }

        int minutesOrZero() {
            return minutes != null ? minutes : 0;
        }
    }

    /**
     * Body of resource-limit updates.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Upscale {
        @JsonProperty("memory_limit")
        private String memoryLimit;
        @JsonProperty("cpu_limit")
        private String cpuLimit;
    }
}
