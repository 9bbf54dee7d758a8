package com.qqsuccubus.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Resource limits of the first container of a Cloud Run service template.
 */
@Value
public class ResourceLimits {
    public static final String NOT_SPECIFIED = "Not specified";

    /**
     * Memory limit, e.g. {@code 512Mi}.
     */
    @JsonProperty("memory_limit")
    String memory;

    /**
     * CPU limit, e.g. {@code 1000m} or {@code 2}.
     */
    @JsonProperty("cpu_limit")
    String cpu;
}
