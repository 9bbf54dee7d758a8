package com.qqsuccubus.console.cloudrun;

import com.qqsuccubus.core.model.ResourceLimits;
import reactor.core.publisher.Mono;

/**
 * Reads and updates the resource limits of the managed Cloud Run service.
 */
public interface IResourceLimitsService {

    Mono<ResourceLimits> getLimits();

    /**
     * Updates the memory and/or CPU limit. {@code null} or blank leaves a limit unchanged.
     *
     * @param memory new memory limit, e.g. {@code 512Mi}
     * @param cpu    new CPU limit, e.g. {@code 1000m}
     * @return Mono<Boolean> true once the service reports the update complete; errors with
     * ValidationException if both limits are absent
     */
    Mono<Boolean> setLimits(String memory, String cpu);
}
