package com.qqsuccubus.console.redis;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Interface for the user credential store (Dependency Inversion Principle).
 * <p>
 * Keyed by username. Enables testing with in-memory implementations.
 * </p>
 */
public interface ICredentialStore {

    /**
     * @return true if the user exists and {@code secret} matches its stored hash
     */
    Mono<Boolean> verify(String username, String secret);

    /**
     * Stores a new user.
     *
     * @return true if created, false if the username already exists
     */
    Mono<Boolean> create(String username, String secret);

    /**
     * @return true if removed, false if the user did not exist
     */
    Mono<Boolean> delete(String username);

    Flux<String> list();

    /**
     * Closes the underlying connection.
     */
    void close();
}
