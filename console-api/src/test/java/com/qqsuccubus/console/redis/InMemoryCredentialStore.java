package com.qqsuccubus.console.redis;

import com.qqsuccubus.console.auth.PasswordHasher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory credential store for tests. Hashes like the Redis store does, with few iterations.
 */
public class InMemoryCredentialStore implements ICredentialStore {

    private final Map<String, String> hashes = new ConcurrentHashMap<>();
    private final PasswordHasher hasher = new PasswordHasher(1_000);
    private boolean closed;

    @Override
    public Mono<Boolean> verify(String username, String secret) {
        return Mono.fromSupplier(() -> {
            String stored = hashes.get(username);
            return stored != null && hasher.verify(secret, stored);
        });
    }

    @Override
    public Mono<Boolean> create(String username, String secret) {
        return Mono.fromSupplier(() -> hashes.putIfAbsent(username, hasher.hash(secret)) == null);
    }

    @Override
    public Mono<Boolean> delete(String username) {
        return Mono.fromSupplier(() -> hashes.remove(username) != null);
    }

    @Override
    public Flux<String> list() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(hashes.keySet())));
    }

    @Override
    public void close() {
        closed = true;
    }

    public String storedHash(String username) {
        return hashes.get(username);
    }

    public boolean isClosed() {
        return closed;
    }
}
