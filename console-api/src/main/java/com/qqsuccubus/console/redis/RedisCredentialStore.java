package com.qqsuccubus.console.redis;

import com.qqsuccubus.console.auth.PasswordHasher;
import com.qqsuccubus.console.config.ConsoleConfig;
import com.qqsuccubus.core.redis.Keys;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive Redis credential store.
 * <p>
 * Users live in one hash ({@link Keys#users()}): field = username, value = password hash.
 * {@code HSETNX} makes creation atomic, so two concurrent registrations of the same name
 * cannot both succeed. Hashing and verification run on the bounded-elastic scheduler;
 * a PBKDF2 derivation blocks for tens of milliseconds.
 * </p>
 */
public class RedisCredentialStore implements ICredentialStore {
    private static final Logger log = LoggerFactory.getLogger(RedisCredentialStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final PasswordHasher hasher;

    public RedisCredentialStore(String redisUrl, PasswordHasher hasher) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.hasher = hasher;
        log.info("Connected to Redis: {}", ConsoleConfig.redactUserInfo(redisUrl));
    }

    @Override
    public Mono<Boolean> verify(String username, String secret) {
        return commands.hget(Keys.users(), username)
            .publishOn(Schedulers.boundedElastic())
            .map(stored -> hasher.verify(secret, stored))
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> create(String username, String secret) {
        return Mono.fromCallable(() -> hasher.hash(secret))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(hash -> commands.hsetnx(Keys.users(), username, hash))
            .doOnNext(created -> {
                if (created) {
                    log.info("Created user {}", username);
                } else {
                    log.debug("User {} already exists", username);
                }
            });
    }

    @Override
    public Mono<Boolean> delete(String username) {
        return commands.hdel(Keys.users(), username)
            .map(removed -> removed > 0)
            .doOnNext(removed -> {
                if (removed) {
                    log.info("Deleted user {}", username);
                }
            });
    }

    @Override
    public Flux<String> list() {
        return commands.hkeys(Keys.users());
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
