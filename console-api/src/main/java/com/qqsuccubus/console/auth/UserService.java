package com.qqsuccubus.console.auth;

import com.qqsuccubus.console.redis.ICredentialStore;
import com.qqsuccubus.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * User management rules on top of the credential store.
 */
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final ICredentialStore store;
    private final TokenService tokenService;
    private final String adminUsername;

    public UserService(ICredentialStore store, TokenService tokenService, String adminUsername) {
        this.store = store;
        this.tokenService = tokenService;
        this.adminUsername = adminUsername;
    }

    /**
     * Checks credentials and issues an access token.
     *
     * @return access token; errors with {@link AuthenticationException} on bad credentials
     */
    public Mono<String> login(String username, String password) {
        if (isBlank(username) || password == null) {
            return Mono.error(new AuthenticationException("Bad username or password"));
        }
        return store.verify(username, password)
            .flatMap(valid -> {
                if (!valid) {
                    log.info("Failed login for {}", username);
                    return Mono.error(new AuthenticationException("Bad username or password"));
                }
                log.info("User {} logged in", username);
                return Mono.just(tokenService.issue(username));
            });
    }

    /**
     * @return true if created, false if the username is taken
     */
    public Mono<Boolean> register(String username, String password) {
        if (isBlank(username) || isBlank(password)) {
            return Mono.error(new ValidationException("Username and password are required"));
        }
        return store.create(username, password);
    }

    /**
     * @return true if revoked, false if the user does not exist
     */
    public Mono<Boolean> revoke(String username) {
        if (isBlank(username)) {
            return Mono.error(new ValidationException("Username is required"));
        }
        if (username.equals(adminUsername)) {
            return Mono.error(new ValidationException("Cannot revoke " + adminUsername));
        }
        return store.delete(username);
    }

    /**
     * @return usernames in ascending order
     */
    public Mono<List<String>> list() {
        return store.list().sort().collectList();
    }

    /**
     * Creates the admin account if it is missing.
     *
     * @param password admin password; {@code null} or blank skips bootstrapping
     */
    public Mono<Void> ensureAdmin(String password) {
        if (isBlank(password)) {
            log.info("ADMIN_PASSWORD not set, skipping admin bootstrap");
            return Mono.empty();
        }
        return store.create(adminUsername, password)
            .doOnNext(created -> log.info(created
                ? "Bootstrapped admin user '{}'"
                : "Admin user '{}' already present", adminUsername))
            .then();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
