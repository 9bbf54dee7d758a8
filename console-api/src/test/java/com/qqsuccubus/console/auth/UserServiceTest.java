package com.qqsuccubus.console.auth;

import com.qqsuccubus.console.redis.InMemoryCredentialStore;
import com.qqsuccubus.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserServiceTest {

    private InMemoryCredentialStore store;
    private TokenService tokenService;
    private UserService userService;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        tokenService = new TokenService("0123456789abcdef0123456789abcdef", Duration.ofMinutes(15), Clock.systemUTC());
        userService = new UserService(store, tokenService, "admin");
    }

    @Test
    void testLoginIssuesTokenForValidCredentials() {
        userService.register("alice", "wonderland").block();

        StepVerifier.create(userService.login("alice", "wonderland"))
            .assertNext(token -> assertEquals("alice", tokenService.verify(token)))
            .verifyComplete();
    }

    @Test
    void testLoginRejectsWrongPasswordAndUnknownUser() {
        userService.register("alice", "wonderland").block();

        StepVerifier.create(userService.login("alice", "looking-glass"))
            .expectErrorMatches(err -> err instanceof AuthenticationException
                && err.getMessage().equals("Bad username or password"))
            .verify();
        StepVerifier.create(userService.login("bob", "wonderland"))
            .expectError(AuthenticationException.class)
            .verify();
        StepVerifier.create(userService.login(null, null))
            .expectError(AuthenticationException.class)
            .verify();
    }

    @Test
    void testPasswordIsStoredHashed() {
        userService.register("alice", "wonderland").block();

        assertNotEquals("wonderland", store.storedHash("alice"));
        assertTrue(store.storedHash("alice").startsWith("pbkdf2:sha256:"));
    }

    @Test
    @DisplayName("Registering an existing username reports a conflict, not an error")
    void testDuplicateRegistrationReturnsFalse() {
        StepVerifier.create(userService.register("alice", "one")).expectNext(true).verifyComplete();
        StepVerifier.create(userService.register("alice", "two")).expectNext(false).verifyComplete();

        // The original password still works
        StepVerifier.create(userService.login("alice", "one")).expectNextCount(1).verifyComplete();
    }

    @Test
    void testRegisterRequiresUsernameAndPassword() {
        StepVerifier.create(userService.register("", "pw")).expectError(ValidationException.class).verify();
        StepVerifier.create(userService.register("alice", null)).expectError(ValidationException.class).verify();
    }

    @Test
    void testRevokeRemovesUser() {
        userService.register("alice", "wonderland").block();

        StepVerifier.create(userService.revoke("alice")).expectNext(true).verifyComplete();
        StepVerifier.create(userService.revoke("alice")).expectNext(false).verifyComplete();
        StepVerifier.create(userService.login("alice", "wonderland"))
            .expectError(AuthenticationException.class)
            .verify();
    }

    @Test
    void testAdminCannotBeRevoked() {
        userService.ensureAdmin("root-pw").block();

        StepVerifier.create(userService.revoke("admin"))
            .expectErrorMatches(err -> err instanceof ValidationException
                && err.getMessage().equals("Cannot revoke admin"))
            .verify();
        StepVerifier.create(userService.revoke(" ")).expectError(ValidationException.class).verify();
    }

    @Test
    void testListIsSorted() {
        userService.register("carol", "pw").block();
        userService.register("alice", "pw").block();
        userService.register("bob", "pw").block();

        StepVerifier.create(userService.list())
            .expectNext(List.of("alice", "bob", "carol"))
            .verifyComplete();
    }

    @Test
    void testEnsureAdminIsIdempotentAndSkipsWithoutPassword() {
        userService.ensureAdmin(null).block();
        assertNull(store.storedHash("admin"));

        userService.ensureAdmin("first").block();
        userService.ensureAdmin("second").block();

        StepVerifier.create(userService.login("admin", "first")).expectNextCount(1).verifyComplete();
        StepVerifier.create(userService.login("admin", "second")).expectError(AuthenticationException.class).verify();
    }
}
