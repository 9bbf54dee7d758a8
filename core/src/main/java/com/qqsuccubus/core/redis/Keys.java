package com.qqsuccubus.core.redis;

/**
 * Redis keyspace definitions for the console.
 * <p>
 * All keys live under the {@code console:} prefix so the console can share a Redis
 * instance with other services.
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Credential hash: {@code console:users}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> username
     * <br>
     * <b>Values:</b> salted password hash ({@code pbkdf2:sha256:<iterations>$<salt>$<hex>})
     * <br>
     * <b>TTL:</b> none
     * </p>
     *
     * @return Redis key
     */
    public static String users() {
        return "console:users";
    }

}
