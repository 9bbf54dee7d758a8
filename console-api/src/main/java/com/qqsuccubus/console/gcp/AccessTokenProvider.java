package com.qqsuccubus.console.gcp;

import reactor.core.publisher.Mono;

/**
 * Supplies OAuth2 bearer tokens for Google APIs.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    Mono<String> accessToken();
}
