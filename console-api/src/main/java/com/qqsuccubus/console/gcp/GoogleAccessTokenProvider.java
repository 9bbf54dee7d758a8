package com.qqsuccubus.console.gcp;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.qqsuccubus.core.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;

/**
 * Access tokens from Google application default credentials. Credentials are loaded on
 * first use and refreshed when they expire.
 */
public class GoogleAccessTokenProvider implements AccessTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(GoogleAccessTokenProvider.class);

    public static final String MONITORING_READ_SCOPE = "https://www.googleapis.com/auth/monitoring.read";
    public static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    private final String scope;
    private GoogleCredentials credentials;

    public GoogleAccessTokenProvider(String scope) {
        this.scope = scope;
    }

    @Override
    public Mono<String> accessToken() {
        return Mono.fromCallable(() -> {
                GoogleCredentials current = credentials();
                current.refreshIfExpired();
                AccessToken token = current.getAccessToken();
                if (token == null) {
                    throw new TransportException("Google credentials returned no access token");
                }
                return token.getTokenValue();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(IOException.class, e ->
                new TransportException("Could not obtain Google credentials: " + e.getMessage(), e));
    }

    private synchronized GoogleCredentials credentials() throws IOException {
        if (credentials == null) {
            credentials = GoogleCredentials.getApplicationDefault().createScoped(scope);
            log.info("Loaded Google application default credentials for {}", scope);
        }
        return credentials;
    }
}
