package com.qqsuccubus.console.gcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.qqsuccubus.core.util.JsonUtils;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code {"error": {...}}} body that Google REST APIs return with non-2xx statuses.
 */
public final class GoogleApiErrors {
    private static final Logger log = LoggerFactory.getLogger(GoogleApiErrors.class);

    private GoogleApiErrors() {
    }

    /**
     * @return the error's message, or the body itself (at most 200 chars) if it is not a Google error
     */
    public static String message(String body) {
        try {
            ErrorResponse error = JsonUtils.readValue(body, ErrorResponse.class);
            if (error.getError() != null && error.getError().getMessage() != null) {
                return error.getError().getMessage();
            }
        } catch (IllegalArgumentException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorResponse {
        private ErrorBody error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorBody {
        private Integer code;
        private String message;
        private String status;
    }
}
