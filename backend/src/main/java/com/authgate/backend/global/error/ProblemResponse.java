package com.authgate.backend.global.error;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

/**
 * Problem body for every failed request. {@code requestId} repeats the
 * {@code X-Request-Id} of the request and is omitted outside a request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    static final String TYPE_URN = "urn:problem:authgate:";

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance, String requestId) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        String reason = status.getReasonPhrase();
        return new ProblemResponse(
                typeFor(code),
                reason,
                status.value(),
                detail == null || detail.isBlank() ? reason : detail,
                instance,
                code,
                requestId
        );
    }

    // USERNAME_TAKEN -> urn:problem:authgate:username-taken
    static String typeFor(String code) {
        return TYPE_URN + code.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
