package com.authgate.backend.modules.auth.application;

import com.authgate.backend.global.error.ProblemException;

import com.fasterxml.jackson.databind.JsonNode;

import org.springframework.stereotype.Component;

/**
 * Turns a raw JSON payload into {@link Credentials}.
 *
 * <p>Absent or {@code null} fields count as empty strings; any other non-string
 * value is rejected. Usernames are stripped of surrounding whitespace, Unicode
 * space separators included, before they are checked, stored or looked up, and
 * must not contain control characters. Password length is counted in code points.
 */
@Component
public class CredentialsValidator {

    public static final int MIN_PASSWORD_LENGTH = 6;

    static final String FIELD_USERNAME = "username";
    static final String FIELD_PASSWORD = "password";

    public Credentials validate(JsonNode payload) {
        if (payload != null && !payload.isMissingNode() && !payload.isObject()) {
            throw ProblemException.validation("INVALID_PAYLOAD", "Request body must be a JSON object");
        }

        String username = stripSpaces(readText(payload, FIELD_USERNAME));
        String password = readText(payload, FIELD_PASSWORD);

        if (username.isEmpty()) {
            throw ProblemException.validation("EMPTY_USERNAME", "username must not be empty");
        }
        if (username.codePoints().anyMatch(Character::isISOControl)) {
            throw ProblemException.validation("INVALID_USERNAME", "username must not contain control characters");
        }
        if (password.codePointCount(0, password.length()) < MIN_PASSWORD_LENGTH) {
            throw ProblemException.validation(
                    "WEAK_PASSWORD",
                    "password must be at least " + MIN_PASSWORD_LENGTH + " characters"
            );
        }
        return new Credentials(username, password);
    }

    private static String stripSpaces(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.codePointAt(start))) {
            start += Character.charCount(value.codePointAt(start));
        }
        while (end > start && isSpace(value.codePointBefore(end))) {
            end -= Character.charCount(value.codePointBefore(end));
        }
        return value.substring(start, end);
    }

    // String.strip() misses no-break and figure spaces
    private static boolean isSpace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    private String readText(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        if (!value.isTextual()) {
            throw ProblemException.validation("INVALID_TYPE", field + " must be a string");
        }
        return value.asText();
    }
}
