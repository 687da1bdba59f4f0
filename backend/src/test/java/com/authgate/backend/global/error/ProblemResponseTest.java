package com.authgate.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void typeIsDerivedFromCode() {
        ProblemResponse problem = ProblemResponse.of(
                HttpStatus.BAD_REQUEST, "USERNAME_TAKEN", "username is already taken", "/auth/register", "req-1");

        assertThat(problem.type()).isEqualTo("urn:problem:authgate:username-taken");
        assertThat(problem.title()).isEqualTo("Bad Request");
        assertThat(problem.status()).isEqualTo(400);
        assertThat(problem.requestId()).isEqualTo("req-1");
    }

    @Test
    void blankDetailFallsBackToReasonPhrase() {
        ProblemResponse problem = ProblemResponse.of(HttpStatus.NOT_FOUND, "NOT_FOUND", " ", "/nope", null);

        assertThat(problem.detail()).isEqualTo("Not Found");
    }

    @Test
    void requestIdIsOmittedWhenUnknown() {
        JsonNode json = objectMapper.valueToTree(
                ProblemResponse.of(HttpStatus.UNAUTHORIZED, "AUTH_REQUIRED", "Authentication required", "/auth/me", null));

        assertThat(json.has("requestId")).isFalse();
        assertThat(json.path("code").asText()).isEqualTo("AUTH_REQUIRED");
    }

    @Test
    void codeIsRequired() {
        assertThatThrownBy(() -> ProblemResponse.of(HttpStatus.BAD_REQUEST, "", "x", "/", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
