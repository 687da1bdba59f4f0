package com.authgate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void passesWithSaneSettings() {
        MockEnvironment environment = validEnvironment();

        assertThatCode(() -> new EnvironmentValidator(environment).validateEnvironment())
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingDatasource() {
        MockEnvironment environment = validEnvironment().withProperty("spring.datasource.url", " ");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.url: missing");
    }

    @Test
    void rejectsWeakSettings() {
        MockEnvironment environment = validEnvironment()
                .withProperty("app.auth.hash-iterations", "10")
                .withProperty("app.auth.session-token-bytes", "sixteen");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("app.auth.hash-iterations: must be at least 1000")
                .hasMessageContaining("app.auth.session-token-bytes: must be a number");
    }

    private MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/authgate")
                .withProperty("app.auth.hash-iterations", "120000")
                .withProperty("app.auth.session-token-bytes", "32");
    }
}
