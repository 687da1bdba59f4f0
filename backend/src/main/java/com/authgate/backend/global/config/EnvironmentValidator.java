package com.authgate.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.authgate.backend.modules.auth.infrastructure.crypto.Pbkdf2PasswordHasher;
import com.authgate.backend.modules.auth.infrastructure.crypto.SessionTokenGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or outside its allowed range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.auth.hash-iterations",
            "app.auth.session-token-bytes"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        checkMinimum(problems, "app.auth.hash-iterations", Pbkdf2PasswordHasher.MIN_ITERATIONS);
        checkMinimum(problems, "app.auth.session-token-bytes", SessionTokenGenerator.MIN_TOKEN_BYTES);

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }

        log.info("Environment validation passed");
    }

    private void checkMinimum(List<String> problems, String property, int minimum) {
        String raw = environment.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < minimum) {
                problems.add(property + ": must be at least " + minimum);
            }
        } catch (NumberFormatException e) {
            problems.add(property + ": must be a number");
        }
    }
}
