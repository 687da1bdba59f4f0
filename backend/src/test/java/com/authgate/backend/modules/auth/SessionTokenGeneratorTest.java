package com.authgate.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Set;

import com.authgate.backend.modules.auth.infrastructure.crypto.SessionTokenGenerator;

import org.junit.jupiter.api.Test;

class SessionTokenGeneratorTest {

    @Test
    void generatesHexTokensOfRequestedEntropy() {
        SessionTokenGenerator generator = new SessionTokenGenerator(32);

        assertThat(generator.generate()).hasSize(64).matches("[0-9a-f]+");
        assertThat(new SessionTokenGenerator(48).generate()).hasSize(96);
    }

    @Test
    void tokensDoNotRepeat() {
        SessionTokenGenerator generator = new SessionTokenGenerator(32);
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            tokens.add(generator.generate());
        }
        assertThat(tokens).hasSize(1_000);
    }

    @Test
    void rejectsTooLittleEntropy() {
        assertThatThrownBy(() -> new SessionTokenGenerator(16))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
