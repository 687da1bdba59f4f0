package com.authgate.backend.modules.auth.infrastructure.crypto;

import java.util.HexFormat;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

/**
 * Issues opaque session tokens: {@code tokenBytes} bytes from {@link java.security.SecureRandom}, hex encoded.
 */
@Component
public class SessionTokenGenerator {

    public static final int MIN_TOKEN_BYTES = 32;

    private final BytesKeyGenerator keyGenerator;

    public SessionTokenGenerator(@Value("${app.auth.session-token-bytes:32}") int tokenBytes) {
        if (tokenBytes < MIN_TOKEN_BYTES) {
            throw new IllegalArgumentException("session tokens need at least " + MIN_TOKEN_BYTES + " bytes");
        }
        this.keyGenerator = KeyGenerators.secureRandom(tokenBytes);
    }

    public String generate() {
        return HexFormat.of().formatHex(keyGenerator.generateKey());
    }
}
