package com.authgate.backend.modules.auth.infrastructure.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import java.util.HexFormat;
import java.util.Optional;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * PBKDF2-HMAC-SHA256 password hashing.
 *
 * <p>Encoded form is {@code <iterations>$<salt-hex>$<hash-hex>}, so every stored
 * hash carries its own parameters and raising the configured iteration count
 * leaves existing hashes verifiable. {@link #upgradeEncoding(String)} reports
 * hashes produced with fewer iterations than currently configured.
 *
 * <p>Verification never throws on a malformed hash; it answers {@code false}.
 */
@Component
public class Pbkdf2PasswordHasher implements PasswordEncoder {

    public static final int DEFAULT_ITERATIONS = 120_000;
    public static final int MIN_ITERATIONS = 1_000;

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int SALT_BYTES = 16;
    private static final int KEY_LENGTH_BITS = 256;
    private static final String SEPARATOR = "$";
    private static final HexFormat HEX = HexFormat.of();

    private final int iterations;
    private final BytesKeyGenerator saltGenerator = KeyGenerators.secureRandom(SALT_BYTES);

    public Pbkdf2PasswordHasher(@Value("${app.auth.hash-iterations:120000}") int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
    }

    public String hash(String password) {
        return hash(password, iterations);
    }

    public String hash(String password, int iterations) {
        if (password == null) {
            throw new IllegalArgumentException("password must be a string");
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        byte[] salt = saltGenerator.generateKey();
        byte[] derived = derive(password, salt, iterations);
        return iterations + SEPARATOR + HEX.formatHex(salt) + SEPARATOR + HEX.formatHex(derived);
    }

    public boolean verify(String encodedHash, String password) {
        if (password == null) {
            return false;
        }
        Optional<EncodedHash> parsed = EncodedHash.parse(encodedHash);
        if (parsed.isEmpty()) {
            return false;
        }
        EncodedHash stored = parsed.get();
        byte[] candidate = derive(password, stored.salt(), stored.iterations());
        return MessageDigest.isEqual(candidate, stored.hash());
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String encode(CharSequence rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("password must be a string");
        }
        return hash(rawPassword.toString());
    }

    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        return verify(encodedPassword, rawPassword == null ? null : rawPassword.toString());
    }

    @Override
    public boolean upgradeEncoding(String encodedPassword) {
        return EncodedHash.parse(encodedPassword)
                .map(stored -> stored.iterations() < iterations)
                .orElse(false);
    }

    private static byte[] derive(String password, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_LENGTH_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Could not derive password hash", e);
        } finally {
            spec.clearPassword();
        }
    }

    private record EncodedHash(int iterations, byte[] salt, byte[] hash) {

        static Optional<EncodedHash> parse(String encoded) {
            if (encoded == null) {
                return Optional.empty();
            }
            String[] parts = encoded.split("\\$", -1);
            if (parts.length != 3) {
                return Optional.empty();
            }
            try {
                int iterations = Integer.parseInt(parts[0]);
                byte[] salt = HEX.parseHex(parts[1]);
                byte[] hash = HEX.parseHex(parts[2]);
                // PBEKeySpec rejects these; treat them as corrupt rather than letting it throw
                if (iterations < 1 || salt.length == 0 || hash.length == 0) {
                    return Optional.empty();
                }
                return Optional.of(new EncodedHash(iterations, salt, hash));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }
}
