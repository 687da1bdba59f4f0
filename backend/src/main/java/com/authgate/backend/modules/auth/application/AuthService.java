package com.authgate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.domain.UserSession;
import com.authgate.backend.modules.auth.infrastructure.crypto.SessionTokenGenerator;
import com.authgate.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.authgate.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.authgate.backend.modules.auth.presentation.dto.CurrentUserResponse;

import com.fasterxml.jackson.databind.JsonNode;

import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Password derivation runs outside any transaction; each store call below commits
 * on its own, so no pooled connection is held while PBKDF2 runs.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    static final String AUTH_REQUIRED = "AUTH_REQUIRED";
    static final String USERNAME_TAKEN = "USERNAME_TAKEN";

    private final UserAccountRepository userAccountRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionTokenGenerator sessionTokenGenerator;
    private final CredentialsValidator credentialsValidator;
    private final Clock clock;

    // verified against when the username is unknown, so both paths pay for one derivation
    private final String unknownUserHash;

    public AuthService(
            UserAccountRepository userAccountRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            SessionTokenGenerator sessionTokenGenerator,
            CredentialsValidator credentialsValidator,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionTokenGenerator = sessionTokenGenerator;
        this.credentialsValidator = credentialsValidator;
        this.clock = clock;
        this.unknownUserHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public RegisteredUser register(JsonNode payload) {
        Credentials credentials = credentialsValidator.validate(payload);
        String passwordHash = passwordEncoder.encode(credentials.password());

        UserAccount account = new UserAccount();
        account.setUsername(credentials.username());
        account.setPasswordHash(passwordHash);

        UserAccount saved;
        try {
            // flush now so the unique constraint fires inside this call
            saved = userAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            if (!violates(ex, UserAccount.USERNAME_CONSTRAINT)) {
                throw ex;
            }
            log.debug("Registration rejected, username already exists");
            throw ProblemException.conflict(USERNAME_TAKEN, "username is already taken");
        }

        log.info("Registered user id={} username={}", saved.getId(), saved.getUsername());
        return new RegisteredUser(saved.getId(), saved.getUsername());
    }

    public IssuedSession login(JsonNode payload) {
        Credentials credentials = credentialsValidator.validate(payload);

        UserAccount account = userAccountRepository.findByUsername(credentials.username()).orElse(null);
        String storedHash = account != null ? account.getPasswordHash() : unknownUserHash;
        boolean passwordMatches = passwordEncoder.matches(credentials.password(), storedHash);
        if (account == null || !passwordMatches) {
            log.debug("Rejected login attempt");
            throw ProblemException.authentication(INVALID_CREDENTIALS, "Invalid username or password");
        }

        String token = sessionTokenGenerator.generate();
        UserSession session = new UserSession();
        session.setToken(token);
        session.setUserAccount(account);
        session.setCreatedAt(OffsetDateTime.now(clock));
        userSessionRepository.save(session);

        log.info("Issued session for user id={}", account.getId());
        return new IssuedSession(account.getUsername(), token);
    }

    public void logout(String token) {
        if (!StringUtils.hasText(token)) {
            return;
        }
        int deleted = userSessionRepository.deleteByToken(token);
        if (deleted > 0) {
            log.info("Ended session");
        }
    }

    @Transactional(readOnly = true)
    public CurrentUserResponse currentUser(String token) {
        if (!StringUtils.hasText(token)) {
            throw authRequired();
        }
        return userAccountRepository.findBySessionToken(token)
                .map(account -> new CurrentUserResponse(account.getId(), account.getUsername(), account.getCreatedAt()))
                .orElseThrow(this::authRequired);
    }

    private static boolean violates(DataIntegrityViolationException ex, String constraintName) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation) {
                return constraintName.equalsIgnoreCase(violation.getConstraintName());
            }
        }
        return false;
    }

    private ProblemException authRequired() {
        return ProblemException.authentication(AUTH_REQUIRED, "Authentication required");
    }

    public record RegisteredUser(Long id, String username) {
    }

    public record IssuedSession(String username, String token) {

        @Override
        public String toString() {
            return "IssuedSession[username=" + username + ", token=***]";
        }
    }
}
