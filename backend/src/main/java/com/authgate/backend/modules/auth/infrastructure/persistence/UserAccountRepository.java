package com.authgate.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.authgate.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Username uniqueness is owned by the {@code user_account.username} constraint:
 * a duplicate insert fails on flush with a {@code DataIntegrityViolationException}.
 */
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByUsername(String username);

    // single statement, so a concurrent logout either wins entirely or not at all
    @Query("""
            select ua
              from UserSession us
              join us.userAccount ua
             where us.token = :token
            """)
    Optional<UserAccount> findBySessionToken(@Param("token") String token);
}
