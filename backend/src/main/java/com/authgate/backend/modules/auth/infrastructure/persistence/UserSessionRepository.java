package com.authgate.backend.modules.auth.infrastructure.persistence;

import com.authgate.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@code save} merges on the token primary key, which gives insert-or-replace semantics.
 */
public interface UserSessionRepository extends JpaRepository<UserSession, String> {

    @Transactional
    @Modifying
    @Query("delete from UserSession us where us.token = :token")
    int deleteByToken(@Param("token") String token);

    // user_session.user_id cascades on delete; this is the explicit equivalent.
    @Transactional
    @Modifying
    @Query("delete from UserSession us where us.userAccount.id = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
