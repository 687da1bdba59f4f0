package com.authgate.backend.modules.auth.domain;

import com.authgate.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * 사용자 계정 엔터티. 가입 시점 이후로는 갱신되지 않는다.
 */
@Entity
@Table(
        name = "user_account",
        uniqueConstraints = @UniqueConstraint(name = UserAccount.USERNAME_CONSTRAINT, columnNames = "username")
)
public class UserAccount extends AbstractCreatedEntity {

    public static final String USERNAME_CONSTRAINT = "uq_user_account_username";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, updatable = false)
    private String username;

    @Column(name = "password_hash", nullable = false, updatable = false)
    private String passwordHash;

    public Long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }
}
