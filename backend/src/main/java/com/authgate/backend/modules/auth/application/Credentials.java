package com.authgate.backend.modules.auth.application;

/**
 * Validated login/registration input. The username is already stripped.
 */
public record Credentials(String username, String password) {

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=***]";
    }
}
