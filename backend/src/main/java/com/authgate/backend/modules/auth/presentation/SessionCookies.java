package com.authgate.backend.modules.auth.presentation;

import org.springframework.http.ResponseCookie;

/**
 * The {@code session} cookie: whole-site path, HTTP-only, no expiry while the session lives.
 */
public final class SessionCookies {

    public static final String NAME = "session";

    private SessionCookies() {
    }

    public static ResponseCookie issue(String token, boolean secure) {
        return ResponseCookie.from(NAME, token)
                .path("/")
                .httpOnly(true)
                .secure(secure)
                .build();
    }

    public static ResponseCookie clear(boolean secure) {
        return ResponseCookie.from(NAME, "")
                .path("/")
                .secure(secure)
                .maxAge(0)
                .build();
    }
}
