package com.authgate.backend.modules.auth.presentation.dto;

public record RegisterResponse(String message, Long id, String username) {
}
