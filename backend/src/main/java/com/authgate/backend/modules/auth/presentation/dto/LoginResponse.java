package com.authgate.backend.modules.auth.presentation.dto;

public record LoginResponse(String message, String username) {
}
