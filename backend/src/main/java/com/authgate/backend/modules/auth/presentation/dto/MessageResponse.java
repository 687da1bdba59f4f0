package com.authgate.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
