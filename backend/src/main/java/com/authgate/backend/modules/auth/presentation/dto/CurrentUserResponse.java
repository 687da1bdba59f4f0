package com.authgate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CurrentUserResponse(
        Long id,
        String username,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
}
