package com.kuruswap.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * POST /api/v1/users. The id is the messaging platform's numeric user id.
 */
public record CreateUserRequest(
        @NotNull(message = "INVALID_USER_ID")
        @Positive(message = "INVALID_USER_ID")
        Long userId,

        String displayName
) {
}
