package com.kuruswap.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/users/{userId}/wallets. The user is created on first use.
 */
public record CreateWalletRequest(
        @NotBlank(message = "INVALID_WALLET_NAME")
        String name,

        String displayName
) {
}
