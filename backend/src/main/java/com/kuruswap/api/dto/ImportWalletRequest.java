package com.kuruswap.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/users/{userId}/wallets/import.
 */
public record ImportWalletRequest(
        @NotBlank(message = "INVALID_WALLET_NAME")
        String name,

        @NotBlank(message = "INVALID_PRIVATE_KEY")
        String privateKey,

        String displayName
) {

    @Override
    public String toString() {
        return "ImportWalletRequest[name=" + name + ", displayName=" + displayName + "]";
    }
}
