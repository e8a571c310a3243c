package com.kuruswap.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SetActiveWalletRequest(
        @NotBlank(message = "INVALID_WALLET_ID")
        String walletId
) {
}
