package com.kuruswap.api.dto;

import com.kuruswap.api.validation.WalletAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * POST /api/v1/users/{userId}/swaps: sell {@code amount} of the native asset for {@code tokenAddress}.
 */
public record SwapRequestBody(
        @NotBlank(message = "INVALID_ADDRESS")
        @WalletAddress
        String tokenAddress,

        @NotNull(message = "INVALID_AMOUNT")
        @Positive(message = "INVALID_AMOUNT")
        BigDecimal amount
) {
}
