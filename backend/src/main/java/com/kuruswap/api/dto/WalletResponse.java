package com.kuruswap.api.dto;

import com.kuruswap.domain.CustodyWallet;

import java.time.Instant;

/**
 * Wallet as shown to its owner. Never carries key material.
 */
public record WalletResponse(String walletId, String name, String address, boolean active, Instant createdAt) {

    public static WalletResponse from(CustodyWallet wallet) {
        return new WalletResponse(wallet.getId(), wallet.getName(), wallet.getAddress(), wallet.isActive(), wallet.getCreatedAt());
    }
}
