package com.kuruswap.api.dto;

import com.kuruswap.wallet.WalletBalance;

import java.math.BigDecimal;

public record ActiveWalletResponse(String walletId, String name, String address, BigDecimal balance) {

    public static ActiveWalletResponse from(WalletBalance balance) {
        return new ActiveWalletResponse(balance.walletId(), balance.name(), balance.address(), balance.balance());
    }
}
