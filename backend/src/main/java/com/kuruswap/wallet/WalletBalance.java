package com.kuruswap.wallet;

import java.math.BigDecimal;

public record WalletBalance(String walletId, String name, String address, BigDecimal balance) {
}
