package com.kuruswap.swap;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Result of an accepted swap. {@code recorded} is false when the network accepted the transaction
 * but the history entry could not be written; the hash is still authoritative and the swap must not be retried.
 */
public record SwapReceipt(
        String txHash,
        String explorerUrl,
        String walletId,
        String walletAddress,
        String tokenAddress,
        String pool,
        BigDecimal amountNative,
        BigInteger minOutput,
        boolean recorded
) {
}
