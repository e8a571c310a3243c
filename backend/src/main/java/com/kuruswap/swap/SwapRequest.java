package com.kuruswap.swap;

import java.math.BigDecimal;

/**
 * Sell {@code amountNative} of the native asset for {@code tokenAddress} from the user's active wallet.
 */
public record SwapRequest(long userId, String tokenAddress, BigDecimal amountNative) {
}
