package com.kuruswap.market;

import com.kuruswap.common.NotFoundException;

/**
 * No market is indexed for the pair in either ordering.
 */
public class NoPoolException extends NotFoundException {

    public NoPoolException(String tokenA, String tokenB) {
        super("No pool found for pair " + tokenA + " / " + tokenB);
    }
}
