package com.kuruswap.chain;

/**
 * ERC20 metadata read from the token contract.
 */
public record TokenMetadata(String address, String name, String symbol, int decimals) {
}
