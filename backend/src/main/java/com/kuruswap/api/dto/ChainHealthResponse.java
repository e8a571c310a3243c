package com.kuruswap.api.dto;

public record ChainHealthResponse(boolean reachable, Long chainId, long configuredChainId) {
}
