package com.kuruswap.market;

import java.util.List;

/**
 * Body of the market discovery request: {"pairs":[{"baseToken":..,"quoteToken":..}]}.
 */
public record MarketFilterRequest(List<Pair> pairs) {

    public static MarketFilterRequest of(String baseToken, String quoteToken) {
        return new MarketFilterRequest(List.of(new Pair(baseToken, quoteToken)));
    }

    public record Pair(String baseToken, String quoteToken) {
    }
}
