package com.kuruswap.market;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Exchange market discovery and price routing settings.
 */
@ConfigurationProperties(prefix = "kuruswap.market")
@NoArgsConstructor
@Getter
@Setter
public class MarketProperties {

    /** Endpoint that maps token pairs to market (pool) addresses. */
    private String discoveryUrl = "https://api.testnet.kuru.io/api/v1/markets/filtered";

    /** Upper bound for one discovery request. */
    private long timeoutMs = 10_000;

    /** Contract exposing calculatePriceOverRoute(address[],bool[]). */
    private String priceRouterAddress = "0x9E50D9202bEc0D046a75048Be8d51bBa93386Ade";
}
