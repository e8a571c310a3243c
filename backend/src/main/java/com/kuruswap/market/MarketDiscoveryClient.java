package com.kuruswap.market;

import reactor.core.publisher.Mono;

/**
 * HTTP transport to the exchange market discovery service.
 */
public interface MarketDiscoveryClient {

    /**
     * @return response body as JSON string; errors with {@link com.kuruswap.common.NetworkException}
     *         on timeout, connection failure or non-2xx status
     */
    Mono<String> filterMarkets(MarketFilterRequest request);
}
