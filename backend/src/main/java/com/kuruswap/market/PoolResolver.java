package com.kuruswap.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kuruswap.common.NetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a token pair to the exchange market (pool) that trades it. The discovery service indexes
 * pairs in one ordering only, so the reversed pair is asked once when the first lookup misses.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PoolResolver {

    private final MarketDiscoveryClient discoveryClient;
    private final ObjectMapper objectMapper;

    /**
     * @return pool address
     * @throws NoPoolException  if neither ordering is indexed
     * @throws NetworkException if the discovery service is unreachable, times out or answers non-2xx
     */
    public String resolve(String tokenA, String tokenB) {
        Optional<String> pool = lookup(tokenA, tokenB);
        if (pool.isEmpty()) {
            log.debug("No market for {}/{}, trying reversed pair", tokenA, tokenB);
            pool = lookup(tokenB, tokenA);
        }
        return pool.orElseThrow(() -> new NoPoolException(tokenA, tokenB));
    }

    private Optional<String> lookup(String baseToken, String quoteToken) {
        String body = discoveryClient.filterMarkets(MarketFilterRequest.of(baseToken, quoteToken)).block();
        return firstMarket(body);
    }

    Optional<String> firstMarket(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new NetworkException("Market discovery returned malformed JSON", e);
        }
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return Optional.empty();
        }
        String market = data.get(0).path("market").asText("");
        return market.isBlank() ? Optional.empty() : Optional.of(market);
    }
}
