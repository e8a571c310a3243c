package com.kuruswap.chain;

import com.kuruswap.chain.rpc.EvmRpcClient;
import com.kuruswap.chain.rpc.RpcEndpointRotator;
import com.kuruswap.chain.rpc.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the JSON-RPC transport, endpoint rotation and the local RPC rate limiter.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainConfig {

    @Bean
    public RpcEndpointRotator chainRpcEndpointRotator(ChainProperties properties) {
        return new RpcEndpointRotator(properties.getRpcUrls());
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainProperties properties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(properties.getTimeoutMs()));
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }
}
