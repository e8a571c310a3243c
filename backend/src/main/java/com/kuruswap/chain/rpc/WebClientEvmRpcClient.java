package com.kuruswap.chain.rpc;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EVM JSON-RPC client using one shared WebClient. The underlying connection pool re-establishes
 * dropped connections, so callers never rebuild the client.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new RpcException(method + " timed out after " + timeout.toMillis() + " ms", e))
                .onErrorMap(e -> !(e instanceof RpcException), e -> new RpcException(method + " failed: " + e.getMessage(), e));
    }
}
