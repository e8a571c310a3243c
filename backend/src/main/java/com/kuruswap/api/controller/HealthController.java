package com.kuruswap.api.controller;

import com.kuruswap.api.dto.ChainHealthResponse;
import com.kuruswap.chain.ChainProperties;
import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.common.NetworkException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /health/chain: 200 when the RPC endpoint answers, 503 otherwise.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final EvmChainClient chainClient;
    private final ChainProperties chainProperties;

    @GetMapping("/chain")
    public Mono<ResponseEntity<ChainHealthResponse>> chain() {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                        new ChainHealthResponse(true, chainClient.getChainId(), chainProperties.getChainId())))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(NetworkException.class, e -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(new ChainHealthResponse(false, null, chainProperties.getChainId()))));
    }
}
