package com.kuruswap.api.controller;

import com.kuruswap.chain.EvmChainClient;
import com.kuruswap.chain.TokenMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final EvmChainClient chainClient;

    @GetMapping("/{address}")
    public Mono<ResponseEntity<TokenMetadata>> getToken(@PathVariable String address) {
        return Mono.fromCallable(() -> chainClient.getTokenMetadata(address))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
