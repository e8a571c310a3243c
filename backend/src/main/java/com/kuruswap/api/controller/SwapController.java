package com.kuruswap.api.controller;

import com.kuruswap.api.dto.SwapRequestBody;
import com.kuruswap.swap.SwapOrchestrator;
import com.kuruswap.swap.SwapReceipt;
import com.kuruswap.swap.SwapRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /users/{userId}/swaps: one swap from the active wallet. Returns 202 once the network accepted
 * the transaction; confirmation is not awaited.
 */
@RestController
@RequestMapping("/api/v1/users/{userId}/swaps")
@RequiredArgsConstructor
public class SwapController {

    private final SwapOrchestrator swapOrchestrator;

    @PostMapping
    public Mono<ResponseEntity<SwapReceipt>> swap(@PathVariable long userId, @Valid @RequestBody SwapRequestBody request) {
        return Mono.fromCallable(() -> swapOrchestrator.execute(
                        new SwapRequest(userId, request.tokenAddress().trim(), request.amount())))
                .subscribeOn(Schedulers.boundedElastic())
                .map(receipt -> ResponseEntity.status(HttpStatus.ACCEPTED).body(receipt));
    }
}
