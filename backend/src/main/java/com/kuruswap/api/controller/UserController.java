package com.kuruswap.api.controller;

import com.kuruswap.api.dto.CreateUserRequest;
import com.kuruswap.api.dto.TransactionResponse;
import com.kuruswap.api.dto.UserResponse;
import com.kuruswap.ledger.LedgerStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /users (idempotent), GET /users/{userId}/transactions.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final LedgerStore ledgerStore;

    @PostMapping
    public Mono<ResponseEntity<UserResponse>> createUser(@Valid @RequestBody CreateUserRequest request) {
        return Mono.fromCallable(() -> ledgerStore.createUser(request.userId(), request.displayName()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(user -> ResponseEntity.ok(UserResponse.from(user)));
    }

    @GetMapping("/{userId}/transactions")
    public Mono<ResponseEntity<List<TransactionResponse>>> getTransactions(
            @PathVariable long userId,
            @RequestParam(required = false, defaultValue = "20") int limit
    ) {
        return Mono.fromCallable(() -> ledgerStore.listTransactions(userId, limit).stream()
                        .map(TransactionResponse::from)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
