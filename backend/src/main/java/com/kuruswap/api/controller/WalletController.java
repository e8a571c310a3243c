package com.kuruswap.api.controller;

import com.kuruswap.api.dto.ActiveWalletResponse;
import com.kuruswap.api.dto.CreateWalletRequest;
import com.kuruswap.api.dto.CreatedWalletResponse;
import com.kuruswap.api.dto.ImportWalletRequest;
import com.kuruswap.api.dto.SetActiveWalletRequest;
import com.kuruswap.api.dto.WalletResponse;
import com.kuruswap.ledger.LedgerStore;
import com.kuruswap.wallet.WalletProvisioningService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Wallet management for one user: create, import, list, active wallet with balance, switch.
 */
@RestController
@RequestMapping("/api/v1/users/{userId}/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final WalletProvisioningService walletProvisioningService;
    private final LedgerStore ledgerStore;

    @PostMapping
    public Mono<ResponseEntity<CreatedWalletResponse>> createWallet(
            @PathVariable long userId,
            @Valid @RequestBody CreateWalletRequest request
    ) {
        return Mono.fromCallable(() -> walletProvisioningService.createWallet(userId, request.displayName(), request.name()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(wallet -> ResponseEntity.status(HttpStatus.CREATED).body(CreatedWalletResponse.from(wallet)));
    }

    @PostMapping("/import")
    public Mono<ResponseEntity<WalletResponse>> importWallet(
            @PathVariable long userId,
            @Valid @RequestBody ImportWalletRequest request
    ) {
        return Mono.fromCallable(() -> walletProvisioningService.importWallet(
                        userId, request.displayName(), request.name(), request.privateKey()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(wallet -> ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(wallet)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<WalletResponse>>> listWallets(@PathVariable long userId) {
        return Mono.fromCallable(() -> ledgerStore.listWallets(userId).stream().map(WalletResponse::from).toList())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/active")
    public Mono<ResponseEntity<ActiveWalletResponse>> getActiveWallet(@PathVariable long userId) {
        return Mono.fromCallable(() -> walletProvisioningService.getActiveWalletBalance(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(balance -> ResponseEntity.ok(ActiveWalletResponse.from(balance)));
    }

    @PutMapping("/active")
    public Mono<ResponseEntity<WalletResponse>> setActiveWallet(
            @PathVariable long userId,
            @Valid @RequestBody SetActiveWalletRequest request
    ) {
        return Mono.fromCallable(() -> ledgerStore.setActiveWallet(userId, request.walletId().trim()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(wallet -> ResponseEntity.ok(WalletResponse.from(wallet)));
    }
}
