package com.kuruswap.api.dto;

import com.kuruswap.domain.TransactionRecord;

import java.time.Instant;

public record TransactionResponse(
        String id,
        String walletId,
        String txHash,
        String type,
        String amount,
        String tokenAddress,
        String status,
        Instant createdAt
) {

    public static TransactionResponse from(TransactionRecord tx) {
        return new TransactionResponse(
                tx.getId(),
                tx.getWalletId(),
                tx.getTxHash(),
                tx.getType() != null ? tx.getType().name() : null,
                tx.getAmount(),
                tx.getTokenAddress(),
                tx.getStatus() != null ? tx.getStatus().name() : null,
                tx.getCreatedAt());
    }
}
