package com.kuruswap.session;

import com.kuruswap.chain.TokenMetadata;

import java.math.BigDecimal;

/**
 * Data collected so far for one user's pending action. Immutable; every transition stores a new row.
 */
public record ConversationSession(
        long userId,
        PendingAction action,
        ConversationState state,
        String walletName,
        TokenMetadata token,
        String pool,
        BigDecimal amount
) {

    static ConversationSession start(long userId, PendingAction action, ConversationState state) {
        return new ConversationSession(userId, action, state, null, null, null, null);
    }

    ConversationSession awaitingPrivateKey(String name) {
        return new ConversationSession(userId, action, ConversationState.AWAITING_PRIVATE_KEY, name, token, pool, amount);
    }

    ConversationSession awaitingAmount(TokenMetadata tokenMetadata, String poolAddress) {
        return new ConversationSession(userId, action, ConversationState.AWAITING_SWAP_AMOUNT, walletName, tokenMetadata, poolAddress, amount);
    }

    ConversationSession awaitingConfirmation(BigDecimal swapAmount) {
        return new ConversationSession(userId, action, ConversationState.AWAITING_SWAP_CONFIRMATION, walletName, token, pool, swapAmount);
    }
}
