package com.kuruswap.session;

public enum ConversationState {
    IDLE,
    AWAITING_WALLET_NAME,
    AWAITING_PRIVATE_KEY,
    AWAITING_TOKEN_ADDRESS,
    AWAITING_SWAP_AMOUNT,
    AWAITING_SWAP_CONFIRMATION
}
