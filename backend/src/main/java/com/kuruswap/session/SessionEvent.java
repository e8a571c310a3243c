package com.kuruswap.session;

/**
 * Outcome of one input. Rejections keep the conversation where it was unless noted.
 */
public enum SessionEvent {
    WALLET_NAME_REQUESTED(false),
    PRIVATE_KEY_REQUESTED(false),
    WALLET_CREATED(false),
    WALLET_IMPORTED(false),
    TOKEN_ADDRESS_REQUESTED(false),
    SWAP_AMOUNT_REQUESTED(false),
    SWAP_CONFIRMATION_REQUESTED(false),
    SWAP_SUBMITTED(false),
    CANCELLED(false),

    INVALID_WALLET_NAME(true),
    INVALID_PRIVATE_KEY(true),
    INVALID_TOKEN(true),
    INVALID_AMOUNT(true),
    INSUFFICIENT_BALANCE(true),
    /** Ends the conversation. */
    NO_ACTIVE_WALLET(true),
    /** Ends the conversation. */
    NO_POOL(true),
    /** Ends the conversation. */
    SWAP_FAILED(true),
    UNEXPECTED_INPUT(true);

    private final boolean rejection;

    SessionEvent(boolean rejection) {
        this.rejection = rejection;
    }

    public boolean isRejection() {
        return rejection;
    }
}
