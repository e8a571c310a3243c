package com.kuruswap.session;

public enum PendingAction {
    CREATE_WALLET,
    IMPORT_WALLET,
    SWAP
}
