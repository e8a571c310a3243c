package com.kuruswap.domain;

/**
 * Lifecycle of a submitted transaction. The core only ever writes PENDING; CONFIRMED and FAILED
 * are set by an external confirmation monitor.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
