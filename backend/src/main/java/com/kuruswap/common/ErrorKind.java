package com.kuruswap.common;

/**
 * Failure categories surfaced by the core. Every external-call failure is converted to one of these
 * at its boundary before it reaches the swap orchestrator.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    NOT_FOUND,
    NETWORK_ERROR,
    QUOTE_UNAVAILABLE,
    INSUFFICIENT_BALANCE,
    SUBMISSION_ERROR
}
