package com.kuruswap.common;

/**
 * Base type for all failures the core reports to its callers. Messages must never carry key material.
 */
public abstract class KuruSwapException extends RuntimeException {

    private final ErrorKind kind;

    protected KuruSwapException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected KuruSwapException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
