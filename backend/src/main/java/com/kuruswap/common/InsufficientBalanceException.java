package com.kuruswap.common;

/**
 * Requested amount exceeds the wallet's native balance.
 */
public class InsufficientBalanceException extends KuruSwapException {

    public InsufficientBalanceException(String message) {
        super(ErrorKind.INSUFFICIENT_BALANCE, message);
    }

    public InsufficientBalanceException(String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_BALANCE, message, cause);
    }
}
