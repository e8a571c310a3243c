package com.kuruswap.common;

/**
 * Malformed input: address, amount, private key or wallet name.
 */
public class ValidationException extends KuruSwapException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
