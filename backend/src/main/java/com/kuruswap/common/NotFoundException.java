package com.kuruswap.common;

/**
 * Missing user, wallet, active wallet or pool.
 */
public class NotFoundException extends KuruSwapException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
