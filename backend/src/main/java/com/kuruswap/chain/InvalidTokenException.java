package com.kuruswap.chain;

import com.kuruswap.common.ValidationException;

/**
 * Address is malformed, is not a contract, or does not answer the ERC20 read interface.
 */
public class InvalidTokenException extends ValidationException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
