package com.kuruswap.common;

/**
 * Route price could not be obtained or was not positive.
 */
public class QuoteUnavailableException extends KuruSwapException {

    public QuoteUnavailableException(String message) {
        super(ErrorKind.QUOTE_UNAVAILABLE, message);
    }

    public QuoteUnavailableException(String message, Throwable cause) {
        super(ErrorKind.QUOTE_UNAVAILABLE, message, cause);
    }
}
