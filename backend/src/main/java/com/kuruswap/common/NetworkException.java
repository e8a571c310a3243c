package com.kuruswap.common;

/**
 * RPC endpoint or discovery service unreachable, failed or timed out.
 */
public class NetworkException extends KuruSwapException {

    public NetworkException(String message) {
        super(ErrorKind.NETWORK_ERROR, message);
    }

    public NetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK_ERROR, message, cause);
    }
}
