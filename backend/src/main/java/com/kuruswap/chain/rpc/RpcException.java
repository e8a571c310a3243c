package com.kuruswap.chain.rpc;

/**
 * Thrown when an RPC call fails (HTTP, timeout, JSON-RPC error or undecodable result).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
