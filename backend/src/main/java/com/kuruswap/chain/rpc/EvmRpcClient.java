package com.kuruswap.chain.rpc;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport abstraction for testing and endpoint failover.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      method params
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure or timeout.
     *         JSON-RPC level errors are returned in the body for the caller to interpret.
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
