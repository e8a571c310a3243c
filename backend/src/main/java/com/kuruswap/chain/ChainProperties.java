package com.kuruswap.chain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain network settings: RPC endpoints, expected chain id, call timeout and local RPC budget.
 */
@ConfigurationProperties(prefix = "kuruswap.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** JSON-RPC endpoints; the first is used until it fails. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://testnet-rpc.monad.xyz"));

    /** EIP-155 chain id used for signing. Monad testnet by default. */
    private long chainId = 10143;

    /** Upper bound for one RPC round trip. */
    private long timeoutMs = 10_000;

    /** Local RPC budget (requests per second) for this instance. */
    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a local limiter permit before failing. */
    private long limiterTimeoutMs = 2_000;

    /** Prefix for transaction links returned to the user. */
    private String explorerTxUrl = "https://testnet.monadexplorer.com/tx/";
}
