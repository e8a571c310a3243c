package com.kuruswap.chain;

import com.kuruswap.common.NetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Logs the chain id reported by the RPC endpoint and warns when it differs from the configured one.
 * An unreachable endpoint does not block startup.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class ChainStartupCheck implements ApplicationRunner {

    private final EvmChainClient chainClient;
    private final ChainProperties chainProperties;

    @Override
    public void run(ApplicationArguments args) {
        try {
            long reported = chainClient.getChainId();
            if (reported != chainProperties.getChainId()) {
                log.warn("RPC reports chain id {} but kuruswap.chain.chain-id is {}; signed transactions will be rejected",
                        reported, chainProperties.getChainId());
            } else {
                log.info("Connected to chain id {}", reported);
            }
        } catch (NetworkException e) {
            log.warn("Chain RPC not reachable at startup: {}", e.getMessage());
        }
    }
}
