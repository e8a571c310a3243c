package com.kuruswap.chain.rpc;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sticky RPC endpoint selection: all calls use the current endpoint until it fails, then the next
 * configured endpoint takes over. A failed call is not repeated here.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);

    public RpcEndpointRotator(List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
    }

    public String current() {
        return endpoints.get(Math.floorMod(index.get(), endpoints.size()));
    }

    /**
     * Moves to the next endpoint if {@code failedEndpoint} is still current. Concurrent reports of the
     * same failure advance only once.
     */
    public void failover(String failedEndpoint) {
        int observed = index.get();
        if (endpoints.size() > 1 && endpoints.get(Math.floorMod(observed, endpoints.size())).equals(failedEndpoint)) {
            index.compareAndSet(observed, observed + 1);
        }
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
