package com.chainwatch.ingestion.adapter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin JSON-RPC endpoint selection. Each retry attempt moves to the next endpoint.
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

    public String nextEndpoint() {
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
