package com.chainwatch.ingestion.adapter.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Ethereum JSON-RPC access. Returns the {@code result} member of the response.
 * Throws {@link com.chainwatch.ingestion.adapter.UpstreamException} on transport or JSON-RPC error.
 */
public interface JsonRpcClient {

    JsonNode call(String method, List<?> params);
}
