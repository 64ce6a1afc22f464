package com.chainwatch.ingestion.adapter.holders;

import java.util.List;

/**
 * Largest holders of an ERC-20 token.
 * Throws {@link com.chainwatch.ingestion.adapter.UpstreamException} on failure.
 */
public interface TopHolderClient {

    /**
     * Holder addresses, largest first, lower-cased.
     */
    List<String> resolveTopHolders(String contractAddress);
}
