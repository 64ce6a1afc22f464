package com.chainwatch.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Token discovery job: which factory to follow and how much of its history to pull per tick.
 */
@ConfigurationProperties(prefix = "chainwatch.discovery")
@NoArgsConstructor
@Getter
@Setter
public class DiscoveryProperties {

    private boolean enabled = true;

    private long pollIntervalMs = 60_000;

    /** Uniswap V2 factory on mainnet. Pair creations show up as its internal create2 transactions. */
    private String factoryAddress = "0x5c69bee701ef814a2b6a3edd4b1652cb9cc5aa6f";

    /** Most recent internal transactions fetched per tick. */
    private int internalTxCount = 50;

    /** The explorer accepts at most 5 addresses per contract-creation lookup. */
    private int creatorBatchSize = 5;
}
