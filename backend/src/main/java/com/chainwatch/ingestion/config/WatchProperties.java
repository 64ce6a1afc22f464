package com.chainwatch.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Wallet watch job.
 */
@ConfigurationProperties(prefix = "chainwatch.watch")
@NoArgsConstructor
@Getter
@Setter
public class WatchProperties {

    private boolean enabled = true;

    private long pollIntervalMs = 60_000;
}
