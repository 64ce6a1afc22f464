package com.chainwatch.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thresholds and allow-lists for the new-token risk checks.
 */
@ConfigurationProperties(prefix = "chainwatch.risk")
@NoArgsConstructor
@Getter
@Setter
public class RiskProperties {

    /** Buy tax above this percentage marks the token as a honeypot. */
    private double maxBuyTaxPct = 5.0;

    /** Sell tax above this percentage marks the token as a honeypot. */
    private double maxSellTaxPct = 5.0;

    /** Candidates not cleared within this many minutes of pair creation are dropped. */
    private long renounceTtlMinutes = 120;

    /** Substring of the explorer's functionName identifying an ownership renounce. */
    private String renounceFunction = "renounceOwnership";

    /**
     * Known liquidity lockers and burn addresses. A top holder on this list counts as locked/burned liquidity.
     * Case-insensitive.
     */
    private List<String> liquidityLockers = List.of(
            "0x000000000000000000000000000000000000dead",
            "0x0000000000000000000000000000000000000000",
            "0x663a5c229c09b049e36dcc11a9b0d4a8eb9db214",
            "0xe2fe530c047f2d85298b07d9333c05737f1435fb",
            "0x71b5759d73262fbb223956913ecf4ecc51057641",
            "0xdba68f07d1b7ca219f78ae8582c213d975c25caf"
    );

    public Duration renounceTtl() {
        return Duration.ofMinutes(renounceTtlMinutes);
    }

    /**
     * Lower-cased allow-list for lookups.
     */
    public Set<String> getLiquidityLockersNormalized() {
        if (liquidityLockers == null || liquidityLockers.isEmpty()) {
            return Set.of();
        }
        return liquidityLockers.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(HashSet::new));
    }
}
