package com.chainwatch.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Monthly provider compute-unit budget and the unit cost charged per upstream operation.
 */
@ConfigurationProperties(prefix = "chainwatch.budget")
@NoArgsConstructor
@Getter
@Setter
public class ComputeBudgetProperties {

    /** Units available per calendar month (Alchemy free tier: 300M CU). */
    private long capacity = 300_000_000L;

    /** Interval of the reset check. Must stay one day for the start-of-month rule to hold. */
    private long resetIntervalMs = 86_400_000L;

    /**
     * Units per operation. Keys are JSON-RPC method names or explorer/API operation names
     * (e.g. {@code eth_getBalance}, {@code explorer.tokentx}).
     */
    private Map<String, Long> unitCosts = new HashMap<>(Map.of(
            "eth_getBalance", 19L,
            "eth_gasPrice", 19L,
            "alchemy_getTokenBalances", 26L
    ));

    /** Cost of operations missing from {@link #unitCosts}. */
    private long defaultUnitCost = 0L;

    public void setUnitCosts(Map<String, Long> unitCosts) {
        this.unitCosts = unitCosts != null ? unitCosts : new HashMap<>();
    }

    public long unitCostOf(String operation) {
        Long cost = unitCosts.get(operation);
        return cost != null ? cost : defaultUnitCost;
    }
}
