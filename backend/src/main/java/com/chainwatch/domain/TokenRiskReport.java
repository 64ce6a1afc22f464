package com.chainwatch.domain;

import java.util.List;

/**
 * Token and pair metadata plus honeypot simulation result for one token or pair address.
 *
 * @param tokenAddress underlying token contract; null when the provider did not return one
 * @param buyTaxPct    simulated buy tax in percent (100 when the simulation did not run)
 * @param sellTaxPct   simulated sell tax in percent (100 when the simulation did not run)
 */
public record TokenRiskReport(
        String tokenAddress,
        String name,
        String symbol,
        int decimals,
        String pairAddress,
        String pairType,
        boolean honeypot,
        String honeypotReason,
        double buyTaxPct,
        double sellTaxPct,
        double liquidityUsd,
        List<String> flags
) {

    public TokenRiskReport {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }
}
