package com.chainwatch.api.dto;

import com.chainwatch.domain.CandidateToken;

import java.time.Instant;

/**
 * One retained candidate with its latest check outcomes.
 */
public record CandidateResponse(
        String pairAddress,
        String tokenAddress,
        String symbol,
        String creatorAddress,
        Instant createdAt,
        String honeypot,
        String liquidityLocked,
        String renounced,
        String status,
        Instant lastCheckedAt
) {

    public static CandidateResponse from(CandidateToken c) {
        return new CandidateResponse(
                c.getPairAddress(),
                c.getTokenAddress(),
                c.getLastReport() != null ? c.getLastReport().symbol() : null,
                c.getCreatorAddress(),
                c.getCreatedAt(),
                c.getHoneypot().name(),
                c.getLiquidityLocked().name(),
                c.getRenounced().name(),
                c.getStatus().name(),
                c.getLastCheckedAt());
    }
}
