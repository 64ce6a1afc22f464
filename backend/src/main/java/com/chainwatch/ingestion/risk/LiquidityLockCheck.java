package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.CheckOutcome;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.holders.TopHolderClient;
import com.chainwatch.ingestion.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * TRUE when a top holder of the token is a known locker or burn address.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiquidityLockCheck implements RiskCheck {

    private final TopHolderClient topHolderClient;
    private final RiskProperties riskProperties;

    @Override
    public CheckOutcome evaluate(CandidateToken candidate) {
        String token = candidate.getTokenAddress();
        if (token == null) {
            return CheckOutcome.UNKNOWN;
        }
        List<String> holders;
        try {
            holders = topHolderClient.resolveTopHolders(token);
        } catch (UpstreamException e) {
            log.warn("Liquidity check unknown for token {}: {}", token, e.getMessage());
            return CheckOutcome.UNKNOWN;
        }
        Set<String> lockers = riskProperties.getLiquidityLockersNormalized();
        return CheckOutcome.of(holders.stream().anyMatch(lockers::contains));
    }
}
