package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.CheckOutcome;
import com.chainwatch.domain.TokenRiskReport;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.honeypot.HoneypotClient;
import com.chainwatch.ingestion.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TRUE when the simulation flags a honeypot or either tax exceeds its configured maximum.
 * Keeps the latest report on the candidate and fills in the token address if discovery could not resolve it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HoneypotCheck implements RiskCheck {

    private final HoneypotClient honeypotClient;
    private final RiskProperties riskProperties;

    @Override
    public CheckOutcome evaluate(CandidateToken candidate) {
        TokenRiskReport report;
        try {
            report = honeypotClient.resolveTokenMeta(candidate.lookupAddress());
        } catch (UpstreamException e) {
            log.warn("Honeypot check unknown for pair {}: {}", candidate.getPairAddress(), e.getMessage());
            return CheckOutcome.UNKNOWN;
        }
        candidate.setLastReport(report);
        if (candidate.getTokenAddress() == null && report.tokenAddress() != null) {
            candidate.setTokenAddress(report.tokenAddress());
        }
        return CheckOutcome.of(isHoneypot(report, riskProperties));
    }

    static boolean isHoneypot(TokenRiskReport report, RiskProperties riskProperties) {
        return report.honeypot()
                || report.buyTaxPct() > riskProperties.getMaxBuyTaxPct()
                || report.sellTaxPct() > riskProperties.getMaxSellTaxPct();
    }
}
