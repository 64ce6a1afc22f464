package com.chainwatch.ingestion.risk;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.CheckOutcome;
import com.chainwatch.domain.ContractCreation;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.explorer.ExplorerClient;
import com.chainwatch.ingestion.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * TRUE when the creator's recent transactions include an ownership renounce. A renounce cannot be undone, so a
 * TRUE outcome is kept without another lookup.
 *
 * <p>A candidate whose creator is still unknown (the lookup failed at discovery, or the token contract was resolved
 * only later by the honeypot check) gets the creator looked up again on every evaluation until it resolves.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenouncementCheck implements RiskCheck {

    private final ExplorerClient explorerClient;
    private final RiskProperties riskProperties;

    @Override
    public CheckOutcome evaluate(CandidateToken candidate) {
        if (candidate.getRenounced().isTrue()) {
            return CheckOutcome.TRUE;
        }
        String creator = candidate.getCreatorAddress() != null ? candidate.getCreatorAddress() : resolveCreator(candidate);
        if (creator == null) {
            return CheckOutcome.UNKNOWN;
        }
        List<ActivityRecord> txs;
        try {
            txs = explorerClient.fetchNormalTxs(creator);
        } catch (UpstreamException e) {
            log.warn("Renouncement check unknown for creator {}: {}", creator, e.getMessage());
            return CheckOutcome.UNKNOWN;
        }
        String function = riskProperties.getRenounceFunction();
        return CheckOutcome.of(txs.stream()
                .anyMatch(tx -> !tx.error() && tx.functionName() != null && tx.functionName().contains(function)));
    }

    private String resolveCreator(CandidateToken candidate) {
        String token = candidate.getTokenAddress();
        if (token == null) {
            return null;
        }
        List<ContractCreation> creations;
        try {
            creations = explorerClient.resolveCreatorAndTxHash(List.of(token));
        } catch (UpstreamException e) {
            log.warn("Creator still unknown for token {}: {}", token, e.getMessage());
            return null;
        }
        for (ContractCreation creation : creations) {
            if (token.equalsIgnoreCase(creation.contractAddress()) && creation.creatorAddress() != null) {
                candidate.setCreatorAddress(creation.creatorAddress());
                candidate.setCreationTxHash(creation.txHash());
                log.info("Resolved creator {} for token {}", creation.creatorAddress(), token);
                return creation.creatorAddress();
            }
        }
        return null;
    }
}
