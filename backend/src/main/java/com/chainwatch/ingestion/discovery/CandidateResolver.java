package com.chainwatch.ingestion.discovery;

import com.chainwatch.config.CaffeineConfig;
import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.ContractCreation;
import com.chainwatch.domain.TokenRiskReport;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.explorer.ExplorerClient;
import com.chainwatch.ingestion.adapter.honeypot.HoneypotClient;
import com.chainwatch.ingestion.config.DiscoveryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds candidates from factory pair-creation transactions: token contract through the honeypot lookup, then
 * creator and creation tx in explorer-sized batches. A failed lookup leaves the field empty; the candidate is still
 * created.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateResolver {

    private final HoneypotClient honeypotClient;
    private final ExplorerClient explorerClient;
    private final DiscoveryProperties discoveryProperties;
    private final CacheManager cacheManager;

    /**
     * @param creations pair-creation transactions, oldest first
     * @return one pending candidate per transaction, same order
     */
    public List<CandidateToken> resolve(List<ActivityRecord> creations) {
        List<CandidateToken> candidates = new ArrayList<>();
        for (ActivityRecord tx : creations) {
            CandidateToken candidate = new CandidateToken(pairAddressOf(tx), Instant.ofEpochSecond(tx.timestamp()), tx.hash());
            resolveToken(candidate);
            candidates.add(candidate);
        }
        resolveCreators(candidates);
        return candidates;
    }

    /**
     * Pair deployed by a factory internal transaction, or null when the transaction created no contract (a plain
     * value transfer or call from the factory).
     */
    static String pairAddressOf(ActivityRecord tx) {
        if (tx.contractAddress() != null && !tx.contractAddress().isBlank()) {
            return tx.contractAddress();
        }
        return null;
    }

    private void resolveToken(CandidateToken candidate) {
        try {
            TokenRiskReport report = honeypotClient.resolveTokenMeta(candidate.getPairAddress());
            candidate.setLastReport(report);
            candidate.setTokenAddress(report.tokenAddress());
        } catch (UpstreamException e) {
            log.warn("Token contract unresolved for pair {}: {}", candidate.getPairAddress(), e.getMessage());
        }
    }

    private void resolveCreators(List<CandidateToken> candidates) {
        Cache cache = cacheManager.getCache(CaffeineConfig.CONTRACT_CREATION_CACHE);
        Map<String, ContractCreation> creations = new HashMap<>();
        LinkedHashSet<String> missing = new LinkedHashSet<>();
        candidates.stream()
                .map(CandidateToken::getTokenAddress)
                .filter(Objects::nonNull)
                .forEach(token -> {
                    ContractCreation cached = cache != null ? cache.get(token, ContractCreation.class) : null;
                    if (cached != null) {
                        creations.put(token, cached);
                    } else {
                        missing.add(token);
                    }
                });

        int batchSize = Math.max(1, Math.min(discoveryProperties.getCreatorBatchSize(), ExplorerClient.MAX_CREATION_BATCH));
        List<String> pending = new ArrayList<>(missing);
        for (int from = 0; from < pending.size(); from += batchSize) {
            List<String> batch = pending.subList(from, Math.min(from + batchSize, pending.size()));
            try {
                for (ContractCreation creation : explorerClient.resolveCreatorAndTxHash(batch)) {
                    creations.put(creation.contractAddress(), creation);
                    if (cache != null) {
                        cache.put(creation.contractAddress(), creation);
                    }
                }
            } catch (UpstreamException e) {
                log.warn("Creator lookup failed for {} contract(s): {}", batch.size(), e.getMessage());
            }
        }

        for (CandidateToken candidate : candidates) {
            ContractCreation creation = candidate.getTokenAddress() != null ? creations.get(candidate.getTokenAddress()) : null;
            if (creation != null) {
                candidate.setCreatorAddress(creation.creatorAddress());
                candidate.setCreationTxHash(creation.txHash());
            }
        }
    }
}
