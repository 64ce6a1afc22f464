package com.chainwatch.ingestion.discovery;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.explorer.ExplorerClient;
import com.chainwatch.ingestion.config.DiscoveryProperties;
import com.chainwatch.ingestion.watch.DiffEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Follows the factory's internal transactions forward. The first page only sets the starting point; afterwards
 * every pair creation newer than the last one seen becomes a pending candidate. Never back-fills.
 *
 * <p>The baseline is this service's own high-water mark, independent of the retained candidate set: once candidates
 * are dropped the set may be empty again, and discovery continues forward from the last seen transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenDiscoveryService {

    private final ExplorerClient explorerClient;
    private final CandidateResolver candidateResolver;
    private final MonitoredCandidates monitoredCandidates;
    private final DiscoveryProperties discoveryProperties;

    /** Timestamp of the newest factory transaction seen. Touched only by the discovery job thread. */
    private volatile OptionalLong lastSeen = OptionalLong.empty();

    /**
     * @return number of candidates added
     */
    public int runTick() {
        List<ActivityRecord> recent;
        try {
            recent = explorerClient.fetchRecentInternalTxs(discoveryProperties.getFactoryAddress(),
                    discoveryProperties.getInternalTxCount());
        } catch (UpstreamException e) {
            log.warn("Skipping discovery this tick: {}", e.getMessage());
            return 0;
        }
        if (recent.isEmpty()) {
            return 0;
        }
        if (lastSeen.isEmpty()) {
            lastSeen = OptionalLong.of(recent.get(0).timestamp());
            log.info("Discovery baseline at {} (tx {})", recent.get(0).timestamp(), recent.get(0).hash());
            return 0;
        }

        List<ActivityRecord> newer = DiffEngine.newerThan(recent, lastSeen.getAsLong());
        if (newer.isEmpty()) {
            return 0;
        }
        lastSeen = OptionalLong.of(newer.get(0).timestamp());

        List<ActivityRecord> creations = new ArrayList<>();
        for (ActivityRecord tx : newer) {
            if (!tx.error() && CandidateResolver.pairAddressOf(tx) != null) {
                creations.add(tx);
            }
        }
        Collections.reverse(creations);
        List<CandidateToken> discovered = candidateResolver.resolve(creations);
        monitoredCandidates.addAll(discovered);
        discovered.forEach(c -> log.info("Discovered pair {} (token {}, creator {})",
                c.getPairAddress(), c.getTokenAddress(), c.getCreatorAddress()));
        return discovered.size();
    }

    public OptionalLong getLastSeen() {
        return lastSeen;
    }
}
