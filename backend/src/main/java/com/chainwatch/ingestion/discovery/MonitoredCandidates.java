package com.chainwatch.ingestion.discovery;

import com.chainwatch.domain.CandidateToken;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Candidates retained between discovery cycles, in creation order. Written only by the discovery job; the REST
 * view reads snapshots.
 */
@Component
public class MonitoredCandidates {

    private final CopyOnWriteArrayList<CandidateToken> candidates = new CopyOnWriteArrayList<>();

    public void addAll(List<CandidateToken> discovered) {
        candidates.addAll(discovered);
    }

    public boolean remove(CandidateToken candidate) {
        return candidates.remove(candidate);
    }

    public List<CandidateToken> snapshot() {
        return List.copyOf(candidates);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }
}
