package com.chainwatch.ingestion.discovery;

/**
 * Counts from one classification cycle.
 */
public record MonitorCycleResult(int classified, int rejected, int expired, int pending, int alertsPublished) {

    public static MonitorCycleResult empty() {
        return new MonitorCycleResult(0, 0, 0, 0, 0);
    }
}
