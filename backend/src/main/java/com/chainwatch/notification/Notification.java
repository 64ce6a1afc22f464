package com.chainwatch.notification;

import java.time.Instant;

/**
 * Rendered notification as shown to a subscriber.
 */
public record Notification(String subscriberId, Kind kind, String text, Instant createdAt) {

    public enum Kind {
        WALLET_ACTIVITY,
        CANDIDATE_TO_BUY
    }
}
