package com.chainwatch.notification;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.CandidateToken;

/**
 * Outbound side of the watch and discovery jobs. Implementations must not block on delivery.
 */
public interface NotificationPublisher {

    void notifyWalletActivity(String subscriberId, String address, ActivityRecord record);

    void notifyCandidateToBuy(String subscriberId, CandidateToken candidate);
}
