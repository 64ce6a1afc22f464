package com.chainwatch.notification;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.CandidateToBuyEvent;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.WalletActivityEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes notifications as Spring application events; {@link NotificationFeedListener} renders and stores them.
 */
@Component
@RequiredArgsConstructor
public class ApplicationEventNotificationPublisher implements NotificationPublisher {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void notifyWalletActivity(String subscriberId, String address, ActivityRecord record) {
        eventPublisher.publishEvent(new WalletActivityEvent(subscriberId, address, record));
    }

    @Override
    public void notifyCandidateToBuy(String subscriberId, CandidateToken candidate) {
        eventPublisher.publishEvent(CandidateToBuyEvent.of(subscriberId, candidate));
    }
}
