package com.chainwatch.notification;

import com.chainwatch.domain.CandidateToBuyEvent;
import com.chainwatch.domain.WalletActivityEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Renders published notification events and stores them in the subscriber's feed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationFeedListener {

    private final NotificationFormatter formatter;
    private final NotificationFeed feed;
    private final Clock clock;

    @EventListener
    public void onWalletActivity(WalletActivityEvent event) {
        String text = formatter.walletActivity(event.address(), event.record());
        feed.append(new Notification(event.subscriberId(), Notification.Kind.WALLET_ACTIVITY, text, clock.instant()));
        log.info("Wallet activity for subscriber {}: {} tx {}", event.subscriberId(), event.address(), event.record().hash());
    }

    @EventListener
    public void onCandidateToBuy(CandidateToBuyEvent event) {
        String text = formatter.candidateToBuy(event);
        feed.append(new Notification(event.subscriberId(), Notification.Kind.CANDIDATE_TO_BUY, text, clock.instant()));
        log.info("Buy alert for subscriber {}: pair {} token {}", event.subscriberId(), event.pairAddress(), event.tokenAddress());
    }
}
