package com.chainwatch.notification;

import com.chainwatch.domain.CandidateToBuyEvent;
import com.chainwatch.domain.CandidateToken;
import com.chainwatch.domain.WalletActivityEvent;
import com.chainwatch.support.MutableClock;
import com.chainwatch.support.Records;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationFeedListenerTest {

    private NotificationFeed feed;
    private NotificationFeedListener listener;

    @BeforeEach
    void setUp() {
        feed = new NotificationFeed(new NotificationProperties());
        listener = new NotificationFeedListener(new NotificationFormatter(), feed, MutableClock.at("2024-06-01T00:00:05Z"));
    }

    @Test
    void walletActivityLandsInSubscriberFeed() {
        listener.onWalletActivity(new WalletActivityEvent("alice", "0xwallet", Records.transfer("0x1", 100L)));

        assertThat(feed.latest("alice", 10)).singleElement().satisfies(n -> {
            assertThat(n.kind()).isEqualTo(Notification.Kind.WALLET_ACTIVITY);
            assertThat(n.createdAt()).isEqualTo(Instant.parse("2024-06-01T00:00:05Z"));
            assertThat(n.text()).contains("0xwallet");
        });
    }

    @Test
    void candidateAlertLandsInSubscriberFeed() {
        CandidateToken candidate = new CandidateToken("0xpair", Instant.parse("2024-06-01T00:00:00Z"), "0xdisc");

        listener.onCandidateToBuy(CandidateToBuyEvent.of("bob", candidate));

        assertThat(feed.latest("bob", 10)).extracting(Notification::kind)
                .containsExactly(Notification.Kind.CANDIDATE_TO_BUY);
        assertThat(feed.latest("alice", 10)).isEmpty();
    }
}
