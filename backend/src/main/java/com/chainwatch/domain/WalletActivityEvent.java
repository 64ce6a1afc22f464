package com.chainwatch.domain;

/**
 * Application event: a watched address shows a token transfer newer than its cursor.
 */
public record WalletActivityEvent(String subscriberId, String address, ActivityRecord record) {
}
