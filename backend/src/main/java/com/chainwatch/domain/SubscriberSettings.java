package com.chainwatch.domain;

/**
 * Per-subscriber flags. Both default to off.
 */
public record SubscriberSettings(boolean hideZeroBalances, boolean autoSnipe) {

    public static SubscriberSettings defaults() {
        return new SubscriberSettings(false, false);
    }

    public SubscriberSettings withAutoSnipe(boolean value) {
        return new SubscriberSettings(hideZeroBalances, value);
    }

    public SubscriberSettings withHideZeroBalances(boolean value) {
        return new SubscriberSettings(value, autoSnipe);
    }
}
