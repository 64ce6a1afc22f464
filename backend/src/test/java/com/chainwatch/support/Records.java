package com.chainwatch.support;

import com.chainwatch.domain.ActivityRecord;

/**
 * Activity record fixtures.
 */
public final class Records {

    private Records() {
    }

    public static ActivityRecord transfer(String hash, long timestamp) {
        return new ActivityRecord(hash, timestamp, 19_000_000L, "0xfrom", "0xto",
                "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2", "1000", "Wrapped Ether", "WETH", 18, null, false);
    }

    public static ActivityRecord pairCreation(String hash, long timestamp, String pair) {
        return new ActivityRecord(hash, timestamp, 19_000_000L, "0x5c69bee701ef814a2b6a3edd4b1652cb9cc5aa6f", null,
                pair, "0", null, null, null, null, false);
    }

    public static ActivityRecord call(String hash, long timestamp, String functionName) {
        return new ActivityRecord(hash, timestamp, 19_000_000L, "0xcreator", "0xtoken",
                null, "0", null, null, null, functionName, false);
    }
}
