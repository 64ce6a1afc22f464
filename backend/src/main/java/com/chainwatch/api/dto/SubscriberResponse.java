package com.chainwatch.api.dto;

import java.util.List;

public record SubscriberResponse(String subscriberId, boolean autoSnipe, boolean hideZeroBalances, List<String> watchList) {
}
