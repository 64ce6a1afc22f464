package com.chainwatch.domain;

/**
 * One subscriber watching one address. Two subscribers watching the same address are independent pairs.
 */
public record WatchedAddress(String subscriberId, String address) {
}
