package com.chainwatch.domain;

/**
 * One transaction as returned by the block explorer (token transfer, internal or normal transaction).
 * Lists of records arrive newest first. Fields the endpoint does not return are null.
 *
 * @param timestamp block timestamp in unix seconds
 */
public record ActivityRecord(
        String hash,
        long timestamp,
        Long blockNumber,
        String from,
        String to,
        String contractAddress,
        String value,
        String tokenName,
        String tokenSymbol,
        Integer tokenDecimal,
        String functionName,
        boolean error
) {
}
