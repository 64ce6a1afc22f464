package com.chainwatch.domain;

import java.math.BigDecimal;

/**
 * Native balance of an address with its USD value at the current ETH price.
 */
public record EthBalance(String address, BigDecimal eth, BigDecimal usd) {
}
