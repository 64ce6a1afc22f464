package com.chainwatch.domain;

import java.math.BigDecimal;

/**
 * ERC-20 balance of the account. Name, symbol and decimals are empty/default when the metadata lookup failed.
 */
public record TokenBalance(String contractAddress, String name, String symbol, Integer decimals, BigDecimal balance, String rawBalanceHex) {

    public boolean isZero() {
        return balance != null ? balance.signum() == 0 : isZeroHex(rawBalanceHex);
    }

    private static boolean isZeroHex(String hex) {
        if (hex == null) {
            return true;
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return digits.chars().allMatch(c -> c == '0');
    }
}
