package com.chainwatch.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address helpers. Addresses are compared and stored lower-case.
 */
public final class EvmAddresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EvmAddresses() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.strip()).matches();
    }

    /**
     * Lower-cased, stripped address; null or blank input yields null.
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.strip().toLowerCase(Locale.ROOT);
    }
}
