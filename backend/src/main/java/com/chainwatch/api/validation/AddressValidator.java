package com.chainwatch.api.validation;

import com.chainwatch.common.EvmAddresses;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates EVM addresses submitted to the watch-list endpoint.
 */
@Component
public class AddressValidator {

    public boolean isValidAddress(String address) {
        return address != null && EvmAddresses.isValid(address.trim());
    }

    /**
     * Splits submitted entries into valid addresses (trimmed) and invalid entries (as submitted, nulls dropped).
     */
    public Partition partition(List<String> submitted) {
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String entry : submitted) {
            if (isValidAddress(entry)) {
                valid.add(entry.trim());
            } else if (entry != null) {
                invalid.add(entry);
            }
        }
        return new Partition(valid, invalid);
    }

    public record Partition(List<String> valid, List<String> invalid) {
    }
}
