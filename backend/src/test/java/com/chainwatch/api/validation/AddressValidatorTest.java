package com.chainwatch.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    @DisplayName("Valid EVM address accepted")
    void validEvmAddress() {
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isTrue();
        assertThat(validator.isValidAddress(" 0x0000000000000000000000000000000000000000 ")).isTrue();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress("")).isFalse();
        assertThat(validator.isValidAddress("0x123")).isFalse();
        assertThat(validator.isValidAddress("742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(validator.isValidAddress("0xZZ2d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
    }

    @Test
    @DisplayName("Partition keeps valid entries trimmed and reports invalid ones")
    void partition() {
        AddressValidator.Partition partition = validator.partition(Arrays.asList(
                " 0x742d35Cc6634C0532925a3b844Bc454e4438f44e", "hello", null,
                "0x5c69bee701ef814a2b6a3edd4b1652cb9cc5aa6f"));

        assertThat(partition.valid()).containsExactly(
                "0x742d35Cc6634C0532925a3b844Bc454e4438f44e", "0x5c69bee701ef814a2b6a3edd4b1652cb9cc5aa6f");
        assertThat(partition.invalid()).containsExactly("hello");
    }
}
