package com.chainwatch.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * The service's own trading wallet, queried by the account endpoints.
 */
@ConfigurationProperties(prefix = "chainwatch.account")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AccountProperties {

    @NotBlank
    private String address;
}
