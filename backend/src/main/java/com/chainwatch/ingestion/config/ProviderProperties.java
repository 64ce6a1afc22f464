package com.chainwatch.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Upstream provider endpoints and credentials. Missing API keys fail startup.
 */
@ConfigurationProperties(prefix = "chainwatch.providers")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    /** Per-call timeout in seconds for blocking provider calls. */
    private int timeoutSeconds = 20;

    @Valid
    private Explorer explorer = new Explorer();

    @Valid
    private Honeypot honeypot = new Honeypot();

    @Valid
    private Holders holders = new Holders();

    @Valid
    private Rpc rpc = new Rpc();

    /**
     * Etherscan-compatible block explorer API.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Explorer {

        private String baseUrl = "https://api.etherscan.io/api";

        @NotBlank
        private String apiKey;

        /** Free tier allows 5 calls per second. */
        private int requestsPerMinute = 300;

        /** Token transfers fetched per watched address per tick. */
        private int transferPageSize = 25;

        /** Normal transactions scanned for the renounce call. */
        private int normalTxPageSize = 100;
    }

    /**
     * honeypot.is simulation API (no key).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Honeypot {

        private String baseUrl = "https://api.honeypot.is";
    }

    /**
     * Chainbase token holder API.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Holders {

        private String baseUrl = "https://api.chainbase.online/v1";

        @NotBlank
        private String apiKey;

        private int chainId = 1;

        /** Top holders inspected for a locker or burn address. */
        private int limit = 10;
    }

    /**
     * Ethereum JSON-RPC endpoints (round-robin), e.g. an Alchemy URL with key.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Rpc {

        private List<String> urls = new ArrayList<>(List.of("https://eth.llamarpc.com"));

        private int requestsPerSecond = 25;

        /** How long the local limiter may wait for a permit before failing the call. */
        private long limiterTimeoutMs = 2_000;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
