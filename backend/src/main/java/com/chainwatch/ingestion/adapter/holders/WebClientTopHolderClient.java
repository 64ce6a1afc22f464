package com.chainwatch.ingestion.adapter.holders;

import com.chainwatch.common.RetryPolicy;
import com.chainwatch.ingestion.adapter.BudgetMeter;
import com.chainwatch.ingestion.adapter.UpstreamCalls;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.config.ProviderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Chainbase {@code token/top-holders} client.
 */
public class WebClientTopHolderClient implements TopHolderClient {

    static final String OPERATION = "holders.topHolders";
    private static final String API_KEY_HEADER = "x-api-key";

    private final WebClient webClient;
    private final ProviderProperties.Holders properties;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final BudgetMeter budgetMeter;
    private final ObjectMapper objectMapper;

    public WebClientTopHolderClient(WebClient.Builder builder,
                                    ProviderProperties providerProperties,
                                    RetryPolicy retryPolicy,
                                    BudgetMeter budgetMeter,
                                    ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = providerProperties.getHolders();
        this.timeout = Duration.ofSeconds(providerProperties.getTimeoutSeconds());
        this.retryPolicy = retryPolicy;
        this.budgetMeter = budgetMeter;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> resolveTopHolders(String contractAddress) {
        URI target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/token/top-holders")
                .queryParam("chain_id", properties.getChainId())
                .queryParam("contract_address", contractAddress)
                .queryParam("limit", properties.getLimit())
                .build()
                .toUri();
        String body = UpstreamCalls.withRetry(retryPolicy, OPERATION, () -> {
            budgetMeter.charge(OPERATION);
            try {
                return webClient.get()
                        .uri(target)
                        .header(API_KEY_HEADER, properties.getApiKey())
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);
            } catch (WebClientResponseException e) {
                throw new UpstreamException("Holders HTTP " + e.getStatusCode().value() + " for " + contractAddress, e);
            }
        });
        return parse(body, objectMapper);
    }

    static List<String> parse(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            throw new UpstreamException("Empty holders response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new UpstreamException("Malformed holders response", e);
        }
        int code = root.path("code").asInt(-1);
        if (code != 0) {
            throw new UpstreamException("Holders error " + code + ": " + root.path("message").asText(""));
        }
        JsonNode data = root.path("data");
        List<String> holders = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode holder : data) {
                String address = holder.path("wallet_address").asText("");
                if (!address.isBlank()) {
                    holders.add(address.strip().toLowerCase(Locale.ROOT));
                }
            }
        }
        return holders;
    }
}
