package com.chainwatch.ingestion.adapter.explorer;

import com.chainwatch.common.RateLimiter;
import com.chainwatch.common.RetryPolicy;
import com.chainwatch.config.CaffeineConfig;
import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.ContractCreation;
import com.chainwatch.ingestion.adapter.BudgetMeter;
import com.chainwatch.ingestion.adapter.UpstreamCalls;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.config.ProviderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Explorer client over WebClient. Calls are spaced by a shared {@link RateLimiter}, retried per {@link RetryPolicy}
 * and charged to the compute budget as {@code explorer.<action>}.
 */
public class WebClientExplorerClient implements ExplorerClient {

    private static final String NO_RESULTS_PREFIX = "No ";

    private final WebClient webClient;
    private final ProviderProperties.Explorer properties;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final BudgetMeter budgetMeter;
    private final ObjectMapper objectMapper;

    public WebClientExplorerClient(WebClient.Builder builder,
                                   ProviderProperties providerProperties,
                                   RetryPolicy retryPolicy,
                                   RateLimiter rateLimiter,
                                   BudgetMeter budgetMeter,
                                   ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = providerProperties.getExplorer();
        this.timeout = Duration.ofSeconds(providerProperties.getTimeoutSeconds());
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.budgetMeter = budgetMeter;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ActivityRecord> fetchRecentTransfers(String address) {
        return parseRecords(get("account", "tokentx", Map.of(
                "address", address,
                "page", "1",
                "offset", String.valueOf(properties.getTransferPageSize()),
                "sort", "desc")));
    }

    @Override
    public List<ActivityRecord> fetchRecentInternalTxs(String address, int count) {
        return parseRecords(get("account", "txlistinternal", Map.of(
                "address", address,
                "page", "1",
                "offset", String.valueOf(count),
                "sort", "desc")));
    }

    @Override
    public List<ActivityRecord> fetchNormalTxs(String address) {
        return parseRecords(get("account", "txlist", Map.of(
                "address", address,
                "startblock", "0",
                "endblock", "99999999",
                "page", "1",
                "offset", String.valueOf(properties.getNormalTxPageSize()),
                "sort", "desc")));
    }

    @Override
    public List<ContractCreation> resolveCreatorAndTxHash(List<String> contractAddresses) {
        if (contractAddresses == null || contractAddresses.isEmpty()) {
            return List.of();
        }
        if (contractAddresses.size() > MAX_CREATION_BATCH) {
            throw new IllegalArgumentException("At most " + MAX_CREATION_BATCH + " addresses per lookup, got "
                    + contractAddresses.size());
        }
        return parseCreations(get("contract", "getcontractcreation",
                Map.of("contractaddresses", String.join(",", contractAddresses))));
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.ETH_PRICE_CACHE, key = "'ethusd'")
    public BigDecimal fetchEthUsdPrice() {
        JsonNode result = get("stats", "ethprice", Map.of());
        JsonNode ethUsd = result.path("ethusd");
        if (ethUsd.isMissingNode() || ethUsd.asText().isBlank()) {
            throw new UpstreamException("Explorer ethprice response has no ethusd field");
        }
        try {
            return new BigDecimal(ethUsd.asText());
        } catch (NumberFormatException e) {
            throw new UpstreamException("Explorer ethprice is not a number: " + ethUsd.asText(), e);
        }
    }

    /**
     * Performs one explorer call and returns the {@code result} node of a successful response.
     */
    private JsonNode get(String module, String action, Map<String, String> params) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .queryParam("module", module)
                .queryParam("action", action);
        params.forEach(uri::queryParam);
        uri.queryParam("apikey", properties.getApiKey());
        URI target = uri.build().toUri();
        String operation = "explorer." + action;

        return UpstreamCalls.withRetry(retryPolicy, operation, () -> {
            if (!rateLimiter.acquire(timeout)) {
                throw new UpstreamException("Local explorer limiter timeout before " + action);
            }
            budgetMeter.charge(operation);
            String body;
            try {
                body = webClient.get()
                        .uri(target)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);
            } catch (WebClientResponseException e) {
                throw new UpstreamException("Explorer HTTP " + e.getStatusCode().value() + " on " + action, e);
            }
            return resultOf(body, action);
        });
    }

    JsonNode resultOf(String body, String action) {
        if (body == null || body.isBlank()) {
            throw new UpstreamException("Empty explorer response for " + action);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new UpstreamException("Malformed explorer response for " + action, e);
        }
        String status = root.path("status").asText("");
        String message = root.path("message").asText("");
        JsonNode result = root.path("result");
        if ("1".equals(status)) {
            return result;
        }
        // "No transactions found" / "No records found" come back with status 0 and an empty array.
        if (message.startsWith(NO_RESULTS_PREFIX) && result.isArray()) {
            return result;
        }
        throw new UpstreamException("Explorer error on " + action + ": " + message
                + (result.isTextual() ? " (" + result.asText() + ")" : ""));
    }

    static List<ActivityRecord> parseRecords(JsonNode result) {
        if (result == null || !result.isArray()) {
            throw new UpstreamException("Explorer result is not a list");
        }
        List<ActivityRecord> records = new ArrayList<>(result.size());
        for (JsonNode tx : result) {
            records.add(new ActivityRecord(
                    text(tx, "hash"),
                    tx.path("timeStamp").asLong(0L),
                    tx.hasNonNull("blockNumber") ? tx.path("blockNumber").asLong() : null,
                    lower(text(tx, "from")),
                    lower(text(tx, "to")),
                    lower(text(tx, "contractAddress")),
                    text(tx, "value"),
                    text(tx, "tokenName"),
                    text(tx, "tokenSymbol"),
                    tx.hasNonNull("tokenDecimal") && !tx.path("tokenDecimal").asText().isBlank()
                            ? tx.path("tokenDecimal").asInt() : null,
                    text(tx, "functionName"),
                    "1".equals(tx.path("isError").asText("0"))));
        }
        return records;
    }

    static List<ContractCreation> parseCreations(JsonNode result) {
        if (result == null || !result.isArray()) {
            throw new UpstreamException("Explorer contract creation result is not a list");
        }
        List<ContractCreation> out = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            out.add(new ContractCreation(
                    lower(text(node, "contractAddress")),
                    lower(text(node, "contractCreator")),
                    text(node, "txHash")));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String s = value.asText();
        return s.isEmpty() ? null : s;
    }

    private static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
