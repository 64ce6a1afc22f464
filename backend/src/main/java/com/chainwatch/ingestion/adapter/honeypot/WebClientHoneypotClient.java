package com.chainwatch.ingestion.adapter.honeypot;

import com.chainwatch.common.RetryPolicy;
import com.chainwatch.domain.TokenRiskReport;
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
 * honeypot.is {@code /v2/IsHoneypot} client.
 */
public class WebClientHoneypotClient implements HoneypotClient {

    static final String OPERATION = "honeypot.isHoneypot";
    static final String MISSING_VERDICT_REASON = "Honeypot verdict missing from simulation response";
    /** Tax assumed when the simulation did not run; such tokens must never pass the tax threshold. */
    static final double UNSIMULATED_TAX_PCT = 100.0;

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final BudgetMeter budgetMeter;
    private final ObjectMapper objectMapper;

    public WebClientHoneypotClient(WebClient.Builder builder,
                                   ProviderProperties providerProperties,
                                   RetryPolicy retryPolicy,
                                   BudgetMeter budgetMeter,
                                   ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.baseUrl = providerProperties.getHoneypot().getBaseUrl();
        this.timeout = Duration.ofSeconds(providerProperties.getTimeoutSeconds());
        this.retryPolicy = retryPolicy;
        this.budgetMeter = budgetMeter;
        this.objectMapper = objectMapper;
    }

    @Override
    public TokenRiskReport resolveTokenMeta(String address) {
        URI target = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/v2/IsHoneypot")
                .queryParam("address", address)
                .build()
                .toUri();
        String body = UpstreamCalls.withRetry(retryPolicy, OPERATION, () -> {
            budgetMeter.charge(OPERATION);
            try {
                return webClient.get()
                        .uri(target)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);
            } catch (WebClientResponseException e) {
                throw new UpstreamException("Honeypot HTTP " + e.getStatusCode().value() + " for " + address, e);
            }
        });
        return parse(body, objectMapper);
    }

    static TokenRiskReport parse(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            throw new UpstreamException("Empty honeypot response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new UpstreamException("Malformed honeypot response", e);
        }
        JsonNode token = root.path("token");
        if (token.isMissingNode() || token.isNull()) {
            throw new UpstreamException("Honeypot response has no token section");
        }

        boolean honeypot;
        String reason;
        JsonNode verdict = root.path("honeypotResult");
        if (verdict.isMissingNode() || verdict.isNull()) {
            honeypot = true;
            reason = MISSING_VERDICT_REASON;
        } else {
            honeypot = verdict.path("isHoneypot").asBoolean(true);
            reason = honeypot ? textOrNull(verdict.path("honeypotReason")) : null;
        }

        double buyTax = UNSIMULATED_TAX_PCT;
        double sellTax = UNSIMULATED_TAX_PCT;
        JsonNode simulation = root.path("simulationResult");
        if (!simulation.isMissingNode() && !simulation.isNull()) {
            buyTax = simulation.path("buyTax").asDouble(UNSIMULATED_TAX_PCT);
            sellTax = simulation.path("sellTax").asDouble(UNSIMULATED_TAX_PCT);
        }

        JsonNode pair = root.path("pair");
        List<String> flags = new ArrayList<>();
        for (JsonNode flag : root.path("summary").path("flags")) {
            String description = textOrNull(flag.path("description"));
            if (description != null) {
                flags.add(description);
            }
        }

        return new TokenRiskReport(
                lower(textOrNull(token.path("address"))),
                textOrNull(token.path("name")),
                textOrNull(token.path("symbol")),
                token.path("decimals").asInt(18),
                lower(firstNonNull(textOrNull(root.path("pairAddress")), textOrNull(pair.path("pair").path("address")))),
                textOrNull(pair.path("pair").path("type")),
                honeypot,
                reason,
                buyTax,
                sellTax,
                pair.path("liquidity").asDouble(0.0),
                flags);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String s = node.asText();
        return s.isBlank() ? null : s;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
