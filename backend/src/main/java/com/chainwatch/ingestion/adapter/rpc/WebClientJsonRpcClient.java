package com.chainwatch.ingestion.adapter.rpc;

import com.chainwatch.common.RetryPolicy;
import com.chainwatch.ingestion.adapter.BudgetMeter;
import com.chainwatch.ingestion.adapter.RpcEndpointRotator;
import com.chainwatch.ingestion.adapter.UpstreamCalls;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC client using WebClient. Each attempt takes the next endpoint from the rotator and one permit
 * from the shared RPC limiter.
 */
public class WebClientJsonRpcClient implements JsonRpcClient {

    private final WebClient webClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rpcRateLimiter;
    private final RetryPolicy retryPolicy;
    private final BudgetMeter budgetMeter;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebClientJsonRpcClient(WebClient.Builder builder,
                                  RpcEndpointRotator rotator,
                                  RateLimiter rpcRateLimiter,
                                  RetryPolicy retryPolicy,
                                  BudgetMeter budgetMeter,
                                  ObjectMapper objectMapper,
                                  Duration timeout) {
        this.webClient = builder.build();
        this.rotator = rotator;
        this.rpcRateLimiter = rpcRateLimiter;
        this.retryPolicy = retryPolicy;
        this.budgetMeter = budgetMeter;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public JsonNode call(String method, List<?> params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : List.of()
        );
        String response = UpstreamCalls.withRetry(retryPolicy, method, () -> {
            if (!rpcRateLimiter.acquirePermission()) {
                throw new UpstreamException("Local RPC rate limit exceeded for " + method);
            }
            String endpoint = rotator.nextEndpoint();
            budgetMeter.charge(method);
            try {
                return webClient.post()
                        .uri(endpoint)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);
            } catch (WebClientResponseException e) {
                throw new UpstreamException("RPC HTTP " + e.getStatusCode().value() + " for " + method, e);
            }
        });
        return resultOf(response, method);
    }

    JsonNode resultOf(String response, String method) {
        if (response == null || response.isBlank()) {
            throw new UpstreamException("Empty RPC response for " + method);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new UpstreamException("Malformed RPC response for " + method, e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new UpstreamException("RPC error for " + method + ": " + error.path("message").asText(error.toString()));
        }
        JsonNode result = root.get("result");
        if (result == null) {
            throw new UpstreamException("RPC response for " + method + " has no result");
        }
        return result;
    }
}
