package com.chainwatch.ingestion.config;

import com.chainwatch.common.ComputeBudgetTracker;
import com.chainwatch.common.RateLimiter;
import com.chainwatch.common.RetryPolicy;
import com.chainwatch.ingestion.adapter.BudgetMeter;
import com.chainwatch.ingestion.adapter.RpcEndpointRotator;
import com.chainwatch.ingestion.adapter.explorer.ExplorerClient;
import com.chainwatch.ingestion.adapter.explorer.WebClientExplorerClient;
import com.chainwatch.ingestion.adapter.holders.TopHolderClient;
import com.chainwatch.ingestion.adapter.holders.WebClientTopHolderClient;
import com.chainwatch.ingestion.adapter.honeypot.HoneypotClient;
import com.chainwatch.ingestion.adapter.honeypot.WebClientHoneypotClient;
import com.chainwatch.ingestion.adapter.rpc.JsonRpcClient;
import com.chainwatch.ingestion.adapter.rpc.WebClientJsonRpcClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the upstream provider clients, their shared retry policy, rate limiters and the compute budget.
 */
@Configuration
@EnableConfigurationProperties({ ProviderProperties.class, UpstreamRetryProperties.class, WatchProperties.class,
        DiscoveryProperties.class, RiskProperties.class, ComputeBudgetProperties.class, AccountProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public RetryPolicy upstreamRetryPolicy(UpstreamRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public ComputeBudgetTracker computeBudgetTracker(ComputeBudgetProperties properties, Clock clock) {
        return new ComputeBudgetTracker(properties.getCapacity(), clock);
    }

    @Bean(name = "explorerRateLimiter")
    public RateLimiter explorerRateLimiter(ProviderProperties providerProperties) {
        return new RateLimiter(providerProperties.getExplorer().getRequestsPerMinute());
    }

    @Bean(name = "rpcRateLimiter")
    public io.github.resilience4j.ratelimiter.RateLimiter rpcRateLimiter(ProviderProperties providerProperties) {
        ProviderProperties.Rpc rpc = providerProperties.getRpc();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpc.getRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpc.getLimiterTimeoutMs())))
                .build();
        return io.github.resilience4j.ratelimiter.RateLimiter.of("eth-rpc", config);
    }

    @Bean
    public RpcEndpointRotator rpcEndpointRotator(ProviderProperties providerProperties) {
        return new RpcEndpointRotator(providerProperties.getRpc().getUrls());
    }

    @Bean
    public ExplorerClient explorerClient(WebClient.Builder webClientBuilder,
                                         ProviderProperties providerProperties,
                                         RetryPolicy upstreamRetryPolicy,
                                         RateLimiter explorerRateLimiter,
                                         BudgetMeter budgetMeter,
                                         ObjectMapper objectMapper) {
        return new WebClientExplorerClient(webClientBuilder, providerProperties, upstreamRetryPolicy,
                explorerRateLimiter, budgetMeter, objectMapper);
    }

    @Bean
    public HoneypotClient honeypotClient(WebClient.Builder webClientBuilder,
                                         ProviderProperties providerProperties,
                                         RetryPolicy upstreamRetryPolicy,
                                         BudgetMeter budgetMeter,
                                         ObjectMapper objectMapper) {
        return new WebClientHoneypotClient(webClientBuilder, providerProperties, upstreamRetryPolicy,
                budgetMeter, objectMapper);
    }

    @Bean
    public TopHolderClient topHolderClient(WebClient.Builder webClientBuilder,
                                           ProviderProperties providerProperties,
                                           RetryPolicy upstreamRetryPolicy,
                                           BudgetMeter budgetMeter,
                                           ObjectMapper objectMapper) {
        return new WebClientTopHolderClient(webClientBuilder, providerProperties, upstreamRetryPolicy,
                budgetMeter, objectMapper);
    }

    @Bean
    public JsonRpcClient jsonRpcClient(WebClient.Builder webClientBuilder,
                                       RpcEndpointRotator rpcEndpointRotator,
                                       io.github.resilience4j.ratelimiter.RateLimiter rpcRateLimiter,
                                       RetryPolicy upstreamRetryPolicy,
                                       BudgetMeter budgetMeter,
                                       ObjectMapper objectMapper,
                                       ProviderProperties providerProperties) {
        return new WebClientJsonRpcClient(webClientBuilder, rpcEndpointRotator, rpcRateLimiter,
                upstreamRetryPolicy, budgetMeter, objectMapper,
                Duration.ofSeconds(providerProperties.getTimeoutSeconds()));
    }
}
