package com.chainwatch.ingestion.account;

import com.chainwatch.domain.EthBalance;
import com.chainwatch.domain.GasEstimate;
import com.chainwatch.domain.TokenBalance;
import com.chainwatch.domain.TokenRiskReport;
import com.chainwatch.ingestion.adapter.UpstreamException;
import com.chainwatch.ingestion.adapter.explorer.ExplorerClient;
import com.chainwatch.ingestion.adapter.honeypot.HoneypotClient;
import com.chainwatch.ingestion.adapter.rpc.JsonRpcClient;
import com.chainwatch.ingestion.config.AccountProperties;
import com.chainwatch.subscription.SubscriberRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * On-demand queries about the service's own wallet: ETH balance, gas price with swap fee estimates, ERC-20 balances.
 * Upstream failures propagate as {@link UpstreamException}; the caller maps them to a 502.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountQueryService {

    static final BigDecimal WEI_PER_ETH = BigDecimal.TEN.pow(18);
    static final BigDecimal WEI_PER_GWEI = BigDecimal.TEN.pow(9);
    /** Typical gas used by a Uniswap V2 swap. */
    static final BigDecimal UNISWAP_V2_SWAP_GAS = BigDecimal.valueOf(152_809);
    /** Typical gas used by a Uniswap V3 swap. */
    static final BigDecimal UNISWAP_V3_SWAP_GAS = BigDecimal.valueOf(184_523);
    /** Margin on top of the raw gas cost for priority fee and price movement. */
    static final BigDecimal FEE_MARGIN = new BigDecimal("1.03");
    private static final int SCALE = 18;

    private final JsonRpcClient jsonRpcClient;
    private final ExplorerClient explorerClient;
    private final HoneypotClient honeypotClient;
    private final AccountProperties accountProperties;
    private final SubscriberRegistry subscriberRegistry;

    public EthBalance ethBalance() {
        String address = accountProperties.getAddress();
        BigInteger wei = hexToBigInteger(jsonRpcClient.call("eth_getBalance", List.of(address, "latest")).asText());
        BigDecimal eth = new BigDecimal(wei).divide(WEI_PER_ETH, SCALE, RoundingMode.DOWN).stripTrailingZeros();
        BigDecimal usd = eth.multiply(explorerClient.fetchEthUsdPrice()).setScale(2, RoundingMode.HALF_UP);
        return new EthBalance(address, eth, usd);
    }

    public GasEstimate gasEstimate() {
        BigInteger wei = hexToBigInteger(jsonRpcClient.call("eth_gasPrice", List.of()).asText());
        BigDecimal gwei = new BigDecimal(wei).divide(WEI_PER_GWEI, 9, RoundingMode.HALF_UP);
        BigDecimal ethUsd = explorerClient.fetchEthUsdPrice();
        return new GasEstimate(
                gwei.setScale(2, RoundingMode.HALF_UP),
                ethUsd,
                swapFeeUsd(wei, ethUsd, UNISWAP_V2_SWAP_GAS),
                swapFeeUsd(wei, ethUsd, UNISWAP_V3_SWAP_GAS));
    }

    static BigDecimal swapFeeUsd(BigInteger gasPriceWei, BigDecimal ethUsd, BigDecimal gasUsed) {
        return new BigDecimal(gasPriceWei)
                .multiply(gasUsed)
                .multiply(ethUsd)
                .multiply(FEE_MARGIN)
                .divide(WEI_PER_ETH, 2, RoundingMode.HALF_UP);
    }

    /**
     * ERC-20 balances of the account. Zero balances are left out when {@code subscriberId} has hide-zero-balances set.
     */
    public List<TokenBalance> tokenBalances(String subscriberId) {
        JsonNode result = jsonRpcClient.call("alchemy_getTokenBalances", List.of(accountProperties.getAddress()));
        boolean hideZero = subscriberId != null && subscriberRegistry.settingsOf(subscriberId).hideZeroBalances();
        List<TokenBalance> balances = new ArrayList<>();
        for (JsonNode entry : result.path("tokenBalances")) {
            String contract = entry.path("contractAddress").asText(null);
            String rawHex = entry.path("tokenBalance").asText(null);
            if (contract == null) {
                continue;
            }
            TokenBalance balance = withMetadata(contract, rawHex);
            if (hideZero && balance.isZero()) {
                continue;
            }
            balances.add(balance);
        }
        return balances;
    }

    private TokenBalance withMetadata(String contract, String rawHex) {
        TokenRiskReport meta;
        try {
            meta = honeypotClient.resolveTokenMeta(contract);
        } catch (UpstreamException e) {
            log.warn("Token metadata unavailable for {}: {}", contract, e.getMessage());
            return new TokenBalance(contract, null, null, null, null, rawHex);
        }
        BigDecimal balance = rawHex == null ? null
                : new BigDecimal(hexToBigInteger(rawHex)).movePointLeft(meta.decimals()).stripTrailingZeros();
        return new TokenBalance(contract, meta.name(), meta.symbol(), meta.decimals(), balance, rawHex);
    }

    static BigInteger hexToBigInteger(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new UpstreamException("Missing hex quantity");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw new UpstreamException("Invalid hex quantity: " + hex, e);
        }
    }
}
