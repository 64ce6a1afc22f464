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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountQueryServiceTest {

    private static final String ACCOUNT = "0x1111111111111111111111111111111111111111";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String DUST = "0x2222222222222222222222222222222222222222";

    @Mock
    private JsonRpcClient jsonRpcClient;
    @Mock
    private ExplorerClient explorerClient;
    @Mock
    private HoneypotClient honeypotClient;

    private SubscriberRegistry registry;
    private AccountQueryService service;

    @BeforeEach
    void setUp() {
        AccountProperties accountProperties = new AccountProperties();
        accountProperties.setAddress(ACCOUNT);
        registry = new SubscriberRegistry();
        service = new AccountQueryService(jsonRpcClient, explorerClient, honeypotClient, accountProperties, registry);
    }

    @Test
    void ethBalance_convertsWeiAndPricesInUsd() {
        when(jsonRpcClient.call("eth_getBalance", List.of(ACCOUNT, "latest")))
                .thenReturn(TextNode.valueOf("0x1bc16d674ec80000")); // 2 ETH
        when(explorerClient.fetchEthUsdPrice()).thenReturn(new BigDecimal("3000.50"));

        EthBalance balance = service.ethBalance();

        assertThat(balance.address()).isEqualTo(ACCOUNT);
        assertThat(balance.eth()).isEqualByComparingTo("2");
        assertThat(balance.usd()).isEqualByComparingTo("6001.00");
    }

    @Test
    void gasEstimate_reportsGweiAndSwapFees() {
        when(jsonRpcClient.call("eth_gasPrice", List.of())).thenReturn(TextNode.valueOf("0x4a817c800")); // 20 gwei
        when(explorerClient.fetchEthUsdPrice()).thenReturn(new BigDecimal("2000"));

        GasEstimate estimate = service.gasEstimate();

        assertThat(estimate.gasPriceGwei()).isEqualByComparingTo("20.00");
        // 20e9 * 152809 * 2000 * 1.03 / 1e18
        assertThat(estimate.uniswapV2SwapUsd()).isEqualByComparingTo("6.30");
        assertThat(estimate.uniswapV3SwapUsd()).isEqualByComparingTo("7.60");
    }

    @Test
    void swapFeeUsd_roundsHalfUpToCents() {
        BigDecimal fee = AccountQueryService.swapFeeUsd(BigInteger.valueOf(1_000_000_000L), new BigDecimal("1000"),
                BigDecimal.valueOf(100_000));

        assertThat(fee).isEqualByComparingTo("0.10"); // 0.103 -> 0.10
    }

    @Test
    void hexToBigInteger_handlesPrefixAndEmptyDigits() {
        assertThat(AccountQueryService.hexToBigInteger("0xff")).isEqualTo(BigInteger.valueOf(255));
        assertThat(AccountQueryService.hexToBigInteger("0x")).isEqualTo(BigInteger.ZERO);
        assertThatThrownBy(() -> AccountQueryService.hexToBigInteger("0xzz")).isInstanceOf(UpstreamException.class);
        assertThatThrownBy(() -> AccountQueryService.hexToBigInteger(null)).isInstanceOf(UpstreamException.class);
    }

    @Test
    void tokenBalances_scalesByDecimalsAndKeepsZeroByDefault() throws Exception {
        stubBalances();

        List<TokenBalance> balances = service.tokenBalances(null);

        assertThat(balances).extracting(TokenBalance::contractAddress).containsExactly(USDC, DUST);
        assertThat(balances.get(0).balance()).isEqualByComparingTo("1.5");
        assertThat(balances.get(0).symbol()).isEqualTo("USDC");
        assertThat(balances.get(1).isZero()).isTrue();
    }

    @Test
    void tokenBalances_hidesZeroWhenSubscriberAsks() throws Exception {
        stubBalances();
        registry.setHideZeroBalances("alice", true);

        assertThat(service.tokenBalances("alice")).extracting(TokenBalance::contractAddress).containsExactly(USDC);
    }

    @Test
    void tokenBalances_metadataFailureKeepsRawBalance() throws Exception {
        when(jsonRpcClient.call("alchemy_getTokenBalances", List.of(ACCOUNT))).thenReturn(new ObjectMapper().readTree("""
                {"address":"%s","tokenBalances":[{"contractAddress":"%s","tokenBalance":"0x16e360"}]}
                """.formatted(ACCOUNT, USDC)));
        when(honeypotClient.resolveTokenMeta(anyString())).thenThrow(new UpstreamException("down"));

        List<TokenBalance> balances = service.tokenBalances(null);

        assertThat(balances).singleElement().satisfies(b -> {
            assertThat(b.symbol()).isNull();
            assertThat(b.balance()).isNull();
            assertThat(b.rawBalanceHex()).isEqualTo("0x16e360");
        });
    }

    private void stubBalances() throws Exception {
        JsonNode result = new ObjectMapper().readTree("""
                {"address":"%s","tokenBalances":[
                  {"contractAddress":"%s","tokenBalance":"0x000000000000000000000000000000000000000000000000000000000016e360"},
                  {"contractAddress":"%s","tokenBalance":"0x0000000000000000000000000000000000000000000000000000000000000000"}
                ]}
                """.formatted(ACCOUNT, USDC, DUST));
        when(jsonRpcClient.call("alchemy_getTokenBalances", List.of(ACCOUNT))).thenReturn(result);
        when(honeypotClient.resolveTokenMeta(USDC)).thenReturn(meta(USDC, "USD Coin", "USDC", 6));
        when(honeypotClient.resolveTokenMeta(DUST)).thenReturn(meta(DUST, "Dust", "DST", 18));
    }

    private static TokenRiskReport meta(String token, String name, String symbol, int decimals) {
        return new TokenRiskReport(token, name, symbol, decimals, null, null, false, null, 0, 0, 0, List.of());
    }
}
