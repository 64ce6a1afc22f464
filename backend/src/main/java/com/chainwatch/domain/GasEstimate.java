package com.chainwatch.domain;

import java.math.BigDecimal;

/**
 * Current gas price and the estimated USD cost of a typical swap on Uniswap V2 and V3.
 */
public record GasEstimate(BigDecimal gasPriceGwei, BigDecimal ethUsd, BigDecimal uniswapV2SwapUsd, BigDecimal uniswapV3SwapUsd) {
}
