package com.chainwatch.notification;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.CandidateToBuyEvent;
import com.chainwatch.domain.TokenRiskReport;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders notification text.
 */
@Component
public class NotificationFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    public String walletActivity(String address, ActivityRecord record) {
        return "New transaction from watched wallet\n\n"
                + "Wallet: " + address + "\n\n"
                + "Timestamp: " + TIMESTAMP.format(Instant.ofEpochSecond(record.timestamp())) + "\n"
                + "Transaction hash: " + record.hash() + "\n"
                + "Token symbol: " + nullToEmpty(record.tokenSymbol()) + "\n"
                + "Token name: " + nullToEmpty(record.tokenName()) + "\n"
                + "Contract: " + nullToEmpty(record.contractAddress());
    }

    public String candidateToBuy(CandidateToBuyEvent event) {
        StringBuilder sb = new StringBuilder("New token passed all checks\n\n");
        TokenRiskReport report = event.report();
        if (report != null && report.name() != null) {
            sb.append("Token: ").append(report.name()).append(" (").append(nullToEmpty(report.symbol())).append(")\n");
        }
        sb.append("Contract: ").append(nullToEmpty(event.tokenAddress())).append('\n');
        sb.append("Pair: ").append(event.pairAddress()).append('\n');
        sb.append("Creator: ").append(nullToEmpty(event.creatorAddress())).append('\n');
        sb.append("Created: ").append(TIMESTAMP.format(event.createdAt())).append('\n');
        if (report != null) {
            sb.append(String.format(Locale.ROOT, "Buy tax: %.2f%%, sell tax: %.2f%%%n", report.buyTaxPct(), report.sellTaxPct()));
            sb.append(String.format(Locale.ROOT, "Liquidity: $%,.2f", report.liquidityUsd()));
        }
        return sb.toString().stripTrailing();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
