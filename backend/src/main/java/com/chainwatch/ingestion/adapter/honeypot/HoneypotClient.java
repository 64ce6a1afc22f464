package com.chainwatch.ingestion.adapter.honeypot;

import com.chainwatch.domain.TokenRiskReport;

/**
 * Token simulation service. Accepts a token or a pair address.
 * Throws {@link com.chainwatch.ingestion.adapter.UpstreamException} on failure.
 */
public interface HoneypotClient {

    TokenRiskReport resolveTokenMeta(String address);
}
