package com.chainwatch.ingestion.adapter.explorer;

import com.chainwatch.domain.ActivityRecord;
import com.chainwatch.domain.ContractCreation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Etherscan-style block explorer. Every method throws
 * {@link com.chainwatch.ingestion.adapter.UpstreamException} on failure; an address without history yields an
 * empty list. Transaction lists are returned newest first.
 */
public interface ExplorerClient {

    int MAX_CREATION_BATCH = 5;

    /** Most recent ERC-20 transfers to or from {@code address}, bounded by the configured page size. */
    List<ActivityRecord> fetchRecentTransfers(String address);

    /** Most recent {@code count} internal transactions of {@code address}. */
    List<ActivityRecord> fetchRecentInternalTxs(String address, int count);

    /** Most recent normal transactions sent or received by {@code address}, bounded by the configured page size. */
    List<ActivityRecord> fetchNormalTxs(String address);

    /**
     * Deployer and deployment tx for each contract. The provider caps one call at
     * {@link #MAX_CREATION_BATCH} addresses; larger lists are rejected.
     */
    List<ContractCreation> resolveCreatorAndTxHash(List<String> contractAddresses);

    /** Last ETH/USD price. */
    BigDecimal fetchEthUsdPrice();
}
