package com.chainwatch.domain;

/**
 * Deployer and deployment transaction of a contract.
 */
public record ContractCreation(String contractAddress, String creatorAddress, String txHash) {
}
