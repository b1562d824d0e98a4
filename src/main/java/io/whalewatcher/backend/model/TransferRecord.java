package io.whalewatcher.backend.model;

import java.time.Instant;

/**
 * A normalized whale transfer.
 *
 * <p>{@code assetContract} is null for native ETH. {@code blockNumber} is 0 when the provider did not
 * report a parsable block. {@code observedAt} is the local normalization time, not the block time.
 */
public record TransferRecord(
    String txHash,
    String fromAddress,
    String toAddress,
    String assetSymbol,
    String assetContract,
    double amount,
    long blockNumber,
    String chain,
    Instant observedAt) {

  public static final String CHAIN = "eth";
}
