package io.governance.core.gov;

import java.util.Objects;

/**
 * Pool-wide counters. {@code totalDeposit} is escrowed proposal deposits, which the contract holds
 * but which never count toward stake weight.
 */
public record PoolState(String contractAddress, long pollCount, long totalShare, long totalDeposit) {

    public PoolState {
        Objects.requireNonNull(contractAddress, "contractAddress");
    }

    public static PoolState empty(String contractAddress) {
        return new PoolState(contractAddress, 0L, 0L, 0L);
    }

    public PoolState withPollCount(long count) {
        return new PoolState(contractAddress, count, totalShare, totalDeposit);
    }

    public PoolState withTotalShare(long share) {
        return new PoolState(contractAddress, pollCount, share, totalDeposit);
    }

    public PoolState withTotalDeposit(long deposit) {
        return new PoolState(contractAddress, pollCount, totalShare, deposit);
    }
}
