package io.governance.core.gov;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Policy consulted by the state machine. Periods are in block heights.
 * {@code token} stays {@code null} until the voting token is registered.
 */
public record GovernanceConfig(String owner,
                               String token,
                               BigDecimal quorum,
                               BigDecimal threshold,
                               long votingPeriod,
                               long timelockPeriod,
                               long expirationPeriod,
                               long proposalDeposit,
                               long snapshotPeriod) {

    public GovernanceConfig {
        Objects.requireNonNull(owner, "owner");
        validateQuorum(quorum);
        validateThreshold(threshold);
        requireNonNegative(votingPeriod, "voting_period");
        requireNonNegative(timelockPeriod, "timelock_period");
        requireNonNegative(expirationPeriod, "expiration_period");
        requireNonNegative(proposalDeposit, "proposal_deposit");
        requireNonNegative(snapshotPeriod, "snapshot_period");
    }

    public GovernanceConfig withToken(String registered) {
        return new GovernanceConfig(owner, registered, quorum, threshold, votingPeriod, timelockPeriod,
                expirationPeriod, proposalDeposit, snapshotPeriod);
    }

    static void validateQuorum(BigDecimal quorum) {
        if (!inUnitRange(quorum)) {
            throw new GovernanceException(GovernanceError.INVALID_RATIO, "quorum must be 0 to 1");
        }
    }

    static void validateThreshold(BigDecimal threshold) {
        if (!inUnitRange(threshold)) {
            throw new GovernanceException(GovernanceError.INVALID_RATIO, "threshold must be 0 to 1");
        }
    }

    private static boolean inUnitRange(BigDecimal ratio) {
        return ratio != null && ratio.signum() >= 0 && ratio.compareTo(BigDecimal.ONE) <= 0;
    }

    private static void requireNonNegative(long value, String field) {
        if (value < 0) {
            throw new GovernanceException(GovernanceError.INVALID_FIELD, field + " must be >= 0");
        }
    }
}
