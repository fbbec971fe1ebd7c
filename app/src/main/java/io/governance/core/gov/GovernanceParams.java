package io.governance.core.gov;

import java.math.BigDecimal;

/** Initial policy supplied at initialization; the caller becomes the owner. */
public record GovernanceParams(BigDecimal quorum,
                               BigDecimal threshold,
                               long votingPeriod,
                               long timelockPeriod,
                               long expirationPeriod,
                               long proposalDeposit,
                               long snapshotPeriod) {

    GovernanceConfig toConfig(String owner) {
        return new GovernanceConfig(owner, null, quorum, threshold, votingPeriod, timelockPeriod,
                expirationPeriod, proposalDeposit, snapshotPeriod);
    }
}
