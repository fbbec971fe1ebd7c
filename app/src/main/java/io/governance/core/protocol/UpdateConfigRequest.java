package io.governance.core.protocol;

import java.math.BigDecimal;

/**
 * Partial config update. Every {@code null} field is left unchanged.
 */
public record UpdateConfigRequest(String owner,
                                  BigDecimal quorum,
                                  BigDecimal threshold,
                                  Long votingPeriod,
                                  Long timelockPeriod,
                                  Long expirationPeriod,
                                  Long proposalDeposit,
                                  Long snapshotPeriod) {

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String owner;
        private BigDecimal quorum;
        private BigDecimal threshold;
        private Long votingPeriod;
        private Long timelockPeriod;
        private Long expirationPeriod;
        private Long proposalDeposit;
        private Long snapshotPeriod;

        public Builder owner(String o) { this.owner = o; return this; }
        public Builder quorum(BigDecimal q) { this.quorum = q; return this; }
        public Builder threshold(BigDecimal t) { this.threshold = t; return this; }
        public Builder votingPeriod(long p) { this.votingPeriod = p; return this; }
        public Builder timelockPeriod(long p) { this.timelockPeriod = p; return this; }
        public Builder expirationPeriod(long p) { this.expirationPeriod = p; return this; }
        public Builder proposalDeposit(long d) { this.proposalDeposit = d; return this; }
        public Builder snapshotPeriod(long p) { this.snapshotPeriod = p; return this; }

        public UpdateConfigRequest build() {
            return new UpdateConfigRequest(owner, quorum, threshold, votingPeriod, timelockPeriod,
                    expirationPeriod, proposalDeposit, snapshotPeriod);
        }
    }
}
