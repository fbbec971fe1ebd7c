package io.governance.core.poll;

import java.util.Objects;

/** A single voter's committed choice on one poll. Never mutated once recorded. */
public record VoterInfo(VoteOption vote, long balance) {
    public VoterInfo {
        Objects.requireNonNull(vote, "vote");
        if (balance < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
    }
}
