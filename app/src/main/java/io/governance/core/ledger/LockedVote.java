package io.governance.core.ledger;

import io.governance.core.poll.VoterInfo;

import java.util.Objects;

/** Staker-side reference to a vote recorded on a poll. */
public record LockedVote(long pollId, VoterInfo voter) {
    public LockedVote {
        Objects.requireNonNull(voter, "voter");
    }
}
