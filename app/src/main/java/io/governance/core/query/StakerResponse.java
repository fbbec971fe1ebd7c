package io.governance.core.query;

import io.governance.core.ledger.LockedVote;

import java.util.List;

/** A staker's quoted token balance, raw share and live vote locks. */
public record StakerResponse(long balance, long share, List<LockedVote> lockedBalance) {
    public StakerResponse {
        lockedBalance = List.copyOf(lockedBalance);
    }
}
