package io.governance.core.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongPredicate;

/**
 * A staker's pool claim (in shares, not tokens) and the polls they still hold a vote reference for.
 */
public record TokenManager(long share, List<LockedVote> lockedBalance) {

    public TokenManager {
        if (share < 0) {
            throw new IllegalArgumentException("share must be >= 0");
        }
        lockedBalance = lockedBalance == null ? List.of() : List.copyOf(lockedBalance);
    }

    public static TokenManager empty() {
        return new TokenManager(0L, List.of());
    }

    public TokenManager withShare(long newShare) {
        return new TokenManager(newShare, lockedBalance);
    }

    public TokenManager withLock(LockedVote lock) {
        List<LockedVote> next = new ArrayList<>(lockedBalance);
        next.add(lock);
        return new TokenManager(share, next);
    }

    /** Keeps only the locks whose poll id satisfies {@code keep}. */
    public TokenManager retainLocks(LongPredicate keep) {
        List<LockedVote> next = new ArrayList<>(lockedBalance.size());
        for (LockedVote lock : lockedBalance) {
            if (keep.test(lock.pollId())) {
                next.add(lock);
            }
        }
        return new TokenManager(share, next);
    }
}
