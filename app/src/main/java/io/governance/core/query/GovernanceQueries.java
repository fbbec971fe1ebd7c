package io.governance.core.query;

import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.GovernanceError;
import io.governance.core.gov.GovernanceException;
import io.governance.core.gov.PoolState;
import io.governance.core.ledger.LockedVote;
import io.governance.core.ledger.StakingLedger;
import io.governance.core.ledger.TokenManager;
import io.governance.core.poll.OrderBy;
import io.governance.core.poll.Poll;
import io.governance.core.poll.PollStatus;
import io.governance.core.poll.VoterEntry;
import io.governance.core.storage.GovernanceStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only views over committed governance state.
 */
public final class GovernanceQueries {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 30;

    private final GovernanceStore store;
    private final StakingLedger ledger;

    public GovernanceQueries(GovernanceStore store, StakingLedger ledger) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public GovernanceConfig config() {
        return store.config().orElseThrow(() -> new GovernanceException(GovernanceError.NOT_INITIALIZED));
    }

    public StateResponse state() {
        PoolState pool = store.poolState()
                .orElseThrow(() -> new GovernanceException(GovernanceError.NOT_INITIALIZED));
        return new StateResponse(pool.pollCount(), pool.totalShare(), pool.totalDeposit());
    }

    public Poll poll(long pollId) {
        return store.poll(pollId).orElseThrow(() -> new GovernanceException(GovernanceError.POLL_NOT_FOUND));
    }

    public List<Poll> polls(PollStatus filter, Long startAfter, Integer limit, OrderBy order) {
        return store.polls(filter, startAfter, clamp(limit), order == null ? OrderBy.ASC : order);
    }

    /** Locks are reported only for polls that are still in progress; stale ones linger in storage until the next withdraw. */
    public StakerResponse staker(String address) {
        TokenManager tm = store.tokenManager(address).orElse(TokenManager.empty());
        List<LockedVote> live = new ArrayList<>();
        for (LockedVote lock : tm.lockedBalance()) {
            if (store.poll(lock.pollId()).map(Poll::inProgress).orElse(false)) {
                live.add(lock);
            }
        }
        return new StakerResponse(ledger.quotedBalance(store, address), tm.share(), live);
    }

    public List<VoterEntry> voters(long pollId, String startAfter, Integer limit, OrderBy order) {
        Poll poll = poll(pollId);
        if (!poll.inProgress()) {
            return List.of();
        }
        return store.voters(pollId, startAfter, clamp(limit), order == null ? OrderBy.ASC : order);
    }

    static int clamp(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(0, Math.min(limit, MAX_LIMIT));
    }
}
