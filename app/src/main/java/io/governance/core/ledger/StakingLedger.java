package io.governance.core.ledger;

import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.GovernanceError;
import io.governance.core.gov.GovernanceException;
import io.governance.core.gov.PoolState;
import io.governance.core.poll.Poll;
import io.governance.core.protocol.Amounts;
import io.governance.core.protocol.HandleResponse;
import io.governance.core.protocol.OutboundMessage;
import io.governance.core.state.StagedState;
import io.governance.core.state.StateView;
import io.governance.core.token.TokenQuerier;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Share-based staking pool.
 *
 * <p>Stakers hold shares, not tokens. The pool's underlying balance is whatever the token contract
 * reports for the governance contract, minus escrowed proposal deposits, so rewards sent to the
 * contract raise the value of every share without touching any record here.
 */
public final class StakingLedger {
    private static final Logger LOG = Logger.getLogger(StakingLedger.class.getName());

    private final TokenQuerier token;

    public StakingLedger(TokenQuerier token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    /** Token balance backing the shares: contract balance minus escrowed deposits. */
    public long poolBalance(StateView view) {
        GovernanceConfig config = view.config().orElse(null);
        PoolState pool = view.poolState().orElse(null);
        if (config == null || pool == null || config.token() == null) {
            return 0L;
        }
        long held = token.balanceOf(config.token(), pool.contractAddress());
        return Math.max(0L, held - pool.totalDeposit());
    }

    /** share * poolBalance / totalShare, floored; 0 for unknown stakers or an empty pool. */
    public long quotedBalance(StateView view, String staker) {
        PoolState pool = view.poolState().orElse(null);
        TokenManager tm = view.tokenManager(staker).orElse(null);
        if (pool == null || tm == null || pool.totalShare() == 0L) {
            return 0L;
        }
        return Amounts.multiplyRatio(tm.share(), poolBalance(view), pool.totalShare());
    }

    /**
     * Credits shares for {@code amount} tokens that already arrived at the contract.
     * The token balance includes the incoming transfer, so the pre-deposit balance is recovered by subtracting it.
     */
    public HandleResponse stake(StagedState state, String staker, long amount) {
        if (amount <= 0) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_FUNDS);
        }
        PoolState pool = state.requirePoolState();
        long before = Math.max(0L, poolBalance(state) - amount);

        long minted;
        if (pool.totalShare() == 0L || before == 0L) {
            minted = amount;
        } else {
            minted = Amounts.multiplyRatio(amount, pool.totalShare(), before);
        }

        TokenManager tm = state.tokenManager(staker).orElse(TokenManager.empty());
        state.saveTokenManager(staker, tm.withShare(Amounts.add(tm.share(), minted)));
        state.savePoolState(pool.withTotalShare(Amounts.add(pool.totalShare(), minted)));

        LOG.fine(() -> "Staked " + amount + " for " + staker + " -> " + minted + " shares");
        return HandleResponse.builder()
                .attribute("action", "staking")
                .attribute("sender", staker)
                .attribute("share", minted)
                .attribute("amount", amount)
                .build();
    }

    /**
     * Burns shares worth {@code amount} tokens (or the whole position when absent) and schedules the payout.
     * Lock references to polls that are no longer in progress are dropped on the way.
     */
    public HandleResponse withdraw(StagedState state, String staker, OptionalLong amount) {
        TokenManager tm = state.tokenManager(staker)
                .orElseThrow(() -> new GovernanceException(GovernanceError.NOTHING_STAKED));
        GovernanceConfig config = state.requireConfig();
        PoolState pool = state.requirePoolState();

        long poolBalance = poolBalance(state);
        long quoted = quotedBalance(state, staker);

        long withdrawAmount;
        long burnShare;
        if (amount.isEmpty()) {
            withdrawAmount = quoted;
            burnShare = tm.share();
        } else {
            withdrawAmount = amount.getAsLong();
            if (withdrawAmount < 0 || withdrawAmount > quoted) {
                throw new GovernanceException(GovernanceError.EXCEEDS_BALANCE);
            }
            if (withdrawAmount == 0L || poolBalance == 0L) {
                burnShare = 0L;
            } else {
                long exact = Amounts.multiplyRatio(withdrawAmount, pool.totalShare(), poolBalance);
                burnShare = Math.min(tm.share(), Math.max(exact, 1L));
            }
        }

        TokenManager next = collectGarbage(state, staker, tm).withShare(tm.share() - burnShare);
        state.saveTokenManager(staker, next);
        state.savePoolState(pool.withTotalShare(Amounts.subtract(pool.totalShare(), burnShare)));

        HandleResponse.Builder out = HandleResponse.builder();
        if (withdrawAmount > 0L) {
            out.message(new OutboundMessage.Transfer(config.token(), staker, withdrawAmount));
        }
        LOG.fine(() -> "Withdrew " + withdrawAmount + " for " + staker + " burning " + burnShare + " shares");
        return out.attribute("action", "withdraw")
                .attribute("recipient", staker)
                .attribute("amount", withdrawAmount)
                .build();
    }

    /** Records the staker-side lock reference for a freshly cast vote. */
    public void lock(StagedState state, String staker, LockedVote lock) {
        TokenManager tm = state.tokenManager(staker).orElse(TokenManager.empty());
        state.saveTokenManager(staker, tm.withLock(lock));
    }

    /**
     * Drops the staker's voter records and lock references for polls that left IN_PROGRESS.
     * Only this staker's own references are scanned.
     */
    private TokenManager collectGarbage(StagedState state, String staker, TokenManager tm) {
        TokenManager kept = tm.retainLocks(pollId -> state.poll(pollId).map(Poll::inProgress).orElse(false));
        for (LockedVote lock : tm.lockedBalance()) {
            if (!kept.lockedBalance().contains(lock)) {
                state.removeVoter(lock.pollId(), staker);
            }
        }
        int dropped = tm.lockedBalance().size() - kept.lockedBalance().size();
        if (dropped > 0) {
            LOG.fine(() -> "Released " + dropped + " stale vote locks for " + staker);
        }
        return kept;
    }
}
