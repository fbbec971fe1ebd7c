package io.governance.core.state;

import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.GovernanceError;
import io.governance.core.gov.GovernanceException;
import io.governance.core.gov.PoolState;
import io.governance.core.ledger.TokenManager;
import io.governance.core.poll.Poll;
import io.governance.core.poll.VoterInfo;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-invocation view: reads fall through to the backing view unless this invocation has
 * already written the key; writes only land in {@link #changes()}.
 * Discarding the instance discards every write, which is how failed invocations leave no trace.
 */
public final class StagedState implements StateView {

    private final StateView base;
    private final StateChanges changes = new StateChanges();

    public StagedState(StateView base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public StateChanges changes() {
        return changes;
    }

    @Override
    public Optional<GovernanceConfig> config() {
        return changes.config().or(base::config);
    }

    @Override
    public Optional<PoolState> poolState() {
        return changes.poolState().or(base::poolState);
    }

    @Override
    public Optional<Poll> poll(long pollId) {
        Poll staged = changes.polls().get(pollId);
        return staged != null ? Optional.of(staged) : base.poll(pollId);
    }

    @Override
    public Optional<VoterInfo> voter(long pollId, String voter) {
        StateChanges.VoterKey key = new StateChanges.VoterKey(pollId, voter);
        if (changes.isVoterDeleted(key)) {
            return Optional.empty();
        }
        VoterInfo staged = changes.voterPuts().get(key);
        return staged != null ? Optional.of(staged) : base.voter(pollId, voter);
    }

    @Override
    public Optional<TokenManager> tokenManager(String staker) {
        TokenManager staged = changes.bank().get(staker);
        return staged != null ? Optional.of(staged) : base.tokenManager(staker);
    }

    /** Config, failing when governance has not been initialized yet. */
    public GovernanceConfig requireConfig() {
        return config().orElseThrow(() -> new GovernanceException(GovernanceError.NOT_INITIALIZED));
    }

    public PoolState requirePoolState() {
        return poolState().orElseThrow(() -> new GovernanceException(GovernanceError.NOT_INITIALIZED));
    }

    public Poll requirePoll(long pollId) {
        return poll(pollId).orElseThrow(() -> new GovernanceException(GovernanceError.POLL_NOT_FOUND));
    }

    public void saveConfig(GovernanceConfig config) { changes.putConfig(config); }
    public void savePoolState(PoolState state) { changes.putPoolState(state); }
    public void savePoll(Poll poll) { changes.putPoll(poll); }
    public void saveVoter(long pollId, String voter, VoterInfo info) { changes.putVoter(pollId, voter, info); }
    public void removeVoter(long pollId, String voter) { changes.deleteVoter(pollId, voter); }
    public void saveTokenManager(String staker, TokenManager tm) { changes.putTokenManager(staker, tm); }
}
