package io.governance.core.state;

import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.PoolState;
import io.governance.core.ledger.TokenManager;
import io.governance.core.poll.Poll;
import io.governance.core.poll.VoterInfo;

import java.util.Optional;

/**
 * Point reads over governance state.
 */
public interface StateView {
    Optional<GovernanceConfig> config();

    Optional<PoolState> poolState();

    Optional<Poll> poll(long pollId);

    Optional<VoterInfo> voter(long pollId, String voter);

    Optional<TokenManager> tokenManager(String staker);
}
