package io.governance.core.state;

import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.PoolState;
import io.governance.core.ledger.TokenManager;
import io.governance.core.poll.Poll;
import io.governance.core.poll.VoterInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Write set of one invocation. Stores apply it as a single unit.
 */
public final class StateChanges {

    public record VoterKey(long pollId, String voter) {}

    private GovernanceConfig config;
    private PoolState poolState;
    private final Map<Long, Poll> polls = new LinkedHashMap<>();
    private final Map<VoterKey, VoterInfo> voterPuts = new LinkedHashMap<>();
    private final Set<VoterKey> voterDeletes = new LinkedHashSet<>();
    private final Map<String, TokenManager> bank = new LinkedHashMap<>();

    void putConfig(GovernanceConfig c) { this.config = c; }
    void putPoolState(PoolState s) { this.poolState = s; }
    void putPoll(Poll p) { polls.put(p.id(), p); }
    void putTokenManager(String staker, TokenManager tm) { bank.put(staker, tm); }

    void putVoter(long pollId, String voter, VoterInfo info) {
        VoterKey key = new VoterKey(pollId, voter);
        voterDeletes.remove(key);
        voterPuts.put(key, info);
    }

    void deleteVoter(long pollId, String voter) {
        VoterKey key = new VoterKey(pollId, voter);
        voterPuts.remove(key);
        voterDeletes.add(key);
    }

    public Optional<GovernanceConfig> config() { return Optional.ofNullable(config); }
    public Optional<PoolState> poolState() { return Optional.ofNullable(poolState); }
    public Map<Long, Poll> polls() { return Collections.unmodifiableMap(polls); }
    public Map<VoterKey, VoterInfo> voterPuts() { return Collections.unmodifiableMap(voterPuts); }
    public Set<VoterKey> voterDeletes() { return Collections.unmodifiableSet(voterDeletes); }
    public Map<String, TokenManager> bank() { return Collections.unmodifiableMap(bank); }

    boolean isVoterDeleted(VoterKey key) { return voterDeletes.contains(key); }

    public boolean isEmpty() {
        return config == null && poolState == null && polls.isEmpty()
                && voterPuts.isEmpty() && voterDeletes.isEmpty() && bank.isEmpty();
    }
}
