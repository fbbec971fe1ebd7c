package io.governance.core.storage;

import io.governance.core.gov.GovernanceConfig;
import io.governance.core.gov.PoolState;
import io.governance.core.ledger.TokenManager;
import io.governance.core.poll.OrderBy;
import io.governance.core.poll.Poll;
import io.governance.core.poll.PollStatus;
import io.governance.core.poll.VoterEntry;
import io.governance.core.poll.VoterInfo;
import io.governance.core.state.StateChanges;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Simple, fast in-memory governance store.
 * Good for tests and local nodes before wiring RocksDB. Not persistent.
 */
public final class InMemoryGovernanceStore implements GovernanceStore {

    private GovernanceConfig config;
    private PoolState poolState;

    /** Map: pollId -> Poll, id-ordered */
    private final NavigableMap<Long, Poll> polls = new TreeMap<>();

    /** Map: pollId -> (voter -> VoterInfo), address-ordered */
    private final Map<Long, NavigableMap<String, VoterInfo>> voters = new HashMap<>();

    /** Map: staker -> TokenManager */
    private final Map<String, TokenManager> bank = new HashMap<>();

    /** Map: holder -> simulated token balance */
    private final Map<String, Long> tokenBalances = new HashMap<>();
    private Long lastHeight;

    @Override
    public synchronized Optional<GovernanceConfig> config() {
        return Optional.ofNullable(config);
    }

    @Override
    public synchronized Optional<PoolState> poolState() {
        return Optional.ofNullable(poolState);
    }

    @Override
    public synchronized Optional<Poll> poll(long pollId) {
        return Optional.ofNullable(polls.get(pollId));
    }

    @Override
    public synchronized Optional<VoterInfo> voter(long pollId, String voter) {
        NavigableMap<String, VoterInfo> byVoter = voters.get(pollId);
        return byVoter == null ? Optional.empty() : Optional.ofNullable(byVoter.get(voter));
    }

    @Override
    public synchronized Optional<TokenManager> tokenManager(String staker) {
        return Optional.ofNullable(bank.get(staker));
    }

    @Override
    public synchronized List<Poll> polls(PollStatus filter, Long startAfter, int limit, OrderBy order) {
        NavigableMap<Long, Poll> range = polls;
        if (startAfter != null) {
            range = order == OrderBy.DESC ? polls.headMap(startAfter, false) : polls.tailMap(startAfter, false);
        }
        Iterable<Poll> ordered = order == OrderBy.DESC ? range.descendingMap().values() : range.values();
        List<Poll> out = new ArrayList<>();
        for (Poll poll : ordered) {
            if (out.size() >= limit) break;
            if (filter == null || poll.status() == filter) {
                out.add(poll);
            }
        }
        return out;
    }

    @Override
    public synchronized List<VoterEntry> voters(long pollId, String startAfter, int limit, OrderBy order) {
        NavigableMap<String, VoterInfo> byVoter = voters.get(pollId);
        if (byVoter == null || byVoter.isEmpty()) {
            return Collections.emptyList();
        }
        NavigableMap<String, VoterInfo> range = byVoter;
        if (startAfter != null) {
            range = order == OrderBy.DESC ? byVoter.headMap(startAfter, false) : byVoter.tailMap(startAfter, false);
        }
        NavigableMap<String, VoterInfo> ordered = order == OrderBy.DESC ? range.descendingMap() : range;
        List<VoterEntry> out = new ArrayList<>();
        for (Map.Entry<String, VoterInfo> e : ordered.entrySet()) {
            if (out.size() >= limit) break;
            out.add(new VoterEntry(e.getKey(), e.getValue()));
        }
        return out;
    }

    @Override
    public synchronized void apply(StateChanges changes) {
        changes.config().ifPresent(c -> this.config = c);
        changes.poolState().ifPresent(s -> this.poolState = s);
        polls.putAll(changes.polls());
        for (Map.Entry<StateChanges.VoterKey, VoterInfo> e : changes.voterPuts().entrySet()) {
            voters.computeIfAbsent(e.getKey().pollId(), k -> new TreeMap<>())
                    .put(e.getKey().voter(), e.getValue());
        }
        for (StateChanges.VoterKey key : changes.voterDeletes()) {
            NavigableMap<String, VoterInfo> byVoter = voters.get(key.pollId());
            if (byVoter != null) {
                byVoter.remove(key.voter());
                if (byVoter.isEmpty()) {
                    voters.remove(key.pollId());
                }
            }
        }
        bank.putAll(changes.bank());
    }

    @Override
    public synchronized OptionalLong lastHeight() {
        return lastHeight == null ? OptionalLong.empty() : OptionalLong.of(lastHeight);
    }

    @Override
    public synchronized Map<String, Long> tokenBalances() {
        return Map.copyOf(tokenBalances);
    }

    @Override
    public synchronized void saveNodeState(long height, Map<String, Long> balances) {
        this.lastHeight = height;
        tokenBalances.putAll(balances);
    }
}
