package io.governance.core.storage;

import io.governance.core.poll.OrderBy;
import io.governance.core.poll.Poll;
import io.governance.core.poll.PollStatus;
import io.governance.core.poll.VoterEntry;
import io.governance.core.state.StateChanges;
import io.governance.core.state.StateView;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Governance persistence API. Polls are keyed by id and iterate in id order;
 * voters are keyed by (poll id, voter address) and iterate in address order.
 */
public interface GovernanceStore extends StateView, AutoCloseable {

    /**
     * Polls ordered by id.
     *
     * @param filter     only polls in this status, or all when {@code null}
     * @param startAfter exclusive id cursor, or {@code null} to start at the edge given by {@code order}
     * @param limit      maximum number of polls returned
     */
    List<Poll> polls(PollStatus filter, Long startAfter, int limit, OrderBy order);

    /** Voter records of one poll ordered by voter address, with an exclusive address cursor. */
    List<VoterEntry> voters(long pollId, String startAfter, int limit, OrderBy order);

    /** Apply every write of one invocation atomically. */
    void apply(StateChanges changes);

    /** Last block height recorded by {@link #saveNodeState}, if any. */
    OptionalLong lastHeight();

    /** Holder balances of the simulated token contract; empty when none were ever saved. */
    Map<String, Long> tokenBalances();

    /** Records the node's height and the given token balances together. */
    void saveNodeState(long height, Map<String, Long> balances);

    @Override
    default void close() {}
}
