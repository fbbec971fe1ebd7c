package io.governance.core.poll;

import io.governance.core.protocol.DelegatedCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A proposal. Instances are immutable; state transitions produce a copy via the {@code with*} methods.
 *
 * <p>{@code stakedAmount} is set by an explicit snapshot; {@code totalBalanceAtEndPoll} records the
 * quorum denominator actually used at resolution. Both stay {@code null} until then.
 */
public record Poll(long id,
                   String creator,
                   PollStatus status,
                   long yesVotes,
                   long noVotes,
                   long endHeight,
                   String title,
                   String description,
                   String link,
                   long depositAmount,
                   List<DelegatedCall> executeData,
                   Long stakedAmount,
                   Long totalBalanceAtEndPoll) {

    public Poll {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(status, "status");
        executeData = executeData == null ? List.of() : List.copyOf(executeData);
    }

    /** Opens a new poll with its delegated calls stably sorted by their declared order. */
    public static Poll open(long id, String creator, long endHeight, String title, String description,
                            String link, long depositAmount, List<DelegatedCall> calls) {
        List<DelegatedCall> sorted = new ArrayList<>(calls == null ? Collections.emptyList() : calls);
        sorted.sort(Comparator.comparingLong(DelegatedCall::order)); // List.sort is stable
        return new Poll(id, creator, PollStatus.IN_PROGRESS, 0L, 0L, endHeight, title, description,
                link, depositAmount, sorted, null, null);
    }

    public long totalVotes() {
        return Math.addExact(yesVotes, noVotes);
    }

    public boolean inProgress() {
        return status == PollStatus.IN_PROGRESS;
    }

    public Poll withVote(VoteOption option, long amount) {
        long yes = option == VoteOption.YES ? Math.addExact(yesVotes, amount) : yesVotes;
        long no = option == VoteOption.NO ? Math.addExact(noVotes, amount) : noVotes;
        return new Poll(id, creator, status, yes, no, endHeight, title, description, link,
                depositAmount, executeData, stakedAmount, totalBalanceAtEndPoll);
    }

    public Poll withStatus(PollStatus next) {
        return new Poll(id, creator, next, yesVotes, noVotes, endHeight, title, description, link,
                depositAmount, executeData, stakedAmount, totalBalanceAtEndPoll);
    }

    public Poll withStakedAmount(long staked) {
        return new Poll(id, creator, status, yesVotes, noVotes, endHeight, title, description, link,
                depositAmount, executeData, staked, totalBalanceAtEndPoll);
    }

    public Poll withTotalBalanceAtEndPoll(long total) {
        return new Poll(id, creator, status, yesVotes, noVotes, endHeight, title, description, link,
                depositAmount, executeData, stakedAmount, total);
    }
}
