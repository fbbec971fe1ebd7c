package io.governance.core.gov;

import io.governance.core.ledger.LockedVote;
import io.governance.core.ledger.StakingLedger;
import io.governance.core.metrics.GovernanceMetrics;
import io.governance.core.poll.Poll;
import io.governance.core.poll.PollStatus;
import io.governance.core.poll.PollValidator;
import io.governance.core.poll.VoteOption;
import io.governance.core.poll.VoterInfo;
import io.governance.core.protocol.Amounts;
import io.governance.core.protocol.CreatePollRequest;
import io.governance.core.protocol.DelegatedCall;
import io.governance.core.protocol.HandleResponse;
import io.governance.core.protocol.HookMessage;
import io.governance.core.protocol.MessageCodec;
import io.governance.core.protocol.OutboundMessage;
import io.governance.core.protocol.UpdateConfigRequest;
import io.governance.core.state.StagedState;
import io.governance.core.storage.GovernanceStore;
import io.governance.core.token.TokenQuerier;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * The poll lifecycle state machine over the staking ledger.
 *
 * <p>Every public operation runs to completion against a {@link StagedState}; its writes reach the
 * store in one {@link GovernanceStore#apply} call only if the operation returns normally. Outbound
 * messages are returned, never executed here. Operations are serialized on the engine instance.
 */
public final class GovernanceEngine {
    private static final Logger LOG = Logger.getLogger(GovernanceEngine.class.getName());

    static final String QUORUM_NOT_REACHED = "Quorum not reached";
    static final String THRESHOLD_NOT_REACHED = "Threshold not reached";

    private final GovernanceStore store;
    private final StakingLedger ledger;
    private final String contractAddress;

    public GovernanceEngine(GovernanceStore store, TokenQuerier token, String contractAddress) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = new StakingLedger(token);
        this.contractAddress = Objects.requireNonNull(contractAddress, "contractAddress");
    }

    public String contractAddress() { return contractAddress; }
    public GovernanceStore store() { return store; }
    public StakingLedger ledger() { return ledger; }

    // -------------------- bootstrap --------------------

    public HandleResponse init(MessageContext ctx, GovernanceParams params) {
        return invoke("init", state -> {
            if (state.config().isPresent()) {
                throw new GovernanceException(GovernanceError.ALREADY_INITIALIZED);
            }
            state.saveConfig(params.toConfig(ctx.sender()));
            state.savePoolState(PoolState.empty(contractAddress));
            LOG.info(() -> "Governance initialized at " + contractAddress + " (owner " + ctx.sender() + ")");
            return HandleResponse.builder().attribute("action", "init").build();
        });
    }

    /** One-shot registration of the voting token whose deposit notifications are accepted. */
    public HandleResponse registerToken(MessageContext ctx, String token) {
        return invoke("register_token", state -> {
            GovernanceConfig config = state.requireConfig();
            if (config.token() != null || !config.owner().equals(ctx.sender())) {
                throw new GovernanceException(GovernanceError.UNAUTHORIZED);
            }
            if (token == null || token.isBlank()) {
                throw new GovernanceException(GovernanceError.INVALID_FIELD, "token must not be blank");
            }
            state.saveConfig(config.withToken(token));
            return HandleResponse.builder()
                    .attribute("action", "register_token")
                    .attribute("token", token)
                    .build();
        });
    }

    // -------------------- deposit notifications --------------------

    /**
     * Entry point for the token contract's transfer notification: {@code from} sent {@code amount}
     * tokens to this contract with {@code msg} attached. Only the registered token may call this.
     */
    public HandleResponse receive(MessageContext ctx, String from, long amount, byte[] msg) {
        return invoke("receive", state -> {
            GovernanceConfig config = state.requireConfig();
            if (config.token() == null || !config.token().equals(ctx.sender())) {
                throw new GovernanceException(GovernanceError.UNAUTHORIZED);
            }
            HookMessage hook = MessageCodec.decodeHook(msg);
            if (hook instanceof HookMessage.CreatePoll create) {
                return createPoll(state, ctx, config, from, amount, create.request());
            }
            return ledger.stake(state, from, amount);
        });
    }

    private HandleResponse createPoll(StagedState state, MessageContext ctx, GovernanceConfig config,
                                      String creator, long deposit, CreatePollRequest request) {
        if (deposit < config.proposalDeposit()) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_DEPOSIT,
                    "Must deposit more than " + config.proposalDeposit() + " token");
        }
        PollValidator.validate(request.title(), request.description(), request.link());

        PoolState pool = state.requirePoolState();
        long pollId = pool.pollCount() + 1;
        long endHeight = Math.addExact(ctx.height(), config.votingPeriod());
        Poll poll = Poll.open(pollId, creator, endHeight, request.title(), request.description(),
                request.link(), deposit, request.executeMsgs());

        state.savePoll(poll);
        state.savePoolState(pool.withPollCount(pollId)
                .withTotalDeposit(Amounts.add(pool.totalDeposit(), deposit)));
        GovernanceMetrics.incrementPollsCreated();
        LOG.fine(() -> "Poll " + pollId + " opened by " + creator + ", ends at " + endHeight);

        return HandleResponse.builder()
                .attribute("action", "create_poll")
                .attribute("creator", creator)
                .attribute("poll_id", pollId)
                .attribute("end_height", endHeight)
                .build();
    }

    // -------------------- staking --------------------

    /** Withdraws {@code amount} tokens, or the caller's whole position when empty. */
    public HandleResponse withdraw(MessageContext ctx, OptionalLong amount) {
        return invoke("withdraw", state -> ledger.withdraw(state, ctx.sender(), amount));
    }

    // -------------------- voting --------------------

    public HandleResponse castVote(MessageContext ctx, long pollId, VoteOption vote, long amount) {
        return invoke("cast_vote", state -> {
            Poll poll = state.requirePoll(pollId);
            if (!poll.inProgress() || ctx.height() > poll.endHeight()) {
                throw new GovernanceException(GovernanceError.POLL_NOT_IN_PROGRESS);
            }
            String voter = ctx.sender();
            if (state.voter(pollId, voter).isPresent()) {
                throw new GovernanceException(GovernanceError.ALREADY_VOTED);
            }
            if (amount < 0 || amount > ledger.quotedBalance(state, voter)) {
                throw new GovernanceException(GovernanceError.INSUFFICIENT_STAKE);
            }

            VoterInfo info = new VoterInfo(vote, amount);
            state.savePoll(poll.withVote(vote, amount));
            state.saveVoter(pollId, voter, info);
            ledger.lock(state, voter, new LockedVote(pollId, info));
            GovernanceMetrics.incrementVotesCast();

            return HandleResponse.builder()
                    .attribute("action", "cast_vote")
                    .attribute("poll_id", pollId)
                    .attribute("amount", amount)
                    .attribute("voter", voter)
                    .attribute("vote_option", vote)
                    .build();
        });
    }

    /**
     * Freezes the quorum denominator at the current pool balance. Allowed once per poll and only
     * within {@code snapshot_period} heights of the poll's end.
     */
    public HandleResponse snapshotPoll(MessageContext ctx, long pollId) {
        return invoke("snapshot_poll", state -> {
            GovernanceConfig config = state.requireConfig();
            Poll poll = state.requirePoll(pollId);
            if (!poll.inProgress() || ctx.height() > poll.endHeight()) {
                throw new GovernanceException(GovernanceError.POLL_NOT_IN_PROGRESS);
            }
            if (ctx.height() < poll.endHeight() - config.snapshotPeriod()) {
                throw new GovernanceException(GovernanceError.SNAPSHOT_WINDOW_NOT_OPEN);
            }
            if (poll.stakedAmount() != null) {
                throw new GovernanceException(GovernanceError.SNAPSHOT_ALREADY_TAKEN);
            }
            long staked = ledger.poolBalance(state);
            state.savePoll(poll.withStakedAmount(staked));

            return HandleResponse.builder()
                    .attribute("action", "snapshot_poll")
                    .attribute("poll_id", pollId)
                    .attribute("staked_amount", staked)
                    .build();
        });
    }

    // -------------------- resolution --------------------

    public HandleResponse endPoll(MessageContext ctx, long pollId) {
        return invoke("end_poll", state -> {
            GovernanceConfig config = state.requireConfig();
            Poll poll = state.requirePoll(pollId);
            if (ctx.height() <= poll.endHeight()) {
                throw new GovernanceException(GovernanceError.VOTING_NOT_EXPIRED);
            }
            if (!poll.inProgress()) {
                throw new GovernanceException(GovernanceError.POLL_NOT_IN_PROGRESS);
            }

            long denominator = poll.stakedAmount() != null ? poll.stakedAmount() : ledger.poolBalance(state);
            long tallied = poll.totalVotes();

            String rejectedReason = "";
            boolean passed = false;
            if (denominator == 0L || !Amounts.ratioAtLeast(tallied, denominator, config.quorum())) {
                rejectedReason = QUORUM_NOT_REACHED;
            } else if (!Amounts.ratioAbove(poll.yesVotes(), tallied, config.threshold())) {
                rejectedReason = THRESHOLD_NOT_REACHED;
            } else {
                passed = true;
            }

            HandleResponse.Builder out = HandleResponse.builder();
            if (passed && poll.depositAmount() > 0L) {
                PoolState pool = state.requirePoolState();
                state.savePoolState(pool.withTotalDeposit(Amounts.subtract(pool.totalDeposit(), poll.depositAmount())));
                out.message(new OutboundMessage.Transfer(config.token(), poll.creator(), poll.depositAmount()));
            }
            state.savePoll(poll
                    .withStatus(passed ? PollStatus.PASSED : PollStatus.REJECTED)
                    .withTotalBalanceAtEndPoll(denominator));
            GovernanceMetrics.recordPollEnded(passed);

            final boolean outcome = passed;
            final String reason = rejectedReason;
            LOG.info(() -> "Poll " + pollId + (outcome ? " passed" : " rejected: " + reason)
                    + " (yes=" + poll.yesVotes() + ", no=" + poll.noVotes() + ", denominator=" + denominator + ")");

            return out.attribute("action", "end_poll")
                    .attribute("poll_id", pollId)
                    .attribute("rejected_reason", rejectedReason)
                    .attribute("passed", passed)
                    .build();
        });
    }

    /** Relays the stored calls of a passed poll, in ascending order, once its timelock has run out. */
    public HandleResponse executePoll(MessageContext ctx, long pollId) {
        return invoke("execute_poll", state -> {
            GovernanceConfig config = state.requireConfig();
            Poll poll = state.requirePoll(pollId);
            if (poll.status() != PollStatus.PASSED) {
                throw new GovernanceException(GovernanceError.POLL_NOT_PASSED);
            }
            if (ctx.height() < Math.addExact(poll.endHeight(), config.timelockPeriod())) {
                throw new GovernanceException(GovernanceError.TIMELOCK_NOT_EXPIRED);
            }

            HandleResponse.Builder out = HandleResponse.builder();
            for (DelegatedCall call : poll.executeData()) {
                out.message(new OutboundMessage.Execute(call.contract(), call.msg()));
            }
            state.savePoll(poll.withStatus(PollStatus.EXECUTED));
            GovernanceMetrics.incrementPollsExecuted();

            return out.attribute("action", "execute_poll")
                    .attribute("poll_id", pollId)
                    .build();
        });
    }

    /** Retires a passed poll whose execution window has gone by. */
    public HandleResponse expirePoll(MessageContext ctx, long pollId) {
        return invoke("expire_poll", state -> {
            GovernanceConfig config = state.requireConfig();
            Poll poll = state.requirePoll(pollId);
            if (poll.status() != PollStatus.PASSED) {
                throw new GovernanceException(GovernanceError.POLL_NOT_PASSED);
            }
            if (ctx.height() < Math.addExact(poll.endHeight(), config.expirationPeriod())) {
                throw new GovernanceException(GovernanceError.EXPIRATION_NOT_REACHED);
            }
            state.savePoll(poll.withStatus(PollStatus.EXPIRED));
            GovernanceMetrics.incrementPollsExpired();

            return HandleResponse.builder()
                    .attribute("action", "expire_poll")
                    .attribute("poll_id", pollId)
                    .build();
        });
    }

    // -------------------- configuration --------------------

    public HandleResponse updateConfig(MessageContext ctx, UpdateConfigRequest request) {
        return invoke("update_config", state -> {
            GovernanceConfig current = state.requireConfig();
            if (!current.owner().equals(ctx.sender())) {
                throw new GovernanceException(GovernanceError.UNAUTHORIZED);
            }
            GovernanceConfig next = new GovernanceConfig(
                    request.owner() != null ? request.owner() : current.owner(),
                    current.token(),
                    request.quorum() != null ? request.quorum() : current.quorum(),
                    request.threshold() != null ? request.threshold() : current.threshold(),
                    request.votingPeriod() != null ? request.votingPeriod() : current.votingPeriod(),
                    request.timelockPeriod() != null ? request.timelockPeriod() : current.timelockPeriod(),
                    request.expirationPeriod() != null ? request.expirationPeriod() : current.expirationPeriod(),
                    request.proposalDeposit() != null ? request.proposalDeposit() : current.proposalDeposit(),
                    request.snapshotPeriod() != null ? request.snapshotPeriod() : current.snapshotPeriod());
            state.saveConfig(next);
            return HandleResponse.builder().attribute("action", "update_config").build();
        });
    }

    /**
     * Handles a delegated call addressed to this contract, e.g. an {@code update_config}
     * scheduled by an executed poll.
     */
    public HandleResponse handleCall(MessageContext ctx, byte[] payload) {
        return updateConfig(ctx, MessageCodec.decodeUpdateConfig(payload));
    }

    // -------------------- plumbing --------------------

    private synchronized HandleResponse invoke(String action, Function<StagedState, HandleResponse> body) {
        return GovernanceMetrics.recordInvocation(action, () -> {
            StagedState state = new StagedState(store);
            HandleResponse response;
            try {
                response = body.apply(state);
            } catch (GovernanceException e) {
                GovernanceMetrics.recordFailure(action, e.error().name());
                LOG.fine(() -> action + " rejected: " + e.getMessage());
                throw e;
            }
            store.apply(state.changes());
            return response;
        });
    }
}
