package io.governance.core.gov;

import io.governance.core.poll.Poll;
import io.governance.core.poll.PollStatus;
import io.governance.core.poll.VoteOption;
import io.governance.core.protocol.CreatePollRequest;
import io.governance.core.protocol.DelegatedCall;
import io.governance.core.protocol.HandleResponse;
import io.governance.core.protocol.MessageCodec;
import io.governance.core.protocol.OutboundMessage;
import io.governance.core.protocol.UpdateConfigRequest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalLong;

import static io.governance.core.gov.GovernanceFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class GovernanceEngineTest {

    private final GovernanceFixture f = GovernanceFixture.initialized();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private GovernanceError errorOf(Runnable call) {
        return assertThrows(GovernanceException.class, call::run).error();
    }

    // -------------------- bootstrap --------------------

    @Test
    void initStoresConfigAndEmptyPool() {
        GovernanceConfig config = f.store.config().orElseThrow();
        assertEquals(OWNER, config.owner());
        assertEquals(TOKEN, config.token());
        assertEquals(0, new BigDecimal("0.3").compareTo(config.quorum()));
        PoolState pool = f.store.poolState().orElseThrow();
        assertEquals(CONTRACT, pool.contractAddress());
        assertEquals(0L, pool.pollCount());
        assertEquals(0L, pool.totalShare());
        assertEquals(0L, pool.totalDeposit());

        assertEquals(GovernanceError.ALREADY_INITIALIZED, errorOf(() -> f.engine.init(ctx(OWNER, 1), params())));
    }

    @Test
    void initRejectsOutOfRangeRatios() {
        GovernanceFixture fresh = new GovernanceFixture();
        GovernanceParams badQuorum = new GovernanceParams(new BigDecimal("1.1"), new BigDecimal("0.5"),
                1, 1, 1, 1, 1);
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> fresh.engine.init(ctx(OWNER, 0), badQuorum));
        assertEquals(GovernanceError.INVALID_RATIO, e.error());
        assertEquals("quorum must be 0 to 1", e.getMessage());
        assertTrue(fresh.store.config().isEmpty());

        GovernanceParams badThreshold = new GovernanceParams(new BigDecimal("0.3"), new BigDecimal("-0.1"),
                1, 1, 1, 1, 1);
        e = assertThrows(GovernanceException.class, () -> fresh.engine.init(ctx(OWNER, 0), badThreshold));
        assertEquals("threshold must be 0 to 1", e.getMessage());
    }

    @Test
    void tokenCanBeRegisteredOnlyOnceAndOnlyByOwner() {
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() -> f.engine.registerToken(ctx(OWNER, 1), "other")));

        GovernanceFixture fresh = new GovernanceFixture();
        fresh.engine.init(ctx(OWNER, 0), params());
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() -> fresh.engine.registerToken(ctx("mallory", 0), TOKEN)));
    }

    @Test
    void depositsRequireRegisteredTokenAsSender() {
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() ->
                f.engine.receive(ctx("fake_token", 0), "voter", 10, MessageCodec.encodeStake())));

        GovernanceFixture fresh = new GovernanceFixture();
        fresh.engine.init(ctx(OWNER, 0), params());
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() ->
                fresh.engine.receive(ctx(TOKEN, 0), "voter", 10, MessageCodec.encodeStake())));
    }

    @Test
    void unknownHookMessageIsRejected() {
        assertEquals(GovernanceError.INVALID_MESSAGE, errorOf(() ->
                f.engine.receive(ctx(TOKEN, 0), "voter", 10, utf8("{\"burn\":{}}"))));
        assertEquals(GovernanceError.INVALID_MESSAGE, errorOf(() ->
                f.engine.receive(ctx(TOKEN, 0), "voter", 10, new byte[0])));
    }

    // -------------------- poll creation --------------------

    @Test
    void createPollAllocatesIdAndEscrowsDeposit() {
        f.token.add(CONTRACT, DEPOSIT);
        HandleResponse res = f.engine.receive(ctx(TOKEN, 5), "creator", DEPOSIT,
                MessageCodec.encodeCreatePoll(new CreatePollRequest("test", "test", "http://google.com", null)));

        assertEquals("create_poll", res.attribute("action").orElseThrow());
        assertEquals("creator", res.attribute("creator").orElseThrow());
        assertEquals("1", res.attribute("poll_id").orElseThrow());
        assertEquals(Long.toString(5 + VOTING_PERIOD), res.attribute("end_height").orElseThrow());
        assertTrue(res.messages().isEmpty());

        Poll poll = f.store.poll(1).orElseThrow();
        assertEquals(PollStatus.IN_PROGRESS, poll.status());
        assertEquals("http://google.com", poll.link());
        assertEquals(DEPOSIT, poll.depositAmount());
        assertNull(poll.stakedAmount());
        assertEquals(1L, f.store.poolState().orElseThrow().pollCount());
        assertEquals(DEPOSIT, f.store.poolState().orElseThrow().totalDeposit());

        assertEquals(2L, f.createPoll("creator", 6));
    }

    @Test
    void createPollRejectsLowDeposit() {
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> f.createPoll("creator", DEPOSIT - 1, 0, null));
        assertEquals(GovernanceError.INSUFFICIENT_DEPOSIT, e.error());
        assertEquals("Must deposit more than " + DEPOSIT + " token", e.getMessage());
        assertEquals(0L, f.store.poolState().orElseThrow().pollCount());
        assertEquals(0L, f.store.poolState().orElseThrow().totalDeposit());
    }

    @Test
    void createPollValidatesTextFields() {
        GovernanceException e = assertThrows(GovernanceException.class, () ->
                f.engine.receive(ctx(TOKEN, 0), "creator", DEPOSIT,
                        MessageCodec.encodeCreatePoll(CreatePollRequest.of("a", "test"))));
        assertEquals(GovernanceError.INVALID_FIELD, e.error());
        assertEquals("Title too short", e.getMessage());

        e = assertThrows(GovernanceException.class, () ->
                f.engine.receive(ctx(TOKEN, 0), "creator", DEPOSIT,
                        MessageCodec.encodeCreatePoll(new CreatePollRequest("test", "test", "http://hi", null))));
        assertEquals("Link too short", e.getMessage());
        assertTrue(f.store.poll(1).isEmpty());
    }

    @Test
    void executeMessagesAreStoredAndRelayedInAscendingOrder() {
        List<DelegatedCall> calls = List.of(
                new DelegatedCall(3, "target", utf8("third")),
                new DelegatedCall(1, "target", utf8("first")),
                new DelegatedCall(2, "target", utf8("second-a")),
                new DelegatedCall(2, "target", utf8("second-b")));
        f.stake("voter", 1000);
        long id = f.createPoll("creator", DEPOSIT, 0, calls);

        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 1000);
        f.settle(f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id));
        HandleResponse res = f.engine.executePoll(ctx("anyone", VOTING_PERIOD + TIMELOCK_PERIOD), id);

        assertEquals(List.of(
                new OutboundMessage.Execute("target", utf8("first")),
                new OutboundMessage.Execute("target", utf8("second-a")),
                new OutboundMessage.Execute("target", utf8("second-b")),
                new OutboundMessage.Execute("target", utf8("third"))), res.messages());
        assertEquals("execute_poll", res.attribute("action").orElseThrow());
        assertEquals(PollStatus.EXECUTED, f.store.poll(id).orElseThrow().status());
    }

    // -------------------- voting --------------------

    @Test
    void castVoteRecordsTallyVoterAndLock() {
        f.stake("voter", 11);
        long id = f.createPoll("creator", 0);

        HandleResponse res = f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 10);
        assertEquals("cast_vote", res.attribute("action").orElseThrow());
        assertEquals("10", res.attribute("amount").orElseThrow());
        assertEquals("voter", res.attribute("voter").orElseThrow());
        assertEquals("yes", res.attribute("vote_option").orElseThrow());

        Poll poll = f.store.poll(id).orElseThrow();
        assertEquals(10L, poll.yesVotes());
        assertEquals(0L, poll.noVotes());
        assertEquals(10L, f.store.voter(id, "voter").orElseThrow().balance());
        assertEquals(1, f.store.tokenManager("voter").orElseThrow().lockedBalance().size());
        // voting alone never snapshots
        assertNull(poll.stakedAmount());
    }

    @Test
    void secondVoteIsRejectedWhateverTheOption() {
        f.stake("voter", 100);
        long id = f.createPoll("creator", 0);
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 10);

        assertEquals(GovernanceError.ALREADY_VOTED, errorOf(() -> f.engine.castVote(ctx("voter", 2), id, VoteOption.NO, 1)));
        assertEquals(GovernanceError.ALREADY_VOTED, errorOf(() -> f.engine.castVote(ctx("voter", 2), id, VoteOption.YES, 10)));
        assertEquals(10L, f.store.poll(id).orElseThrow().totalVotes());
    }

    @Test
    void voteCannotExceedQuotedBalanceAndFailureLeavesNoTrace() {
        f.stake("voter", 10);
        long id = f.createPoll("creator", 0);

        GovernanceException e = assertThrows(GovernanceException.class,
                () -> f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 11));
        assertEquals(GovernanceError.INSUFFICIENT_STAKE, e.error());
        assertEquals("User does not have enough staked tokens.", e.getMessage());
        assertEquals(0L, f.store.poll(id).orElseThrow().totalVotes());
        assertTrue(f.store.voter(id, "voter").isEmpty());
        assertTrue(f.store.tokenManager("voter").orElseThrow().lockedBalance().isEmpty());

        assertEquals(GovernanceError.INSUFFICIENT_STAKE, errorOf(() -> f.engine.castVote(ctx("stranger", 1), id, VoteOption.YES, 1)));
    }

    @Test
    void voteGuardsPollExistenceAndWindow() {
        f.stake("voter", 10);
        assertEquals(GovernanceError.POLL_NOT_FOUND, errorOf(() -> f.engine.castVote(ctx("voter", 1), 7, VoteOption.YES, 1)));

        long id = f.createPoll("creator", 0);
        f.engine.castVote(ctx("voter", VOTING_PERIOD), id, VoteOption.NO, 1);
        f.stake("late", 10);
        assertEquals(GovernanceError.POLL_NOT_IN_PROGRESS,
                errorOf(() -> f.engine.castVote(ctx("late", VOTING_PERIOD + 1), id, VoteOption.YES, 1)));
    }

    // -------------------- snapshot --------------------

    @Test
    void snapshotOnlyInsideWindowAndOnlyOnce() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", 0);
        long end = f.store.poll(id).orElseThrow().endHeight();

        assertEquals(GovernanceError.SNAPSHOT_WINDOW_NOT_OPEN,
                errorOf(() -> f.engine.snapshotPoll(ctx("anyone", end - SNAPSHOT_PERIOD - 1), id)));

        HandleResponse res = f.engine.snapshotPoll(ctx("anyone", end - SNAPSHOT_PERIOD), id);
        assertEquals("snapshot_poll", res.attribute("action").orElseThrow());
        assertEquals("1000", res.attribute("staked_amount").orElseThrow());
        assertEquals(1000L, f.store.poll(id).orElseThrow().stakedAmount());

        assertEquals(GovernanceError.SNAPSHOT_ALREADY_TAKEN, errorOf(() -> f.engine.snapshotPoll(ctx("anyone", end), id)));
        assertEquals(GovernanceError.POLL_NOT_IN_PROGRESS, errorOf(() -> f.engine.snapshotPoll(ctx("anyone", end + 1), id)));
        assertEquals(GovernanceError.POLL_NOT_FOUND, errorOf(() -> f.engine.snapshotPoll(ctx("anyone", end), 99)));
    }

    @Test
    void snapshotFreezesQuorumDenominatorAgainstLateStake() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", 0);
        long end = f.store.poll(id).orElseThrow().endHeight();
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 400);
        f.engine.snapshotPoll(ctx("anyone", end - 5), id);
        f.stake("whale", 10_000);

        HandleResponse res = f.engine.endPoll(ctx("anyone", end + 1), id);
        assertEquals("true", res.attribute("passed").orElseThrow());
        Poll poll = f.store.poll(id).orElseThrow();
        assertEquals(PollStatus.PASSED, poll.status());
        assertEquals(1000L, poll.totalBalanceAtEndPoll());
    }

    @Test
    void withoutSnapshotLiveBalanceIsTheDenominator() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", 0);
        long end = f.store.poll(id).orElseThrow().endHeight();
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 400);
        f.stake("whale", 10_000);

        HandleResponse res = f.engine.endPoll(ctx("anyone", end + 1), id);
        assertEquals("false", res.attribute("passed").orElseThrow());
        assertEquals("Quorum not reached", res.attribute("rejected_reason").orElseThrow());
        Poll poll = f.store.poll(id).orElseThrow();
        assertNull(poll.stakedAmount());
        assertEquals(11_000L, poll.totalBalanceAtEndPoll());
    }

    // -------------------- resolution --------------------

    @Test
    void passingPollRefundsDeposit() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", 0);
        assertEquals(1100L, f.token.balanceOf(TOKEN, CONTRACT));
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 1000);

        HandleResponse res = f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id);
        assertEquals("end_poll", res.attribute("action").orElseThrow());
        assertEquals("", res.attribute("rejected_reason").orElseThrow());
        assertEquals("true", res.attribute("passed").orElseThrow());
        assertEquals(List.of(new OutboundMessage.Transfer(TOKEN, "creator", DEPOSIT)), res.messages());
        assertEquals(0L, f.store.poolState().orElseThrow().totalDeposit());
        assertEquals(1000L, f.store.poll(id).orElseThrow().totalBalanceAtEndPoll());
    }

    @Test
    void lowTurnoutIsRejectedAndDepositForfeited() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", 0);
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 10);

        HandleResponse res = f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id);
        assertEquals("false", res.attribute("passed").orElseThrow());
        assertEquals("Quorum not reached", res.attribute("rejected_reason").orElseThrow());
        assertTrue(res.messages().isEmpty());
        assertEquals(PollStatus.REJECTED, f.store.poll(id).orElseThrow().status());
        assertEquals(DEPOSIT, f.store.poolState().orElseThrow().totalDeposit());
    }

    @Test
    void evenSplitFailsThreshold() {
        f.stake("yes_voter", 500);
        f.stake("no_voter", 500);
        long id = f.createPoll("creator", 0);
        f.engine.castVote(ctx("yes_voter", 1), id, VoteOption.YES, 500);
        f.engine.castVote(ctx("no_voter", 1), id, VoteOption.NO, 500);

        HandleResponse res = f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id);
        assertEquals("Threshold not reached", res.attribute("rejected_reason").orElseThrow());
        assertEquals(PollStatus.REJECTED, f.store.poll(id).orElseThrow().status());
    }

    @Test
    void emptyPoolIsRejectedForQuorum() {
        long id = f.createPoll("creator", 0);
        HandleResponse res = f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id);
        assertEquals("Quorum not reached", res.attribute("rejected_reason").orElseThrow());
        assertEquals(0L, f.store.poll(id).orElseThrow().totalBalanceAtEndPoll());
    }

    @Test
    void endPollGuards() {
        long id = f.createPoll("creator", 0);
        assertEquals(GovernanceError.VOTING_NOT_EXPIRED, errorOf(() -> f.engine.endPoll(ctx("anyone", VOTING_PERIOD), id)));
        assertEquals(GovernanceError.POLL_NOT_FOUND, errorOf(() -> f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), 42)));

        f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id);
        assertEquals(GovernanceError.POLL_NOT_IN_PROGRESS, errorOf(() -> f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 2), id)));
    }

    // -------------------- execute / expire --------------------

    private long passedPoll() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", DEPOSIT, 0,
                List.of(new DelegatedCall(1, "target", utf8("{}"))));
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 1000);
        f.settle(f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id));
        return id;
    }

    @Test
    void executeWaitsForTimelockAndRunsOnce() {
        long id = passedPoll();
        assertEquals(GovernanceError.TIMELOCK_NOT_EXPIRED,
                errorOf(() -> f.engine.executePoll(ctx("anyone", VOTING_PERIOD + TIMELOCK_PERIOD - 1), id)));

        f.engine.executePoll(ctx("anyone", VOTING_PERIOD + TIMELOCK_PERIOD), id);
        assertEquals(GovernanceError.POLL_NOT_PASSED,
                errorOf(() -> f.engine.executePoll(ctx("anyone", VOTING_PERIOD + TIMELOCK_PERIOD), id)));
        assertEquals(GovernanceError.POLL_NOT_PASSED,
                errorOf(() -> f.engine.expirePoll(ctx("anyone", VOTING_PERIOD + EXPIRATION_PERIOD), id)));
    }

    @Test
    void executeRequiresPassedPoll() {
        long id = f.createPoll("creator", 0);
        assertEquals(GovernanceError.POLL_NOT_PASSED, errorOf(() -> f.engine.executePoll(ctx("anyone", 1), id)));
        assertEquals(GovernanceError.POLL_NOT_FOUND, errorOf(() -> f.engine.executePoll(ctx("anyone", 1), 5)));
    }

    @Test
    void expiredPollCanNoLongerExecute() {
        long id = passedPoll();
        assertEquals(GovernanceError.EXPIRATION_NOT_REACHED,
                errorOf(() -> f.engine.expirePoll(ctx("anyone", VOTING_PERIOD + EXPIRATION_PERIOD - 1), id)));

        HandleResponse res = f.engine.expirePoll(ctx("anyone", VOTING_PERIOD + EXPIRATION_PERIOD), id);
        assertEquals("expire_poll", res.attribute("action").orElseThrow());
        assertEquals(PollStatus.EXPIRED, f.store.poll(id).orElseThrow().status());
        assertEquals(GovernanceError.POLL_NOT_PASSED,
                errorOf(() -> f.engine.executePoll(ctx("anyone", VOTING_PERIOD + EXPIRATION_PERIOD), id)));
    }

    // -------------------- staking through the engine --------------------

    @Test
    void lockedVoteDoesNotBlockWithdrawal() {
        f.stake("voter", 11);
        long id = f.createPoll("creator", 0);
        f.engine.castVote(ctx("voter", 1), id, VoteOption.YES, 10);

        assertEquals(GovernanceError.EXCEEDS_BALANCE,
                errorOf(() -> f.engine.withdraw(ctx("voter", 2), OptionalLong.of(12))));

        HandleResponse res = f.engine.withdraw(ctx("voter", 2), OptionalLong.of(11));
        assertEquals(List.of(new OutboundMessage.Transfer(TOKEN, "voter", 11)), res.messages());
        assertEquals(10L, f.store.poll(id).orElseThrow().yesVotes());
        // lock on an open poll survives
        assertEquals(1, f.store.tokenManager("voter").orElseThrow().lockedBalance().size());
    }

    @Test
    void withdrawCollectsLocksOfFinishedPolls() {
        f.stake("voter", 1000);
        long id = f.createPoll("creator", 0);
        f.engine.castVote(ctx("voter", 1), id, VoteOption.NO, 500);
        f.engine.endPoll(ctx("anyone", VOTING_PERIOD + 1), id);
        assertTrue(f.store.voter(id, "voter").isPresent());

        f.settle(f.engine.withdraw(ctx("voter", VOTING_PERIOD + 2), OptionalLong.of(1)));
        assertTrue(f.store.voter(id, "voter").isEmpty());
        assertTrue(f.store.tokenManager("voter").orElseThrow().lockedBalance().isEmpty());
        assertEquals(500L, f.store.poll(id).orElseThrow().noVotes());
    }

    // -------------------- configuration --------------------

    @Test
    void onlyOwnerUpdatesConfig() {
        UpdateConfigRequest req = UpdateConfigRequest.builder().threshold(new BigDecimal("0.75")).build();
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() -> f.engine.updateConfig(ctx("mallory", 1), req)));

        f.engine.updateConfig(ctx(OWNER, 1), req);
        GovernanceConfig config = f.store.config().orElseThrow();
        assertEquals(0, new BigDecimal("0.75").compareTo(config.threshold()));
        assertEquals(VOTING_PERIOD, config.votingPeriod());
        assertEquals(TOKEN, config.token());
    }

    @Test
    void invalidUpdateLeavesConfigUntouched() {
        UpdateConfigRequest req = UpdateConfigRequest.builder()
                .votingPeriod(5)
                .quorum(new BigDecimal("2"))
                .build();
        assertEquals(GovernanceError.INVALID_RATIO, errorOf(() -> f.engine.updateConfig(ctx(OWNER, 1), req)));
        assertEquals(VOTING_PERIOD, f.store.config().orElseThrow().votingPeriod());
    }

    @Test
    void ownerTransferTakesEffectImmediately() {
        f.engine.updateConfig(ctx(OWNER, 1), UpdateConfigRequest.builder().owner("new_owner").build());
        UpdateConfigRequest req = UpdateConfigRequest.builder().proposalDeposit(5).build();
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() -> f.engine.updateConfig(ctx(OWNER, 2), req)));
        f.engine.updateConfig(ctx("new_owner", 2), req);
        assertEquals(5L, f.store.config().orElseThrow().proposalDeposit());
    }

    @Test
    void delegatedUpdateConfigActsAsTheCallingContract() {
        f.engine.updateConfig(ctx(OWNER, 1), UpdateConfigRequest.builder().owner(CONTRACT).build());
        byte[] payload = MessageCodec.encodeUpdateConfig(UpdateConfigRequest.builder().snapshotPeriod(42).build());

        f.engine.handleCall(ctx(CONTRACT, 2), payload);
        assertEquals(42L, f.store.config().orElseThrow().snapshotPeriod());
        assertEquals(GovernanceError.UNAUTHORIZED, errorOf(() -> f.engine.handleCall(ctx(OWNER, 3), payload)));
    }
}
