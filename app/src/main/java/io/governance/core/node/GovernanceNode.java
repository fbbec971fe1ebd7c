package io.governance.core.node;

import io.governance.core.gov.GovernanceEngine;
import io.governance.core.gov.MessageContext;
import io.governance.core.poll.VoteOption;
import io.governance.core.protocol.HandleResponse;
import io.governance.core.protocol.UpdateConfigRequest;
import io.governance.core.query.GovernanceQueries;
import io.governance.core.storage.GovernanceStore;
import io.governance.core.storage.InMemoryGovernanceStore;
import io.governance.core.storage.RocksDBGovernanceStore;
import io.governance.core.token.InMemoryTokenLedger;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the governance engine, its store, the simulated token contract and the call dispatcher.
 * Start once, then call tick() periodically to advance the block height. Token balances and the
 * height are saved in the store, so a persistent node resumes where it stopped.
 *
 * <p>Every operation runs at the current height; messages it returns are dispatched only after
 * the engine has committed.
 */
public final class GovernanceNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(GovernanceNode.class.getName());

    private final NodeConfig config;
    private final GovernanceStore store;
    private final InMemoryTokenLedger token;
    private final GovernanceEngine engine;
    private final GovernanceQueries queries;
    private final CallDispatcher dispatcher;
    private final AtomicLong height = new AtomicLong(1L);
    private boolean seeded;

    public GovernanceNode(NodeConfig config, GovernanceStore store) {
        this.config = config;
        this.store = store;
        this.token = new InMemoryTokenLedger(config.tokenAddress);
        this.engine = new GovernanceEngine(store, token, config.contractAddress);
        this.queries = new GovernanceQueries(store, engine.ledger());
        this.dispatcher = new CallDispatcher();
        dispatcher.register(token.address(), token::execute);
        dispatcher.register(config.contractAddress, (sender, payload) ->
                dispatcher.dispatch(config.contractAddress, engine.handleCall(context(sender), payload)));
    }

    /** Convenience factory for an in-memory local node. */
    public static GovernanceNode inMemory(NodeConfig config) {
        return new GovernanceNode(config, new InMemoryGovernanceStore());
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static GovernanceNode rocks(NodeConfig config, String dataDir) {
        return new GovernanceNode(config, RocksDBGovernanceStore.open(dataDir));
    }

    /**
     * Restores token balances and height saved by a previous run, or seeds the genesis allocations
     * on first start, then initializes governance state if the store is empty. Safe to call multiple times.
     */
    public synchronized void start() {
        if (!seeded) {
            Map<String, Long> saved = store.tokenBalances();
            if (saved.isEmpty()) {
                for (Map.Entry<String, Long> e : config.genesisAllocations.entrySet()) {
                    token.credit(e.getKey(), e.getValue());
                }
            } else {
                token.restore(saved);
                LOG.info(() -> "Restored " + saved.size() + " token balances");
            }
            store.lastHeight().ifPresent(h -> height.set(Math.max(height.get(), h)));
            seeded = true;
        }
        if (store.config().isEmpty()) {
            engine.init(context(config.owner), config.toParams());
            engine.registerToken(context(config.owner), config.tokenAddress);
            LOG.info(() -> "Initialized governance " + config.contractAddress + " for token " + config.tokenAddress);
        }
        saveNodeState();
    }

    /** Advance one block; returns the new height. */
    public synchronized long tick() {
        long next = height.incrementAndGet();
        store.saveNodeState(next, Map.of());
        return next;
    }

    public long height() {
        return height.get();
    }

    /**
     * Moves {@code amount} tokens from {@code from} to the contract, then delivers the deposit
     * notification. A rejected notification returns the tokens.
     */
    public synchronized HandleResponse send(String from, long amount, byte[] msg) {
        token.transfer(from, config.contractAddress, amount);
        HandleResponse res;
        try {
            res = engine.receive(context(config.tokenAddress), from, amount, msg);
        } catch (RuntimeException e) {
            token.transfer(config.contractAddress, from, amount);
            throw e;
        }
        return dispatched(res);
    }

    public synchronized HandleResponse castVote(String sender, long pollId, VoteOption vote, long amount) {
        return dispatched(engine.castVote(context(sender), pollId, vote, amount));
    }

    public synchronized HandleResponse snapshotPoll(String sender, long pollId) {
        return dispatched(engine.snapshotPoll(context(sender), pollId));
    }

    public synchronized HandleResponse endPoll(String sender, long pollId) {
        return dispatched(engine.endPoll(context(sender), pollId));
    }

    public synchronized HandleResponse executePoll(String sender, long pollId) {
        return dispatched(engine.executePoll(context(sender), pollId));
    }

    public synchronized HandleResponse expirePoll(String sender, long pollId) {
        return dispatched(engine.expirePoll(context(sender), pollId));
    }

    public synchronized HandleResponse withdraw(String sender, OptionalLong amount) {
        return dispatched(engine.withdraw(context(sender), amount));
    }

    public synchronized HandleResponse updateConfig(String sender, UpdateConfigRequest request) {
        return dispatched(engine.updateConfig(context(sender), request));
    }

    private HandleResponse dispatched(HandleResponse res) {
        int failed = dispatcher.dispatch(config.contractAddress, res);
        if (failed > 0) {
            LOG.warning(() -> failed + " of " + res.messages().size() + " messages failed to dispatch");
        }
        saveNodeState();
        return res;
    }

    private void saveNodeState() {
        store.saveNodeState(height.get(), token.balances());
    }

    private MessageContext context(String sender) {
        return new MessageContext(sender, height.get());
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        try {
            store.close();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to close governance store", e);
        }
    }

    public NodeConfig config() { return config; }
    public GovernanceStore store() { return store; }
    public InMemoryTokenLedger token() { return token; }
    public GovernanceQueries queries() { return queries; }
}
