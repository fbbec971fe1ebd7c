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
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Persistent GovernanceStore using RocksDB.
 *
 * Layout (column families):
 *  - "meta"   : key = "config" | "state",       val = JSON
 *              key = "height",                 val = long(8, big-endian)
 *  - "polls"  : key = pollId(8, big-endian),     val = JSON Poll
 *  - "voters" : key = pollId(8) || voter(utf-8), val = JSON VoterInfo
 *  - "bank"   : key = staker(utf-8),             val = JSON TokenManager
 *  - "token"  : key = holder(utf-8),             val = long(8, big-endian) simulated token balance
 */
public final class RocksDBGovernanceStore implements GovernanceStore {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] CONFIG_KEY = "config".getBytes(StandardCharsets.UTF_8);
    private static final byte[] STATE_KEY = "state".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HEIGHT_KEY = "height".getBytes(StandardCharsets.UTF_8);

    private final RocksDB db;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle cfMeta;
    private final ColumnFamilyHandle cfPolls;
    private final ColumnFamilyHandle cfVoters;
    private final ColumnFamilyHandle cfBank;
    private final ColumnFamilyHandle cfToken;
    private final DBOptions dbOptions;

    private RocksDBGovernanceStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        // index 0 is the default CF, unused
        this.cfMeta = handles.get(1);
        this.cfPolls = handles.get(2);
        this.cfVoters = handles.get(3);
        this.cfBank = handles.get(4);
        this.cfToken = handles.get(5);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBGovernanceStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> descriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("polls".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("voters".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("bank".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("token".getBytes(StandardCharsets.UTF_8))
        );
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, descriptors, handles);
            return new RocksDBGovernanceStore(db, handles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- point reads ----------------

    @Override
    public synchronized Optional<GovernanceConfig> config() {
        return read(cfMeta, CONFIG_KEY, GovernanceConfig.class);
    }

    @Override
    public synchronized Optional<PoolState> poolState() {
        return read(cfMeta, STATE_KEY, PoolState.class);
    }

    @Override
    public synchronized Optional<Poll> poll(long pollId) {
        return read(cfPolls, StoreCodec.longKey(pollId), Poll.class);
    }

    @Override
    public synchronized Optional<VoterInfo> voter(long pollId, String voter) {
        return read(cfVoters, StoreCodec.voterKey(pollId, voter), VoterInfo.class);
    }

    @Override
    public synchronized Optional<TokenManager> tokenManager(String staker) {
        return read(cfBank, StoreCodec.stringKey(staker), TokenManager.class);
    }

    // -------------- range reads ----------------

    @Override
    public synchronized List<Poll> polls(PollStatus filter, Long startAfter, int limit, OrderBy order) {
        List<Poll> out = new ArrayList<>();
        boolean desc = order == OrderBy.DESC;
        try (RocksIterator it = db.newIterator(cfPolls)) {
            if (startAfter == null) {
                if (desc) it.seekToLast(); else it.seekToFirst();
            } else {
                byte[] cursor = StoreCodec.longKey(startAfter);
                if (desc) it.seekForPrev(cursor); else it.seek(cursor);
                if (it.isValid() && Arrays.equals(it.key(), cursor)) {
                    step(it, desc);
                }
            }
            for (; it.isValid() && out.size() < limit; step(it, desc)) {
                Poll poll = StoreCodec.decode(it.value(), Poll.class);
                if (filter == null || poll.status() == filter) {
                    out.add(poll);
                }
            }
        }
        return out;
    }

    @Override
    public synchronized List<VoterEntry> voters(long pollId, String startAfter, int limit, OrderBy order) {
        List<VoterEntry> out = new ArrayList<>();
        boolean desc = order == OrderBy.DESC;
        byte[] prefix = StoreCodec.longKey(pollId);
        try (RocksIterator it = db.newIterator(cfVoters)) {
            if (startAfter == null) {
                if (desc) it.seekForPrev(StoreCodec.longKey(pollId + 1)); else it.seek(prefix);
            } else {
                byte[] cursor = StoreCodec.voterKey(pollId, startAfter);
                if (desc) it.seekForPrev(cursor); else it.seek(cursor);
                if (it.isValid() && Arrays.equals(it.key(), cursor)) {
                    step(it, desc);
                }
            }
            for (; it.isValid() && out.size() < limit; step(it, desc)) {
                byte[] key = it.key();
                if (!hasPrefix(key, prefix)) {
                    break;
                }
                out.add(new VoterEntry(StoreCodec.voterFromKey(key), StoreCodec.decode(it.value(), VoterInfo.class)));
            }
        }
        return out;
    }

    // -------------- writes ----------------

    @Override
    public synchronized void apply(StateChanges changes) {
        if (changes.isEmpty()) {
            return;
        }
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            if (changes.config().isPresent()) {
                batch.put(cfMeta, CONFIG_KEY, StoreCodec.encode(changes.config().get()));
            }
            if (changes.poolState().isPresent()) {
                batch.put(cfMeta, STATE_KEY, StoreCodec.encode(changes.poolState().get()));
            }
            for (Map.Entry<Long, Poll> e : changes.polls().entrySet()) {
                batch.put(cfPolls, StoreCodec.longKey(e.getKey()), StoreCodec.encode(e.getValue()));
            }
            for (Map.Entry<StateChanges.VoterKey, VoterInfo> e : changes.voterPuts().entrySet()) {
                StateChanges.VoterKey k = e.getKey();
                batch.put(cfVoters, StoreCodec.voterKey(k.pollId(), k.voter()), StoreCodec.encode(e.getValue()));
            }
            for (StateChanges.VoterKey k : changes.voterDeletes()) {
                batch.delete(cfVoters, StoreCodec.voterKey(k.pollId(), k.voter()));
            }
            for (Map.Entry<String, TokenManager> e : changes.bank().entrySet()) {
                batch.put(cfBank, StoreCodec.stringKey(e.getKey()), StoreCodec.encode(e.getValue()));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to commit governance changes", e);
        }
    }

    // -------------- node state ----------------

    @Override
    public synchronized OptionalLong lastHeight() {
        try {
            byte[] raw = db.get(cfMeta, HEIGHT_KEY);
            return raw == null ? OptionalLong.empty() : OptionalLong.of(StoreCodec.bytesToLong(raw));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Read of last height failed", e);
        }
    }

    @Override
    public synchronized Map<String, Long> tokenBalances() {
        Map<String, Long> out = new TreeMap<>();
        try (RocksIterator it = db.newIterator(cfToken)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.put(new String(it.key(), StandardCharsets.UTF_8), StoreCodec.bytesToLong(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized void saveNodeState(long height, Map<String, Long> balances) {
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            batch.put(cfMeta, HEIGHT_KEY, StoreCodec.longKey(height));
            for (Map.Entry<String, Long> e : balances.entrySet()) {
                batch.put(cfToken, StoreCodec.stringKey(e.getKey()), StoreCodec.longKey(e.getValue()));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("Failed to save node state", e);
        }
    }

    @Override
    public synchronized void close() {
        for (ColumnFamilyHandle h : handles) {
            h.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private <T> Optional<T> read(ColumnFamilyHandle cf, byte[] key, Class<T> type) {
        try {
            byte[] raw = db.get(cf, key);
            return raw == null ? Optional.empty() : Optional.of(StoreCodec.decode(raw, type));
        } catch (RocksDBException e) {
            throw new IllegalStateException("Read of " + type.getSimpleName() + " failed", e);
        }
    }

    private static void step(RocksIterator it, boolean desc) {
        if (desc) it.prev(); else it.next();
    }

    private static boolean hasPrefix(byte[] key, byte[] prefix) {
        if (key.length <= prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) return false;
        }
        return true;
    }
}
