package io.txledger.core.storage;

import io.txledger.core.protocol.Hash;
import io.txledger.core.updates.Updates;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Persistent UpdatesStore using RocksDB.
 *
 * Layout (column families):
 *  - "updates" : key = blockHash(32), val = updates.serialize()
 *  - "meta"    : key = "lastFinalized", val = blockHash(32)
 */
public final class RocksDBUpdatesStore implements UpdatesStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBUpdatesStore.class.getName());

    private static final byte[] LAST_FINALIZED = "lastFinalized".getBytes(StandardCharsets.US_ASCII);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfUpdates;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;

    private RocksDBUpdatesStore(RocksDB db,
                                ColumnFamilyHandle cfDefault,
                                ColumnFamilyHandle cfUpdates,
                                ColumnFamilyHandle cfMeta,
                                DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfUpdates = cfUpdates;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBUpdatesStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("updates".getBytes(StandardCharsets.US_ASCII)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.US_ASCII)));
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info("Opened updates store at " + dataDir);
            return new RocksDBUpdatesStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized void put(Hash blockHash, Updates updates) {
        try {
            db.put(cfUpdates, blockHash.bytes(), updates.serialize());
        } catch (RocksDBException e) {
            throw new IllegalStateException("put failed", e);
        }
    }

    @Override
    public synchronized Optional<Updates> get(Hash blockHash) {
        if (blockHash == null) return Optional.empty();
        try {
            byte[] body = db.get(cfUpdates, blockHash.bytes());
            return body == null ? Optional.empty() : Optional.of(Updates.fromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("get failed", e);
        }
    }

    @Override
    public synchronized void remove(Hash blockHash) {
        if (blockHash == null) return;
        try {
            db.delete(cfUpdates, blockHash.bytes());
        } catch (RocksDBException e) {
            throw new IllegalStateException("remove failed", e);
        }
    }

    @Override
    public synchronized long size() {
        try (RocksIterator it = db.newIterator(cfUpdates)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void setLastFinalized(Hash blockHash) {
        byte[] key = blockHash.bytes();
        try (WriteOptions wo = new WriteOptions().setSync(true)) {
            if (db.get(cfUpdates, key) == null) {
                throw new IllegalArgumentException("Unknown block " + blockHash + " (store its updates first)");
            }
            db.put(cfMeta, wo, LAST_FINALIZED, key);
        } catch (RocksDBException e) {
            throw new IllegalStateException("setLastFinalized failed", e);
        }
    }

    @Override
    public synchronized Optional<Hash> getLastFinalized() {
        try {
            byte[] h = db.get(cfMeta, LAST_FINALIZED);
            return h == null ? Optional.empty() : Optional.of(new Hash(h));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getLastFinalized failed", e);
        }
    }

    @Override
    public synchronized void close() {
        // handles before the DB, options last
        cfUpdates.close();
        cfMeta.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }
}
