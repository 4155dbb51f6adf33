package edu.yu.blockvfs.tx;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.blockvfs.buffer.BlockCache;
import edu.yu.blockvfs.file.Block;
import edu.yu.blockvfs.file.Metadata;
import edu.yu.blockvfs.store.KeyRange;
import edu.yu.blockvfs.store.StoreKey;
import edu.yu.blockvfs.store.StoreMode;
import edu.yu.blockvfs.store.StoreRecord;
import edu.yu.blockvfs.store.TransactionalStore;
import edu.yu.blockvfs.tx.concurrency.LockLevel;
import edu.yu.blockvfs.tx.concurrency.LockTransitionHook;

/**
 * Decides, from lock transitions, when cached blocks become durable and when
 * they are discarded.
 * <ul>
 * <li>Acquiring SHARED switches the store to read-only transactions, reloads
 * the metadata, remembers the file size for a rollback and drops the cache.</li>
 * <li>Acquiring EXCLUSIVE switches the store to read-write transactions.</li>
 * <li>Releasing EXCLUSIVE flushes the cache to the primary table in one
 * transaction, unless a rollback is pending.</li>
 * <li>Any release while a rollback is pending bumps the change counter of block
 * 0 and restores the remembered file size instead.</li>
 * </ul>
 */
public class LockProtocol implements LockTransitionHook {

    private static final Logger logger = LogManager.getLogger(LockProtocol.class);

    /** offset of the engine's 4-byte big-endian change counter in block 0 */
    public static final int CHANGE_COUNTER_OFFSET = 24;

    private final TransactionalStore store;
    private final BlockCache cache;
    private final Metadata metadata;
    private final RollbackState rollback;

    public LockProtocol(TransactionalStore store, BlockCache cache, Metadata metadata) {
        if (store == null || cache == null || metadata == null) {
            throw new IllegalArgumentException("Store, cache and metadata can't be null");
        }
        if (!cache.fileName().equals(metadata.name())) {
            throw new IllegalArgumentException("Cache and metadata belong to different files");
        }

        this.store = store;
        this.cache = cache;
        this.metadata = metadata;
        this.rollback = new RollbackState();
    }

    @Override
    public void afterAcquire(LockLevel previous, LockLevel current) {
        if (!previous.isAtLeast(LockLevel.SHARED) && current.isAtLeast(LockLevel.SHARED)) {
            onShared();
        }
        if (current == LockLevel.EXCLUSIVE) {
            this.store.setMode(StoreMode.READ_WRITE);
        }
    }

    @Override
    public void beforeRelease(LockLevel current, LockLevel target) {
        final boolean exclusive = current == LockLevel.EXCLUSIVE;
        if (exclusive) {
            if (!this.rollback.isActive()) {
                flush();
            }
            discardCache();
        }

        if (this.rollback.isActive()) {
            rollback(exclusive);
        }
    }

    /**
     * Signal that the pending writes must be discarded without the engine
     * writing them back.
     */
    public void requestRollback() {
        this.rollback.request();
        logger.debug("Out-of-band rollback requested for {}", this.metadata.name());
    }

    public RollbackState rollbackState() {
        return this.rollback;
    }

    public Metadata metadata() {
        return this.metadata;
    }

    private void onShared() {
        this.store.setMode(StoreMode.READ_ONLY);

        final StoreKey key = this.metadata.key();
        StoreRecord fresh = TransactionalStore.await(this.store.runTransaction(tx -> tx.primary().get(key)));
        if (fresh == null) {
            logger.warn("No stored metadata for {}, keeping {}", this.metadata.name(), this.metadata);
        } else {
            Metadata stored = (Metadata) fresh;
            if (stored.blockSize() != this.metadata.blockSize()) {
                throw new IllegalStateException("Block size of " + this.metadata.name() + " changed from "
                        + this.metadata.blockSize() + " to " + stored.blockSize());
            }
            this.metadata.setFileSize(stored.fileSize());
        }

        this.rollback.capture(this.metadata.fileSize());
        this.cache.clear();
    }

    /**
     * Commit the metadata and every pending block within the file size to the
     * primary table, and delete stored blocks past the end of the file, all in
     * one transaction. The cache is left untouched if the transaction fails.
     */
    void flush() {
        this.cache.checkSpills();

        final String name = this.metadata.name();
        final Metadata meta = this.metadata.copy();
        final int pageSize = this.cache.capacity();
        final boolean scanOverflow = this.cache.hasReachedCapacity();
        final Set<Long> spilled = new HashSet<>(this.cache.spilledIndices());
        final List<Block> pending = new ArrayList<>();
        for (Block block : this.cache.entries()) {
            if (meta.holds(block.index())) {
                pending.add(block.copy());
            }
        }

        int written = TransactionalStore.await(this.store.runTransaction(tx -> {
            tx.primary().put(meta);

            int count = 0;
            for (Block block : pending) {
                tx.primary().put(block);
                count++;
            }

            if (scanOverflow) {
                KeyRange range = KeyRange.blocksOf(name);
                List<StoreRecord> page = tx.overflow().getAll(range, pageSize);
                while (!page.isEmpty()) {
                    for (StoreRecord record : page) {
                        long index = record.key().index();
                        if (spilled.contains(index) && meta.holds(index)) {
                            tx.primary().put(record);
                            count++;
                        }
                    }
                    range = KeyRange.blocksAfter(name, page.get(page.size() - 1).key().index());
                    page = tx.overflow().getAll(range, pageSize);
                }
            }

            // blocks truncated away
            tx.primary().delete(KeyRange.blocksFrom(name, meta.blockCount()));
            return count;
        }));

        logger.debug("Flushed {} block(s) of {}, size {}", written, name, meta.fileSize());
    }

    private void discardCache() {
        if (this.cache.hasReachedCapacity()) {
            final String name = this.metadata.name();
            this.store.runTransaction(tx -> tx.overflow().delete(KeyRange.blocksOf(name)))
                    .whenComplete((deleted, e) -> {
                        if (e != null) {
                            logger.warn("Couldn't clear overflow blocks of {}", name, e);
                        }
                    });
        }
        this.cache.clear();
    }

    /**
     * Bump the change counter in block 0 so the engine drops its own page
     * cache, then restore the file size remembered at the last SHARED
     * acquisition. Nothing else reaches storage.
     */
    private void rollback(boolean exclusive) {
        // everything may have fit in the engine's cache, so the lock never got
        // past SHARED and the store is still read-only
        if (!exclusive) {
            this.store.setMode(StoreMode.READ_WRITE);
        }

        final StoreKey header = StoreKey.block(this.metadata.name(), 0);
        Integer counter = TransactionalStore.await(this.store.runTransaction(tx -> {
            Block block = (Block) tx.primary().get(header);
            if (block == null || block.size() < CHANGE_COUNTER_OFFSET + Integer.BYTES) {
                return null;
            }
            int next = block.getInt(CHANGE_COUNTER_OFFSET) + 1;
            block.setInt(CHANGE_COUNTER_OFFSET, next);
            tx.primary().put(block);
            return next;
        }));

        if (counter == null) {
            logger.warn("No block 0 with a change counter stored for {}, counter not updated",
                    this.metadata.name());
        } else {
            logger.debug("Rolled back {}, change counter now {}", this.metadata.name(), counter);
        }

        this.metadata.setFileSize(this.rollback.savedSize());
        this.rollback.complete();
    }

}
