package edu.yu.blockvfs.buffer;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.blockvfs.file.Block;
import edu.yu.blockvfs.file.BlockId;
import edu.yu.blockvfs.file.BlockNotFoundException;
import edu.yu.blockvfs.store.StoreException;
import edu.yu.blockvfs.store.StoreKey;
import edu.yu.blockvfs.store.StoreRecord;
import edu.yu.blockvfs.store.TransactionalStore;

/**
 * Two-tier write-back cache of one file's blocks.
 * <p>
 * Written blocks live in an insertion-ordered map. When it grows past its
 * capacity the oldest blocks, other than block 0, are spilled to the store's
 * overflow table and their indices recorded in the spill set. An index is in at
 * most one of the two tiers at a time.
 * <p>
 * Spill writes are fire-and-forget: nothing waits for them, and a later read
 * of a spilled block relies on the store committing transactions in submission
 * order.
 * <p>
 * Not thread safe; one file handle owns the cache.
 */
public class BlockCache {

    private static final Logger logger = LogManager.getLogger(BlockCache.class);

    private final String filename;
    private final TransactionalStore store;
    private final int capacity;
    private final LinkedHashMap<Long, Block> writeCache;
    private final Set<Long> spillSet;
    private boolean reachedCapacity;
    private volatile Throwable spillFailure;
    private volatile int generation;

    public BlockCache(String filename, TransactionalStore store, int capacity) {
        if (filename == null || store == null) {
            throw new IllegalArgumentException("Filename and store can't be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }

        this.filename = filename;
        this.store = store;
        this.capacity = capacity;
        this.writeCache = new LinkedHashMap<>();
        this.spillSet = new HashSet<>();
    }

    /**
     * Look up a block: the write cache first, then the overflow table if the
     * block was spilled, else the primary table. A block returned from the write
     * cache is the live entry and may be overwritten by the next write to it.
     *
     * @param index
     * @return the block
     * @throws BlockNotFoundException if no tier holds the block
     */
    public Block get(long index) {
        Block cached = this.writeCache.get(index);
        if (cached != null) {
            return cached;
        }

        final StoreKey key = StoreKey.block(this.filename, index);
        final boolean spilled = this.spillSet.contains(index);
        StoreRecord found = TransactionalStore.await(this.store.runTransaction(
                tx -> spilled ? tx.overflow().get(key) : tx.primary().get(key)));
        if (found == null) {
            throw new BlockNotFoundException(new BlockId(this.filename, index));
        }
        return (Block) found;
    }

    /**
     * @param index
     * @return the write cache entry, or null if the block isn't in memory
     */
    public Block cached(long index) {
        return this.writeCache.get(index);
    }

    /**
     * Insert or refresh a block as the newest entry, spilling the oldest
     * entries while the cache is over capacity.
     *
     * @param block
     */
    public void put(Block block) {
        if (block == null) {
            throw new IllegalArgumentException("Block can't be null");
        }
        if (!this.filename.equals(block.id().fileName())) {
            throw new IllegalArgumentException("Block " + block.id() + " doesn't belong to " + this.filename);
        }

        // reinsert at the newest position
        final long index = block.index();
        this.writeCache.remove(index);
        this.writeCache.put(index, block);
        this.spillSet.remove(index);

        if (this.writeCache.size() >= this.capacity) {
            this.reachedCapacity = true;
        }

        int spilled = 0;
        Iterator<Block> candidates = this.writeCache.values().iterator();
        while (this.writeCache.size() > this.capacity && candidates.hasNext()) {
            Block candidate = candidates.next();

            // block 0 stays in memory
            if (candidate.index() == 0) {
                continue;
            }

            spill(candidate.copy());
            this.spillSet.add(candidate.index());
            candidates.remove();
            spilled++;
        }

        if (spilled > 0) {
            logger.debug("Spilled {} block(s) of {} to overflow", spilled, this.filename);
        }
    }

    private void spill(Block snapshot) {
        final int spillGeneration = this.generation;
        this.store.runTransaction(tx -> {
            tx.overflow().put(snapshot);
            return null;
        }).whenComplete((v, e) -> {
            if (e != null) {
                logger.warn("Spill of {} failed", snapshot.id(), e);
                // a failure from before the last clear concerns discarded state
                if (spillGeneration == this.generation) {
                    this.spillFailure = e;
                }
            }
        });
    }

    /**
     * Drop both tiers without persisting anything.
     */
    public void clear() {
        this.writeCache.clear();
        this.spillSet.clear();
        this.reachedCapacity = false;
        this.spillFailure = null;
        this.generation++;
    }

    /**
     * @throws StoreException if a spill write failed since the last clear, in
     *                        which case the overflow tier is missing blocks
     */
    public void checkSpills() {
        Throwable failure = this.spillFailure;
        if (failure != null) {
            throw new StoreException("Spill to overflow failed for " + this.filename, failure);
        }
    }

    /**
     * @return the in-memory blocks, oldest first
     */
    public Collection<Block> entries() {
        return Collections.unmodifiableCollection(this.writeCache.values());
    }

    public boolean isSpilled(long index) {
        return this.spillSet.contains(index);
    }

    public Set<Long> spilledIndices() {
        return Collections.unmodifiableSet(this.spillSet);
    }

    /**
     * @return true iff the write cache has been full since the last clear, so
     *         the overflow table may hold blocks of this file
     */
    public boolean hasReachedCapacity() {
        return this.reachedCapacity;
    }

    public int size() {
        return this.writeCache.size();
    }

    public int capacity() {
        return this.capacity;
    }

    public String fileName() {
        return this.filename;
    }

}
