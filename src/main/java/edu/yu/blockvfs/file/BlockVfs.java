package edu.yu.blockvfs.file;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.blockvfs.config.VfsConfiguration;
import edu.yu.blockvfs.store.KeyRange;
import edu.yu.blockvfs.store.StoreKey;
import edu.yu.blockvfs.store.StoreRecord;
import edu.yu.blockvfs.store.TransactionalStore;
import edu.yu.blockvfs.tx.concurrency.MutualExclusion;

/**
 * Opens, creates and deletes {@link BlockFile}s kept in a transactional store.
 * Each open handle gets its own store connection, so its transaction mode is
 * independent of other handles.
 */
public class BlockVfs {

    private static final Logger logger = LogManager.getLogger(BlockVfs.class);

    private final Supplier<TransactionalStore> connector;
    private final MutualExclusion mutualExclusion;
    private final int blockSize;
    private final int cacheCapacity;
    private final Map<String, AtomicInteger> openCounts;

    public BlockVfs(Supplier<TransactionalStore> connector, MutualExclusion mutualExclusion) {
        this(connector, mutualExclusion, VfsConfiguration.INSTANCE.blockSize(),
                VfsConfiguration.INSTANCE.writeCacheCapacity());
    }

    public BlockVfs(Supplier<TransactionalStore> connector, MutualExclusion mutualExclusion, int blockSize,
            int cacheCapacity) {
        if (connector == null || mutualExclusion == null) {
            throw new IllegalArgumentException("Connector and mutual exclusion can't be null");
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive");
        }
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }

        this.connector = connector;
        this.mutualExclusion = mutualExclusion;
        this.blockSize = blockSize;
        this.cacheCapacity = cacheCapacity;
        this.openCounts = new ConcurrentHashMap<>();

        logger.info("BlockVfs started | blockSize = {}, writeCacheCapacity = {}", blockSize, cacheCapacity);
    }

    /**
     * Open a file, optionally creating it. A created file has size 0 and the
     * configured block size, and its metadata is stored before this returns.
     *
     * @param name
     * @param create
     * @return the open handle
     * @throws CannotOpenException if the file doesn't exist and create is false
     */
    public BlockFile open(String name, boolean create) {
        checkName(name);

        TransactionalStore store = this.connector.get();
        Metadata metadata = loadMetadata(store, name);
        if (metadata == null) {
            if (!create) {
                throw new CannotOpenException("File " + name + " doesn't exist");
            }

            final Metadata created = new Metadata(name, 0, this.blockSize);
            TransactionalStore.await(store.runTransaction(tx -> {
                tx.primary().put(created);
                return null;
            }));
            metadata = created;
            logger.info("Created {}", name);
        }

        final AtomicInteger count = this.openCounts.computeIfAbsent(name, (k) -> new AtomicInteger());
        count.incrementAndGet();
        logger.debug("Opened {} | {}", name, metadata);
        return new BlockFile(metadata, store, this.mutualExclusion, this.cacheCapacity,
                () -> count.decrementAndGet());
    }

    /**
     * @param name
     * @return true iff metadata for the file is stored
     */
    public boolean exists(String name) {
        checkName(name);
        return loadMetadata(this.connector.get(), name) != null;
    }

    /**
     * Remove the file's metadata and every primary and overflow block.
     *
     * @param name
     * @throws VfsIoException if a handle on the file is still open
     */
    public void delete(String name) {
        checkName(name);
        if (isOpen(name)) {
            throw new VfsIoException("File " + name + " can't be deleted while open");
        }

        int deleted = TransactionalStore.await(this.connector.get().runTransaction(tx -> {
            int count = tx.primary().clear(name);
            count += tx.overflow().delete(KeyRange.blocksOf(name));
            return count;
        }));
        logger.info("Deleted {} ({} records)", name, deleted);
    }

    /**
     * @param name
     * @return true iff a handle on the file is open
     */
    public boolean isOpen(String name) {
        AtomicInteger count = this.openCounts.get(name);
        return count != null && count.get() > 0;
    }

    public int blockSize() {
        return this.blockSize;
    }

    public int cacheCapacity() {
        return this.cacheCapacity;
    }

    private static Metadata loadMetadata(TransactionalStore store, String name) {
        final StoreKey key = StoreKey.metadata(name);
        StoreRecord found = TransactionalStore.await(store.runTransaction(tx -> tx.primary().get(key)));
        return (Metadata) found;
    }

    private static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Name can't be null or empty");
        }
    }

}
