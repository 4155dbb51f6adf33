package edu.yu.blockvfs.file;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.blockvfs.buffer.BlockCache;
import edu.yu.blockvfs.store.TransactionalStore;
import edu.yu.blockvfs.tx.LockProtocol;
import edu.yu.blockvfs.tx.concurrency.LockCoordinator;
import edu.yu.blockvfs.tx.concurrency.LockLevel;
import edu.yu.blockvfs.tx.concurrency.LockTransitionHook;
import edu.yu.blockvfs.tx.concurrency.MutualExclusion;

/**
 * An open file as the database engine sees it: aligned block reads and
 * whole-block writes over a two-tier write cache.
 * <p>
 * Writes only reach the primary table when an EXCLUSIVE lock is released, so
 * {@link #sync()} has nothing to do. Reads at or past end-of-file are not errors;
 * they zero-fill the buffer and report {@link IoStatus#SHORT_READ}.
 * <p>
 * A handle is owned by one caller at a time and is not thread safe.
 */
public class BlockFile implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(BlockFile.class);

    private static final Set<DeviceCharacteristic> CHARACTERISTICS = EnumSet.of(
            DeviceCharacteristic.SAFE_APPEND,
            DeviceCharacteristic.UNDELETABLE_WHEN_OPEN);

    private final Metadata metadata;
    private final BlockCache cache;
    private final LockProtocol protocol;
    private final LockCoordinator locks;
    private final Runnable onClose;
    private boolean closed;

    public BlockFile(Metadata metadata, TransactionalStore store, MutualExclusion mutualExclusion,
            int cacheCapacity) {
        this(metadata, store, mutualExclusion, cacheCapacity, () -> {
        });
    }

    BlockFile(Metadata metadata, TransactionalStore store, MutualExclusion mutualExclusion, int cacheCapacity,
            Runnable onClose) {
        if (metadata == null || store == null || mutualExclusion == null || onClose == null) {
            throw new IllegalArgumentException("Input can't be null");
        }

        this.metadata = metadata;
        this.cache = new BlockCache(metadata.name(), store, cacheCapacity);
        this.protocol = new LockProtocol(store, this.cache, metadata);
        this.locks = new LockCoordinator(metadata.name(), mutualExclusion);
        this.locks.register(this.protocol);
        this.onClose = onClose;
    }

    public String name() {
        return this.metadata.name();
    }

    /**
     * Read {@code dst.length} bytes at {@code offset}. The range must lie within
     * one block.
     *
     * @param offset
     * @param dst
     * @return {@link IoStatus#SHORT_READ} if the offset is at or past
     *         end-of-file, else {@link IoStatus#OK}
     * @throws AlignmentException if the range crosses a block boundary
     */
    public IoStatus read(long offset, byte[] dst) {
        checkOpen();
        if (dst == null) {
            throw new IllegalArgumentException("Buffer can't be null");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be >= 0");
        }

        final int blockSize = this.metadata.blockSize();
        final long blockIndex = offset / blockSize;
        if (offset + dst.length > (blockIndex + 1) * blockSize) {
            throw new AlignmentException("Read of " + dst.length + " bytes at " + offset
                    + " crosses a block boundary");
        }

        if (offset >= this.metadata.fileSize()) {
            Arrays.fill(dst, (byte) 0);
            return IoStatus.SHORT_READ;
        }

        Block block = this.cache.get(blockIndex);
        block.copyTo((int) (offset - blockIndex * blockSize), dst, dst.length);
        return IoStatus.OK;
    }

    /**
     * Write exactly one block at a block-aligned offset.
     *
     * @param offset
     * @param data
     * @throws AlignmentException unless the write covers exactly one block
     */
    public void write(long offset, byte[] data) {
        checkOpen();
        if (data == null) {
            throw new IllegalArgumentException("Data can't be null");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be >= 0");
        }

        final int blockSize = this.metadata.blockSize();
        final long blockIndex = offset / blockSize;
        if (offset != blockIndex * blockSize || data.length != blockSize) {
            throw new AlignmentException("Write of " + data.length + " bytes at " + offset
                    + " is not a single aligned block");
        }

        this.metadata.setFileSize(Math.max(this.metadata.fileSize(), offset + data.length));

        Block block = this.cache.cached(blockIndex);
        if (block == null) {
            block = new Block(new BlockId(name(), blockIndex), blockSize);
        }
        block.overwrite(data);
        this.cache.put(block);
    }

    /**
     * Set the file size. Stored blocks past the new end are removed by the next
     * flush.
     *
     * @param size
     */
    public void truncate(long size) {
        checkOpen();
        if (size < 0) {
            throw new IllegalArgumentException("Size must be >= 0");
        }
        this.metadata.setFileSize(size);
    }

    /**
     * Writes become durable when EXCLUSIVE is released, never here.
     */
    public void sync() {
        checkOpen();
    }

    public long size() {
        checkOpen();
        return this.metadata.fileSize();
    }

    public int sectorSize() {
        return this.metadata.blockSize();
    }

    public Set<DeviceCharacteristic> deviceCharacteristics() {
        return EnumSet.copyOf(CHARACTERISTICS);
    }

    public void lock(LockLevel level) {
        checkOpen();
        this.locks.lock(level);
    }

    public void unlock(LockLevel level) {
        checkOpen();
        this.locks.unlock(level);
    }

    public LockLevel lockLevel() {
        return this.locks.level();
    }

    /**
     * Add coordination that runs after the cache protocol on every lock
     * transition.
     *
     * @param hook
     */
    public void registerLockHook(LockTransitionHook hook) {
        this.locks.register(hook);
    }

    /**
     * Discard every pending write at the next unlock without the engine's
     * involvement. The only durable effect is an increment of the change counter
     * in block 0.
     */
    public void requestRollback() {
        checkOpen();
        this.protocol.requestRollback();
    }

    BlockCache cache() {
        return this.cache;
    }

    public boolean isClosed() {
        return this.closed;
    }

    /**
     * Release any lock still held, running the release protocol, then close.
     * The handle is closed even if the release protocol fails: the lock is
     * dropped, pending writes are discarded and the failure is rethrown.
     */
    @Override
    public void close() {
        if (this.closed) {
            return;
        }

        try {
            this.locks.unlock(LockLevel.UNLOCKED);
        } finally {
            if (this.locks.level() != LockLevel.UNLOCKED) {
                this.locks.abandon();
            }
            this.closed = true;
            this.onClose.run();
            logger.debug("Closed {}", name());
        }
    }

    private void checkOpen() {
        if (this.closed) {
            throw new IllegalStateException("File " + name() + " is closed");
        }
    }

    @Override
    public String toString() {
        return "BlockFile[" + this.metadata + ", lock=" + this.locks.level() + "]";
    }

}
