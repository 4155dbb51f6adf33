package edu.yu.blockvfs.tx.concurrency;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.blockvfs.config.VfsConfiguration;

/**
 * Lock service for handles living in this process.
 * <p>
 * Any number of owners may hold SHARED. At most one owner, the writer, holds
 * RESERVED or above; RESERVED still admits new readers, PENDING and EXCLUSIVE
 * don't, and EXCLUSIVE is granted only once every other reader has left.
 * Waits are bounded by the configured lock wait time.
 */
public class LocalMutualExclusion implements MutualExclusion {

    private static final Logger logger = LogManager.getLogger(LocalMutualExclusion.class);

    private final long waitTime;
    private final Map<String, FileLock> lockMap;

    public LocalMutualExclusion() {
        this(VfsConfiguration.INSTANCE.lockWaitMillis());
    }

    public LocalMutualExclusion(long waitTimeMillis) {
        if (waitTimeMillis <= 0) {
            throw new IllegalArgumentException("Wait time must be positive");
        }

        this.waitTime = waitTimeMillis;
        this.lockMap = new ConcurrentHashMap<>();
    }

    @Override
    public void acquire(String filename, long owner, LockLevel level) {
        if (filename == null || level == null) {
            throw new IllegalArgumentException("Filename and level can't be null");
        }
        if (level == LockLevel.UNLOCKED) {
            throw new IllegalArgumentException("Can't acquire UNLOCKED");
        }

        try {
            if (!getLock(filename).tryAcquire(owner, level, this.waitTime)) {
                throw new LockAbortException("Timed out waiting for " + level + " on " + filename);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAbortException("Interrupted while waiting for " + level + " on " + filename);
        }

        logger.debug("{} acquired by {} on {}", level, owner, filename);
    }

    @Override
    public void release(String filename, long owner, LockLevel level) {
        if (filename == null || level == null) {
            throw new IllegalArgumentException("Filename and level can't be null");
        }
        if (level != LockLevel.SHARED && level != LockLevel.UNLOCKED) {
            throw new IllegalArgumentException("Can only release to SHARED or UNLOCKED");
        }

        getLock(filename).release(owner, level);
        logger.debug("{} released to {} on {}", owner, level, filename);
    }

    /**
     * @param filename
     * @param owner
     * @return the level the owner holds on the file
     */
    public LockLevel heldBy(String filename, long owner) {
        return getLock(filename).levelOf(owner);
    }

    private FileLock getLock(String filename) {
        return this.lockMap.computeIfAbsent(filename, (k) -> new FileLock());
    }

    /**
     * Lock state of one file.
     */
    private static final class FileLock {
        private final Set<Long> readers = new HashSet<>();
        private Long writer = null;
        private LockLevel writerLevel = LockLevel.UNLOCKED;

        synchronized boolean tryAcquire(long owner, LockLevel level, long timeoutMillis)
                throws InterruptedException {
            long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
            LockLevel priorWriterLevel = this.writerLevel;

            while (!canGrant(owner, level)) {
                // a waiting writer blocks new readers
                if (level == LockLevel.EXCLUSIVE && isWriter(owner)) {
                    this.writerLevel = LockLevel.PENDING;
                }

                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMillis <= 0) {
                    if (isWriter(owner)) {
                        this.writerLevel = priorWriterLevel;
                        notifyAll();
                    }
                    return false;
                }
                wait(remainingMillis);
            }

            this.readers.add(owner);
            if (level != LockLevel.SHARED) {
                this.writer = owner;
                this.writerLevel = level;
            }
            return true;
        }

        synchronized void release(long owner, LockLevel level) {
            if (isWriter(owner)) {
                this.writer = null;
                this.writerLevel = LockLevel.UNLOCKED;
            }
            if (level == LockLevel.UNLOCKED) {
                this.readers.remove(owner);
            }
            notifyAll();
        }

        synchronized LockLevel levelOf(long owner) {
            if (isWriter(owner)) {
                return this.writerLevel;
            }
            return this.readers.contains(owner) ? LockLevel.SHARED : LockLevel.UNLOCKED;
        }

        private boolean isWriter(long owner) {
            return this.writer != null && this.writer == owner;
        }

        private boolean canGrant(long owner, LockLevel level) {
            boolean writerFree = this.writer == null || isWriter(owner);
            switch (level) {
            case SHARED:
                return writerFree || this.writerLevel == LockLevel.RESERVED;
            case RESERVED:
            case PENDING:
                return writerFree;
            case EXCLUSIVE:
                return writerFree && (this.readers.isEmpty()
                        || (this.readers.size() == 1 && this.readers.contains(owner)));
            default:
                return false;
            }
        }
    }

}
