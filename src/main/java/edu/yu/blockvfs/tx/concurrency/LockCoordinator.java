package edu.yu.blockvfs.tx.concurrency;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks the lock level one file handle holds and runs the registered
 * {@link LockTransitionHook}s around every transition, in registration order.
 * <p>
 * Locking only ever raises the level and unlocking only lowers it; a request
 * that wouldn't move the level is a no-op. If a hook fails the failure
 * propagates. A failed {@code afterAcquire} hook from UNLOCKED or SHARED
 * releases the lock back to where it was, so a retry runs the hooks again; a
 * failed {@code beforeRelease} hook leaves the lock held.
 */
public class LockCoordinator {

    private static final Logger logger = LogManager.getLogger(LockCoordinator.class);
    private static final AtomicLong OWNER_IDS = new AtomicLong();

    private final String filename;
    private final MutualExclusion mutualExclusion;
    private final long owner;
    private final List<LockTransitionHook> hooks;
    private LockLevel level;

    public LockCoordinator(String filename, MutualExclusion mutualExclusion) {
        if (filename == null || mutualExclusion == null) {
            throw new IllegalArgumentException("Filename and mutual exclusion can't be null");
        }

        this.filename = filename;
        this.mutualExclusion = mutualExclusion;
        this.owner = OWNER_IDS.incrementAndGet();
        this.hooks = new CopyOnWriteArrayList<>();
        this.level = LockLevel.UNLOCKED;
    }

    /**
     * Append a hook; hooks run in the order they were registered.
     *
     * @param hook
     */
    public void register(LockTransitionHook hook) {
        if (hook == null) {
            throw new IllegalArgumentException("Hook can't be null");
        }
        this.hooks.add(hook);
    }

    public void unregister(LockTransitionHook hook) {
        this.hooks.remove(hook);
    }

    /**
     * Raise the lock to {@code target}.
     *
     * @param target
     * @throws LockAbortException if the lock couldn't be acquired
     */
    public void lock(LockLevel target) {
        if (target == null) {
            throw new IllegalArgumentException("Level can't be null");
        }
        if (this.level.isAtLeast(target)) {
            return;
        }

        final LockLevel previous = this.level;
        for (LockTransitionHook hook : this.hooks) {
            hook.beforeAcquire(previous, target);
        }

        this.mutualExclusion.acquire(this.filename, this.owner, target);
        this.level = target;
        logger.debug("{} locked {} -> {}", this.filename, previous, target);

        try {
            for (LockTransitionHook hook : this.hooks) {
                hook.afterAcquire(previous, target);
            }
        } catch (RuntimeException e) {
            if (previous == LockLevel.UNLOCKED || previous == LockLevel.SHARED) {
                backOut(previous, e);
            }
            throw e;
        }
    }

    /**
     * Undo an acquisition whose hooks failed, without running release hooks.
     */
    private void backOut(LockLevel previous, RuntimeException cause) {
        try {
            this.mutualExclusion.release(this.filename, this.owner, previous);
            this.level = previous;
            logger.warn("{} back to {} after a failed acquisition hook", this.filename, previous);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Drop every lock level without running any hook. Used when a handle is
     * closed after its release protocol failed; pending writes are lost.
     */
    public void abandon() {
        if (this.level == LockLevel.UNLOCKED) {
            return;
        }

        final LockLevel previous = this.level;
        this.mutualExclusion.release(this.filename, this.owner, LockLevel.UNLOCKED);
        this.level = LockLevel.UNLOCKED;
        logger.warn("{} abandoned {} lock", this.filename, previous);
    }

    /**
     * Lower the lock to {@code target}, SHARED or UNLOCKED.
     *
     * @param target
     */
    public void unlock(LockLevel target) {
        if (target == null) {
            throw new IllegalArgumentException("Level can't be null");
        }
        if (target != LockLevel.SHARED && target != LockLevel.UNLOCKED) {
            throw new IllegalArgumentException("Can only unlock to SHARED or UNLOCKED");
        }
        if (target.isAtLeast(this.level)) {
            return;
        }

        final LockLevel previous = this.level;
        for (LockTransitionHook hook : this.hooks) {
            hook.beforeRelease(previous, target);
        }

        this.mutualExclusion.release(this.filename, this.owner, target);
        this.level = target;
        logger.debug("{} unlocked {} -> {}", this.filename, previous, target);

        for (LockTransitionHook hook : this.hooks) {
            hook.afterRelease(previous, target);
        }
    }

    public LockLevel level() {
        return this.level;
    }

    public long owner() {
        return this.owner;
    }

    public String fileName() {
        return this.filename;
    }

}
