package edu.yu.blockvfs.tx.concurrency;

/**
 * Callbacks run by a {@link LockCoordinator} around each lock transition.
 * Acquisition callbacks run after the lock is held; release callbacks run while
 * it is still held.
 */
public interface LockTransitionHook {

    default void beforeAcquire(LockLevel current, LockLevel target) {
    }

    default void afterAcquire(LockLevel previous, LockLevel current) {
    }

    default void beforeRelease(LockLevel current, LockLevel target) {
    }

    default void afterRelease(LockLevel previous, LockLevel current) {
    }

}
