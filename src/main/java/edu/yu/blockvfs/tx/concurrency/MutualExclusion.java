package edu.yu.blockvfs.tx.concurrency;

/**
 * Lock service coordinating the handles of a file, possibly across processes.
 * Owners are opaque handle identities.
 */
public interface MutualExclusion {

    /**
     * Raise the owner's lock on the file to {@code level}, waiting if needed.
     *
     * @param filename
     * @param owner
     * @param level
     * @throws LockAbortException if the wait timed out
     */
    void acquire(String filename, long owner, LockLevel level);

    /**
     * Lower the owner's lock on the file to {@code level}, which is SHARED or
     * UNLOCKED.
     *
     * @param filename
     * @param owner
     * @param level
     */
    void release(String filename, long owner, LockLevel level);

}
