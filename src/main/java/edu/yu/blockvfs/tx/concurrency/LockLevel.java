package edu.yu.blockvfs.tx.concurrency;

/**
 * Lock levels of a file, weakest first. Only SHARED, EXCLUSIVE and the release
 * of EXCLUSIVE change cache state; RESERVED and PENDING pass through.
 */
public enum LockLevel {
    UNLOCKED, SHARED, RESERVED, PENDING, EXCLUSIVE;

    public boolean isAtLeast(LockLevel other) {
        return compareTo(other) >= 0;
    }
}
