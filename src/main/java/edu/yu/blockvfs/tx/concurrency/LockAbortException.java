package edu.yu.blockvfs.tx.concurrency;

/**
 * A lock couldn't be acquired within the configured wait time.
 */
public class LockAbortException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LockAbortException(String message) {
        super(message);
    }

}
