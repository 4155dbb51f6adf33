package edu.yu.blockvfs.store;

/**
 * Failure of a {@link TransactionalStore} operation. A transaction that raises
 * it has been aborted and none of its writes are visible.
 */
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

}
