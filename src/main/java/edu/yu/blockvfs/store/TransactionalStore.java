package edu.yu.blockvfs.store;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Asynchronous transactional key-value store holding a primary and an overflow
 * table.
 * <p>
 * A transaction commits atomically when its body returns normally and aborts
 * when it throws; the returned future then completes exceptionally with a
 * {@link StoreException}. Transactions submitted through one store commit in
 * submission order, so a read submitted after a write to the same key always
 * observes that write, even when nobody waited for the write to complete.
 */
public interface TransactionalStore {

    /**
     * Submit a transaction.
     * 
     * @param <T>
     * @param body
     * @return a future completed with the body's result once committed
     */
    <T> CompletableFuture<T> runTransaction(StoreTransaction.Body<T> body);

    /**
     * Set the mode of transactions submitted from now on.
     * 
     * @param mode
     */
    void setMode(StoreMode mode);

    StoreMode getMode();

    /**
     * Wait for a transaction, rethrowing its {@link StoreException} unwrapped.
     *
     * @param <T>
     * @param future
     * @return the transaction result
     */
    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof StoreException) {
                throw (StoreException) e.getCause();
            }
            throw new StoreException("Transaction failed", e.getCause() != null ? e.getCause() : e);
        }
    }

}
