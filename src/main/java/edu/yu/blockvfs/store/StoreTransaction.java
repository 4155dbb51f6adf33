package edu.yu.blockvfs.store;

/**
 * The tables visible to a transaction body.
 */
public interface StoreTransaction {

    String PRIMARY = "primary";
    String OVERFLOW = "overflow";

    /**
     * @return the authoritative table
     */
    StoreTable primary();

    /**
     * @return the table holding blocks spilled from a write cache
     */
    StoreTable overflow();

    StoreMode mode();

    /**
     * Work executed inside a transaction.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    interface Body<T> {
        T execute(StoreTransaction tx) throws Exception;
    }

}
