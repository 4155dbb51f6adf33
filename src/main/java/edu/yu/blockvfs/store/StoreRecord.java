package edu.yu.blockvfs.store;

/**
 * A value persisted in a {@link StoreTable}. Records carry their own key.
 */
public interface StoreRecord {

    StoreKey key();

    /**
     * @return a deep copy sharing no mutable state with this record
     */
    StoreRecord copy();

}
