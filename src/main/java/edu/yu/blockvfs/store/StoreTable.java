package edu.yu.blockvfs.store;

import java.util.List;

/**
 * Handle to one named table inside a running transaction.
 */
public interface StoreTable {

    /**
     * @param key
     * @return a copy of the stored record, or null if absent
     */
    StoreRecord get(StoreKey key);

    /**
     * Insert or replace the record stored under {@code record.key()}.
     * 
     * @param record
     */
    void put(StoreRecord record);

    /**
     * Delete every record whose key lies in the range.
     * 
     * @param range
     * @return the number of records deleted
     */
    int delete(KeyRange range);

    /**
     * Fetch up to {@code limit} records in the range, in ascending key order.
     * 
     * @param range
     * @param limit
     * @return copies of the records found
     */
    List<StoreRecord> getAll(KeyRange range, int limit);

    /**
     * Delete every record of the file, metadata included.
     * 
     * @param name
     * @return the number of records deleted
     */
    int clear(String name);

}
