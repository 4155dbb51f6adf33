package edu.yu.blockvfs.file;

/**
 * Capabilities a {@link BlockFile} advertises to the database engine.
 */
public enum DeviceCharacteristic {
    /** appended data is never left as garbage after a crash */
    SAFE_APPEND,
    /** the file can't be deleted while it is open */
    UNDELETABLE_WHEN_OPEN
}
