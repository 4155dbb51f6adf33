package edu.yu.blockvfs.store;

public enum StoreMode {
    READ_ONLY, READ_WRITE
}
