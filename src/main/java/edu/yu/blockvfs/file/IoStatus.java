package edu.yu.blockvfs.file;

/**
 * Outcome of a successful read.
 */
public enum IoStatus {
    OK,
    /** the read started at or past end-of-file; the buffer was zero-filled */
    SHORT_READ
}
