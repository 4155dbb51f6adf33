package edu.yu.blockvfs.file;

import edu.yu.blockvfs.store.StoreKey;
import edu.yu.blockvfs.store.StoreRecord;

/**
 * Size bookkeeping of one file. The block size is fixed when the file is
 * created; the file size is advanced by writes and lowered only by truncate.
 */
public class Metadata implements StoreRecord {

    private final String name;
    private final int blockSize;
    private long fileSize;

    public Metadata(String name, long fileSize, int blockSize) {
        if (name == null) {
            throw new IllegalArgumentException("Name can't be null");
        }
        if (fileSize < 0) {
            throw new IllegalArgumentException("File size must be >= 0");
        }
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive");
        }

        this.name = name;
        this.fileSize = fileSize;
        this.blockSize = blockSize;
    }

    public String name() {
        return this.name;
    }

    public long fileSize() {
        return this.fileSize;
    }

    public void setFileSize(long fileSize) {
        if (fileSize < 0) {
            throw new IllegalArgumentException("File size must be >= 0");
        }
        this.fileSize = fileSize;
    }

    public int blockSize() {
        return this.blockSize;
    }

    /**
     * @return the number of blocks needed to hold fileSize bytes
     */
    public long blockCount() {
        return (this.fileSize + this.blockSize - 1) / this.blockSize;
    }

    /**
     * @param index
     * @return true iff the block starts before the end of the file
     */
    public boolean holds(long index) {
        return index * this.blockSize < this.fileSize;
    }

    @Override
    public StoreKey key() {
        return StoreKey.metadata(this.name);
    }

    @Override
    public Metadata copy() {
        return new Metadata(this.name, this.fileSize, this.blockSize);
    }

    @Override
    public String toString() {
        return "Metadata[name=" + this.name + ", fileSize=" + this.fileSize + ", blockSize=" + this.blockSize + "]";
    }

}
