package edu.yu.blockvfs.file;

import java.nio.ByteBuffer;

import edu.yu.blockvfs.store.StoreKey;
import edu.yu.blockvfs.store.StoreRecord;

/**
 * A fixed-size block of opaque bytes. The content is mutable so the write
 * cache can overwrite a cached block in place; readers copy what they need.
 */
public class Block implements StoreRecord {

    private final BlockId id;
    private final byte[] data;

    public Block(BlockId id, int blocksize) {
        this(id, new byte[checkSize(blocksize)]);
    }

    public Block(BlockId id, byte[] data) {
        if (id == null || data == null) {
            throw new IllegalArgumentException("Block id and data can't be null");
        }

        this.id = id;
        this.data = data;
    }

    private static int checkSize(int blocksize) {
        if (blocksize <= 0) {
            throw new IllegalArgumentException("Blocksize must be positive");
        }
        return blocksize;
    }

    public BlockId id() {
        return this.id;
    }

    public long index() {
        return this.id.number();
    }

    public int size() {
        return this.data.length;
    }

    /**
     * @return the live content of this block
     */
    public byte[] data() {
        return this.data;
    }

    /**
     * Overwrite the whole content.
     * 
     * @param src must be exactly {@link #size()} bytes
     */
    public void overwrite(byte[] src) {
        if (src == null || src.length != this.data.length) {
            throw new IllegalArgumentException("Content must be exactly " + this.data.length + " bytes");
        }
        System.arraycopy(src, 0, this.data, 0, this.data.length);
    }

    /**
     * Copy part of the content.
     * 
     * @param offset offset within the block
     * @param dst
     * @param length
     */
    public void copyTo(int offset, byte[] dst, int length) {
        System.arraycopy(this.data, offset, dst, 0, length);
    }

    /**
     * @param offset
     * @return the big-endian int at the offset
     */
    public int getInt(int offset) {
        return ByteBuffer.wrap(this.data).getInt(offset);
    }

    /**
     * Store a big-endian int at the offset.
     * 
     * @param offset
     * @param n
     */
    public void setInt(int offset, int n) {
        ByteBuffer.wrap(this.data).putInt(offset, n);
    }

    @Override
    public StoreKey key() {
        return StoreKey.block(this.id.fileName(), this.id.number());
    }

    @Override
    public Block copy() {
        return new Block(this.id, this.data.clone());
    }

    @Override
    public String toString() {
        return "Block(" + this.id + ", " + this.data.length + " bytes)";
    }

}
