package edu.yu.blockvfs.file;

import java.util.Objects;

/**
 * Identity of a block: (file name, block index).
 */
public class BlockId {

    private final String filename;
    private final long number;

    public BlockId(String filename, long number) {
        if (filename == null) {
            throw new IllegalArgumentException("Filename can't be null");
        }
        if (filename.isEmpty()) {
            throw new IllegalArgumentException("Filename must have a length greater than 0");
        }
        if (number < 0) {
            throw new IllegalArgumentException("Block number must be >= 0");
        }

        this.filename = filename;
        this.number = number;
    }

    public String fileName() {
        return this.filename;
    }

    public long number() {
        return this.number;
    }

    @Override
    public boolean equals(Object other) {
        if (other != null && other instanceof BlockId) {
            BlockId otherBlock = (BlockId) other;
            return this.filename.equals(otherBlock.filename) && this.number == otherBlock.number;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.filename, this.number);
    }

    @Override
    public String toString() {
        StringBuilder stb = new StringBuilder();
        stb.append("BlockID: [file: ")
                .append(this.filename)
                .append(", block: ")
                .append(this.number)
                .append("]");
        return stb.toString();
    }

}
