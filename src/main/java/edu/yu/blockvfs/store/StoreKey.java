package edu.yu.blockvfs.store;

import java.util.Objects;

/**
 * Key of a record in a {@link StoreTable}: (file name, block index), or the
 * metadata key of a file. Keys order by name, then every block of that name by
 * index, then the metadata key.
 */
public final class StoreKey implements Comparable<StoreKey> {

    private final String name;
    private final long index;
    private final boolean metadata;

    private StoreKey(String name, long index, boolean metadata) {
        if (name == null) {
            throw new IllegalArgumentException("Name can't be null");
        }
        if (index < 0) {
            throw new IllegalArgumentException("Index must be >= 0");
        }

        this.name = name;
        this.index = index;
        this.metadata = metadata;
    }

    public static StoreKey block(String name, long index) {
        return new StoreKey(name, index, false);
    }

    public static StoreKey metadata(String name) {
        return new StoreKey(name, 0, true);
    }

    public String name() {
        return this.name;
    }

    /**
     * @return the block index, meaningless for the metadata key
     */
    public long index() {
        return this.index;
    }

    public boolean isMetadata() {
        return this.metadata;
    }

    @Override
    public int compareTo(StoreKey other) {
        int cmp = this.name.compareTo(other.name);
        if (cmp != 0) {
            return cmp;
        }
        if (this.metadata != other.metadata) {
            return this.metadata ? 1 : -1;
        }
        return Long.compare(this.index, other.index);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof StoreKey) {
            StoreKey otherKey = (StoreKey) other;
            return this.name.equals(otherKey.name)
                    && this.index == otherKey.index
                    && this.metadata == otherKey.metadata;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.index, this.metadata);
    }

    @Override
    public String toString() {
        return "[" + this.name + ", " + (this.metadata ? "metadata" : String.valueOf(this.index)) + "]";
    }

}
