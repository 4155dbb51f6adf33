package edu.yu.blockvfs.store;

/**
 * A contiguous, bounded range of {@link StoreKey}s. Ranges built by the
 * factory methods never span more than one file name and never include the
 * metadata key.
 */
public final class KeyRange {

    private final StoreKey lower;
    private final boolean lowerOpen;
    private final StoreKey upper;
    private final boolean upperOpen;

    private KeyRange(StoreKey lower, boolean lowerOpen, StoreKey upper, boolean upperOpen) {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("Range bounds can't be null");
        }

        this.lower = lower;
        this.lowerOpen = lowerOpen;
        this.upper = upper;
        this.upperOpen = upperOpen;
    }

    public static KeyRange bound(StoreKey lower, boolean lowerOpen, StoreKey upper, boolean upperOpen) {
        return new KeyRange(lower, lowerOpen, upper, upperOpen);
    }

    /**
     * Every block key of the file.
     * 
     * @param name
     * @return the range [name, 0] .. [name, MAX]
     */
    public static KeyRange blocksOf(String name) {
        return blocksFrom(name, 0);
    }

    /**
     * Block keys of the file with index >= {@code index}.
     * 
     * @param name
     * @param index
     * @return the range
     */
    public static KeyRange blocksFrom(String name, long index) {
        return new KeyRange(StoreKey.block(name, index), false, StoreKey.block(name, Long.MAX_VALUE), false);
    }

    /**
     * Block keys of the file with index > {@code index}, used to resume a paged
     * scan after the last key seen.
     * 
     * @param name
     * @param index
     * @return the range
     */
    public static KeyRange blocksAfter(String name, long index) {
        return new KeyRange(StoreKey.block(name, index), true, StoreKey.block(name, Long.MAX_VALUE), false);
    }

    public StoreKey lower() {
        return this.lower;
    }

    public boolean isLowerOpen() {
        return this.lowerOpen;
    }

    public StoreKey upper() {
        return this.upper;
    }

    public boolean isUpperOpen() {
        return this.upperOpen;
    }

    public boolean contains(StoreKey key) {
        int lowerCmp = key.compareTo(this.lower);
        int upperCmp = key.compareTo(this.upper);
        return (this.lowerOpen ? lowerCmp > 0 : lowerCmp >= 0)
                && (this.upperOpen ? upperCmp < 0 : upperCmp <= 0);
    }

    @Override
    public String toString() {
        return (this.lowerOpen ? "(" : "[") + this.lower + " .. " + this.upper + (this.upperOpen ? ")" : "]");
    }

}
