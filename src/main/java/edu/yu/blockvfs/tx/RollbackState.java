package edu.yu.blockvfs.tx;

/**
 * Pending out-of-band rollback: when active, the next release discards every
 * pending write and restores the file size captured at the last SHARED
 * acquisition.
 */
public class RollbackState {

    private boolean active;
    private long savedSize;

    public boolean isActive() {
        return this.active;
    }

    public void request() {
        this.active = true;
    }

    public long savedSize() {
        return this.savedSize;
    }

    public void capture(long fileSize) {
        this.savedSize = fileSize;
    }

    public void complete() {
        this.active = false;
    }

    @Override
    public String toString() {
        return "RollbackState[active=" + this.active + ", savedSize=" + this.savedSize + "]";
    }

}
