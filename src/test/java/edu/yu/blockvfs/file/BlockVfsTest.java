package edu.yu.blockvfs.file;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.yu.blockvfs.config.VfsConfiguration;
import edu.yu.blockvfs.store.MemoryStoreDatabase;
import edu.yu.blockvfs.store.StoreTransaction;
import edu.yu.blockvfs.tx.concurrency.LocalMutualExclusion;
import edu.yu.blockvfs.tx.concurrency.LockLevel;

public class BlockVfsTest {

    private static final int BLOCK_SIZE = 512;

    private MemoryStoreDatabase db;
    private BlockVfs vfs;

    @BeforeEach
    public void setUp() {
        this.db = new MemoryStoreDatabase("vfs-test");
        this.vfs = new BlockVfs(this.db::connect, new LocalMutualExclusion(200), BLOCK_SIZE, 2);
    }

    @AfterEach
    public void tearDown() {
        this.db.close();
    }

    private void writeBlocks(BlockFile file, int count) {
        file.lock(LockLevel.SHARED);
        file.lock(LockLevel.RESERVED);
        file.lock(LockLevel.EXCLUSIVE);
        for (int i = 0; i < count; i++) {
            byte[] data = new byte[BLOCK_SIZE];
            Arrays.fill(data, (byte) i);
            file.write((long) i * BLOCK_SIZE, data);
        }
        file.unlock(LockLevel.UNLOCKED);
    }

    @Test
    @DisplayName("constructor validation")
    public void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> new BlockVfs(null, new LocalMutualExclusion(1), BLOCK_SIZE, 2));
        assertThrows(IllegalArgumentException.class, () -> new BlockVfs(this.db::connect, null, BLOCK_SIZE, 2));
        assertThrows(IllegalArgumentException.class,
                () -> new BlockVfs(this.db::connect, new LocalMutualExclusion(1), 0, 2));
        assertThrows(IllegalArgumentException.class,
                () -> new BlockVfs(this.db::connect, new LocalMutualExclusion(1), BLOCK_SIZE, 0));
        assertThrows(IllegalArgumentException.class, () -> this.vfs.open("", true));
    }

    @Test
    @DisplayName("configured defaults")
    public void configuredDefaults() {
        BlockVfs configured = new BlockVfs(this.db::connect, new LocalMutualExclusion());
        assertEquals(VfsConfiguration.INSTANCE.blockSize(), configured.blockSize());
        assertEquals(VfsConfiguration.INSTANCE.writeCacheCapacity(), configured.cacheCapacity());
    }

    @Test
    @DisplayName("open creates only when asked")
    public void openAndCreate() {
        assertFalse(this.vfs.exists("a.db"));
        assertThrows(CannotOpenException.class, () -> this.vfs.open("a.db", false));
        assertFalse(this.vfs.isOpen("a.db"));

        try (BlockFile file = this.vfs.open("a.db", true)) {
            assertTrue(this.vfs.exists("a.db"));
            assertTrue(this.vfs.isOpen("a.db"));
            assertEquals(0, file.size());
            assertEquals(BLOCK_SIZE, file.sectorSize());
            assertEquals(1, this.db.records(StoreTransaction.PRIMARY, "a.db").size());
        }
        assertFalse(this.vfs.isOpen("a.db"));

        // create on an existing file keeps its contents
        try (BlockFile file = this.vfs.open("a.db", true)) {
            writeBlocks(file, 2);
        }
        try (BlockFile file = this.vfs.open("a.db", true)) {
            assertEquals(2 * BLOCK_SIZE, file.size());
        }
    }

    @Test
    @DisplayName("the block size of an existing file wins")
    public void existingBlockSize() {
        try (BlockFile file = this.vfs.open("a.db", true)) {
            writeBlocks(file, 1);
        }

        BlockVfs bigger = new BlockVfs(this.db::connect, new LocalMutualExclusion(200), BLOCK_SIZE * 2, 2);
        try (BlockFile file = bigger.open("a.db", false)) {
            assertEquals(BLOCK_SIZE, file.sectorSize());
        }
    }

    @Test
    @DisplayName("delete removes every record of one file")
    public void delete() {
        try (BlockFile a = this.vfs.open("a.db", true); BlockFile b = this.vfs.open("b.db", true)) {
            // more blocks than the cache holds, so some go through overflow
            writeBlocks(a, 5);
            writeBlocks(b, 3);
        }

        this.vfs.delete("a.db");

        assertFalse(this.vfs.exists("a.db"));
        assertTrue(this.db.records(StoreTransaction.PRIMARY, "a.db").isEmpty());
        assertTrue(this.db.records(StoreTransaction.OVERFLOW, "a.db").isEmpty());
        assertEquals(4, this.db.records(StoreTransaction.PRIMARY, "b.db").size());
        assertThrows(CannotOpenException.class, () -> this.vfs.open("a.db", false));
    }

    @Test
    @DisplayName("an open file can't be deleted")
    public void deleteWhileOpen() {
        BlockFile first = this.vfs.open("a.db", true);
        BlockFile second = this.vfs.open("a.db", false);

        assertThrows(VfsIoException.class, () -> this.vfs.delete("a.db"));
        first.close();
        assertThrows(VfsIoException.class, () -> this.vfs.delete("a.db"));
        second.close();

        this.vfs.delete("a.db");
        assertFalse(this.vfs.exists("a.db"));
    }

}
