package edu.yu.blockvfs.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-process transactional store holding the primary and overflow tables in
 * sorted maps.
 * <p>
 * Every transaction, from every connection, runs on one single-threaded
 * executor. Submission order is therefore commit order, and the tables are only
 * ever touched by the executor thread. Atomicity comes from an undo log that is
 * replayed in reverse when a body throws.
 */
public class MemoryStoreDatabase implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(MemoryStoreDatabase.class);
    private static final AtomicInteger DATABASE_IDS = new AtomicInteger();

    private final String name;
    private final ExecutorService executor;
    private final NavigableMap<StoreKey, StoreRecord> primary;
    private final NavigableMap<StoreKey, StoreRecord> overflow;
    private volatile boolean closed;

    public MemoryStoreDatabase(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Name can't be null");
        }

        this.name = name;
        this.primary = new TreeMap<>();
        this.overflow = new TreeMap<>();

        // single thread keeps transactions serialized in submission order
        final int id = DATABASE_IDS.incrementAndGet();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "store-" + name + "-" + id);
            t.setDaemon(true);
            return t;
        });

        logger.info("Store database '{}' started", name);
    }

    public String getName() {
        return this.name;
    }

    /**
     * Open a connection with its own transaction mode, initially READ_WRITE.
     *
     * @return the connection
     */
    public TransactionalStore connect() {
        if (this.closed) {
            throw new IllegalStateException("Store database is closed");
        }
        return new Connection();
    }

    /**
     * Read every record of a file from a table. Runs as a transaction of its
     * own, so it observes all work submitted before it.
     *
     * @param table {@link StoreTransaction#PRIMARY} or
     *              {@link StoreTransaction#OVERFLOW}
     * @param fileName
     * @return copies of the records in key order, metadata last
     */
    public List<StoreRecord> records(String table, String fileName) {
        if (!StoreTransaction.PRIMARY.equals(table) && !StoreTransaction.OVERFLOW.equals(table)) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        return submit(StoreMode.READ_ONLY, tx -> {
            StoreTable handle = StoreTransaction.PRIMARY.equals(table) ? tx.primary() : tx.overflow();
            List<StoreRecord> found = new ArrayList<>(handle.getAll(KeyRange.blocksOf(fileName), Integer.MAX_VALUE));
            StoreRecord meta = handle.get(StoreKey.metadata(fileName));
            if (meta != null) {
                found.add(meta);
            }
            return found;
        }).join();
    }

    @Override
    public void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;

        // drain submitted work before stopping
        this.executor.shutdown();
        try {
            if (!this.executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Store database '{}' did not drain in time", this.name);
                this.executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            this.executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Store database '{}' closed", this.name);
    }

    private <T> CompletableFuture<T> submit(StoreMode mode, StoreTransaction.Body<T> body) {
        if (body == null) {
            throw new IllegalArgumentException("Transaction body can't be null");
        }

        try {
            return CompletableFuture.supplyAsync(() -> execute(mode, body), this.executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new StoreException("Store database is closed", e));
        }
    }

    /**
     * Run the body on the executor thread, undoing its writes if it fails.
     */
    private <T> T execute(StoreMode mode, StoreTransaction.Body<T> body) {
        Transaction tx = new Transaction(mode);
        try {
            return body.execute(tx);
        } catch (Exception e) {
            tx.abort();
            logger.debug("Transaction aborted: {}", e.toString());
            if (e instanceof StoreException) {
                throw (StoreException) e;
            }
            if (e instanceof CompletionException && e.getCause() instanceof StoreException) {
                throw (StoreException) e.getCause();
            }
            throw new StoreException("Transaction failed", e);
        } finally {
            tx.finish();
        }
    }

    private final class Connection implements TransactionalStore {

        private volatile StoreMode mode = StoreMode.READ_WRITE;

        @Override
        public <T> CompletableFuture<T> runTransaction(StoreTransaction.Body<T> body) {
            // mode is fixed at submission
            return submit(this.mode, body);
        }

        @Override
        public void setMode(StoreMode mode) {
            if (mode == null) {
                throw new IllegalArgumentException("Mode can't be null");
            }
            this.mode = mode;
        }

        @Override
        public StoreMode getMode() {
            return this.mode;
        }

    }

    private final class Transaction implements StoreTransaction {

        private final StoreMode mode;
        private final Deque<Undo> undoLog;
        private final Table primaryHandle;
        private final Table overflowHandle;
        private boolean finished;

        Transaction(StoreMode mode) {
            this.mode = mode;
            this.undoLog = new ArrayDeque<>();
            this.primaryHandle = new Table(PRIMARY, MemoryStoreDatabase.this.primary, this);
            this.overflowHandle = new Table(OVERFLOW, MemoryStoreDatabase.this.overflow, this);
        }

        @Override
        public StoreTable primary() {
            return this.primaryHandle;
        }

        @Override
        public StoreTable overflow() {
            return this.overflowHandle;
        }

        @Override
        public StoreMode mode() {
            return this.mode;
        }

        void checkActive() {
            if (this.finished) {
                throw new StoreException("Transaction is no longer active");
            }
        }

        void checkWritable(String table) {
            checkActive();
            if (this.mode != StoreMode.READ_WRITE) {
                throw new StoreException("Write to '" + table + "' in a read-only transaction");
            }
        }

        void abort() {
            while (!this.undoLog.isEmpty()) {
                this.undoLog.pop().revert();
            }
        }

        void finish() {
            this.undoLog.clear();
            this.finished = true;
        }

    }

    private static final class Undo {
        final Map<StoreKey, StoreRecord> table;
        final StoreKey key;
        final StoreRecord previous;

        Undo(Map<StoreKey, StoreRecord> table, StoreKey key, StoreRecord previous) {
            this.table = table;
            this.key = key;
            this.previous = previous;
        }

        void revert() {
            if (this.previous == null) {
                this.table.remove(this.key);
            } else {
                this.table.put(this.key, this.previous);
            }
        }
    }

    private static final class Table implements StoreTable {

        private final String name;
        private final NavigableMap<StoreKey, StoreRecord> data;
        private final Transaction tx;

        Table(String name, NavigableMap<StoreKey, StoreRecord> data, Transaction tx) {
            this.name = name;
            this.data = data;
            this.tx = tx;
        }

        @Override
        public StoreRecord get(StoreKey key) {
            if (key == null) {
                throw new IllegalArgumentException("Key can't be null");
            }
            this.tx.checkActive();

            StoreRecord found = this.data.get(key);
            return found == null ? null : found.copy();
        }

        @Override
        public void put(StoreRecord record) {
            if (record == null || record.key() == null) {
                throw new IllegalArgumentException("Record and its key can't be null");
            }
            this.tx.checkWritable(this.name);

            StoreKey key = record.key();
            StoreRecord previous = this.data.put(key, record.copy());
            this.tx.undoLog.push(new Undo(this.data, key, previous));
        }

        @Override
        public int delete(KeyRange range) {
            if (range == null) {
                throw new IllegalArgumentException("Range can't be null");
            }
            this.tx.checkWritable(this.name);

            int deleted = 0;
            Iterator<Map.Entry<StoreKey, StoreRecord>> it = view(range).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<StoreKey, StoreRecord> entry = it.next();
                this.tx.undoLog.push(new Undo(this.data, entry.getKey(), entry.getValue()));
                it.remove();
                deleted++;
            }
            return deleted;
        }

        @Override
        public List<StoreRecord> getAll(KeyRange range, int limit) {
            if (range == null) {
                throw new IllegalArgumentException("Range can't be null");
            }
            if (limit <= 0) {
                throw new IllegalArgumentException("Limit must be positive");
            }
            this.tx.checkActive();

            List<StoreRecord> found = new ArrayList<>();
            for (StoreRecord record : view(range).values()) {
                if (found.size() >= limit) {
                    break;
                }
                found.add(record.copy());
            }
            return found;
        }

        @Override
        public int clear(String fileName) {
            if (fileName == null) {
                throw new IllegalArgumentException("Name can't be null");
            }

            int deleted = delete(KeyRange.blocksOf(fileName));
            StoreKey metaKey = StoreKey.metadata(fileName);
            StoreRecord previous = this.data.remove(metaKey);
            if (previous != null) {
                this.tx.undoLog.push(new Undo(this.data, metaKey, previous));
                deleted++;
            }
            return deleted;
        }

        private NavigableMap<StoreKey, StoreRecord> view(KeyRange range) {
            if (range.lower().compareTo(range.upper()) > 0) {
                return new TreeMap<>();
            }
            return this.data.subMap(range.lower(), !range.isLowerOpen(), range.upper(), !range.isUpperOpen());
        }

    }

}
