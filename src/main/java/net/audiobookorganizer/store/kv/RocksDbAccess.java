package net.audiobookorganizer.store.kv;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.audiobookorganizer.exception.AudiobookStoreException;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Slice;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

/**
 * Thin byte-level layer over RocksDB: point reads, bounded prefix scans, synced atomic batches
 * and persisted integer counters. {@link RocksDBException} never escapes this class.
 */
@Slf4j
final class RocksDbAccess implements AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final int LOCK_STRIPES = 64;

    private final Path directory;
    private final Options options;
    private final WriteOptions writeOptions;
    private final RocksDB db;
    private final ReentrantLock counterLock = new ReentrantLock();
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    RocksDbAccess(Path directory) {
        this.directory = directory;
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new ReentrantLock();
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new AudiobookStoreException("Failed to create RocksDB directory " + directory, ex);
        }
        this.options = new Options().setCreateIfMissing(true);
        this.writeOptions = new WriteOptions().setSync(true);
        try {
            this.db = RocksDB.open(options, directory.toAbsolutePath().toString());
        } catch (RocksDBException ex) {
            writeOptions.close();
            options.close();
            throw new AudiobookStoreException("Failed to open RocksDB at " + directory, ex);
        }
        log.debug("Opened RocksDB at {}", directory);
    }

    Path directory() {
        return directory;
    }

    Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(db.get(KeySpace.bytes(key)));
        } catch (RocksDBException ex) {
            throw new AudiobookStoreException("Failed to read key " + key, ex);
        }
    }

    Optional<String> getString(String key) {
        return get(key).map(value -> new String(value, StandardCharsets.UTF_8));
    }

    boolean exists(String key) {
        return get(key).isPresent();
    }

    /** Every key/value pair under {@code prefix}, in key order. */
    List<Entry> scan(String prefix) {
        List<Entry> entries = new ArrayList<>();
        try (Slice lower = new Slice(KeySpace.bytes(prefix));
             Slice upper = new Slice(KeySpace.upperBound(prefix));
             ReadOptions readOptions = new ReadOptions().setIterateLowerBound(lower).setIterateUpperBound(upper);
             RocksIterator iterator = db.newIterator(readOptions)) {
            for (iterator.seek(KeySpace.bytes(prefix)); iterator.isValid(); iterator.next()) {
                entries.add(new Entry(KeySpace.string(iterator.key()), iterator.value()));
            }
            iterator.status();
        } catch (RocksDBException ex) {
            throw new AudiobookStoreException("Failed to scan prefix " + prefix, ex);
        }
        return entries;
    }

    /** Keys under {@code prefix}, in key order. */
    List<String> keys(String prefix) {
        List<String> keys = new ArrayList<>();
        for (Entry entry : scan(prefix)) {
            keys.add(entry.key());
        }
        return keys;
    }

    /** Every key in the database. */
    List<String> allKeys() {
        List<String> keys = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator()) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                keys.add(KeySpace.string(iterator.key()));
            }
            iterator.status();
        } catch (RocksDBException ex) {
            throw new AudiobookStoreException("Failed to scan keyspace", ex);
        }
        return keys;
    }

    Batch batch() {
        return new Batch();
    }

    /**
     * Returns the counter's current value and persists value + 1. A counter that was never
     * written starts at 1. Values only grow; gaps are possible when a caller's later write fails.
     */
    long nextId(String family) {
        String key = KeySpace.counter(family);
        counterLock.lock();
        try {
            long current = readLong(key, 1L);
            try (Batch batch = batch()) {
                batch.put(key, Long.toString(current + 1));
                batch.commit();
            }
            return current;
        } finally {
            counterLock.unlock();
        }
    }

    /**
     * Runs {@code work} while holding the lock stripe of {@code key}, so read-modify-write
     * sequences on the same record cannot interleave. Callers take at most one stripe at a time.
     */
    <T> T withLock(String key, Supplier<T> work) {
        ReentrantLock lock = keyLocks[Math.floorMod(key.hashCode(), keyLocks.length)];
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    void runWithLock(String key, Runnable work) {
        withLock(key, () -> {
            work.run();
            return null;
        });
    }

    /** Applies several counter deltas in one batch, e.g. play count and listened seconds together. */
    void incrementAll(Map<String, Long> deltas) {
        counterLock.lock();
        try (Batch batch = batch()) {
            for (Map.Entry<String, Long> delta : deltas.entrySet()) {
                batch.put(delta.getKey(), Long.toString(readLong(delta.getKey(), 0L) + delta.getValue()));
            }
            batch.commit();
        } finally {
            counterLock.unlock();
        }
    }

    long readLong(String key, long missingValue) {
        Optional<String> raw = getString(key);
        if (raw.isEmpty()) {
            return missingValue;
        }
        try {
            return Long.parseLong(raw.get().trim());
        } catch (NumberFormatException ex) {
            throw new AudiobookStoreException("Counter " + key + " holds a non-numeric value", ex);
        }
    }

    /** Deletes every key. Counters restart at their initial value because missing reads as 1. */
    void clear() {
        counterLock.lock();
        try (Batch batch = batch()) {
            for (String key : allKeys()) {
                batch.delete(key);
            }
            batch.commit();
        } finally {
            counterLock.unlock();
        }
    }

    @Override
    public void close() {
        db.close();
        writeOptions.close();
        options.close();
        log.debug("Closed RocksDB at {}", directory);
    }

    record Entry(String key, byte[] value) {

        String valueAsString() {
            return new String(value, StandardCharsets.UTF_8);
        }
    }

    /**
     * Atomic multi-key mutation. Nothing is visible to readers until {@link #commit()}; closing
     * without committing discards the batch.
     */
    final class Batch implements AutoCloseable {

        private final WriteBatch writeBatch = new WriteBatch();
        private int operations;

        Batch put(String key, byte[] value) {
            try {
                writeBatch.put(KeySpace.bytes(key), value);
            } catch (RocksDBException ex) {
                throw new AudiobookStoreException("Failed to stage write of " + key, ex);
            }
            operations++;
            return this;
        }

        Batch put(String key, String value) {
            return put(key, value.getBytes(StandardCharsets.UTF_8));
        }

        Batch delete(String key) {
            try {
                writeBatch.delete(KeySpace.bytes(key));
            } catch (RocksDBException ex) {
                throw new AudiobookStoreException("Failed to stage delete of " + key, ex);
            }
            operations++;
            return this;
        }

        int size() {
            return operations;
        }

        void commit() {
            if (operations == 0) {
                return;
            }
            try {
                db.write(writeOptions, writeBatch);
            } catch (RocksDBException ex) {
                throw new AudiobookStoreException("Failed to commit batch of " + operations + " operations", ex);
            }
        }

        @Override
        public void close() {
            writeBatch.close();
        }
    }
}
