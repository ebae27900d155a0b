package com.ryuqq.recordstore.adapter.inmemory.store;

import com.ryuqq.recordstore.core.model.HolderId;
import com.ryuqq.recordstore.core.model.LockEntry;
import com.ryuqq.recordstore.core.model.TransactionRecord;
import com.ryuqq.recordstore.core.spi.RecordStore;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link RecordStore} SPI.
 *
 * <p>Combines an {@link InMemoryRecordTable} with an {@link InMemoryLockManager}. Writes go
 * through {@link InMemoryLockManager#guardWrite} so the holder check and the table update
 * are atomic with respect to lock acquisition on the same key.</p>
 *
 * <p><strong>Process-wide Instance:</strong></p>
 * <ul>
 *   <li>{@link #getInstance()} creates the store on first call and returns the same instance afterwards</li>
 *   <li>Internal tables are never re-initialized by later calls</li>
 *   <li>{@link #resetInstance()} discards the shared instance; test use only</li>
 *   <li>Components receive the store by constructor injection rather than calling {@code getInstance()} themselves</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Locks are advisory and scoped to this process</li>
 *   <li>Data lost on process restart</li>
 *   <li>No eviction: records live until overwritten</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordStore store = InMemoryRecordStore.getInstance();
 * HolderId holder = HolderId.of("worker-1");
 *
 * try (LockScope scope = store.lock(key, holder, Duration.ofMinutes(5))) {
 *     TransactionRecord cached = store.read(key);
 *     if (cached == null) {
 *         store.write(key, compute(), holder);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryRecordStore implements RecordStore {

    private static final AtomicReference<InMemoryRecordStore> INSTANCE = new AtomicReference<>();

    private final InMemoryRecordTable records;
    private final InMemoryLockManager locks;

    private InMemoryRecordStore() {
        this.records = new InMemoryRecordTable();
        this.locks = new InMemoryLockManager();
    }

    /**
     * Returns the process-wide store, creating it on first access.
     *
     * <p>Concurrent first calls agree on a single instance.</p>
     *
     * @return the shared store
     */
    public static InMemoryRecordStore getInstance() {
        InMemoryRecordStore current = INSTANCE.get();
        if (current != null) {
            return current;
        }
        InMemoryRecordStore created = new InMemoryRecordStore();
        return INSTANCE.compareAndSet(null, created) ? created : INSTANCE.get();
    }

    /**
     * Discards the shared store so the next {@link #getInstance()} creates a fresh one.
     *
     * <p>This method is used for test isolation. Production code never calls it.</p>
     */
    public static void resetInstance() {
        INSTANCE.set(null);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public TransactionRecord read(String key) {
        requireKey(key);
        return records.get(key);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Holder check and table update run under the key's monitor</li>
     *   <li>Unlocked keys are written without acquiring a lock</li>
     *   <li>A rejected write leaves the table unchanged</li>
     * </ul>
     */
    @Override
    public void write(String key, Object value, HolderId holder) {
        requireKey(key);
        locks.guardWrite(key, holder, () -> records.put(key, value));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean exists(String key) {
        requireKey(key);
        return records.contains(key);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Re-acquisition by the current holder keeps the original hold deadline; the
     * {@code holdTimeout} of the repeated call is ignored.</p>
     */
    @Override
    public boolean acquireLock(String key, HolderId holder, Duration holdTimeout, Duration acquireTimeout) {
        requireKey(key);
        requireNonNegative(holdTimeout, "holdTimeout");
        requireNonNegative(acquireTimeout, "acquireTimeout");
        return locks.acquire(key, holder, holdTimeout, acquireTimeout);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void releaseLock(String key, HolderId holder) {
        requireKey(key);
        locks.release(key, holder);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean isLocked(String key) {
        requireKey(key);
        return locks.isLocked(key);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean isLockHolder(String key, HolderId holder) {
        requireKey(key);
        return locks.isHolder(key, holder);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean waitForLock(String key, Duration timeout) {
        requireKey(key);
        requireNonNegative(timeout, "timeout");
        return locks.waitForRelease(key, timeout);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public LockEntry currentLock(String key) {
        requireKey(key);
        return locks.current(key);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int reapExpiredLocks(int batchSize) {
        return locks.reapExpired(batchSize);
    }

    /**
     * Returns the number of stored records.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return the number of records
     */
    public int recordCount() {
        return records.size();
    }

    /**
     * Returns the number of keys with lock bookkeeping in memory.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return the number of tracked keys
     */
    public int trackedLockCount() {
        return locks.trackedKeyCount();
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void requireNonNegative(Duration duration, String name) {
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, but was: " + duration);
        }
    }
}
