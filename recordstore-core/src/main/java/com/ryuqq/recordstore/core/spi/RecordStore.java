package com.ryuqq.recordstore.core.spi;

import com.ryuqq.recordstore.core.exception.HolderConflictException;
import com.ryuqq.recordstore.core.exception.LockInterruptedException;
import com.ryuqq.recordstore.core.exception.NotHolderException;
import com.ryuqq.recordstore.core.model.HolderId;
import com.ryuqq.recordstore.core.model.LockEntry;
import com.ryuqq.recordstore.core.model.TransactionRecord;

import java.time.Duration;

/**
 * Transactional Record Store SPI.
 *
 * <p>A cache from an opaque transaction key to a previously computed result, combined with an
 * advisory, self-expiring lock per key. Callers producing a result lock the key, check for a
 * prior result, compute if absent, write holder-checked and release. Callers that only want a
 * cached value call {@link #read(String)} or {@link #exists(String)} without locking.</p>
 *
 * <p><strong>Optional Arguments:</strong></p>
 * <ul>
 *   <li>{@code holder == null}: the fixed {@link HolderId#DEFAULT} is substituted</li>
 *   <li>{@code holdTimeout == null}: the lock never self-expires</li>
 *   <li>{@code acquireTimeout == null} / {@code timeout == null}: block indefinitely</li>
 * </ul>
 *
 * <p><strong>Lock Semantics:</strong></p>
 * <ul>
 *   <li>At most one live (non-expired) lock per key</li>
 *   <li>Expired locks are equivalent to no lock (evaluated lazily on every call)</li>
 *   <li>Re-acquisition by the current holder succeeds immediately and keeps the original deadline</li>
 *   <li>Timeouts are reported as {@code false}, never as exceptions, and change no state</li>
 * </ul>
 *
 * <p><strong>Blocking:</strong> only {@code acquireLock} and {@code waitForLock} may block.
 * {@code read}, {@code exists}, {@code isLocked} and {@code isLockHolder} never wait on lock
 * holders; {@code write} and {@code releaseLock} perform a bounded check-then-mutate.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe under arbitrary interleavings of OS-level threads</li>
 *   <li>Blocked acquirers are woken by releases performed on unrelated threads</li>
 *   <li>Failed operations leave no partial mutation</li>
 *   <li>Independent keys should not contend on a single global mutex</li>
 * </ul>
 *
 * <p>{@code AbstractRecordStoreContractTest} in {@code recordstore-testkit} is the executable
 * form of this contract.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RecordStore {

    /**
     * Reads the record stored for the key.
     *
     * @param key the transaction key
     * @return the stored record, or {@code null} if the key was never written
     * @throws IllegalArgumentException if key is null
     */
    TransactionRecord read(String key);

    /**
     * Stores or overwrites the record for the key.
     *
     * <p>Writing an unlocked key always succeeds regardless of the supplied holder.</p>
     *
     * @param key the transaction key
     * @param value the opaque result, stored by reference
     * @param holder the writing holder (null for {@link HolderId#DEFAULT})
     * @throws HolderConflictException if a live lock on the key is held by a different holder
     * @throws IllegalArgumentException if key is null
     */
    void write(String key, Object value, HolderId holder);

    /**
     * Stores or overwrites the record for the key as {@link HolderId#DEFAULT}.
     *
     * @param key the transaction key
     * @param value the opaque result
     * @throws HolderConflictException if a live lock on the key is held by a different holder
     */
    default void write(String key, Object value) {
        write(key, value, null);
    }

    /**
     * Checks whether a record exists for the key.
     *
     * @param key the transaction key
     * @return true if the key has been written
     * @throws IllegalArgumentException if key is null
     */
    boolean exists(String key);

    /**
     * Acquires the lock for the key.
     *
     * @param key the transaction key
     * @param holder the acquiring holder (null for {@link HolderId#DEFAULT})
     * @param holdTimeout maximum hold duration before the lock self-expires (null for never)
     * @param acquireTimeout maximum time to wait for a contended lock (null to wait indefinitely)
     * @return true if the lock is held by {@code holder} on return, false if acquireTimeout elapsed
     * @throws LockInterruptedException if the waiting thread is interrupted
     * @throws IllegalArgumentException if key is null or a duration is negative
     */
    boolean acquireLock(String key, HolderId holder, Duration holdTimeout, Duration acquireTimeout);

    /**
     * Acquires the lock for the key as {@link HolderId#DEFAULT}, waiting indefinitely.
     *
     * @param key the transaction key
     * @return true once acquired
     */
    default boolean acquireLock(String key) {
        return acquireLock(key, null, null, null);
    }

    /**
     * Acquires the lock for the key, waiting indefinitely.
     *
     * @param key the transaction key
     * @param holder the acquiring holder
     * @return true once acquired
     */
    default boolean acquireLock(String key, HolderId holder) {
        return acquireLock(key, holder, null, null);
    }

    /**
     * Acquires a self-expiring lock for the key, waiting indefinitely.
     *
     * @param key the transaction key
     * @param holder the acquiring holder
     * @param holdTimeout maximum hold duration
     * @return true once acquired
     */
    default boolean acquireLock(String key, HolderId holder, Duration holdTimeout) {
        return acquireLock(key, holder, holdTimeout, null);
    }

    /**
     * Releases the lock for the key and wakes blocked acquirers and waiters.
     *
     * @param key the transaction key
     * @param holder the releasing holder (null for {@link HolderId#DEFAULT})
     * @throws NotHolderException if no live lock exists or it belongs to a different holder
     * @throws IllegalArgumentException if key is null
     */
    void releaseLock(String key, HolderId holder);

    /**
     * Releases the lock for the key held by {@link HolderId#DEFAULT}.
     *
     * @param key the transaction key
     * @throws NotHolderException if the default holder does not hold a live lock
     */
    default void releaseLock(String key) {
        releaseLock(key, null);
    }

    /**
     * @param key the transaction key
     * @return true if a live lock exists for the key
     */
    boolean isLocked(String key);

    /**
     * @param key the transaction key
     * @param holder the holder to check (null for {@link HolderId#DEFAULT})
     * @return true if a live lock exists and is held by {@code holder}
     */
    boolean isLockHolder(String key, HolderId holder);

    /**
     * Waits until the key is not locked, without acquiring it.
     *
     * @param key the transaction key
     * @param timeout maximum time to wait (null to wait indefinitely)
     * @return true if the key is (or became) unlocked, false if the timeout elapsed first
     * @throws LockInterruptedException if the waiting thread is interrupted
     */
    boolean waitForLock(String key, Duration timeout);

    /**
     * Waits indefinitely until the key is not locked.
     *
     * @param key the transaction key
     * @return true once unlocked
     */
    default boolean waitForLock(String key) {
        return waitForLock(key, null);
    }

    /**
     * Returns a snapshot of the live lock entry for the key.
     *
     * @param key the transaction key
     * @return the live entry, or {@code null} if the key is unlocked or its lock expired
     */
    LockEntry currentLock(String key);

    /**
     * Acquires the lock as {@link HolderId#DEFAULT} for the span of a try-with-resources block.
     *
     * @param key the transaction key
     * @return the open scope; closing it releases the lock
     */
    default LockScope lock(String key) {
        return LockScope.open(this, key, null, null);
    }

    /**
     * Acquires the lock for the span of a try-with-resources block.
     *
     * @param key the transaction key
     * @param holder the acquiring holder
     * @return the open scope; closing it releases the lock
     */
    default LockScope lock(String key, HolderId holder) {
        return LockScope.open(this, key, holder, null);
    }

    /**
     * Acquires a self-expiring lock for the span of a try-with-resources block.
     *
     * @param key the transaction key
     * @param holder the acquiring holder
     * @param holdTimeout maximum hold duration (null for never)
     * @return the open scope; closing it releases the lock
     */
    default LockScope lock(String key, HolderId holder, Duration holdTimeout) {
        return LockScope.open(this, key, holder, holdTimeout);
    }

    /**
     * Removes expired lock entries and wakes their waiters.
     *
     * <p>Optional: lazy expiry already treats expired entries as absent, so implementations
     * that do not track lock entries in memory may keep this default.</p>
     *
     * @param batchSize maximum number of entries to remove
     * @return the number of entries removed
     * @throws IllegalArgumentException if batchSize is not positive
     */
    default int reapExpiredLocks(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        return 0;
    }
}
