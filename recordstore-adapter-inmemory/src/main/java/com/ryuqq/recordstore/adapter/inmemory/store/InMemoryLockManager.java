package com.ryuqq.recordstore.adapter.inmemory.store;

import com.ryuqq.recordstore.core.exception.HolderConflictException;
import com.ryuqq.recordstore.core.exception.LockInterruptedException;
import com.ryuqq.recordstore.core.exception.NotHolderException;
import com.ryuqq.recordstore.core.model.HolderId;
import com.ryuqq.recordstore.core.model.LockEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory advisory lock manager with per-key blocking waits and lazy expiry.
 *
 * <p>Each locked (or waited-on) key owns a {@link KeyMonitor}: a {@link ReentrantLock} guarding
 * the key's {@link LockEntry}, and a {@link Condition} signalled whenever the entry is removed.
 * Blocked acquirers park on the condition and are woken by a release on any thread, or wake
 * themselves when the current holder's deadline passes.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>monitors:</strong> ConcurrentHashMap&lt;String, KeyMonitor&gt; - one monitor per active key</li>
 * </ul>
 *
 * <p><strong>Monitor Lifecycle:</strong></p>
 * <ul>
 *   <li>Created on first acquire, wait or guarded write for a key</li>
 *   <li>Retired and removed once it has no live entry and no waiters</li>
 *   <li>A thread that locks a retired monitor retries with a fresh lookup</li>
 * </ul>
 *
 * <p><strong>Expiry:</strong> evaluated lazily against {@link System#nanoTime()} whenever a
 * monitor is inspected. {@link #reapExpired(int)} additionally clears expired entries in bulk.</p>
 *
 * <p><strong>Wake-up Policy:</strong> {@code signalAll} on release; waiters race for the lock
 * and at least one makes progress. No FIFO ordering.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryLockManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLockManager.class);

    /**
     * Key: transaction key, Value: monitor guarding that key's lock entry.
     */
    private final ConcurrentHashMap<String, KeyMonitor> monitors;

    /**
     * Creates a lock manager with no locks held.
     */
    public InMemoryLockManager() {
        this.monitors = new ConcurrentHashMap<>();
    }

    /**
     * Acquires the lock for the key.
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Unlocked or expired: a new entry is created for {@code holder}</li>
     *   <li>Held by {@code holder}: returns immediately, deadline unchanged</li>
     *   <li>Held by another holder: waits for release or expiry, bounded by acquireTimeout</li>
     * </ul>
     *
     * @param key the transaction key
     * @param holder the acquiring holder (null for {@link HolderId#DEFAULT})
     * @param holdTimeout maximum hold duration (null or beyond {@link LockEntry#MAX_BOUNDED_DURATION} for never)
     * @param acquireTimeout maximum wait (null or beyond {@link LockEntry#MAX_BOUNDED_DURATION} for indefinitely)
     * @return true if acquired, false if acquireTimeout elapsed
     * @throws LockInterruptedException if interrupted while waiting
     */
    public boolean acquire(String key, HolderId holder, Duration holdTimeout, Duration acquireTimeout) {
        HolderId resolved = HolderId.orDefault(holder);
        boolean timed = !LockEntry.isUnbounded(acquireTimeout);
        long waitDeadline = timed ? System.nanoTime() + acquireTimeout.toNanos() : 0L;

        return withMonitor(key, true, monitor -> {
            monitor.waiters++;
            try {
                while (true) {
                    long now = System.nanoTime();
                    LockEntry live = monitor.liveEntry(now);
                    if (live == null) {
                        monitor.entry = LockEntry.acquire(key, resolved, holdTimeout, now);
                        log.debug("Lock acquired: key={}, holder={}, holdTimeout={}", key, resolved, holdTimeout);
                        return true;
                    }
                    if (live.isHeldBy(resolved)) {
                        return true;
                    }

                    long waitNanos = live.remainingNanos(now);
                    if (timed) {
                        long remaining = waitDeadline - now;
                        if (remaining <= 0) {
                            log.debug("Lock acquire timed out: key={}, holder={}, heldBy={}", key, resolved, live.holder());
                            return false;
                        }
                        waitNanos = Math.min(waitNanos, remaining);
                    }
                    monitor.await(waitNanos);
                }
            } finally {
                monitor.waiters--;
            }
        });
    }

    /**
     * Releases the lock for the key and wakes every waiter on it.
     *
     * @param key the transaction key
     * @param holder the releasing holder (null for {@link HolderId#DEFAULT})
     * @throws NotHolderException if no live lock exists or another holder owns it
     */
    public void release(String key, HolderId holder) {
        HolderId resolved = HolderId.orDefault(holder);

        withMonitor(key, false, monitor -> {
            LockEntry live = monitor == null ? null : monitor.liveEntry(System.nanoTime());
            if (live == null || !live.isHeldBy(resolved)) {
                throw new NotHolderException(key, resolved);
            }
            monitor.entry = null;
            monitor.released.signalAll();
            log.debug("Lock released: key={}, holder={}", key, resolved);
            return null;
        });
    }

    /**
     * @param key the transaction key
     * @return the live entry, or null if unlocked or expired
     */
    public LockEntry current(String key) {
        return withMonitor(key, false, monitor -> monitor == null ? null : monitor.liveEntry(System.nanoTime()));
    }

    /**
     * @param key the transaction key
     * @return true if a live lock exists
     */
    public boolean isLocked(String key) {
        return current(key) != null;
    }

    /**
     * @param key the transaction key
     * @param holder the holder to check (null for {@link HolderId#DEFAULT})
     * @return true if a live lock exists and is held by {@code holder}
     */
    public boolean isHolder(String key, HolderId holder) {
        LockEntry live = current(key);
        return live != null && live.isHeldBy(HolderId.orDefault(holder));
    }

    /**
     * Waits until the key is unlocked, without acquiring it.
     *
     * <p>If another acquirer takes the lock between the release and this thread waking up,
     * the wait continues against the new holder.</p>
     *
     * @param key the transaction key
     * @param timeout maximum wait (null or beyond {@link LockEntry#MAX_BOUNDED_DURATION} for indefinitely)
     * @return true if unlocked, false if the timeout elapsed first
     * @throws LockInterruptedException if interrupted while waiting
     */
    public boolean waitForRelease(String key, Duration timeout) {
        boolean timed = !LockEntry.isUnbounded(timeout);
        long waitDeadline = timed ? System.nanoTime() + timeout.toNanos() : 0L;

        return withMonitor(key, false, monitor -> {
            if (monitor == null) {
                return true;
            }
            monitor.waiters++;
            try {
                while (true) {
                    long now = System.nanoTime();
                    LockEntry live = monitor.liveEntry(now);
                    if (live == null) {
                        return true;
                    }

                    long waitNanos = live.remainingNanos(now);
                    if (timed) {
                        long remaining = waitDeadline - now;
                        if (remaining <= 0) {
                            return false;
                        }
                        waitNanos = Math.min(waitNanos, remaining);
                    }
                    monitor.await(waitNanos);
                }
            } finally {
                monitor.waiters--;
            }
        });
    }

    /**
     * Runs a mutation for the key while holding its monitor, after checking that no other
     * holder owns a live lock.
     *
     * <p>The check and the mutation are atomic with respect to acquisitions of the same key,
     * so a holder that acquired the key never observes a write by someone else.</p>
     *
     * @param key the transaction key
     * @param holder the writing holder (null for {@link HolderId#DEFAULT})
     * @param mutation the mutation to run when permitted
     * @throws HolderConflictException if a live lock is held by a different holder
     */
    public void guardWrite(String key, HolderId holder, Runnable mutation) {
        HolderId resolved = HolderId.orDefault(holder);

        withMonitor(key, true, monitor -> {
            LockEntry live = monitor.liveEntry(System.nanoTime());
            if (live != null && !live.isHeldBy(resolved)) {
                throw new HolderConflictException(key, resolved);
            }
            mutation.run();
            return null;
        });
    }

    /**
     * Removes up to {@code batchSize} expired entries and wakes their waiters.
     *
     * @param batchSize maximum number of entries to remove
     * @return the number of entries removed
     * @throws IllegalArgumentException if batchSize is not positive
     */
    public int reapExpired(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        int reaped = 0;
        for (KeyMonitor monitor : monitors.values()) {
            if (reaped >= batchSize) {
                break;
            }
            monitor.mutex.lock();
            try {
                if (monitor.retired) {
                    continue;
                }
                LockEntry entry = monitor.entry;
                if (entry != null && entry.isExpired(System.nanoTime())) {
                    monitor.entry = null;
                    monitor.released.signalAll();
                    reaped++;
                    log.debug("Reaped expired lock: key={}, holder={}", monitor.key, entry.holder());
                }
            } finally {
                retireIfIdle(monitor);
                monitor.mutex.unlock();
            }
        }
        return reaped;
    }

    /**
     * Returns the number of keys that currently have a monitor.
     *
     * <p>This method is used for test assertions on monitor retirement.</p>
     *
     * @return the number of tracked keys
     */
    public int trackedKeyCount() {
        return monitors.size();
    }

    /**
     * Looks up (or creates) the key's monitor, locks it and applies the action.
     *
     * <p>When {@code create} is false and no monitor exists, the action receives null.
     * A monitor retired between lookup and locking is skipped and the lookup retried.</p>
     */
    private <T> T withMonitor(String key, boolean create, Function<KeyMonitor, T> action) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        while (true) {
            KeyMonitor monitor = create ? monitors.computeIfAbsent(key, KeyMonitor::new) : monitors.get(key);
            if (monitor == null) {
                return action.apply(null);
            }

            monitor.mutex.lock();
            try {
                if (monitor.retired) {
                    continue;
                }
                return action.apply(monitor);
            } finally {
                retireIfIdle(monitor);
                monitor.mutex.unlock();
            }
        }
    }

    /**
     * Removes the monitor from the map once nothing depends on it. Caller holds the mutex.
     */
    private void retireIfIdle(KeyMonitor monitor) {
        if (monitor.retired || monitor.waiters > 0) {
            return;
        }
        if (monitor.liveEntry(System.nanoTime()) == null) {
            monitor.retired = true;
            monitors.remove(monitor.key, monitor);
        }
    }

    /**
     * Per-key mutex, condition and lock entry. All fields are guarded by {@code mutex}.
     */
    private static final class KeyMonitor {

        private final String key;
        private final ReentrantLock mutex = new ReentrantLock();
        private final Condition released = mutex.newCondition();

        private LockEntry entry;
        private int waiters;
        private boolean retired;

        KeyMonitor(String key) {
            this.key = key;
        }

        /**
         * Returns the entry if still live, clearing it (and waking waiters) once expired.
         */
        LockEntry liveEntry(long nowNanos) {
            if (entry != null && entry.isExpired(nowNanos)) {
                log.debug("Lock expired: key={}, holder={}, holdTimeout={}", key, entry.holder(), entry.holdTimeout());
                entry = null;
                released.signalAll();
            }
            return entry;
        }

        /**
         * Parks on the release condition for at most {@code nanos} ({@link Long#MAX_VALUE} for no bound).
         */
        void await(long nanos) {
            try {
                if (nanos == Long.MAX_VALUE) {
                    released.await();
                } else {
                    released.awaitNanos(nanos);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockInterruptedException(key, e);
            }
        }
    }
}
