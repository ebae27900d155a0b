package com.ryuqq.recordstore.core.spi;

import com.ryuqq.recordstore.core.exception.NotHolderException;
import com.ryuqq.recordstore.core.model.HolderId;

import java.time.Duration;

/**
 * Scoped lock acquisition over a {@link RecordStore}.
 *
 * <p>Opening a scope blocks until the lock is acquired. Closing it releases the lock,
 * so a try-with-resources block guarantees release on normal return, exception and
 * interruption alike.</p>
 *
 * <pre>
 * try (LockScope scope = store.lock(key, holder)) {
 *     TransactionRecord cached = store.read(key);
 *     if (cached == null) {
 *         store.write(key, compute(), scope.holder());
 *     }
 * }
 * </pre>
 *
 * <p>{@link #close()} is idempotent. If the hold timeout elapsed inside the block, closing
 * throws {@link NotHolderException}; when the block itself threw, that failure is attached
 * to the block's exception as suppressed.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LockScope implements AutoCloseable {

    private final RecordStore store;
    private final String key;
    private final HolderId holder;
    private boolean closed;

    private LockScope(RecordStore store, String key, HolderId holder) {
        this.store = store;
        this.key = key;
        this.holder = holder;
    }

    /**
     * Acquires the lock (blocking, no acquire timeout) and opens a scope over it.
     *
     * @param store the store owning the lock
     * @param key the transaction key
     * @param holder the acquiring holder (null for {@link HolderId#DEFAULT})
     * @param holdTimeout maximum hold duration (null for never)
     * @return the open scope
     * @throws IllegalArgumentException if store is null
     */
    public static LockScope open(RecordStore store, String key, HolderId holder, Duration holdTimeout) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        HolderId resolved = HolderId.orDefault(holder);
        if (!store.acquireLock(key, resolved, holdTimeout, null)) {
            // a blocking acquire only returns false if the store breaks its contract
            throw new IllegalStateException("Lock for transaction with key " + key + " was not acquired");
        }
        return new LockScope(store, key, resolved);
    }

    public String key() {
        return key;
    }

    /**
     * The resolved holder of this scope, never null.
     */
    public HolderId holder() {
        return holder;
    }

    /**
     * @return true if this scope's holder still holds a live lock on the key
     */
    public boolean isHeld() {
        return !closed && store.isLockHolder(key, holder);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        store.releaseLock(key, holder);
    }
}
