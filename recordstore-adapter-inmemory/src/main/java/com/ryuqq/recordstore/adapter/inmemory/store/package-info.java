/**
 * In-memory record store adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.recordstore.core.spi.RecordStore} SPI for single-process use and tests.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.recordstore.adapter.inmemory.store.InMemoryRecordStore}:
 *       Facade and process-wide instance</li>
 *   <li>{@link com.ryuqq.recordstore.adapter.inmemory.store.InMemoryRecordTable}:
 *       Transaction key → record table</li>
 *   <li>{@link com.ryuqq.recordstore.adapter.inmemory.store.InMemoryLockManager}:
 *       Per-key advisory locks with blocking waits and lazy expiry</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> {@link java.util.concurrent.ConcurrentHashMap} for records,
 *       one {@link java.util.concurrent.locks.ReentrantLock} and
 *       {@link java.util.concurrent.locks.Condition} per active key for locks</li>
 *   <li><strong>No Global Mutex:</strong> unrelated keys never contend</li>
 *   <li><strong>Lazy Expiry:</strong> hold deadlines are checked on access, no background timer</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Locks do not coordinate across processes</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @see com.ryuqq.recordstore.core.spi.RecordStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.recordstore.adapter.inmemory.store;
