/**
 * Record store error types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.recordstore.core.exception.HolderConflictException} - write to a key locked by another holder</li>
 *   <li>{@link com.ryuqq.recordstore.core.exception.NotHolderException} - release of a lock the caller does not hold</li>
 *   <li>{@link com.ryuqq.recordstore.core.exception.LockInterruptedException} - blocked wait interrupted</li>
 * </ul>
 *
 * <p>Timeouts are not errors: {@code acquireLock} and {@code waitForLock} return {@code false}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recordstore.core.exception;
