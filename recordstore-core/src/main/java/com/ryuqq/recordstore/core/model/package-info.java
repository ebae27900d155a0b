/**
 * Core domain model package for the transactional record store.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.recordstore.core.model.HolderId} - Opaque lock holder identity with a fixed default</li>
 *   <li>{@link com.ryuqq.recordstore.core.model.TransactionRecord} - Cached result for a transaction key</li>
 *   <li>{@link com.ryuqq.recordstore.core.model.LockEntry} - Live lock state for a key (holder, optional deadline)</li>
 * </ul>
 *
 * <p>Transaction keys are plain {@link java.lang.String}s compared by exact equality.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recordstore.core.model;
