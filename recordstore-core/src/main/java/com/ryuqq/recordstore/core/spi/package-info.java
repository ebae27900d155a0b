/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the contract that record store adapters implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.recordstore.core.spi.RecordStore} - Transaction key → result cache with per-key advisory locks</li>
 *   <li>{@link com.ryuqq.recordstore.core.spi.LockScope} - Try-with-resources lock acquisition over any RecordStore</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., recordstore-adapter-inmemory) provide concrete implementations.
 * Durable backings implement the same interface and verify it with the contract tests in
 * recordstore-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> In-memory for tests and single-process use, other backings behind the same contract</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.recordstore.core.spi;
