/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the persistence port that infrastructure adapters implement
 * for the lifecycle core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.StatusStore} - Owner rows, status history and pointer compare-and-swap</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., lifecycle-adapter-inmemory) provide the concrete implementations.
 * The testkit module ships contract tests every adapter should extend.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.spi;
