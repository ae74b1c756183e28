/**
 * In-memory {@link com.ryuqq.lifecycle.core.spi.StatusStore} adapter.
 *
 * <p>Reference implementation used by tests and by hosts that need no durability.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.store;
