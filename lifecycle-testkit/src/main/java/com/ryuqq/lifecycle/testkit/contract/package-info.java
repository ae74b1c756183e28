/**
 * Contract tests and fixtures for {@link com.ryuqq.lifecycle.core.spi.StatusStore} adapters.
 *
 * <p>Adapters extend {@link com.ryuqq.lifecycle.testkit.contract.AbstractStatusStoreContractTest}
 * from their own test sources.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.testkit.contract;
