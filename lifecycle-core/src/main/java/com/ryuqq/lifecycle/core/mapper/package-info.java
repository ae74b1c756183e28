/**
 * Mapping between persisted owner/status rows and domain entities.
 *
 * <p>Read paths are lenient about unknown status strings and malformed context JSON (logged at
 * WARN) but strict about the current-status invariant. Write paths are strict about both.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.mapper;
