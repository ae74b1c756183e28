/**
 * Error taxonomy of the lifecycle core.
 *
 * <p>Every exception extends {@link com.ryuqq.lifecycle.core.exception.LifecycleException}
 * and carries a stable {@link com.ryuqq.lifecycle.core.exception.ErrorCode} that the
 * external API layer maps to its responses.</p>
 *
 * <h2>Recovery</h2>
 * <ul>
 *   <li><strong>ValidationException:</strong> write rejected, nothing persisted</li>
 *   <li><strong>InvalidTransitionException:</strong> rejected request, not retried</li>
 *   <li><strong>OrderingException:</strong> integration error, fatal to the request</li>
 *   <li><strong>MappingException:</strong> read fails instead of returning a corrupted entity</li>
 *   <li><strong>ConcurrentTransitionException:</strong> caller re-reads and retries</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.exception;
