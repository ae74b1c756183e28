/**
 * Inbound contract of the lifecycle core.
 *
 * <p>{@link com.ryuqq.lifecycle.application.lifecycle.LifecycleService} is the only component
 * allowed to create status records or move current-status pointers.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.application.lifecycle;
