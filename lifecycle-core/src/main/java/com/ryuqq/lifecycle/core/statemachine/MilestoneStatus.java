package com.ryuqq.lifecycle.core.statemachine;

/**
 * 마일스톤 상태.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → IN_PROGRESS (START_PROGRESS), CANCELLED (CANCEL_MILESTONE)</li>
 *   <li>IN_PROGRESS → COMPLETED (MARK_COMPLETED), CANCELLED (CANCEL_MILESTONE), CREATED (RESET_TO_CREATED)</li>
 *   <li>COMPLETED → CANCELLED (CANCEL_MILESTONE)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MilestoneStatus implements LifecycleStatus {

    CREATED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
