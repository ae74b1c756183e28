package com.ryuqq.lifecycle.core.statemachine;

/**
 * 레슨 플랜 상태.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>DRAFT → PENDING_APPROVAL (SUBMIT_FOR_APPROVAL), DRAFT → CANCELLED (CANCEL_PLAN)</li>
 *   <li>PENDING_APPROVAL → ACTIVE (APPROVE), REJECTED (REJECT), DRAFT (REVISE), CANCELLED (CANCEL_PLAN)</li>
 *   <li>ACTIVE → COMPLETED (COMPLETE_PLAN), CANCELLED (CANCEL_PLAN)</li>
 *   <li>REJECTED → DRAFT (REVISE), CANCELLED (CANCEL_PLAN)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LessonPlanStatus implements LifecycleStatus {

    DRAFT,
    PENDING_APPROVAL,
    ACTIVE,
    COMPLETED,
    CANCELLED,
    REJECTED
}
