package com.ryuqq.lifecycle.core.statemachine;

/**
 * 레슨 상태.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>REQUESTED → ACCEPTED (ACCEPT), REQUESTED → REJECTED (REJECT)</li>
 *   <li>ACCEPTED → COMPLETED (COMPLETE), ACCEPTED → VOIDED (VOID)</li>
 *   <li>REJECTED → VOIDED, COMPLETED → VOIDED (VOID)</li>
 * </ul>
 *
 * <p>레슨은 상태 없이 생성될 수 있으며, 첫 상태는 REQUESTED 또는 ACCEPTED만 허용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LessonStatus implements LifecycleStatus {

    /** 학생이 레슨을 요청함. */
    REQUESTED,

    /** 교사가 레슨을 확정함. */
    ACCEPTED,

    /** 교사가 레슨 요청을 거절함. */
    REJECTED,

    /** 레슨 완료. */
    COMPLETED,

    /** 레슨 무효화 (종료 상태). */
    VOIDED
}
