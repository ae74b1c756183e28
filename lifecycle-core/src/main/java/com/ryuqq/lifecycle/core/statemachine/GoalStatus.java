package com.ryuqq.lifecycle.core.statemachine;

/**
 * 학습 목표 상태.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → IN_PROGRESS (START), ABANDONED (ABANDON)</li>
 *   <li>IN_PROGRESS → ACHIEVED (COMPLETE), ABANDONED (ABANDON)</li>
 *   <li>ACHIEVED → ABANDONED (ABANDON)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum GoalStatus implements LifecycleStatus {

    CREATED {
        @Override
        public String displayLabel() {
            return "Ready to Start";
        }
    },
    IN_PROGRESS,
    ACHIEVED,
    ABANDONED
}
