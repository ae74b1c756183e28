package com.ryuqq.lifecycle.core.entity;

import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.GoalStatus;

/**
 * 레슨의 학습 목표.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Goal extends LifecycleEntity<GoalStatus> {

    private Goal(EntityState<GoalStatus> state) {
        super(EntityKind.GOAL, state);
    }

    /**
     * 저장된 상태로 Goal 복원.
     *
     * @param state 공통 상태
     * @return Goal 인스턴스
     * @throws IllegalArgumentException 이력이 다른 엔티티의 것이거나 포인터가 최신 레코드가 아닌데 어긋남 표시가 없는 경우
     */
    public static Goal of(EntityState<GoalStatus> state) {
        return new Goal(state);
    }

    public String getLessonId() {
        return getParentId();
    }
}
