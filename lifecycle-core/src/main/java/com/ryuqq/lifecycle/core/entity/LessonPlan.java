package com.ryuqq.lifecycle.core.entity;

import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LessonPlanStatus;

/**
 * 레슨 플랜. 교사가 작성하고 학생 승인을 거쳐 활성화됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LessonPlan extends LifecycleEntity<LessonPlanStatus> {

    private LessonPlan(EntityState<LessonPlanStatus> state) {
        super(EntityKind.LESSON_PLAN, state);
    }

    /**
     * 저장된 상태로 LessonPlan 복원.
     *
     * @param state 공통 상태
     * @return LessonPlan 인스턴스
     * @throws IllegalArgumentException 이력이 다른 엔티티의 것이거나 포인터가 최신 레코드가 아닌데 어긋남 표시가 없는 경우
     */
    public static LessonPlan of(EntityState<LessonPlanStatus> state) {
        return new LessonPlan(state);
    }

    public String getLessonId() {
        return getParentId();
    }
}
