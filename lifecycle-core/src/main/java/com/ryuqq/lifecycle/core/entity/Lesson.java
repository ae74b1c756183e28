package com.ryuqq.lifecycle.core.entity;

import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LessonStatus;

/**
 * 레슨. 확정된 견적에서 만들어지며 요청, 확정, 완료, 무효화 상태를 거칩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Lesson extends LifecycleEntity<LessonStatus> {

    private Lesson(EntityState<LessonStatus> state) {
        super(EntityKind.LESSON, state);
    }

    /**
     * 저장된 상태로 Lesson 복원.
     *
     * @param state 공통 상태
     * @return Lesson 인스턴스
     * @throws IllegalArgumentException 이력이 다른 엔티티의 것이거나 포인터가 최신 레코드가 아닌데 어긋남 표시가 없는 경우
     */
    public static Lesson of(EntityState<LessonStatus> state) {
        return new Lesson(state);
    }

    public String getQuoteId() {
        return getParentId();
    }
}
