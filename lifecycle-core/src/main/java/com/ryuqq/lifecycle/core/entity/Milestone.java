package com.ryuqq.lifecycle.core.entity;

import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.MilestoneStatus;

/**
 * 레슨 플랜의 마일스톤.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Milestone extends LifecycleEntity<MilestoneStatus> {

    private Milestone(EntityState<MilestoneStatus> state) {
        super(EntityKind.MILESTONE, state);
    }

    /**
     * 저장된 상태로 Milestone 복원.
     *
     * @param state 공통 상태
     * @return Milestone 인스턴스
     * @throws IllegalArgumentException 이력이 다른 엔티티의 것이거나 포인터가 최신 레코드가 아닌데 어긋남 표시가 없는 경우
     */
    public static Milestone of(EntityState<MilestoneStatus> state) {
        return new Milestone(state);
    }

    public String getLessonPlanId() {
        return getParentId();
    }
}
