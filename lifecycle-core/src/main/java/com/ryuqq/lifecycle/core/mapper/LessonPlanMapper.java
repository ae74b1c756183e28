package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.entity.EntityState;
import com.ryuqq.lifecycle.core.entity.LessonPlan;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LessonPlanStatus;

import java.time.Clock;

/**
 * LessonPlan 매퍼.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LessonPlanMapper extends EntityMapper<LessonPlanStatus, LessonPlan> {

    public LessonPlanMapper() {
        this(Clock.systemUTC());
    }

    public LessonPlanMapper(Clock clock) {
        super(EntityKind.LESSON_PLAN, clock);
    }

    @Override
    protected LessonPlan createEntity(EntityState<LessonPlanStatus> state) {
        return LessonPlan.of(state);
    }
}
