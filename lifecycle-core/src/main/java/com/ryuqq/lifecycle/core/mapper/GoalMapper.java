package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.entity.EntityState;
import com.ryuqq.lifecycle.core.entity.Goal;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.GoalStatus;

import java.time.Clock;

/**
 * Goal 매퍼. 목표는 항상 현재 상태를 가져야 합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GoalMapper extends EntityMapper<GoalStatus, Goal> {

    public GoalMapper() {
        this(Clock.systemUTC());
    }

    public GoalMapper(Clock clock) {
        super(EntityKind.GOAL, clock);
    }

    @Override
    protected Goal createEntity(EntityState<GoalStatus> state) {
        return Goal.of(state);
    }
}
