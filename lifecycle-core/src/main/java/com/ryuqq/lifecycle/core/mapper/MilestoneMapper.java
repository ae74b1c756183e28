package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.entity.EntityState;
import com.ryuqq.lifecycle.core.entity.Milestone;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.MilestoneStatus;

import java.time.Clock;

/**
 * Milestone 매퍼.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MilestoneMapper extends EntityMapper<MilestoneStatus, Milestone> {

    public MilestoneMapper() {
        this(Clock.systemUTC());
    }

    public MilestoneMapper(Clock clock) {
        super(EntityKind.MILESTONE, clock);
    }

    @Override
    protected Milestone createEntity(EntityState<MilestoneStatus> state) {
        return Milestone.of(state);
    }
}
