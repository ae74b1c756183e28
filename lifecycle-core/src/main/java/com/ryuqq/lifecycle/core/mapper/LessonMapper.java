package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.entity.EntityState;
import com.ryuqq.lifecycle.core.entity.Lesson;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LessonStatus;

import java.time.Clock;

/**
 * Lesson 매퍼.
 *
 * <p>레슨은 상태 없이 생성될 수 있으므로, currentStatus가 null이고 이력이 비어 있는 행은
 * 상태가 없는 레슨으로 복원됩니다. 알 수 없는 상태 문자열은 조회 시 REQUESTED로 대체됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LessonMapper extends EntityMapper<LessonStatus, Lesson> {

    public LessonMapper() {
        this(Clock.systemUTC());
    }

    public LessonMapper(Clock clock) {
        super(EntityKind.LESSON, clock);
    }

    @Override
    protected Lesson createEntity(EntityState<LessonStatus> state) {
        return Lesson.of(state);
    }
}
