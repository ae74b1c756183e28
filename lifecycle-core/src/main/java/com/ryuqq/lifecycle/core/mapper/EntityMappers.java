package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.entity.LifecycleEntity;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 엔티티 종류별 매퍼 레지스트리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EntityMappers {

    private final Map<EntityKind<?>, EntityMapper<?, ?>> mappers;

    private EntityMappers(Clock clock) {
        Map<EntityKind<?>, EntityMapper<?, ?>> registry = new LinkedHashMap<>();
        registry.put(EntityKind.LESSON, new LessonMapper(clock));
        registry.put(EntityKind.LESSON_PLAN, new LessonPlanMapper(clock));
        registry.put(EntityKind.MILESTONE, new MilestoneMapper(clock));
        registry.put(EntityKind.GOAL, new GoalMapper(clock));
        this.mappers = Map.copyOf(registry);
    }

    /**
     * 주어진 시계를 쓰는 레지스트리 생성.
     *
     * @param clock 복원 시 시계 차이 감지에 쓰는 서버 시계
     * @return 레지스트리
     */
    public static EntityMappers create(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new EntityMappers(clock);
    }

    /**
     * 시스템 UTC 시계를 쓰는 레지스트리 생성.
     *
     * @return 레지스트리
     */
    public static EntityMappers create() {
        return create(Clock.systemUTC());
    }

    /**
     * 종류별 매퍼 조회.
     *
     * <p>등록 시 종류와 매퍼의 상태 타입이 짝지어지므로 캐스트는 안전합니다.</p>
     *
     * @param kind 엔티티 종류
     * @param <S> 상태 enum 타입
     * @return 매퍼
     */
    public <S extends Enum<S> & LifecycleStatus> EntityMapper<S, ? extends LifecycleEntity<S>> forKind(EntityKind<S> kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        EntityMapper<?, ?> mapper = mappers.get(kind);
        if (mapper == null) {
            throw new IllegalArgumentException("No mapper registered for " + kind);
        }
        return (EntityMapper<S, ? extends LifecycleEntity<S>>) mapper;
    }
}
