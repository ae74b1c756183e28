package com.ryuqq.lifecycle.core.statemachine;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 상태 이력을 가지는 엔티티 종류.
 *
 * <p>종류마다 상태 enum 타입과 {@link TransitionTable}이 고정됩니다.
 * 타입 파라미터 덕분에 레슨 상태를 목표 이력에 넣는 식의 오용은 컴파일 시점에 차단됩니다.</p>
 *
 * <p><strong>종류:</strong></p>
 * <ul>
 *   <li>LESSON: {@link LessonStatus}</li>
 *   <li>LESSON_PLAN: {@link LessonPlanStatus}</li>
 *   <li>MILESTONE: {@link MilestoneStatus}</li>
 *   <li>GOAL: {@link GoalStatus}</li>
 * </ul>
 *
 * @param <S> 상태 enum 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EntityKind<S extends Enum<S> & LifecycleStatus> {

    public static final EntityKind<LessonStatus> LESSON =
        new EntityKind<>("LESSON", LessonStatus.class, TransitionTables.LESSON);

    public static final EntityKind<LessonPlanStatus> LESSON_PLAN =
        new EntityKind<>("LESSON_PLAN", LessonPlanStatus.class, TransitionTables.LESSON_PLAN);

    public static final EntityKind<MilestoneStatus> MILESTONE =
        new EntityKind<>("MILESTONE", MilestoneStatus.class, TransitionTables.MILESTONE);

    public static final EntityKind<GoalStatus> GOAL =
        new EntityKind<>("GOAL", GoalStatus.class, TransitionTables.GOAL);

    private static final List<EntityKind<?>> VALUES =
        Collections.unmodifiableList(Arrays.asList(LESSON, LESSON_PLAN, MILESTONE, GOAL));

    private final String name;
    private final Class<S> statusType;
    private final TransitionTable<S> table;

    private EntityKind(String name, Class<S> statusType, TransitionTable<S> table) {
        this.name = name;
        this.statusType = statusType;
        this.table = table;
    }

    /**
     * 모든 엔티티 종류 (선언 순서).
     *
     * @return 읽기 전용 목록
     */
    public static List<EntityKind<?>> values() {
        return VALUES;
    }

    /**
     * 이름으로 엔티티 종류 조회.
     *
     * @param name 종류 이름 (대소문자 무시, 예: "lesson_plan")
     * @return 엔티티 종류, 알 수 없는 이름이면 empty
     */
    public static Optional<EntityKind<?>> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EntityKind<?> kind : VALUES) {
            if (kind.name.equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * 저장된 상태 문자열을 이 종류의 상태로 변환.
     *
     * @param raw 저장된 상태 문자열
     * @return 상태, 이 종류의 상태가 아니면 empty
     */
    public Optional<S> parseStatus(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (S status : statusType.getEnumConstants()) {
            if (status.name().equals(raw)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * 임의 객체가 이 종류의 상태인지 확인 후 캐스팅.
     *
     * @param value 검사할 값
     * @return 상태
     * @throws IllegalArgumentException 이 종류의 상태가 아닌 경우
     */
    public S castStatus(Object value) {
        if (!statusType.isInstance(value)) {
            throw new IllegalArgumentException(
                String.format("%s is not a %s status", value, name));
        }
        return statusType.cast(value);
    }

    public String name() {
        return name;
    }

    public Class<S> statusType() {
        return statusType;
    }

    public TransitionTable<S> table() {
        return table;
    }

    @Override
    public String toString() {
        return name;
    }
}
