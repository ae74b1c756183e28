package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.exception.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * 상태 전이 검증.
 *
 * <p>모든 상태 쓰기는 이 클래스의 {@link #validateOrFail}을 통과해야 합니다.
 * 판단 근거는 종류별 {@link TransitionTable} 하나뿐이며, 숨겨진 예외 규칙은 없습니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>current가 null이면 (이력이 비어 있으면) 첫 상태 집합에 속해야 함</li>
 *   <li>그 외에는 (current, requested) 간선이 테이블에 있어야 함</li>
 *   <li>자기 자신으로의 전이는 테이블에 명시된 경우에만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransitionValidator {

    private static final Logger log = LoggerFactory.getLogger(TransitionValidator.class);

    // Utility class - prevent instantiation
    private TransitionValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부.
     *
     * @param kind 엔티티 종류
     * @param current 현재 상태, 이력이 비어 있으면 null
     * @param requested 요청 상태
     * @param <S> 상태 enum 타입
     * @return 허용되면 true
     * @throws IllegalArgumentException kind 또는 requested가 null인 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> boolean canTransition(
        EntityKind<S> kind, S current, S requested) {
        requireKind(kind);
        if (requested == null) {
            throw new IllegalArgumentException("requested status cannot be null");
        }
        return kind.table().allows(current, requested);
    }

    /**
     * 전이 검증.
     *
     * @param kind 엔티티 종류
     * @param current 현재 상태, 이력이 비어 있으면 null
     * @param requested 요청 상태
     * @param <S> 상태 enum 타입
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> void validateOrFail(
        EntityKind<S> kind, S current, S requested) {
        if (!canTransition(kind, current, requested)) {
            log.warn("Rejected {} status transition: {} → {}", kind.name(), current, requested);
            throw InvalidTransitionException.of(
                kind.name(),
                current == null ? null : current.name(),
                requested.name()
            );
        }
    }

    /**
     * 액션 이름을 대상 상태로 변환.
     *
     * @param kind 엔티티 종류
     * @param current 현재 상태, 이력이 비어 있으면 null
     * @param action 액션 이름 (예: ACCEPT)
     * @param <S> 상태 enum 타입
     * @return 대상 상태
     * @throws InvalidTransitionException current에서 사용할 수 없는 액션인 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> S resolveAction(
        EntityKind<S> kind, S current, String action) {
        requireKind(kind);
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        return kind.table().targetOf(current, action.trim()).orElseThrow(() -> {
            log.warn("Rejected {} action {} from {}", kind.name(), action, current);
            return InvalidTransitionException.ofAction(
                kind.name(),
                current == null ? null : current.name(),
                action
            );
        });
    }

    /**
     * 현재 상태에서 도달 가능한 상태.
     *
     * @param kind 엔티티 종류
     * @param current 현재 상태, null이면 첫 상태 집합
     * @param <S> 상태 enum 타입
     * @return 읽기 전용 집합
     */
    public static <S extends Enum<S> & LifecycleStatus> Set<S> nextStatuses(EntityKind<S> kind, S current) {
        requireKind(kind);
        return kind.table().nextStatuses(current);
    }

    /**
     * 현재 상태에서 사용 가능한 액션.
     *
     * @param kind 엔티티 종류
     * @param current 현재 상태
     * @param <S> 상태 enum 타입
     * @return 액션 이름 → 대상 상태
     */
    public static <S extends Enum<S> & LifecycleStatus> Map<String, S> actionsFrom(EntityKind<S> kind, S current) {
        requireKind(kind);
        return kind.table().actionsFrom(current);
    }

    /**
     * 종료 상태 여부.
     *
     * @param kind 엔티티 종류
     * @param status 상태
     * @param <S> 상태 enum 타입
     * @return 나가는 전이가 없으면 true
     */
    public static <S extends Enum<S> & LifecycleStatus> boolean isTerminal(EntityKind<S> kind, S status) {
        requireKind(kind);
        return kind.table().isTerminal(status);
    }

    private static void requireKind(EntityKind<?> kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }
}
