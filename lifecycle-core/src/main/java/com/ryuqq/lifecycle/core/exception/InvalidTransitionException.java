package com.ryuqq.lifecycle.core.exception;

/**
 * 전이 테이블에 없는 상태 전이 요청.
 *
 * <p>위반한 (from, to) 쌍 또는 (from, action) 쌍을 그대로 담습니다.
 * from이 null이면 이력이 비어 있는 엔티티의 첫 상태 요청입니다.</p>
 *
 * <p>자동 재시도 대상이 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends LifecycleException {

    private final String entityKind;
    private final String from;
    private final String to;
    private final String action;

    private InvalidTransitionException(String entityKind, String from, String to, String action, String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
        this.entityKind = entityKind;
        this.from = from;
        this.to = to;
        this.action = action;
    }

    /**
     * (from, to) 쌍이 허용되지 않은 경우.
     *
     * @param entityKind 엔티티 종류 이름 (예: LESSON)
     * @param from 현재 상태 (이력이 비어 있으면 null)
     * @param to 요청된 상태
     * @return 예외 인스턴스
     */
    public static InvalidTransitionException of(String entityKind, String from, String to) {
        String message = from == null
            ? String.format("Invalid initial status for %s: %s", entityKind, to)
            : String.format("Invalid %s status transition: %s → %s", entityKind, from, to);
        return new InvalidTransitionException(entityKind, from, to, null, message);
    }

    /**
     * 현재 상태에서 사용할 수 없는 액션인 경우.
     *
     * @param entityKind 엔티티 종류 이름
     * @param from 현재 상태 (이력이 비어 있으면 null)
     * @param action 요청된 액션 (예: ACCEPT)
     * @return 예외 인스턴스
     */
    public static InvalidTransitionException ofAction(String entityKind, String from, String action) {
        String message = String.format("Invalid %s status transition '%s' for current status '%s'",
            entityKind, action, from);
        return new InvalidTransitionException(entityKind, from, null, action, message);
    }

    public String getEntityKind() {
        return entityKind;
    }

    /**
     * @return 현재 상태 이름, 이력이 비어 있으면 null
     */
    public String getFrom() {
        return from;
    }

    /**
     * @return 요청된 상태 이름, 액션으로 요청된 경우 null
     */
    public String getTo() {
        return to;
    }

    /**
     * @return 요청된 액션 이름, 상태로 요청된 경우 null
     */
    public String getAction() {
        return action;
    }
}
