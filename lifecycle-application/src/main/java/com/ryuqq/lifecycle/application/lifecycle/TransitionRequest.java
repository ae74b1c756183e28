package com.ryuqq.lifecycle.application.lifecycle;

import com.ryuqq.lifecycle.application.authorization.Caller;

/**
 * 외부 API 계층에서 들어오는 타입 없는 전이 요청.
 *
 * <p>문자열 값의 검증은 {@link LifecycleService#transition(TransitionRequest)}이 수행합니다.
 * 알 수 없는 종류나 상태, 잘못된 context JSON은
 * {@link com.ryuqq.lifecycle.core.exception.ValidationException}으로 거부됩니다.</p>
 *
 * @param caller 검증된 호출자
 * @param entityKind 엔티티 종류 이름 (예: LESSON)
 * @param ownerId 소유 엔티티 ID
 * @param requestedStatus 요청 상태 이름 (예: ACCEPTED)
 * @param context context JSON 원문 (null 허용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransitionRequest(
    Caller caller,
    String entityKind,
    String ownerId,
    String requestedStatus,
    String context
) {

    public TransitionRequest {
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
    }

    /**
     * context 없는 요청 생성.
     *
     * @param caller 검증된 호출자
     * @param entityKind 엔티티 종류 이름
     * @param ownerId 소유 엔티티 ID
     * @param requestedStatus 요청 상태 이름
     * @return 요청
     */
    public static TransitionRequest of(Caller caller, String entityKind, String ownerId, String requestedStatus) {
        return new TransitionRequest(caller, entityKind, ownerId, requestedStatus, null);
    }
}
