package com.ryuqq.lifecycle.core.exception;

/**
 * 상태 이력의 시각 역행.
 *
 * <p>새 레코드의 createdAt이 현재 레코드보다 이전인 경우 발생합니다.
 * 프로그래밍/연동 오류로 취급하며 해당 요청만 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OrderingException extends LifecycleException {

    public OrderingException(String message) {
        super(ErrorCode.ORDERING, message);
    }
}
