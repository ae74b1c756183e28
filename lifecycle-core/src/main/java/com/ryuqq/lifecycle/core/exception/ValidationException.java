package com.ryuqq.lifecycle.core.exception;

/**
 * 잘못된 StatusRecord 입력.
 *
 * <p>알 수 없는 상태 값, 서버 시각보다 미래인 createdAt, 파싱할 수 없는 context JSON,
 * 중복 소유자 ID 등에서 발생합니다. 쓰기는 거부되며 아무것도 저장되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends LifecycleException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
