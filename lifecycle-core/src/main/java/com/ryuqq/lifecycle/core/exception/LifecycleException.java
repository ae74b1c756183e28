package com.ryuqq.lifecycle.core.exception;

/**
 * 상태 생명주기 코어의 모든 예외의 상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}를 가지며, API 계층은
 * {@link #getErrorCode()}만으로 응답을 결정할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class LifecycleException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LifecycleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LifecycleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
