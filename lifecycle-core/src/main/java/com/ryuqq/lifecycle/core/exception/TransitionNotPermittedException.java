package com.ryuqq.lifecycle.core.exception;

/**
 * 외부 인가 계층이 호출자의 전이 요청을 거부.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransitionNotPermittedException extends LifecycleException {

    public TransitionNotPermittedException(String message) {
        super(ErrorCode.NOT_PERMITTED, message);
    }
}
