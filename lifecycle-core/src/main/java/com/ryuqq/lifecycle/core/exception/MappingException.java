package com.ryuqq.lifecycle.core.exception;

/**
 * 저장된 데이터가 "현재 상태가 존재해야 한다"는 불변식을 위반.
 *
 * <p>손상된 엔티티를 반환하는 대신 읽기 요청 자체가 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MappingException extends LifecycleException {

    public MappingException(String message) {
        super(ErrorCode.MAPPING, message);
    }
}
