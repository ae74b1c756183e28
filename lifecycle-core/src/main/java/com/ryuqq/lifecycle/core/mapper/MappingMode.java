package com.ryuqq.lifecycle.core.mapper;

/**
 * 매핑 경로.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MappingMode {

    /** 조회 경로. 알 수 없는 상태는 fallback으로 대체. */
    READ,

    /** 쓰기 경로. 알 수 없는 상태는 실패. */
    WRITE
}
