package com.ryuqq.lifecycle.application.authorization;

/**
 * 검증된 호출자의 역할.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CallerRole {

    STUDENT,
    TEACHER,
    ADMIN,

    /** 스케줄러, 마이그레이션 등 내부 호출. */
    SYSTEM
}
