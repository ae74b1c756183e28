package com.ryuqq.lifecycle.adapter.runner;

/**
 * 포인터 어긋남(divergence) 처리 전략.
 *
 * <p>현재 상태 포인터가 이력의 최신 레코드를 가리키지 않을 때 어떻게 처리할지 결정합니다.
 * 어느 전략이든 현재 상태의 기준은 이력입니다.</p>
 *
 * <p><strong>어긋남 발생 시나리오:</strong></p>
 * <pre>
 * 1. 상태 레코드 INSERT 성공
 * 2. 포인터 UPDATE 전 프로세스 중단 (원자적 저장을 지원하지 않는 저장소)
 * 3. 이력의 최신 레코드 ≠ currentStatusId
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 복구 전략.
     *
     * <p>포인터를 이력의 최신 레코드로 옮깁니다 (compare-and-swap).
     * 그 사이 다른 전이가 포인터를 옮겼다면 복구를 건너뜁니다.</p>
     */
    REPAIR,

    /**
     * 표시 전략.
     *
     * <p>WARN 로그만 남기고 저장 데이터는 건드리지 않습니다.
     * 수동 조사가 필요한 환경에서 사용합니다.</p>
     */
    FLAG
}
