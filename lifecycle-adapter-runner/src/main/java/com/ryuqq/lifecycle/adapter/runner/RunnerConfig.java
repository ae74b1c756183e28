package com.ryuqq.lifecycle.adapter.runner;

import java.time.Duration;

/**
 * StatusTransitionRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>readRepairStrategy: 조회 시 포인터 어긋남을 발견했을 때의 처리 (기본 REPAIR)</li>
 *   <li>maxClockSkew: 현재 레코드가 서버 시각보다 이만큼 미래여도 전이를 허용 (기본 1초)</li>
 * </ul>
 *
 * <p>허용 범위 안에서는 새 레코드의 시각을 현재 레코드 시각에 맞춰 순서를 지킵니다.
 * 범위를 넘으면 OrderingException으로 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param readRepairStrategy 조회 시 어긋남 처리 전략 (null이 아니어야 함)
 * @param maxClockSkew 허용할 노드 간 시계 차이 (0 이상)
 */
public record RunnerConfig(ReconcileStrategy readRepairStrategy, Duration maxClockSkew) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: readRepairStrategy=REPAIR, maxClockSkew=1초</p>
     */
    public RunnerConfig() {
        this(ReconcileStrategy.REPAIR, Duration.ofSeconds(1));
    }

    public RunnerConfig {
        if (readRepairStrategy == null) {
            throw new IllegalArgumentException("readRepairStrategy cannot be null");
        }
        if (maxClockSkew == null || maxClockSkew.isNegative()) {
            throw new IllegalArgumentException("maxClockSkew must be zero or positive");
        }
    }

    public RunnerConfig withReadRepairStrategy(ReconcileStrategy readRepairStrategy) {
        return new RunnerConfig(readRepairStrategy, maxClockSkew);
    }

    public RunnerConfig withMaxClockSkew(Duration maxClockSkew) {
        return new RunnerConfig(readRepairStrategy, maxClockSkew);
    }
}
