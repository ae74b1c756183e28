package com.ryuqq.lifecycle.adapter.runner;

/**
 * PointerReconciler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 호스트 스케줄러가 사용할 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 종류별로 한 번에 처리할 엔티티 수 (기본 100)</li>
 *   <li>strategy: 어긋남 처리 전략 (기본 REPAIR)</li>
 * </ul>
 *
 * <p>scanIntervalMs는 {@link PointerReconciler}가 읽지 않습니다. 라이브러리는 스레드를 만들지 않으므로
 * 호스트 스케줄러가 이 값을 {@link PointerReconciler#scan()} 호출 간격으로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 호스트 스케줄러용 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param strategy 어긋남 처리 전략 (null이 아니어야 함)
 */
public record ReconcilerConfig(
    long scanIntervalMs,
    int batchSize,
    ReconcileStrategy strategy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=300000ms (5분), batchSize=100, strategy=REPAIR</p>
     */
    public ReconcilerConfig() {
        this(300000, 100, ReconcileStrategy.REPAIR);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReconcilerConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
    }

    public ReconcilerConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReconcilerConfig(scanIntervalMs, batchSize, strategy);
    }

    public ReconcilerConfig withBatchSize(int batchSize) {
        return new ReconcilerConfig(scanIntervalMs, batchSize, strategy);
    }

    public ReconcilerConfig withStrategy(ReconcileStrategy strategy) {
        return new ReconcilerConfig(scanIntervalMs, batchSize, strategy);
    }
}
