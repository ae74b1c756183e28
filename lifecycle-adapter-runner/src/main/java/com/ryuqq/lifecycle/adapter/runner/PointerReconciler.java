package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.entity.LifecycleEntity;
import com.ryuqq.lifecycle.core.mapper.EntityMapper;
import com.ryuqq.lifecycle.core.mapper.EntityMappers;
import com.ryuqq.lifecycle.core.mapper.PersistedOwnerRow;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusRecordId;
import com.ryuqq.lifecycle.core.spi.StatusStore;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * PointerReconciler 컴포넌트.
 *
 * <p>현재 상태 포인터가 이력의 최신 레코드를 가리키지 않거나, 이력이 있는데 포인터가 비어 있는
 * 엔티티를 찾아 복구합니다.</p>
 *
 * <p><strong>복구 시나리오:</strong></p>
 * <pre>
 * 1. 상태 레코드 INSERT 성공
 * 2. 포인터 UPDATE 전 장애 → 분리된(detached) 레코드 발생
 * 3. PointerReconciler가 주기적 스캔 (예: 5분마다)
 * 4. scanDivergent(kind, batchSize)로 어긋난 엔티티 발견
 * 5. 전략 적용:
 *    - REPAIR: repointCurrentStatus(expected = 관찰한 포인터, new = 이력의 최신 레코드)
 *    - FLAG: WARN 로그만 기록
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>모든 엔티티 종류 스캔</li>
 *   <li>예외 발생 시에도 다음 엔티티 처리 계속</li>
 *   <li>스레드를 만들지 않음 (호스트 스케줄러가 {@link #scan()} 호출)</li>
 * </ul>
 *
 * <p><strong>멱등성:</strong> 포인터 교체는 compare-and-swap이므로 여러 인스턴스가 동시에 실행되어도
 * 한 번만 반영되며, 이미 복구된 엔티티는 다음 스캔에서 조회되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PointerReconciler {

    private static final Logger log = LoggerFactory.getLogger(PointerReconciler.class);
    private final StatusStore store;
    private final ReconcilerConfig config;
    private final EntityMappers mappers;

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param config 설정
     * @param clock 레코드 검증에 쓰는 서버 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PointerReconciler(StatusStore store, ReconcilerConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.config = config;
        this.mappers = EntityMappers.create(clock);
    }

    /**
     * 어긋난 포인터 스캔 및 처리.
     *
     * <p>주기적으로 호출되어야 합니다 (예: @Scheduled). 호출 간격은 호스트가
     * {@link ReconcilerConfig#scanIntervalMs()}로 정하며 이 클래스는 그 값을 읽지 않습니다.</p>
     *
     * @return 복구된 엔티티 수 (FLAG 전략이면 항상 0)
     */
    public int scan() {
        log.info("PointerReconciler scan started with strategy {}", config.strategy());

        int found = 0;
        int repaired = 0;
        for (EntityKind<?> kind : EntityKind.values()) {
            List<PersistedOwnerRow> divergent = store.scanDivergent(kind, config.batchSize());
            found += divergent.size();
            for (PersistedOwnerRow row : divergent) {
                if (tryReconcile(kind, row)) {
                    repaired++;
                }
            }
        }

        log.info("PointerReconciler scan completed: {} repaired out of {} divergent", repaired, found);
        return repaired;
    }

    /**
     * 개별 엔티티 처리 시도.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 엔티티 복구를 방해하지 않습니다.</p>
     *
     * @param kind 엔티티 종류
     * @param row 어긋난 소유자 행
     * @return 포인터를 옮겼으면 true
     */
    private <S extends Enum<S> & LifecycleStatus> boolean tryReconcile(EntityKind<S> kind, PersistedOwnerRow row) {
        try {
            EntityMapper<S, ? extends LifecycleEntity<S>> mapper = mappers.forKind(kind);
            StatusRecordId latest;
            if (row.currentStatusId() == null) {
                // 첫 전이가 포인터 갱신 전에 중단됨
                latest = mapper.findDetachedLatest(row).orElse(null);
            } else {
                LifecycleEntity<S> entity = mapper.toDomain(row);
                latest = entity.isPointerDivergent() ? entity.getStatuses().latestId().orElse(null) : null;
            }
            if (latest == null) {
                return false;
            }

            switch (config.strategy()) {
                case REPAIR -> store.repointCurrentStatus(
                    kind, OwnerId.of(row.id()), row.currentStatusId(), latest.getValue());
                case FLAG -> {
                    log.warn("PointerReconciler flagged {} {}: current status {} is not the latest record {}",
                        kind, row.id(), row.currentStatusId(), latest.getValue());
                    return false;
                }
            }

            log.warn("PointerReconciler repaired {} {}: current status {} → {}",
                kind, row.id(), row.currentStatusId(), latest.getValue());
            return true;

        } catch (Exception e) {
            log.error("Failed to reconcile {} {} in PointerReconciler scan", kind, row.id(), e);
            return false;
        }
    }
}
