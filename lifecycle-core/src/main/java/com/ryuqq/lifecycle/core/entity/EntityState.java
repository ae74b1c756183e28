package com.ryuqq.lifecycle.core.entity;

import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusHistory;
import com.ryuqq.lifecycle.core.model.StatusRecordId;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;

import java.time.Instant;

/**
 * 엔티티 복원에 필요한 공통 상태 묶음.
 *
 * @param id 엔티티 ID
 * @param parentId 상위 엔티티 ID
 * @param currentStatusId 저장된 현재 상태 포인터 (null 허용)
 * @param statuses 전체 상태 이력
 * @param version 낙관적 잠금 버전
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 * @param pointerDivergent 포인터와 이력이 어긋났는지
 * @param <S> 상태 enum 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EntityState<S extends Enum<S> & LifecycleStatus>(
    OwnerId id,
    String parentId,
    StatusRecordId currentStatusId,
    StatusHistory<S> statuses,
    long version,
    Instant createdAt,
    Instant updatedAt,
    boolean pointerDivergent
) {

    public EntityState {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (parentId == null || parentId.isBlank()) {
            throw new IllegalArgumentException("parentId cannot be null or blank");
        }
        if (statuses == null) {
            throw new IllegalArgumentException("statuses cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
    }
}
