package com.ryuqq.lifecycle.core.entity;

import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusHistory;
import com.ryuqq.lifecycle.core.model.StatusRecord;
import com.ryuqq.lifecycle.core.model.StatusRecordId;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 상태 이력을 소유하는 도메인 엔티티의 공통 상위 타입.
 *
 * <p>현재 상태는 항상 {@link StatusHistory}에서 계산됩니다. 저장된 currentStatusId 포인터는
 * 조회 최적화 용도이며, 이력과 어긋난 경우 {@link #isPointerDivergent()}가 true입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>이력의 kind와 ownerId는 엔티티의 kind, id와 같음</li>
 *   <li>어긋나지 않은 엔티티의 currentStatusId는 이력의 최신 레코드 ID와 같음</li>
 * </ul>
 *
 * @param <S> 상태 enum 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class LifecycleEntity<S extends Enum<S> & LifecycleStatus> {

    private final EntityKind<S> kind;
    private final OwnerId id;
    private final String parentId;
    private final StatusRecordId currentStatusId;
    private final StatusHistory<S> statuses;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final boolean pointerDivergent;

    protected LifecycleEntity(EntityKind<S> kind, EntityState<S> state) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state.statuses().getKind() != kind || !state.statuses().getOwnerId().equals(state.id())) {
            throw new IllegalArgumentException(String.format(
                "History of %s %s cannot be attached to %s %s",
                state.statuses().getKind(), state.statuses().getOwnerId().getValue(), kind, state.id().getValue()));
        }
        if (!state.pointerDivergent()
            && !Objects.equals(state.currentStatusId(), state.statuses().latestId().orElse(null))) {
            throw new IllegalArgumentException(String.format(
                "currentStatusId %s does not reference the latest status of %s %s",
                state.currentStatusId(), kind, state.id().getValue()));
        }
        this.kind = kind;
        this.id = state.id();
        this.parentId = state.parentId();
        this.currentStatusId = state.currentStatusId();
        this.statuses = state.statuses();
        this.version = state.version();
        this.createdAt = state.createdAt();
        this.updatedAt = state.updatedAt();
        this.pointerDivergent = state.pointerDivergent();
    }

    public EntityKind<S> getKind() {
        return kind;
    }

    public OwnerId getId() {
        return id;
    }

    /**
     * 상위 엔티티 참조 (레슨은 견적, 레슨 플랜과 목표는 레슨, 마일스톤은 레슨 플랜).
     *
     * @return 상위 엔티티 ID
     */
    public String getParentId() {
        return parentId;
    }

    /**
     * 저장된 현재 상태 포인터.
     *
     * @return 포인터, 상태 없이 생성된 엔티티이면 empty
     */
    public Optional<StatusRecordId> getCurrentStatusId() {
        return Optional.ofNullable(currentStatusId);
    }

    /**
     * 현재 상태 레코드 (이력의 최신 레코드).
     *
     * @return 현재 레코드, 이력이 비어 있으면 empty
     */
    public Optional<StatusRecord<S>> currentRecord() {
        return statuses.current();
    }

    /**
     * 현재 상태.
     *
     * @return 현재 상태, 이력이 비어 있으면 empty
     */
    public Optional<S> currentStatus() {
        return statuses.currentStatus();
    }

    public StatusHistory<S> getStatuses() {
        return statuses;
    }

    /**
     * 낙관적 잠금 버전. 포인터가 바뀔 때마다 증가합니다.
     *
     * @return 버전
     */
    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 저장된 포인터가 이력의 최신 레코드를 가리키지 않는지.
     *
     * @return 포인터와 이력이 어긋났으면 true
     */
    public boolean isPointerDivergent() {
        return pointerDivergent;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
            "id=" + id.getValue() +
            ", parentId=" + parentId +
            ", currentStatus=" + currentStatus().map(Enum::name).orElse("none") +
            ", statuses=" + statuses.size() +
            ", version=" + version +
            (pointerDivergent ? ", pointerDivergent" : "") +
            '}';
    }
}
