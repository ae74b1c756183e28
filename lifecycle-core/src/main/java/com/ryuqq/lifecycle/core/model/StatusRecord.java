package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 상태 이력의 한 항목.
 *
 * <p>한 번 생성된 레코드는 수정되거나 삭제되지 않습니다. 상태 변경은 항상
 * 새 레코드를 추가하는 방식으로 이루어집니다.</p>
 *
 * <p><strong>유효성 검증 ({@link ValidationException}):</strong></p>
 * <ul>
 *   <li>id, kind, ownerId, status, createdAt 필수</li>
 *   <li>status는 kind의 상태 enum에 속해야 함</li>
 *   <li>새 레코드의 createdAt은 서버 시각보다 미래일 수 없음</li>
 * </ul>
 *
 * <p>저장된 레코드를 복원할 때는 미래 시각도 받아들이고 WARN만 남깁니다.
 * 다른 노드의 시계가 조금 앞서 있거나 NTP로 시계가 되돌려진 경우입니다.</p>
 *
 * @param <S> 상태 enum 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusRecord<S extends Enum<S> & LifecycleStatus> {

    private static final Logger log = LoggerFactory.getLogger(StatusRecord.class);

    private final StatusRecordId id;
    private final EntityKind<S> kind;
    private final OwnerId ownerId;
    private final S status;
    private final StatusContext context;
    private final Instant createdAt;

    private StatusRecord(
        StatusRecordId id,
        EntityKind<S> kind,
        OwnerId ownerId,
        S status,
        StatusContext context,
        Instant createdAt
    ) {
        if (id == null) {
            throw new ValidationException("StatusRecord id cannot be null");
        }
        if (kind == null) {
            throw new ValidationException("StatusRecord kind cannot be null");
        }
        if (ownerId == null) {
            throw new ValidationException("StatusRecord ownerId cannot be null");
        }
        if (status == null) {
            throw new ValidationException("StatusRecord status cannot be null");
        }
        // raw 타입 오용 방어
        if (!kind.statusType().isInstance(status)) {
            throw new ValidationException(
                String.format("Status %s is not a valid %s status", status, kind.name()));
        }
        if (createdAt == null) {
            throw new ValidationException("StatusRecord createdAt cannot be null");
        }
        this.id = id;
        this.kind = kind;
        this.ownerId = ownerId;
        this.status = status;
        this.context = context == null ? StatusContext.empty() : context;
        this.createdAt = createdAt;
    }

    /**
     * 새 레코드 생성 (서버가 ID와 시각 부여).
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param status 상태
     * @param context 첨부 context (null이면 빈 context)
     * @param clock 서버 시계
     * @param <S> 상태 enum 타입
     * @return 새 StatusRecord
     * @throws ValidationException 유효하지 않은 값이거나 시각이 미래인 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> StatusRecord<S> create(
        EntityKind<S> kind, OwnerId ownerId, S status, StatusContext context, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        StatusRecord<S> record =
            new StatusRecord<>(StatusRecordId.generate(), kind, ownerId, status, context, clock.instant());
        Instant now = clock.instant();
        if (record.createdAt.isAfter(now)) {
            throw new ValidationException(
                String.format("StatusRecord createdAt %s is in the future (now: %s)", record.createdAt, now));
        }
        return record;
    }

    /**
     * 저장된 레코드 복원.
     *
     * <p>서버 시각보다 미래인 createdAt은 거부하지 않고 WARN 로그를 남깁니다.</p>
     *
     * @param id 레코드 ID
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param status 상태
     * @param context 첨부 context (null이면 빈 context)
     * @param createdAt 생성 시각
     * @param clock 시계 차이 감지에 쓰는 서버 시계
     * @param <S> 상태 enum 타입
     * @return StatusRecord
     * @throws ValidationException 유효하지 않은 값인 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> StatusRecord<S> of(
        StatusRecordId id,
        EntityKind<S> kind,
        OwnerId ownerId,
        S status,
        StatusContext context,
        Instant createdAt,
        Clock clock
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        StatusRecord<S> record = new StatusRecord<>(id, kind, ownerId, status, context, createdAt);
        Instant now = clock.instant();
        if (createdAt.isAfter(now)) {
            log.warn("Clock skew: stored {} status record {} of {} is {} ahead of server time {}",
                kind, id.getValue(), ownerId.getValue(), Duration.between(now, createdAt), now);
        }
        return record;
    }

    public StatusRecordId getId() {
        return id;
    }

    public EntityKind<S> getKind() {
        return kind;
    }

    public OwnerId getOwnerId() {
        return ownerId;
    }

    public S getStatus() {
        return status;
    }

    public StatusContext getContext() {
        return context;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatusRecord<?> that = (StatusRecord<?>) o;
        return id.equals(that.id)
            && kind == that.kind
            && ownerId.equals(that.ownerId)
            && status == that.status
            && context.equals(that.context)
            && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, ownerId, status, context, createdAt);
    }

    @Override
    public String toString() {
        return "StatusRecord{" +
            "id=" + id.getValue() +
            ", kind=" + kind +
            ", ownerId=" + ownerId.getValue() +
            ", status=" + status +
            ", createdAt=" + createdAt +
            '}';
    }
}
