package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.entity.EntityState;
import com.ryuqq.lifecycle.core.entity.LifecycleEntity;
import com.ryuqq.lifecycle.core.exception.MappingException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusHistory;
import com.ryuqq.lifecycle.core.model.StatusRecord;
import com.ryuqq.lifecycle.core.model.StatusRecordId;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 저장된 소유자 행을 도메인 엔티티로 변환하는 매퍼의 공통 구현.
 *
 * <p>"현재 상태가 반드시 존재해야 한다"는 불변식을 위반한 데이터는
 * 손상된 엔티티로 반환하지 않고 {@link MappingException}으로 실패합니다.
 * 입력 행은 변경하지 않으며 I/O를 수행하지 않습니다.</p>
 *
 * <p><strong>실패 조건 ({@link MappingException}):</strong></p>
 * <ul>
 *   <li>행의 종류가 매퍼의 종류와 다름</li>
 *   <li>이력이 있는데 currentStatus가 null</li>
 *   <li>첫 상태가 필수인 종류인데 currentStatus가 null이고 이력도 비어 있음</li>
 *   <li>currentStatusId가 있지만 currentStatus가 조회되지 않았거나 ID가 다름</li>
 *   <li>currentStatus의 ownerId가 엔티티 ID와 다르거나 이력에 없음</li>
 * </ul>
 *
 * <p><strong>경고 후 계속 (WARN):</strong></p>
 * <ul>
 *   <li>알 수 없는 상태 문자열 (읽기 경로만, fallback 상태로 대체)</li>
 *   <li>손상된 context JSON (원문을 문자열로 보존)</li>
 *   <li>포인터가 최신 레코드가 아님 (엔티티에 어긋남 표시, 현재 상태는 이력 기준)</li>
 * </ul>
 *
 * @param <S> 상태 enum 타입
 * @param <E> 엔티티 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class EntityMapper<S extends Enum<S> & LifecycleStatus, E extends LifecycleEntity<S>> {

    private static final Logger log = LoggerFactory.getLogger(EntityMapper.class);

    private final EntityKind<S> kind;
    private final Clock clock;

    protected EntityMapper(EntityKind<S> kind, Clock clock) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.kind = kind;
        this.clock = clock;
    }

    /**
     * 조회 경로 매핑.
     *
     * @param row 저장된 소유자 행
     * @return 도메인 엔티티
     * @throws MappingException 저장 데이터가 불변식을 위반한 경우
     */
    public E toDomain(PersistedOwnerRow row) {
        return map(row, MappingMode.READ);
    }

    /**
     * 쓰기 경로 매핑. 알 수 없는 상태 문자열도 실패로 처리합니다.
     *
     * @param row 저장된 소유자 행
     * @return 도메인 엔티티
     * @throws MappingException 저장 데이터가 불변식을 위반했거나 알 수 없는 상태가 있는 경우
     */
    public E toDomainForWrite(PersistedOwnerRow row) {
        return map(row, MappingMode.WRITE);
    }

    /**
     * 엔티티를 저장용 행으로 변환.
     *
     * @param entity 도메인 엔티티
     * @return 저장용 소유자 행
     */
    public PersistedOwnerRow toPersisted(E entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        List<PersistedStatusRow> rows = new ArrayList<>(entity.getStatuses().size());
        for (StatusRecord<S> record : entity.getStatuses()) {
            rows.add(StatusRecordMapper.toRow(record));
        }
        StatusRecordId pointer = entity.getCurrentStatusId().orElse(null);
        PersistedStatusRow currentRow = pointer == null
            ? null
            : entity.getStatuses().find(pointer).map(StatusRecordMapper::toRow).orElse(null);
        return new PersistedOwnerRow(
            kind.name(),
            entity.getId().getValue(),
            entity.getParentId(),
            pointer == null ? null : pointer.getValue(),
            currentRow,
            rows,
            entity.getVersion(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    /**
     * 포인터 없이 이력만 남은 행의 복구 대상 레코드.
     *
     * <p>첫 전이가 레코드 저장 후 포인터 갱신 전에 중단된 경우입니다.
     * {@link #toDomain(PersistedOwnerRow)}는 이런 행을 실패로 처리하므로,
     * 복구 경로는 이 메서드로 최신 레코드(createdAt 기준, 같으면 나중에 저장된 것)를 찾습니다.</p>
     *
     * @param row 저장된 소유자 행
     * @return 포인터가 비어 있고 이력이 있으면 최신 레코드 ID, 아니면 empty
     * @throws MappingException 종류가 다르거나 이력이 손상된 경우
     */
    public Optional<StatusRecordId> findDetachedLatest(PersistedOwnerRow row) {
        requireKind(row);
        if (row.currentStatusId() != null || row.statuses().isEmpty()) {
            return Optional.empty();
        }
        return toHistory(toOwnerId(row), row, MappingMode.READ).latestId();
    }

    public EntityKind<S> getKind() {
        return kind;
    }

    /**
     * 종류별 엔티티 생성.
     *
     * @param state 검증을 마친 공통 상태
     * @return 엔티티
     */
    protected abstract E createEntity(EntityState<S> state);

    private E map(PersistedOwnerRow row, MappingMode mode) {
        requireKind(row);
        OwnerId ownerId = toOwnerId(row);
        StatusHistory<S> history = toHistory(ownerId, row, mode);
        PersistedStatusRow current = row.currentStatus();

        if (current == null) {
            if (!history.isEmpty()) {
                throw new MappingException(String.format(
                    "%s %s has %d status records but no current status", kind, row.id(), history.size()));
            }
            if (kind.table().requiresInitialStatus()) {
                throw new MappingException(String.format(
                    "%s %s has no current status", kind, row.id()));
            }
            if (row.currentStatusId() != null) {
                throw new MappingException(String.format(
                    "%s %s current status %s could not be resolved", kind, row.id(), row.currentStatusId()));
            }
            return restore(row, ownerId, null, history, false);
        }

        if (!current.id().equals(row.currentStatusId())) {
            throw new MappingException(String.format(
                "%s %s current status pointer %s does not match resolved status %s",
                kind, row.id(), row.currentStatusId(), current.id()));
        }
        if (!current.ownerId().equals(row.id())) {
            throw new MappingException(String.format(
                "%s %s current status %s belongs to owner %s",
                kind, row.id(), current.id(), current.ownerId()));
        }
        StatusRecordId pointer = StatusRecordId.of(current.id());
        if (history.find(pointer).isEmpty()) {
            throw new MappingException(String.format(
                "%s %s current status %s is not part of its status history", kind, row.id(), current.id()));
        }

        boolean divergent = !history.latestId().map(pointer::equals).orElse(false);
        if (divergent) {
            log.warn("Data integrity: {} {} current status pointer {} is not the latest record {}, using history",
                kind, row.id(), pointer.getValue(), history.latestId().map(StatusRecordId::getValue).orElse(null));
        }
        return restore(row, ownerId, pointer, history, divergent);
    }

    private void requireKind(PersistedOwnerRow row) {
        if (row == null) {
            throw new IllegalArgumentException("row cannot be null");
        }
        if (!kind.name().equals(row.kind())) {
            throw new MappingException(String.format(
                "Row %s is a %s, not a %s", row.id(), row.kind(), kind));
        }
    }

    private E restore(
        PersistedOwnerRow row,
        OwnerId ownerId,
        StatusRecordId pointer,
        StatusHistory<S> history,
        boolean divergent
    ) {
        try {
            return createEntity(new EntityState<>(
                ownerId, row.parentId(), pointer, history, row.version(), row.createdAt(), row.updatedAt(), divergent));
        } catch (IllegalArgumentException e) {
            throw new MappingException(String.format("%s %s cannot be restored: %s", kind, row.id(), e.getMessage()));
        }
    }

    private OwnerId toOwnerId(PersistedOwnerRow row) {
        try {
            return OwnerId.of(row.id());
        } catch (IllegalArgumentException e) {
            throw new MappingException(String.format("%s id '%s' is invalid: %s", kind, row.id(), e.getMessage()));
        }
    }

    private StatusHistory<S> toHistory(OwnerId ownerId, PersistedOwnerRow row, MappingMode mode) {
        List<StatusRecord<S>> records = new ArrayList<>(row.statuses().size());
        for (PersistedStatusRow statusRow : row.statuses()) {
            if (!statusRow.ownerId().equals(row.id())) {
                throw new MappingException(String.format(
                    "%s %s status history contains record %s of owner %s",
                    kind, row.id(), statusRow.id(), statusRow.ownerId()));
            }
            records.add(StatusRecordMapper.toDomain(kind, statusRow, mode, clock));
        }
        try {
            return StatusHistory.of(kind, ownerId, records);
        } catch (ValidationException e) {
            throw new MappingException(String.format(
                "%s %s status history is invalid: %s", kind, row.id(), e.getMessage()));
        }
    }
}
