package com.ryuqq.lifecycle.core.mapper;

import com.ryuqq.lifecycle.core.exception.MappingException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.model.OwnerId;
import com.ryuqq.lifecycle.core.model.StatusContext;
import com.ryuqq.lifecycle.core.model.StatusRecord;
import com.ryuqq.lifecycle.core.model.StatusRecordId;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * {@link StatusRecord}와 {@link PersistedStatusRow} 간 변환.
 *
 * <p><strong>알 수 없는 상태 문자열:</strong></p>
 * <ul>
 *   <li>{@link MappingMode#READ}: WARN 로그 후 종류별 fallback 상태로 대체</li>
 *   <li>{@link MappingMode#WRITE}: {@link MappingException}</li>
 * </ul>
 *
 * <p>context JSON이 손상된 경우 두 모드 모두 원문을 JSON 문자열로 보존합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusRecordMapper {

    private static final Logger log = LoggerFactory.getLogger(StatusRecordMapper.class);

    // Utility class - prevent instantiation
    private StatusRecordMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 레코드를 저장용 행으로 변환.
     *
     * @param record 상태 레코드
     * @return 저장용 행
     */
    public static PersistedStatusRow toRow(StatusRecord<?> record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return new PersistedStatusRow(
            record.getId().getValue(),
            record.getOwnerId().getValue(),
            record.getStatus().name(),
            record.getContext().toJson(),
            record.getCreatedAt()
        );
    }

    /**
     * 저장된 행을 레코드로 변환.
     *
     * @param kind 엔티티 종류
     * @param row 저장된 행
     * @param mode 읽기/쓰기 모드
     * @param clock 시계 차이 감지용 서버 시계
     * @param <S> 상태 enum 타입
     * @return 상태 레코드
     * @throws MappingException 쓰기 모드에서 알 수 없는 상태이거나, 저장된 값이 레코드 규칙을 위반한 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> StatusRecord<S> toDomain(
        EntityKind<S> kind, PersistedStatusRow row, MappingMode mode, Clock clock) {
        if (row == null) {
            throw new MappingException("Status row of " + kind + " cannot be null");
        }
        S status = resolveStatus(kind, row, mode);
        try {
            return StatusRecord.of(
                StatusRecordId.of(row.id()),
                kind,
                OwnerId.of(row.ownerId()),
                status,
                StatusContext.parseLenient(row.context()),
                row.createdAt(),
                clock
            );
        } catch (ValidationException | IllegalArgumentException e) {
            throw new MappingException(String.format(
                "Stored %s status record %s is invalid: %s", kind, row.id(), e.getMessage()));
        }
    }

    private static <S extends Enum<S> & LifecycleStatus> S resolveStatus(
        EntityKind<S> kind, PersistedStatusRow row, MappingMode mode) {
        Optional<S> parsed = kind.parseStatus(row.status());
        if (parsed.isPresent()) {
            return parsed.get();
        }
        if (mode == MappingMode.WRITE) {
            throw new MappingException(String.format(
                "Unknown %s status '%s' in record %s", kind, row.status(), row.id()));
        }
        S fallback = kind.table().fallbackStatus();
        log.warn("Unknown {} status '{}' in record {}, falling back to {}",
            kind, row.status(), row.id(), fallback);
        return fallback;
    }
}
