package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.exception.OrderingException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.statemachine.EntityKind;
import com.ryuqq.lifecycle.core.statemachine.LifecycleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 소유 엔티티 하나의 상태 이력.
 *
 * <p>레코드는 createdAt 오름차순으로 정렬되며, 같은 시각이면 추가된 순서를 유지합니다.
 * 마지막 레코드가 현재 상태입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>모든 레코드는 같은 kind, 같은 ownerId</li>
 *   <li>레코드 ID 중복 불가</li>
 *   <li>{@link #append}는 새 이력을 반환하며 기존 이력은 변경되지 않음</li>
 *   <li>추가되는 레코드의 createdAt은 현재 레코드 이상</li>
 * </ul>
 *
 * <p>반복은 읽기 전용이며 {@link Iterator#remove()}는 지원하지 않습니다.</p>
 *
 * @param <S> 상태 enum 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusHistory<S extends Enum<S> & LifecycleStatus> implements Iterable<StatusRecord<S>> {

    private static final Logger log = LoggerFactory.getLogger(StatusHistory.class);

    private final EntityKind<S> kind;
    private final OwnerId ownerId;
    private final List<StatusRecord<S>> records;

    private StatusHistory(EntityKind<S> kind, OwnerId ownerId, List<StatusRecord<S>> records) {
        this.kind = kind;
        this.ownerId = ownerId;
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * 빈 이력.
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param <S> 상태 enum 타입
     * @return 빈 StatusHistory
     */
    public static <S extends Enum<S> & LifecycleStatus> StatusHistory<S> empty(EntityKind<S> kind, OwnerId ownerId) {
        requireOwner(kind, ownerId);
        return new StatusHistory<>(kind, ownerId, new ArrayList<>());
    }

    /**
     * 저장된 레코드로 이력 복원.
     *
     * <p>입력 순서와 관계없이 createdAt 기준으로 안정 정렬합니다.</p>
     *
     * @param kind 엔티티 종류
     * @param ownerId 소유 엔티티 ID
     * @param records 레코드 목록 (변경되지 않음)
     * @param <S> 상태 enum 타입
     * @return StatusHistory
     * @throws ValidationException 다른 종류/소유자의 레코드 또는 중복 ID가 있는 경우
     */
    public static <S extends Enum<S> & LifecycleStatus> StatusHistory<S> of(
        EntityKind<S> kind, OwnerId ownerId, List<StatusRecord<S>> records) {
        requireOwner(kind, ownerId);
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        Set<StatusRecordId> ids = new HashSet<>();
        List<StatusRecord<S>> sorted = new ArrayList<>(records.size());
        for (StatusRecord<S> record : records) {
            requireBelongs(kind, ownerId, record);
            if (!ids.add(record.getId())) {
                throw new ValidationException("Duplicate status record id in history: " + record.getId().getValue());
            }
            sorted.add(record);
        }
        // List.sort는 안정 정렬
        sorted.sort(Comparator.comparing(StatusRecord::getCreatedAt));
        return new StatusHistory<>(kind, ownerId, sorted);
    }

    /**
     * 레코드를 추가한 새 이력 반환.
     *
     * @param record 추가할 레코드
     * @return record가 현재 상태인 새 StatusHistory
     * @throws ValidationException 다른 종류/소유자의 레코드 또는 중복 ID인 경우
     * @throws OrderingException record.createdAt이 현재 레코드보다 이전인 경우
     */
    public StatusHistory<S> append(StatusRecord<S> record) {
        requireBelongs(kind, ownerId, record);
        if (find(record.getId()).isPresent()) {
            throw new ValidationException("Duplicate status record id in history: " + record.getId().getValue());
        }
        Optional<StatusRecord<S>> current = current();
        if (current.isPresent() && record.getCreatedAt().isBefore(current.get().getCreatedAt())) {
            log.error("Status history ordering violated: owner={}, current={} at {}, new={} at {}",
                ownerId.getValue(), current.get().getStatus(), current.get().getCreatedAt(),
                record.getStatus(), record.getCreatedAt());
            throw new OrderingException(String.format(
                "Status record %s at %s precedes current record at %s for %s %s",
                record.getId().getValue(), record.getCreatedAt(), current.get().getCreatedAt(),
                kind.name(), ownerId.getValue()));
        }
        List<StatusRecord<S>> appended = new ArrayList<>(records.size() + 1);
        appended.addAll(records);
        appended.add(record);
        return new StatusHistory<>(kind, ownerId, appended);
    }

    /**
     * 현재 상태 레코드 (가장 최근 레코드).
     *
     * @return 현재 레코드, 이력이 비어 있으면 empty
     */
    public Optional<StatusRecord<S>> current() {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(records.get(records.size() - 1));
    }

    /**
     * 현재 상태 값.
     *
     * @return 현재 상태, 이력이 비어 있으면 empty
     */
    public Optional<S> currentStatus() {
        return current().map(StatusRecord::getStatus);
    }

    public Optional<StatusRecordId> latestId() {
        return current().map(StatusRecord::getId);
    }

    public Optional<StatusRecord<S>> find(StatusRecordId id) {
        if (id == null) {
            return Optional.empty();
        }
        return records.stream().filter(record -> record.getId().equals(id)).findFirst();
    }

    @Override
    public Iterator<StatusRecord<S>> iterator() {
        return records.iterator();
    }

    public Stream<StatusRecord<S>> stream() {
        return records.stream();
    }

    /**
     * 레코드 목록 (읽기 전용, 오래된 순).
     *
     * @return 읽기 전용 목록
     */
    public List<StatusRecord<S>> toList() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public EntityKind<S> getKind() {
        return kind;
    }

    public OwnerId getOwnerId() {
        return ownerId;
    }

    private static void requireOwner(EntityKind<?> kind, OwnerId ownerId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
    }

    private static void requireBelongs(EntityKind<?> kind, OwnerId ownerId, StatusRecord<?> record) {
        if (record == null) {
            throw new ValidationException("Status record cannot be null");
        }
        if (record.getKind() != kind) {
            throw new ValidationException(String.format(
                "Status record %s belongs to %s, not %s", record.getId().getValue(), record.getKind(), kind));
        }
        if (!record.getOwnerId().equals(ownerId)) {
            throw new ValidationException(String.format(
                "Status record %s belongs to owner %s, not %s",
                record.getId().getValue(), record.getOwnerId().getValue(), ownerId.getValue()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatusHistory<?> that = (StatusHistory<?>) o;
        return kind == that.kind && ownerId.equals(that.ownerId) && records.equals(that.records);
    }

    @Override
    public int hashCode() {
        return 31 * ownerId.hashCode() + records.hashCode();
    }

    @Override
    public String toString() {
        return "StatusHistory{" +
            "kind=" + kind +
            ", ownerId=" + ownerId.getValue() +
            ", size=" + records.size() +
            ", current=" + currentStatus().map(Enum::name).orElse("none") +
            '}';
    }
}
