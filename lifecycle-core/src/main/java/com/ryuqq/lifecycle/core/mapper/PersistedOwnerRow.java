package com.ryuqq.lifecycle.core.mapper;

import java.time.Instant;
import java.util.List;

/**
 * 저장소의 소유 엔티티 행과 그 상태 이력 전체.
 *
 * <p>currentStatus는 currentStatusId 포인터를 따라 조회한 행입니다. 포인터가 가리키는 행이
 * 없으면 null이며, 이 경우 매퍼가 불변식 위반으로 판단합니다.</p>
 *
 * @param kind 엔티티 종류 이름 (예: MILESTONE)
 * @param id 엔티티 ID
 * @param parentId 상위 엔티티 ID
 * @param currentStatusId 현재 상태 포인터 (null 허용)
 * @param currentStatus 포인터가 가리키는 상태 행 (null 허용)
 * @param statuses 전체 상태 행 (저장 순서)
 * @param version 낙관적 잠금 버전
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PersistedOwnerRow(
    String kind,
    String id,
    String parentId,
    String currentStatusId,
    PersistedStatusRow currentStatus,
    List<PersistedStatusRow> statuses,
    long version,
    Instant createdAt,
    Instant updatedAt
) {

    public PersistedOwnerRow {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
    }

    /**
     * 상태 행을 제외한 소유자 행만으로 생성.
     *
     * @param kind 엔티티 종류 이름
     * @param id 엔티티 ID
     * @param parentId 상위 엔티티 ID
     * @param createdAt 생성 시각
     * @return 상태가 없는 소유자 행
     */
    public static PersistedOwnerRow withoutStatuses(String kind, String id, String parentId, Instant createdAt) {
        return new PersistedOwnerRow(kind, id, parentId, null, null, List.of(), 0L, createdAt, createdAt);
    }
}
