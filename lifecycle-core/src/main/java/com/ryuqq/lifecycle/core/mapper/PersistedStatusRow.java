package com.ryuqq.lifecycle.core.mapper;

import java.time.Instant;

/**
 * 저장소에 기록된 상태 레코드 한 행.
 *
 * <p>값은 저장된 그대로의 문자열입니다. status는 검증되지 않았으며
 * context는 JSON 원문이거나 null입니다.</p>
 *
 * @param id 레코드 ID
 * @param ownerId 소유 엔티티 ID
 * @param status 저장된 상태 문자열 (검증 전)
 * @param context 저장된 context JSON 원문 (null 허용)
 * @param createdAt 생성 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PersistedStatusRow(
    String id,
    String ownerId,
    String status,
    String context,
    Instant createdAt
) {

    public PersistedStatusRow {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }
}
