package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 상태 이력을 소유하는 엔티티(레슨, 레슨 플랜, 마일스톤, 목표)의 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~{@value #MAX_LENGTH}자 (UUID, cuid, 접두사가 붙은 ID를 모두 수용)</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OwnerId {

    static final int MAX_LENGTH = 64;
    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final String value;

    private OwnerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OwnerId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "OwnerId length cannot exceed " + MAX_LENGTH + " characters: " + value.length());
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException("OwnerId may contain only alphanumerics, hyphens and underscores: " + value);
        }
        this.value = value;
    }

    /**
     * OwnerId 생성.
     *
     * @param value 식별자 값
     * @return OwnerId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OwnerId of(String value) {
        return new OwnerId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OwnerId ownerId = (OwnerId) o;
        return value.equals(ownerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OwnerId{" + value + '}';
    }
}
