package com.ryuqq.lifecycle.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * StatusRecord 식별자.
 *
 * <p>값은 불투명 문자열이며 순서 정보를 담지 않습니다. 새 레코드의 ID는 서버가
 * {@link #generate()}로 부여합니다 (UUID 문자열).</p>
 *
 * <p><strong>유효성 검증:</strong> 영숫자와 하이픈(-)만, 최대 {@value #MAX_LENGTH}자 (UUID 표기 길이).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusRecordId {

    static final int MAX_LENGTH = 36;
    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9-]+$");

    private final String value;

    private StatusRecordId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StatusRecordId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "StatusRecordId length cannot exceed " + MAX_LENGTH + " characters: " + value.length());
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException("StatusRecordId may contain only alphanumerics and hyphens: " + value);
        }
        this.value = value;
    }

    /**
     * 저장된 값으로 StatusRecordId 복원.
     *
     * @param value 식별자 값
     * @return StatusRecordId 인스턴스
     * @throws IllegalArgumentException 비어 있거나, 너무 길거나, 허용되지 않는 문자가 있는 경우
     */
    public static StatusRecordId of(String value) {
        return new StatusRecordId(value);
    }

    /**
     * 새 StatusRecordId 생성 (UUID).
     *
     * @return 새 StatusRecordId 인스턴스
     */
    public static StatusRecordId generate() {
        return new StatusRecordId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatusRecordId that = (StatusRecordId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "StatusRecordId{" + value + '}';
    }
}
